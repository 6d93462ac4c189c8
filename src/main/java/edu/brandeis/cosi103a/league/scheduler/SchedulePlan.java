package edu.brandeis.cosi103a.league.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * The complete league plan: every round with its matches, built once before round 1.
 */
public record SchedulePlan(
    @JsonProperty("league_id") String leagueId,
    @JsonProperty("rounds") ImmutableList<ImmutableList<ScheduledMatch>> rounds
) {
    @JsonIgnore
    public int totalRounds() {
        return rounds.size();
    }

    @JsonIgnore
    public int totalMatches() {
        return rounds.stream().mapToInt(ImmutableList::size).sum();
    }

    @JsonIgnore
    public ImmutableList<ScheduledMatch> allMatches() {
        ImmutableList.Builder<ScheduledMatch> all = ImmutableList.builder();
        rounds.forEach(all::addAll);
        return all.build();
    }
}
