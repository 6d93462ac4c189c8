package edu.brandeis.cosi103a.league.tournament;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * A batch of matches in which no player appears twice. Created in full when the plan
 * is built and never resharded.
 */
public class Round {

    private final int roundNumber;
    private final ImmutableList<Match> matches;
    private final Set<String> completedMatchIds = new LinkedHashSet<>();
    private RoundStatus status = RoundStatus.PENDING;

    public Round(int roundNumber, ImmutableList<Match> matches) {
        this.roundNumber = roundNumber;
        this.matches = matches;
    }

    public Optional<Match> match(String matchId) {
        return matches.stream().filter(m -> m.matchId().equals(matchId)).findFirst();
    }

    /**
     * Records a finished match.
     *
     * @return true only on the call that finishes the last outstanding match
     */
    boolean markComplete(String matchId) {
        boolean added = completedMatchIds.add(matchId);
        return added && isComplete();
    }

    @JsonIgnore
    public boolean isComplete() {
        return completedMatchIds.size() == matches.size();
    }

    void setStatus(RoundStatus status) {
        this.status = status;
    }

    @JsonProperty("round_number")
    public int roundNumber() {
        return roundNumber;
    }

    @JsonProperty("matches")
    public ImmutableList<Match> matches() {
        return matches;
    }

    @JsonProperty("completed_match_ids")
    public ImmutableSet<String> completedMatchIds() {
        return ImmutableSet.copyOf(completedMatchIds);
    }

    @JsonProperty("status")
    public RoundStatus status() {
        return status;
    }
}
