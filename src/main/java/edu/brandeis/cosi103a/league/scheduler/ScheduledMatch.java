package edu.brandeis.cosi103a.league.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One match of the plan, with its referee already assigned.
 */
public record ScheduledMatch(
    @JsonProperty("match_id") String matchId,
    @JsonProperty("round_number") int roundNumber,
    @JsonProperty("player_A_id") String playerAId,
    @JsonProperty("player_B_id") String playerBId,
    @JsonProperty("referee_id") String refereeId
) {}
