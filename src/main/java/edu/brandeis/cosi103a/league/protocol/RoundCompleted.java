package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Broadcast when every match of a round has finished. {@code next_round_id} is null after the last round.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoundCompleted(
    @JsonProperty("league_id") String leagueId,
    @JsonProperty("round_id") int roundId,
    @JsonProperty("matches_completed") int matchesCompleted,
    @JsonProperty("next_round_id") Integer nextRoundId
) {}
