package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * Asks a player for its choice. Both players receive this concurrently.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChooseParityCall(
    @JsonProperty("match_id") String matchId,
    @JsonProperty("player_id") String playerId,
    @JsonProperty("context") Context context,
    @JsonProperty("deadline") String deadline
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Context(
        @JsonProperty("opponent_id") String opponentId,
        @JsonProperty("standings") ImmutableList<StandingRow> standings
    ) {}
}
