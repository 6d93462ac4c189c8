package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sent by a referee to each player before a match.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GameInvitation(
    @JsonProperty("match_id") String matchId,
    @JsonProperty("round_id") int roundId,
    @JsonProperty("opponent_id") String opponentId,
    @JsonProperty("role") String role
) {
    public static final String PLAYER_A = "PLAYER_A";
    public static final String PLAYER_B = "PLAYER_B";
}
