package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.league.standings.PlayerStanding;

/**
 * One line of the leaderboard as exchanged on the wire.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StandingRow(
    @JsonProperty("player_id") String playerId,
    @JsonProperty("rank") int rank,
    @JsonProperty("points") int points,
    @JsonProperty("wins") int wins,
    @JsonProperty("losses") int losses,
    @JsonProperty("ties") int ties
) {
    public static StandingRow of(PlayerStanding standing) {
        return new StandingRow(standing.playerId(), standing.rank(), standing.points(),
            standing.wins(), standing.losses(), standing.ties());
    }
}
