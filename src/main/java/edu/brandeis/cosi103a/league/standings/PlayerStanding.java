package edu.brandeis.cosi103a.league.standings;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A player's record at the moment standings were read. {@code rank} is derived on every read.
 */
public record PlayerStanding(
    @JsonProperty("player_id") String playerId,
    @JsonProperty("display_name") String displayName,
    @JsonProperty("wins") int wins,
    @JsonProperty("losses") int losses,
    @JsonProperty("ties") int ties,
    @JsonProperty("points") int points,
    @JsonProperty("matches_played") int matchesPlayed,
    @JsonProperty("rank") int rank
) {}
