package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * Hands one scheduled match to its referee, with everything the referee needs to run it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MatchAssignment(
    @JsonProperty("league_id") String leagueId,
    @JsonProperty("round_id") int roundId,
    @JsonProperty("match_id") String matchId,
    @JsonProperty("player_A_id") String playerAId,
    @JsonProperty("player_A_endpoint") String playerAEndpoint,
    @JsonProperty("player_B_id") String playerBId,
    @JsonProperty("player_B_endpoint") String playerBEndpoint,
    @JsonProperty("standings") ImmutableList<StandingRow> standings
) {}
