package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.league.standings.PlayerStanding;

/**
 * Broadcast once after the last round completes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TournamentEnd(
    @JsonProperty("league_id") String leagueId,
    @JsonProperty("total_rounds") int totalRounds,
    @JsonProperty("total_matches") int totalMatches,
    @JsonProperty("champion") String champion,
    @JsonProperty("final_standings") ImmutableList<PlayerStanding> finalStandings
) {}
