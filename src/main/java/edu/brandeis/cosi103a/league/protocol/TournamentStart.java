package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TournamentStart(
    @JsonProperty("league_id") String leagueId,
    @JsonProperty("total_rounds") int totalRounds,
    @JsonProperty("total_matches") int totalMatches,
    @JsonProperty("players") ImmutableList<String> players
) {}
