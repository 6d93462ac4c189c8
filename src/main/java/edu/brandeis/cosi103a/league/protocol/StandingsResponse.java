package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StandingsResponse(
    @JsonProperty("league_id") String leagueId,
    @JsonProperty("standings") ImmutableList<StandingRow> standings
) {}
