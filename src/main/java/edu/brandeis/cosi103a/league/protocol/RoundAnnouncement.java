package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * Broadcast to every player when a round starts.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoundAnnouncement(
    @JsonProperty("league_id") String leagueId,
    @JsonProperty("round_id") int roundId,
    @JsonProperty("matches") ImmutableList<AnnouncedMatch> matches
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnnouncedMatch(
        @JsonProperty("match_id") String matchId,
        @JsonProperty("player_A_id") String playerAId,
        @JsonProperty("player_B_id") String playerBId,
        @JsonProperty("referee_id") String refereeId,
        @JsonProperty("referee_endpoint") String refereeEndpoint
    ) {}
}
