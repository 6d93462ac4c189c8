package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.league.game.GameResult;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GameOver(
    @JsonProperty("match_id") String matchId,
    @JsonProperty("game_result") GameResult gameResult
) {}
