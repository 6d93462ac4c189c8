package edu.brandeis.cosi103a.league.game;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

import java.util.Optional;

/**
 * Outcome of one parity game as computed by {@link ParityScorer}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GameResult(
    @JsonProperty("status") Status status,
    @JsonProperty("winner_player_id") Optional<String> winnerPlayerId,
    @JsonProperty("drawn_number") int drawnNumber,
    @JsonProperty("number_parity") ParityChoice numberParity,
    @JsonProperty("choices") ImmutableMap<String, ParityChoice> choices,
    @JsonProperty("scores") ImmutableMap<String, Integer> scores
) {
    public enum Status {
        WIN,
        DRAW
    }

    @JsonIgnore
    public boolean isDraw() {
        return status == Status.DRAW;
    }
}
