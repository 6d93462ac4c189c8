package edu.brandeis.cosi103a.league.game;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One entry in a session's audit history.
 */
public record StateTransition(
    @JsonProperty("state") GameState state,
    @JsonProperty("timestamp") Instant timestamp
) {}
