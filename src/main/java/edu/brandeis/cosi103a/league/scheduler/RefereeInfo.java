package edu.brandeis.cosi103a.league.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The referee metadata the scheduler needs.
 */
public record RefereeInfo(
    @JsonProperty("referee_id") String refereeId,
    @JsonProperty("endpoint") String endpoint
) {}
