package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A player's answer. The value is kept as sent so that invalid symbols can be rejected.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChooseParityResponse(
    @JsonProperty("parity_choice") String parityChoice
) {}
