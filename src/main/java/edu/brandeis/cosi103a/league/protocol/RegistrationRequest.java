package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Sent by a player or referee to join the league.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegistrationRequest(
    @JsonProperty("display_name") @NotBlank String displayName,
    @JsonProperty("endpoint") @NotBlank String endpoint,
    @JsonProperty("game_types") ImmutableList<String> gameTypes,
    @JsonProperty("version") String version,
    @JsonProperty("max_concurrent_matches") @Min(1) Integer maxConcurrentMatches
) {
    public static final String EVEN_ODD = "even_odd";
}
