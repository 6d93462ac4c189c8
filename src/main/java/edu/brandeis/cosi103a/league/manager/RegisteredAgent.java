package edu.brandeis.cosi103a.league.manager;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.time.Instant;

/**
 * A player or referee admitted to the league.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegisteredAgent(
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("role") AgentRole role,
    @JsonProperty("display_name") String displayName,
    @JsonProperty("endpoint") String endpoint,
    @JsonProperty("game_types") ImmutableList<String> gameTypes,
    @JsonProperty("version") String version,
    @JsonProperty("max_concurrent_matches") int maxConcurrentMatches,
    @JsonProperty("auth_token") String authToken,
    @JsonProperty("registered_at") Instant registeredAt
) {}
