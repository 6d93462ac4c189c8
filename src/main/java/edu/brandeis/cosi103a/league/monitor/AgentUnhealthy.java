package edu.brandeis.cosi103a.league.monitor;

import java.time.Instant;

public record AgentUnhealthy(String agentId, int consecutiveFailures, Instant detectedAt) implements AgentHealthEvent {
}
