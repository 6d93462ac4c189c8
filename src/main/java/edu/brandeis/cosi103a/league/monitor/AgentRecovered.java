package edu.brandeis.cosi103a.league.monitor;

import java.time.Instant;

public record AgentRecovered(String agentId, Instant detectedAt) implements AgentHealthEvent {
}
