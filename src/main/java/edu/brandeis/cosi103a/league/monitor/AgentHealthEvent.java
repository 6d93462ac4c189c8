package edu.brandeis.cosi103a.league.monitor;

import java.time.Instant;

/**
 * A change in an agent's health, published by {@link HealthMonitor}.
 */
public interface AgentHealthEvent {

    String agentId();

    Instant detectedAt();
}
