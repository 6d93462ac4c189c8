package edu.brandeis.cosi103a.league.server;

import edu.brandeis.cosi103a.league.broadcast.Recipient;
import edu.brandeis.cosi103a.league.manager.AgentRegistry;
import edu.brandeis.cosi103a.league.manager.LeagueCoordinator;
import edu.brandeis.cosi103a.league.monitor.AgentHealthEvent;
import edu.brandeis.cosi103a.league.monitor.HealthMonitor;
import edu.brandeis.cosi103a.league.monitor.RecoveryCoordinator;
import edu.brandeis.cosi103a.league.network.HttpClientWrapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Starts agent health monitoring on the league manager when {@code league.monitor.enabled} is set.
 */
@Component
@ConditionalOnExpression("${league.monitor.enabled:false} and '${league.role:manager}' == 'manager'")
public class MonitoringLifecycle {

    private final HealthMonitor monitor;
    private final RecoveryCoordinator recovery;
    private final Duration interval;

    public MonitoringLifecycle(
            LeagueCoordinator coordinator,
            HttpClientWrapper httpClientWrapper,
            @Value("${league.monitor.interval-ms:5000}") long intervalMs,
            @Value("${league.monitor.timeout-ms:2000}") long timeoutMs,
            @Value("${league.monitor.failure-threshold:3}") int failureThreshold) {
        AgentRegistry registry = coordinator.registry();
        BlockingQueue<AgentHealthEvent> events = new LinkedBlockingQueue<>();
        this.monitor = new HealthMonitor(
            httpClientWrapper,
            () -> registry.all().stream().map(agent -> new Recipient(agent.agentId(), agent.endpoint())).toList(),
            events,
            Duration.ofMillis(timeoutMs),
            failureThreshold,
            Clock.systemUTC());
        this.recovery = new RecoveryCoordinator(events, registry);
        this.interval = Duration.ofMillis(intervalMs);
    }

    @PostConstruct
    public void start() {
        recovery.start();
        monitor.start(interval);
    }

    @PreDestroy
    public void stop() {
        monitor.stop();
        recovery.stop();
    }
}
