package edu.brandeis.cosi103a.league.monitor;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import edu.brandeis.cosi103a.league.broadcast.Recipient;
import edu.brandeis.cosi103a.league.network.HttpClientWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Polls {@code GET /health} on every agent and publishes an {@link AgentUnhealthy} event once
 * an agent has failed {@code failureThreshold} checks in a row, then an {@link AgentRecovered}
 * event on its first success afterwards.
 */
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final HttpClientWrapper httpClient;
    private final Supplier<List<Recipient>> agents;
    private final BlockingQueue<AgentHealthEvent> events;
    private final Duration timeout;
    private final int failureThreshold;
    private final Clock clock;
    private final Map<String, Integer> failures = new HashMap<>();
    private final Set<String> unhealthy = new HashSet<>();

    private ScheduledExecutorService scheduler;

    public HealthMonitor(HttpClientWrapper httpClient, Supplier<List<Recipient>> agents,
                         BlockingQueue<AgentHealthEvent> events, Duration timeout, int failureThreshold, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1, got " + failureThreshold);
        }
        this.httpClient = httpClient;
        this.agents = agents;
        this.events = events;
        this.timeout = timeout;
        this.failureThreshold = failureThreshold;
        this.clock = clock;
    }

    /**
     * Runs one round of checks over the current agent list.
     */
    public synchronized void checkAll() {
        for (Recipient agent : agents.get()) {
            boolean healthy;
            try {
                healthy = probe(agent);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (healthy) {
                onSuccess(agent.id());
            } else {
                onFailure(agent.id());
            }
        }
    }

    private boolean probe(Recipient agent) throws InterruptedException {
        if (!agent.hasEndpoint()) {
            return false;
        }
        try {
            HttpRequest request = HttpRequest.newBuilder(healthUri(agent.endpoint()))
                .timeout(timeout)
                .GET()
                .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.debug("Health check of {} returned {}", agent.id(), response.statusCode());
                return false;
            }
            return true;
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Health check of {} failed: {}", agent.id(), e.getMessage());
            return false;
        }
    }

    private void onSuccess(String agentId) {
        failures.remove(agentId);
        if (unhealthy.remove(agentId)) {
            log.info("Agent {} is healthy again", agentId);
            publish(new AgentRecovered(agentId, clock.instant()));
        }
    }

    private void onFailure(String agentId) {
        int count = failures.merge(agentId, 1, Integer::sum);
        if (count >= failureThreshold && unhealthy.add(agentId)) {
            log.error("Agent {} unhealthy after {} failed checks", agentId, count);
            publish(new AgentUnhealthy(agentId, count, clock.instant()));
        } else if (count < failureThreshold) {
            log.debug("Agent {} failed check {}/{}", agentId, count, failureThreshold);
        }
    }

    private void publish(AgentHealthEvent event) {
        if (!events.offer(event)) {
            log.warn("Dropped health event {}, queue is full", event);
        }
    }

    public synchronized int failureCount(String agentId) {
        return failures.getOrDefault(agentId, 0);
    }

    public synchronized boolean isHealthy(String agentId) {
        return !unhealthy.contains(agentId);
    }

    /**
     * The health URL of an agent: {@code /health} on the host of its JSON-RPC endpoint.
     */
    static URI healthUri(String endpoint) {
        return URI.create(endpoint).resolve("/health");
    }

    public synchronized void start(Duration interval) {
        if (scheduler != null) {
            log.warn("Health monitor already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("health-monitor").setDaemon(true).build());
        scheduler.scheduleAtFixedRate(() -> {
            try {
                checkAll();
            } catch (RuntimeException e) {
                log.error("Health check round failed", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Health monitor started, checking every {} ms", interval.toMillis());
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
        log.info("Health monitor stopped");
    }
}
