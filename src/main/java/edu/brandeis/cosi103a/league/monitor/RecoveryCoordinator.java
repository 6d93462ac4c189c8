package edu.brandeis.cosi103a.league.monitor;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import edu.brandeis.cosi103a.league.manager.AgentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;

/**
 * Consumes health events and keeps agent availability in the registry in step with them.
 * Unavailable referees are left out when the league schedule is built.
 */
public class RecoveryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RecoveryCoordinator.class);

    private final BlockingQueue<AgentHealthEvent> events;
    private final AgentRegistry registry;

    private volatile boolean running;
    private Thread handlerThread;

    public RecoveryCoordinator(BlockingQueue<AgentHealthEvent> events, AgentRegistry registry) {
        this.events = events;
        this.registry = registry;
    }

    public void handle(AgentHealthEvent event) {
        if (event instanceof AgentUnhealthy) {
            AgentUnhealthy unhealthy = (AgentUnhealthy) event;
            registry.markAvailable(unhealthy.agentId(), false);
            log.warn("Marked {} unavailable after {} failed checks", unhealthy.agentId(), unhealthy.consecutiveFailures());
        } else if (event instanceof AgentRecovered) {
            registry.markAvailable(event.agentId(), true);
            log.info("Marked {} available again", event.agentId());
        } else {
            log.warn("Ignoring unknown health event {}", event);
        }
    }

    public synchronized void start() {
        if (handlerThread != null) {
            return;
        }
        running = true;
        handlerThread = new ThreadFactoryBuilder()
            .setNameFormat("health-recovery")
            .setDaemon(true)
            .build()
            .newThread(this::handleLoop);
        handlerThread.start();
    }

    public synchronized void stop() {
        running = false;
        if (handlerThread != null) {
            handlerThread.interrupt();
            handlerThread = null;
        }
    }

    private void handleLoop() {
        while (running) {
            try {
                handle(events.take());
            } catch (InterruptedException e) {
                if (!running) {
                    Thread.currentThread().interrupt();
                    return;
                }
            } catch (RuntimeException e) {
                log.error("Failed to handle health event", e);
            }
        }
    }
}
