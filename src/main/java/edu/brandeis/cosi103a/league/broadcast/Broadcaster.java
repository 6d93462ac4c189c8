package edu.brandeis.cosi103a.league.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fans one message out to many recipients concurrently, one task per recipient, and
 * accounts for every delivery in a {@link DeliveryReport}. Delivery failures never
 * escape as exceptions.
 */
public class Broadcaster {

    private static final Logger log = LoggerFactory.getLogger(Broadcaster.class);

    private final MessageSender sender;
    private final ExecutorService executor;

    public Broadcaster(MessageSender sender) {
        this(sender, Executors.newCachedThreadPool(new ThreadFactoryBuilder()
            .setNameFormat("broadcast-%d")
            .setDaemon(true)
            .build()));
    }

    public Broadcaster(MessageSender sender, ExecutorService executor) {
        this.sender = sender;
        this.executor = executor;
    }

    /**
     * Delivers {@code message} to every recipient via {@code method}.
     *
     * @return a fresh report covering every recipient
     */
    public DeliveryReport broadcast(List<Recipient> recipients, String method, JsonNode message) {
        List<CompletableFuture<Optional<String>>> deliveries = new ArrayList<>(recipients.size());
        for (Recipient recipient : recipients) {
            if (!recipient.hasEndpoint()) {
                deliveries.add(CompletableFuture.completedFuture(Optional.of("No endpoint registered")));
                continue;
            }
            deliveries.add(CompletableFuture
                .supplyAsync(() -> deliver(recipient, method, message), executor)
                .handle((error, unexpected) -> unexpected == null
                    ? error
                    : Optional.of(String.valueOf(unexpected.getCause() != null ? unexpected.getCause() : unexpected))));
        }

        DeliveryReport.Builder report = DeliveryReport.builder();
        for (int i = 0; i < recipients.size(); i++) {
            Optional<String> error = deliveries.get(i).join();
            if (error.isPresent()) {
                report.failure(recipients.get(i).id(), error.get());
            } else {
                report.success();
            }
        }
        DeliveryReport result = report.build();
        if (result.allDelivered()) {
            log.debug("{} delivered to all {} recipients", method, result.total());
        } else {
            log.warn("{} delivered to {}/{} recipients, failed: {}",
                method, result.successful(), result.total(), result.failedIds());
        }
        return result;
    }

    private Optional<String> deliver(Recipient recipient, String method, JsonNode message) {
        try {
            sender.send(recipient.endpoint(), method, message);
            return Optional.empty();
        } catch (DeliveryException e) {
            return Optional.of(String.valueOf(e.getMessage()));
        }
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
