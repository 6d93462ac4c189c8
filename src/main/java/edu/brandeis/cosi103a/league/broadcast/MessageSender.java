package edu.brandeis.cosi103a.league.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import edu.brandeis.cosi103a.league.network.RpcClient;
import edu.brandeis.cosi103a.league.network.RpcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delivers one message to one endpoint under a {@link RetryPolicy}.
 *
 * Transient failures (timeouts, connection errors, non-2xx replies) are retried with
 * linear backoff. An error reply from the peer is final and is not retried.
 */
public class MessageSender {

    private static final Logger log = LoggerFactory.getLogger(MessageSender.class);

    private final RpcClient rpcClient;
    private final RetryPolicy retryPolicy;

    public MessageSender(RpcClient rpcClient, RetryPolicy retryPolicy) {
        this.rpcClient = rpcClient;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Sends {@code message} and waits for the reply.
     *
     * @return the peer's result
     * @throws DeliveryException once every attempt has failed, or at once for a missing
     *         endpoint or a non-transient failure
     */
    public JsonNode send(String endpoint, String method, JsonNode message) throws DeliveryException {
        if (endpoint == null || endpoint.isBlank()) {
            throw new DeliveryException("No endpoint to deliver " + method + " to", 0, null);
        }
        RpcException lastError = null;
        int maxAttempts = retryPolicy.maxAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return awaitReply(rpcClient.call(endpoint, method, message, retryPolicy.requestTimeout()), endpoint, method);
            } catch (RpcException e) {
                lastError = e;
                if (!e.isTransient()) {
                    throw new DeliveryException(e.getMessage(), attempt + 1, e);
                }
                log.debug("Attempt {}/{} of {} to {} failed: {}", attempt + 1, maxAttempts, method, endpoint, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DeliveryException("Interrupted while delivering " + method + " to " + endpoint, attempt + 1, e);
            }

            if (attempt + 1 < maxAttempts) {
                try {
                    Thread.sleep(retryPolicy.backoffAfter(attempt).toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new DeliveryException("Interrupted while backing off " + method + " to " + endpoint, attempt + 1, e);
                }
            }
        }
        throw new DeliveryException(lastError.getMessage(), maxAttempts, lastError);
    }

    private JsonNode awaitReply(Future<JsonNode> reply, String endpoint, String method) throws InterruptedException {
        try {
            return reply.get(retryPolicy.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw RpcException.unwrap(e);
        } catch (TimeoutException e) {
            reply.cancel(true);
            throw new RpcException(RpcException.Kind.TIMEOUT,
                method + " at " + endpoint + " timed out after " + retryPolicy.requestTimeout().toMillis() + "ms", e);
        }
    }
}
