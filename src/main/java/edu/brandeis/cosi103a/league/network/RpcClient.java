package edu.brandeis.cosi103a.league.network;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Calls a method on a remote agent. Every call carries its own deadline.
 */
public interface RpcClient {

    /**
     * Sends {@code params} to {@code method} at {@code endpoint}.
     *
     * @return the call's result; fails with {@link RpcException} on timeout, transport
     *         failure or an error reply
     */
    CompletableFuture<JsonNode> call(String endpoint, String method, Object params, Duration timeout);
}
