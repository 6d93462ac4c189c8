package edu.brandeis.cosi103a.league.network;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import edu.brandeis.cosi103a.league.network.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.league.network.dto.JsonRpcRequest;
import edu.brandeis.cosi103a.league.network.dto.JsonRpcResponse;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link RpcClient} speaking JSON-RPC 2.0 over HTTP POST.
 */
public class JsonRpcClient implements RpcClient {

    private final HttpClientWrapper httpClient;
    private final ObjectMapper objectMapper;
    private final AtomicLong nextId = new AtomicLong();

    public JsonRpcClient() {
        this(new HttpClientWrapper.Default(), ObjectMapperFactory.create());
    }

    public JsonRpcClient(HttpClientWrapper httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<JsonNode> call(String endpoint, String method, Object params, Duration timeout) {
        String requestJson;
        try {
            JsonNode paramsNode = objectMapper.valueToTree(params);
            requestJson = objectMapper.writeValueAsString(
                JsonRpcRequest.of(method, paramsNode, nextId.incrementAndGet()));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                new RpcException(RpcException.Kind.INVALID_REQUEST, "Cannot encode " + method + " request", e));
        }

        HttpRequest httpRequest;
        try {
            httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(endpoint))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestJson))
                .build();
        } catch (IllegalArgumentException | NullPointerException e) {
            return CompletableFuture.failedFuture(
                new RpcException(RpcException.Kind.INVALID_ENDPOINT, "Invalid endpoint '" + endpoint + "'", e));
        }

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((response, error) -> {
                if (error != null) {
                    throw translate(error, endpoint, method, timeout);
                }
                return readResult(response, endpoint, method);
            });
    }

    private JsonNode readResult(HttpResponse<String> response, String endpoint, String method) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new RpcException(RpcException.Kind.HTTP_STATUS, response.statusCode(),
                method + " at " + endpoint + " returned " + response.statusCode() + " - " + response.body());
        }
        JsonRpcResponse rpcResponse;
        try {
            rpcResponse = objectMapper.readValue(response.body(), JsonRpcResponse.class);
        } catch (JsonProcessingException e) {
            throw new RpcException(RpcException.Kind.MALFORMED_RESPONSE,
                "Unreadable reply to " + method + " from " + endpoint, e);
        }
        if (rpcResponse.error() != null) {
            throw new RpcException(RpcException.Kind.REMOTE_ERROR, rpcResponse.error().code(),
                method + " at " + endpoint + " failed: " + rpcResponse.error().message());
        }
        return rpcResponse.result() != null ? rpcResponse.result() : NullNode.getInstance();
    }

    private static RpcException translate(Throwable error, String endpoint, String method, Duration timeout) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof RpcException) {
            return (RpcException) cause;
        }
        if (cause instanceof TimeoutException || cause instanceof HttpTimeoutException) {
            return new RpcException(RpcException.Kind.TIMEOUT,
                method + " at " + endpoint + " timed out after " + timeout.toMillis() + "ms", cause);
        }
        if (cause instanceof IOException) {
            return new RpcException(RpcException.Kind.CONNECTION,
                method + " at " + endpoint + " failed: " + cause.getMessage(), cause);
        }
        return new RpcException(RpcException.Kind.CONNECTION,
            method + " at " + endpoint + " failed: " + cause, cause);
    }
}
