package edu.brandeis.cosi103a.league.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import edu.brandeis.cosi103a.league.manager.AuthenticationException;
import edu.brandeis.cosi103a.league.network.dto.JsonRpcError;
import edu.brandeis.cosi103a.league.network.dto.JsonRpcRequest;
import edu.brandeis.cosi103a.league.network.dto.JsonRpcResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Routes JSON-RPC 2.0 requests to method handlers and turns handler failures into
 * JSON-RPC error replies.
 *
 * <ul>
 *   <li>unparseable body: -32700</li>
 *   <li>not a JSON-RPC 2.0 request: -32600</li>
 *   <li>unknown method: -32601</li>
 *   <li>{@link IllegalArgumentException} or another bad-input failure: -32602</li>
 *   <li>{@link AuthenticationException}: -32001</li>
 *   <li>anything else: -32603</li>
 * </ul>
 */
public class JsonRpcDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcDispatcher.class);

    /**
     * Handles the {@code params} of one method. A missing {@code params} arrives as an empty object.
     */
    @FunctionalInterface
    public interface Handler {
        Object handle(JsonNode params);
    }

    private final ObjectMapper objectMapper;
    private final Map<String, Handler> handlers = new LinkedHashMap<>();

    public JsonRpcDispatcher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonRpcDispatcher register(String method, Handler handler) {
        if (handlers.putIfAbsent(method, handler) != null) {
            throw new IllegalStateException("Handler for " + method + " already registered");
        }
        return this;
    }

    public Set<String> methods() {
        return handlers.keySet();
    }

    public JsonRpcResponse dispatch(String body) {
        JsonNode tree;
        try {
            tree = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return JsonRpcResponse.failure(NullNode.getInstance(), JsonRpcError.PARSE_ERROR, "Parse error: " + e.getOriginalMessage());
        }
        if (tree == null || !tree.isObject()) {
            return JsonRpcResponse.failure(NullNode.getInstance(), JsonRpcError.INVALID_REQUEST, "Request must be a JSON object");
        }

        JsonRpcRequest request;
        try {
            request = objectMapper.treeToValue(tree, JsonRpcRequest.class);
        } catch (JsonProcessingException e) {
            return JsonRpcResponse.failure(NullNode.getInstance(), JsonRpcError.INVALID_REQUEST, "Invalid request: " + e.getOriginalMessage());
        }
        JsonNode id = request.id() != null ? request.id() : NullNode.getInstance();
        if (!JsonRpcRequest.VERSION.equals(request.jsonrpc()) || request.method() == null || request.method().isBlank()) {
            return JsonRpcResponse.failure(id, JsonRpcError.INVALID_REQUEST, "Invalid JSON-RPC 2.0 request");
        }

        Handler handler = handlers.get(request.method());
        if (handler == null) {
            return JsonRpcResponse.failure(id, JsonRpcError.METHOD_NOT_FOUND, "Method not found: " + request.method());
        }
        JsonNode params = request.params() == null || request.params().isNull()
            ? objectMapper.createObjectNode()
            : request.params();

        try {
            return JsonRpcResponse.success(id, objectMapper.valueToTree(handler.handle(params)));
        } catch (AuthenticationException e) {
            log.warn("Rejected {}: {}", request.method(), e.getMessage());
            return JsonRpcResponse.failure(id, JsonRpcError.UNAUTHORIZED, e.getMessage());
        } catch (IllegalArgumentException e) {
            log.info("Invalid params for {}: {}", request.method(), e.getMessage());
            return JsonRpcResponse.failure(id, JsonRpcError.INVALID_PARAMS, e.getMessage());
        } catch (IllegalStateException e) {
            log.info("Cannot run {} now: {}", request.method(), e.getMessage());
            return JsonRpcResponse.failure(id, JsonRpcError.INTERNAL_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Handler for {} failed", request.method(), e);
            return JsonRpcResponse.failure(id, JsonRpcError.INTERNAL_ERROR, "Internal error: " + e.getMessage());
        }
    }
}
