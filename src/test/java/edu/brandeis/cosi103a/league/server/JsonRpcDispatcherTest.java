package edu.brandeis.cosi103a.league.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.league.manager.AuthenticationException;
import edu.brandeis.cosi103a.league.network.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.league.network.dto.JsonRpcError;
import edu.brandeis.cosi103a.league.network.dto.JsonRpcResponse;
import edu.brandeis.cosi103a.league.tournament.RoundLifecycleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonRpcDispatcherTest {

    private final ObjectMapper objectMapper = ObjectMapperFactory.create();
    private JsonRpcDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new JsonRpcDispatcher(objectMapper)
            .register("echo", params -> params)
            .register("status", params -> Map.of("status", "ok"))
            .register("bad_params", params -> {
                throw new IllegalArgumentException("match_id is required");
            })
            .register("unauthorized", params -> {
                throw new AuthenticationException("Invalid token for REF01");
            })
            .register("too_late", params -> {
                throw new RoundLifecycleException("League L1 is already RUNNING");
            })
            .register("broken", params -> {
                throw new NullPointerException("boom");
            });
    }

    @Test
    void dispatch_returnsHandlerResultWithRequestId() {
        JsonRpcResponse response = dispatcher.dispatch(
            "{\"jsonrpc\":\"2.0\",\"method\":\"echo\",\"params\":{\"match_id\":\"M1\"},\"id\":7}");

        assertNull(response.error());
        assertEquals("M1", response.result().get("match_id").asText());
        assertEquals(7, response.id().asInt());
    }

    @Test
    void dispatch_missingParamsBecomeEmptyObject() {
        JsonRpcResponse response = dispatcher.dispatch("{\"jsonrpc\":\"2.0\",\"method\":\"echo\",\"id\":\"a\"}");

        assertTrue(response.result().isObject());
        assertEquals(0, response.result().size());
        assertEquals("a", response.id().asText());
    }

    @Test
    void dispatch_parseError() {
        assertEquals(JsonRpcError.PARSE_ERROR, dispatcher.dispatch("{not json").error().code());
    }

    @Test
    void dispatch_invalidRequest() {
        assertEquals(JsonRpcError.INVALID_REQUEST, dispatcher.dispatch("[1,2]").error().code());
        assertEquals(JsonRpcError.INVALID_REQUEST,
            dispatcher.dispatch("{\"jsonrpc\":\"1.0\",\"method\":\"echo\",\"id\":1}").error().code());
        assertEquals(JsonRpcError.INVALID_REQUEST, dispatcher.dispatch("{\"jsonrpc\":\"2.0\",\"id\":1}").error().code());
    }

    @Test
    void dispatch_unknownMethod() {
        JsonRpcResponse response = dispatcher.dispatch("{\"jsonrpc\":\"2.0\",\"method\":\"nope\",\"id\":1}");

        assertEquals(JsonRpcError.METHOD_NOT_FOUND, response.error().code());
        assertTrue(response.error().message().contains("nope"));
    }

    @Test
    void dispatch_mapsHandlerFailures() {
        assertEquals(JsonRpcError.INVALID_PARAMS, call("bad_params").error().code());
        assertEquals(JsonRpcError.UNAUTHORIZED, call("unauthorized").error().code());
        assertEquals(JsonRpcError.INTERNAL_ERROR, call("too_late").error().code());
        assertEquals("League L1 is already RUNNING", call("too_late").error().message());
        assertEquals(JsonRpcError.INTERNAL_ERROR, call("broken").error().code());
    }

    @Test
    void register_rejectsDuplicateMethod() {
        assertThrows(IllegalStateException.class, () -> dispatcher.register("echo", params -> params));
        assertTrue(dispatcher.methods().contains("status"));
    }

    private JsonRpcResponse call(String method) {
        return dispatcher.dispatch("{\"jsonrpc\":\"2.0\",\"method\":\"" + method + "\",\"params\":{},\"id\":1}");
    }
}
