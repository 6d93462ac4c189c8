package edu.brandeis.cosi103a.league.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import edu.brandeis.cosi103a.league.network.RpcClient;
import edu.brandeis.cosi103a.league.network.RpcException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MessageSenderTest {

    private static final RetryPolicy FAST = new RetryPolicy(2, Duration.ofMillis(500), Duration.ofMillis(1));
    private static final JsonNode MESSAGE = JsonNodeFactory.instance.objectNode().put("message_type", "ACK");

    private final RpcClient rpcClient = mock(RpcClient.class);

    @Test
    void send_returnsReplyOnFirstSuccess() throws DeliveryException {
        JsonNode reply = JsonNodeFactory.instance.objectNode().put("acknowledged", true);
        when(rpcClient.call(anyString(), anyString(), any(), any())).thenReturn(CompletableFuture.completedFuture(reply));

        JsonNode result = new MessageSender(rpcClient, FAST).send("http://p1/mcp", "notify", MESSAGE);

        assertEquals(reply, result);
        verify(rpcClient, times(1)).call(eq("http://p1/mcp"), eq("notify"), eq(MESSAGE), eq(Duration.ofMillis(500)));
    }

    @Test
    void send_retriesTransientFailuresThenSucceeds() throws DeliveryException {
        JsonNode reply = JsonNodeFactory.instance.objectNode();
        when(rpcClient.call(anyString(), anyString(), any(), any()))
            .thenReturn(CompletableFuture.failedFuture(new RpcException(RpcException.Kind.CONNECTION, "refused", null)))
            .thenReturn(CompletableFuture.failedFuture(new RpcException(RpcException.Kind.HTTP_STATUS, 503, "busy")))
            .thenReturn(CompletableFuture.completedFuture(reply));

        assertEquals(reply, new MessageSender(rpcClient, FAST).send("http://p1/mcp", "notify", MESSAGE));
        verify(rpcClient, times(3)).call(anyString(), anyString(), any(), any());
    }

    @Test
    void send_givesUpAfterMaxAttempts() {
        when(rpcClient.call(anyString(), anyString(), any(), any()))
            .thenReturn(CompletableFuture.failedFuture(new RpcException(RpcException.Kind.CONNECTION, "refused", null)));

        DeliveryException e = assertThrows(DeliveryException.class,
            () -> new MessageSender(rpcClient, FAST).send("http://p1/mcp", "notify", MESSAGE));

        assertEquals(3, e.attempts());
        verify(rpcClient, times(3)).call(anyString(), anyString(), any(), any());
    }

    @Test
    void send_doesNotRetryRemoteErrors() {
        when(rpcClient.call(anyString(), anyString(), any(), any()))
            .thenReturn(CompletableFuture.failedFuture(new RpcException(RpcException.Kind.REMOTE_ERROR, -32602, "bad params")));

        DeliveryException e = assertThrows(DeliveryException.class,
            () -> new MessageSender(rpcClient, FAST).send("http://p1/mcp", "notify", MESSAGE));

        assertEquals(1, e.attempts());
        verify(rpcClient, times(1)).call(anyString(), anyString(), any(), any());
    }

    @Test
    void send_timesOutUnansweredCalls() {
        RetryPolicy noRetry = new RetryPolicy(0, Duration.ofMillis(50), Duration.ZERO);
        when(rpcClient.call(anyString(), anyString(), any(), any())).thenReturn(new CompletableFuture<>());

        DeliveryException e = assertThrows(DeliveryException.class,
            () -> new MessageSender(rpcClient, noRetry).send("http://p1/mcp", "notify", MESSAGE));

        assertTrue(e.getMessage().contains("timed out"), e.getMessage());
    }

    @Test
    void send_rejectsMissingEndpointWithoutCalling() {
        assertThrows(DeliveryException.class, () -> new MessageSender(rpcClient, FAST).send(" ", "notify", MESSAGE));
        verifyNoInteractions(rpcClient);
    }
}
