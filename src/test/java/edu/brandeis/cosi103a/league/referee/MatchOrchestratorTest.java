package edu.brandeis.cosi103a.league.referee;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.league.broadcast.DeliveryException;
import edu.brandeis.cosi103a.league.broadcast.MessageSender;
import edu.brandeis.cosi103a.league.game.GameState;
import edu.brandeis.cosi103a.league.game.ParityScorer;
import edu.brandeis.cosi103a.league.game.StateTransition;
import edu.brandeis.cosi103a.league.network.RpcClient;
import edu.brandeis.cosi103a.league.network.RpcException;
import edu.brandeis.cosi103a.league.network.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.league.protocol.Acknowledgement;
import edu.brandeis.cosi103a.league.protocol.ChooseParityResponse;
import edu.brandeis.cosi103a.league.protocol.InvitationResponse;
import edu.brandeis.cosi103a.league.protocol.MatchAssignment;
import edu.brandeis.cosi103a.league.protocol.MessageBuilder;
import edu.brandeis.cosi103a.league.protocol.MessageType;
import edu.brandeis.cosi103a.league.protocol.RpcMethods;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MatchOrchestratorTest {

    private static final String MANAGER = "http://localhost:8000/mcp";
    private static final String A_ENDPOINT = "http://localhost:8101/mcp";
    private static final String B_ENDPOINT = "http://localhost:8102/mcp";
    private static final MatchAssignment ASSIGNMENT = new MatchAssignment(
        "L1", 1, "L1_R1_M001", "P01", A_ENDPOINT, "P02", B_ENDPOINT, ImmutableList.of());

    private final ObjectMapper objectMapper = ObjectMapperFactory.create();
    private final MessageBuilder player = new MessageBuilder(objectMapper, "player:P0x");
    private final MessageBuilder referee = new MessageBuilder(objectMapper, "referee:REF01").authenticated("tok_ref01_secret");

    private RpcClient rpcClient;
    private MessageSender reportSender;
    private MatchOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws DeliveryException {
        rpcClient = mock(RpcClient.class);
        reportSender = mock(MessageSender.class);
        when(reportSender.send(anyString(), anyString(), any())).thenReturn(objectMapper.createObjectNode());
        when(rpcClient.call(anyString(), eq(RpcMethods.NOTIFY_MATCH_RESULT), any(), any()))
            .thenReturn(CompletableFuture.completedFuture(player.build(MessageType.ACK, Acknowledgement.ok())));
        orchestrator = new MatchOrchestrator(rpcClient, reportSender, () -> 4, new ParityScorer(),
            new RefereeSettings(Duration.ofMillis(100), Duration.ofMillis(100), MANAGER));
    }

    @Test
    void run_playsMatchAndReportsWinner() throws DeliveryException {
        acceptInvitation(A_ENDPOINT);
        acceptInvitation(B_ENDPOINT);
        answerChoice(A_ENDPOINT, "even");
        answerChoice(B_ENDPOINT, "odd");

        MatchOutcome outcome = orchestrator.run(ASSIGNMENT, referee);

        assertEquals(GameState.FINISHED, outcome.finalState());
        assertTrue(outcome.reported());
        assertEquals("P01", outcome.result().orElseThrow().winnerPlayerId().orElseThrow());
        List<GameState> states = outcome.history().stream().map(StateTransition::state).toList();
        assertEquals(List.of(GameState.WAITING_FOR_PLAYERS, GameState.COLLECTING_CHOICES,
            GameState.DRAWING_NUMBER, GameState.EVALUATING, GameState.FINISHED), states);

        JsonNode report = capturedReport();
        assertEquals("MATCH_RESULT_REPORT", report.get("message_type").asText());
        assertEquals("tok_ref01_secret", report.get("auth_token").asText());
        assertEquals("L1_R1_M001", report.get("match_id").asText());
        assertEquals("COMPLETED", report.get("result").get("status").asText());
        assertEquals("P01", report.get("result").get("winner").asText());
        assertEquals(4, report.get("result").get("details").get("drawn_number").asInt());
        assertEquals("odd", report.get("result").get("details").get("choices").get("P02").asText());
        verify(rpcClient, times(2)).call(anyString(), eq(RpcMethods.NOTIFY_MATCH_RESULT), any(), any());
    }

    @Test
    void run_abortsWhenInvitationTimesOut() throws DeliveryException {
        acceptInvitation(A_ENDPOINT);
        when(rpcClient.call(eq(B_ENDPOINT), eq(RpcMethods.HANDLE_GAME_INVITATION), any(), any()))
            .thenReturn(new CompletableFuture<>());

        MatchOutcome outcome = orchestrator.run(ASSIGNMENT, referee);

        assertEquals(GameState.ABORTED, outcome.finalState());
        assertTrue(outcome.abortReason().orElseThrow().contains("P02"));
        assertTrue(outcome.result().isEmpty());
        JsonNode report = capturedReport();
        assertEquals("ABORTED", report.get("result").get("status").asText());
        verify(rpcClient, never()).call(anyString(), eq(RpcMethods.CHOOSE_PARITY), any(), any());
    }

    @Test
    void run_abortsWhenPlayerDeclines() {
        acceptInvitation(A_ENDPOINT);
        when(rpcClient.call(eq(B_ENDPOINT), eq(RpcMethods.HANDLE_GAME_INVITATION), any(), any()))
            .thenReturn(CompletableFuture.completedFuture(
                player.build(MessageType.GAME_JOIN_ACK, new InvitationResponse(false))));

        MatchOutcome outcome = orchestrator.run(ASSIGNMENT, referee);

        assertEquals(GameState.ABORTED, outcome.finalState());
        assertEquals("P02 declined the invitation", outcome.abortReason().orElseThrow());
    }

    @Test
    void run_abortsOnInvalidParityChoice() throws DeliveryException {
        acceptInvitation(A_ENDPOINT);
        acceptInvitation(B_ENDPOINT);
        answerChoice(A_ENDPOINT, "EVEN");
        answerChoice(B_ENDPOINT, "odd");

        MatchOutcome outcome = orchestrator.run(ASSIGNMENT, referee);

        assertEquals(GameState.ABORTED, outcome.finalState());
        assertTrue(outcome.abortReason().orElseThrow().contains("invalid parity choice"));
        assertEquals("ABORTED", capturedReport().get("result").get("status").asText());
        verify(rpcClient, never()).call(anyString(), eq(RpcMethods.NOTIFY_MATCH_RESULT), any(), any());
    }

    @Test
    void run_asksBothPlayersEvenIfOneFails() {
        acceptInvitation(A_ENDPOINT);
        acceptInvitation(B_ENDPOINT);
        when(rpcClient.call(eq(A_ENDPOINT), eq(RpcMethods.CHOOSE_PARITY), any(), any()))
            .thenReturn(CompletableFuture.failedFuture(new RpcException(RpcException.Kind.CONNECTION, "reset", null)));
        answerChoice(B_ENDPOINT, "even");

        MatchOutcome outcome = orchestrator.run(ASSIGNMENT, referee);

        assertEquals(GameState.ABORTED, outcome.finalState());
        verify(rpcClient).call(eq(B_ENDPOINT), eq(RpcMethods.CHOOSE_PARITY), any(), any());
    }

    @Test
    void run_recordsUndeliveredReport() throws DeliveryException {
        acceptInvitation(A_ENDPOINT);
        acceptInvitation(B_ENDPOINT);
        answerChoice(A_ENDPOINT, "odd");
        answerChoice(B_ENDPOINT, "odd");
        when(reportSender.send(anyString(), anyString(), any())).thenThrow(new DeliveryException("down", 3, null));

        MatchOutcome outcome = orchestrator.run(ASSIGNMENT, referee);

        // both wrong on an even draw
        assertTrue(outcome.result().orElseThrow().isDraw());
        assertFalse(outcome.reported());
    }

    private void acceptInvitation(String endpoint) {
        when(rpcClient.call(eq(endpoint), eq(RpcMethods.HANDLE_GAME_INVITATION), any(), any()))
            .thenReturn(CompletableFuture.completedFuture(
                player.build(MessageType.GAME_JOIN_ACK, new InvitationResponse(true))));
    }

    private void answerChoice(String endpoint, String choice) {
        when(rpcClient.call(eq(endpoint), eq(RpcMethods.CHOOSE_PARITY), any(), any()))
            .thenReturn(CompletableFuture.completedFuture(
                player.build(MessageType.CHOOSE_PARITY_RESPONSE, new ChooseParityResponse(choice))));
    }

    private JsonNode capturedReport() throws DeliveryException {
        ArgumentCaptor<JsonNode> report = ArgumentCaptor.forClass(JsonNode.class);
        verify(reportSender).send(eq(MANAGER), eq(RpcMethods.REPORT_MATCH_RESULT), report.capture());
        return report.getValue();
    }
}
