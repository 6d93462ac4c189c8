package edu.brandeis.cosi103a.league.referee;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.league.broadcast.DeliveryException;
import edu.brandeis.cosi103a.league.broadcast.MessageSender;
import edu.brandeis.cosi103a.league.game.GameResult;
import edu.brandeis.cosi103a.league.game.GameSession;
import edu.brandeis.cosi103a.league.game.GameState;
import edu.brandeis.cosi103a.league.game.NumberDrawer;
import edu.brandeis.cosi103a.league.game.ParityChoice;
import edu.brandeis.cosi103a.league.game.ParityScorer;
import edu.brandeis.cosi103a.league.game.ProtocolViolationException;
import edu.brandeis.cosi103a.league.network.RpcClient;
import edu.brandeis.cosi103a.league.network.RpcException;
import edu.brandeis.cosi103a.league.protocol.ChooseParityCall;
import edu.brandeis.cosi103a.league.protocol.ChooseParityResponse;
import edu.brandeis.cosi103a.league.protocol.GameInvitation;
import edu.brandeis.cosi103a.league.protocol.GameOver;
import edu.brandeis.cosi103a.league.protocol.InvitationResponse;
import edu.brandeis.cosi103a.league.protocol.MatchAssignment;
import edu.brandeis.cosi103a.league.protocol.MatchResultReport;
import edu.brandeis.cosi103a.league.protocol.MessageBuilder;
import edu.brandeis.cosi103a.league.protocol.MessageType;
import edu.brandeis.cosi103a.league.protocol.RpcMethods;
import edu.brandeis.cosi103a.league.protocol.StandingRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one match from invitation to report.
 *
 * <ol>
 *   <li>Invite both players concurrently; both must accept before the invitation deadline.</li>
 *   <li>Ask both players for their choice concurrently, before either answer is seen.</li>
 *   <li>Draw a number and score the game.</li>
 *   <li>Tell both players the result without waiting for them.</li>
 *   <li>Report the result to the league manager with retries.</li>
 * </ol>
 *
 * Any failure in the first two phases aborts the match, and an {@code ABORTED} report is
 * still sent so the league never waits on a match that will not finish. Failures never
 * escape {@link #run}. The orchestrator itself is stateless; each run owns a fresh
 * {@link GameSession}.
 */
public class MatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MatchOrchestrator.class);
    private static final long DEADLINE_GRACE_MS = 250;

    private final RpcClient rpcClient;
    private final MessageSender reportSender;
    private final NumberDrawer drawer;
    private final ParityScorer scorer;
    private final RefereeSettings settings;
    private final Clock clock;

    public MatchOrchestrator(RpcClient rpcClient, MessageSender reportSender, NumberDrawer drawer,
                             ParityScorer scorer, RefereeSettings settings) {
        this(rpcClient, reportSender, drawer, scorer, settings, Clock.systemUTC());
    }

    public MatchOrchestrator(RpcClient rpcClient, MessageSender reportSender, NumberDrawer drawer,
                             ParityScorer scorer, RefereeSettings settings, Clock clock) {
        this.rpcClient = rpcClient;
        this.reportSender = reportSender;
        this.drawer = drawer;
        this.scorer = scorer;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Plays the assigned match to completion or abort.
     *
     * @param messages envelope builder carrying this referee's identity and token
     */
    public MatchOutcome run(MatchAssignment assignment, MessageBuilder messages) {
        GameSession session = new GameSession(assignment.matchId(), clock);
        log.info("Match {}: {} vs {}", assignment.matchId(), assignment.playerAId(), assignment.playerBId());
        try {
            invitePlayers(assignment, messages);
            session.transition(GameState.COLLECTING_CHOICES);

            Map<String, ParityChoice> choices = collectChoices(assignment, messages);
            session.transition(GameState.DRAWING_NUMBER);

            int drawn = drawer.draw();
            session.transition(GameState.EVALUATING);
            GameResult result = scorer.determineWinner(drawn, choices);
            session.transition(GameState.FINISHED);
            log.info("Match {}: drew {}, {}", assignment.matchId(), drawn,
                result.winnerPlayerId().map(w -> "winner " + w).orElse("draw"));

            notifyPlayers(assignment, messages, result);
            boolean reported = report(messages,
                MatchResultReport.completed(assignment.leagueId(), assignment.matchId(), assignment.roundId(), result));
            return MatchOutcome.finished(assignment.matchId(), session.state(), result, session.history(), reported);
        } catch (MatchAbortedException e) {
            return abort(session, assignment, messages, e.getMessage());
        } catch (ProtocolViolationException e) {
            log.error("Match {}: protocol violation in state {}", assignment.matchId(), session.state(), e);
            return abort(session, assignment, messages, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Match {}: unexpected failure in state {}", assignment.matchId(), session.state(), e);
            return abort(session, assignment, messages, "Referee error: " + e.getMessage());
        }
    }

    private void invitePlayers(MatchAssignment assignment, MessageBuilder messages) throws MatchAbortedException {
        Duration timeout = settings.invitationTimeout();
        ObjectNode toA = messages.build(MessageType.GAME_INVITATION, new GameInvitation(
            assignment.matchId(), assignment.roundId(), assignment.playerBId(), GameInvitation.PLAYER_A));
        ObjectNode toB = messages.build(MessageType.GAME_INVITATION, new GameInvitation(
            assignment.matchId(), assignment.roundId(), assignment.playerAId(), GameInvitation.PLAYER_B));

        // Both invitations leave before either reply is examined
        CompletableFuture<JsonNode> replyA = rpcClient.call(
            assignment.playerAEndpoint(), RpcMethods.HANDLE_GAME_INVITATION, toA, timeout);
        CompletableFuture<JsonNode> replyB = rpcClient.call(
            assignment.playerBEndpoint(), RpcMethods.HANDLE_GAME_INVITATION, toB, timeout);
        awaitBoth(replyA, replyB, timeout);

        requireAccepted(assignment.playerAId(), replyOf(replyA, assignment.playerAId(), "Invitation"), messages);
        requireAccepted(assignment.playerBId(), replyOf(replyB, assignment.playerBId(), "Invitation"), messages);
    }

    private void requireAccepted(String playerId, JsonNode reply, MessageBuilder messages) throws MatchAbortedException {
        InvitationResponse response;
        try {
            response = messages.payloadOf(reply, InvitationResponse.class);
        } catch (IllegalArgumentException e) {
            throw new MatchAbortedException("Unreadable invitation reply from " + playerId);
        }
        if (!response.accept()) {
            throw new MatchAbortedException(playerId + " declined the invitation");
        }
    }

    private Map<String, ParityChoice> collectChoices(MatchAssignment assignment, MessageBuilder messages)
            throws MatchAbortedException {
        Duration timeout = settings.choiceTimeout();
        String deadline = Instant.now(clock).plus(timeout).toString();
        ImmutableList<StandingRow> standings =
            assignment.standings() != null ? assignment.standings() : ImmutableList.of();

        ObjectNode toA = messages.build(MessageType.CHOOSE_PARITY_CALL, new ChooseParityCall(
            assignment.matchId(), assignment.playerAId(),
            new ChooseParityCall.Context(assignment.playerBId(), standings), deadline));
        ObjectNode toB = messages.build(MessageType.CHOOSE_PARITY_CALL, new ChooseParityCall(
            assignment.matchId(), assignment.playerBId(),
            new ChooseParityCall.Context(assignment.playerAId(), standings), deadline));

        // Simultaneous: neither request may depend on the other player's answer
        CompletableFuture<JsonNode> replyA = rpcClient.call(
            assignment.playerAEndpoint(), RpcMethods.CHOOSE_PARITY, toA, timeout);
        CompletableFuture<JsonNode> replyB = rpcClient.call(
            assignment.playerBEndpoint(), RpcMethods.CHOOSE_PARITY, toB, timeout);
        awaitBoth(replyA, replyB, timeout);

        Map<String, ParityChoice> choices = new LinkedHashMap<>();
        choices.put(assignment.playerAId(),
            choiceOf(assignment.playerAId(), replyOf(replyA, assignment.playerAId(), "Choice request"), messages));
        choices.put(assignment.playerBId(),
            choiceOf(assignment.playerBId(), replyOf(replyB, assignment.playerBId(), "Choice request"), messages));
        return choices;
    }

    private ParityChoice choiceOf(String playerId, JsonNode reply, MessageBuilder messages) {
        ChooseParityResponse response;
        try {
            response = messages.payloadOf(reply, ChooseParityResponse.class);
        } catch (IllegalArgumentException e) {
            throw new ProtocolViolationException("Unreadable choice from " + playerId);
        }
        return ParityChoice.fromWire(response.parityChoice())
            .orElseThrow(() -> new ProtocolViolationException(
                playerId + " sent invalid parity choice '" + response.parityChoice() + "'"));
    }

    private void notifyPlayers(MatchAssignment assignment, MessageBuilder messages, GameResult result) {
        ObjectNode gameOver = messages.build(MessageType.GAME_OVER, new GameOver(assignment.matchId(), result));
        notifyPlayer(assignment.matchId(), assignment.playerAId(), assignment.playerAEndpoint(), gameOver);
        notifyPlayer(assignment.matchId(), assignment.playerBId(), assignment.playerBEndpoint(), gameOver);
    }

    private void notifyPlayer(String matchId, String playerId, String endpoint, ObjectNode gameOver) {
        rpcClient.call(endpoint, RpcMethods.NOTIFY_MATCH_RESULT, gameOver, settings.invitationTimeout())
            .whenComplete((reply, error) -> {
                if (error != null) {
                    log.warn("Match {}: result notification to {} failed: {}",
                        matchId, playerId, RpcException.unwrap(error).getMessage());
                }
            });
    }

    private MatchOutcome abort(GameSession session, MatchAssignment assignment, MessageBuilder messages, String reason) {
        if (session.canTransition(GameState.ABORTED)) {
            session.transition(GameState.ABORTED);
        } else {
            log.error("Match {}: cannot abort from {}, reporting it aborted anyway", assignment.matchId(), session.state());
        }
        log.warn("Match {} aborted: {}", assignment.matchId(), reason);
        boolean reported = report(messages,
            MatchResultReport.aborted(assignment.leagueId(), assignment.matchId(), assignment.roundId(), reason));
        return MatchOutcome.aborted(assignment.matchId(), session.state(), reason, session.history(), reported);
    }

    private boolean report(MessageBuilder messages, MatchResultReport report) {
        String endpoint = settings.managerEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            log.warn("Match {}: no league manager endpoint configured, result not reported", report.matchId());
            return false;
        }
        try {
            reportSender.send(endpoint, RpcMethods.REPORT_MATCH_RESULT,
                messages.build(MessageType.MATCH_RESULT_REPORT, report));
            return true;
        } catch (DeliveryException e) {
            log.error("Match {}: result report failed after {} attempts: {}",
                report.matchId(), e.attempts(), e.getMessage());
            return false;
        }
    }

    private static void awaitBoth(CompletableFuture<JsonNode> first, CompletableFuture<JsonNode> second,
                                  Duration timeout) {
        try {
            CompletableFuture.allOf(first, second).get(timeout.toMillis() + DEADLINE_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Not every reply arrived cleanly: {}", e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            first.cancel(true);
            second.cancel(true);
        }
    }

    private static JsonNode replyOf(CompletableFuture<JsonNode> reply, String playerId, String phase)
            throws MatchAbortedException {
        if (!reply.isDone()) {
            reply.cancel(true);
            throw new MatchAbortedException(phase + " to " + playerId + " timed out");
        }
        try {
            return reply.join();
        } catch (CancellationException e) {
            throw new MatchAbortedException(phase + " to " + playerId + " was cancelled");
        } catch (CompletionException e) {
            throw new MatchAbortedException(phase + " to " + playerId + " failed: " + RpcException.unwrap(e).getMessage());
        }
    }

    private static final class MatchAbortedException extends Exception {
        MatchAbortedException(String reason) {
            super(reason);
        }
    }
}
