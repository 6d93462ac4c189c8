package edu.brandeis.cosi103a.league.tournament;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.brandeis.cosi103a.league.broadcast.Broadcaster;
import edu.brandeis.cosi103a.league.broadcast.DeliveryReport;
import edu.brandeis.cosi103a.league.broadcast.Recipient;
import edu.brandeis.cosi103a.league.network.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.league.protocol.MessageBuilder;
import edu.brandeis.cosi103a.league.protocol.RpcMethods;
import edu.brandeis.cosi103a.league.scheduler.MatchScheduler;
import edu.brandeis.cosi103a.league.scheduler.RefereeInfo;
import edu.brandeis.cosi103a.league.scheduler.SchedulePlan;
import edu.brandeis.cosi103a.league.standings.StandingsEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RoundManagerTest {

    private static final List<String> PLAYERS = List.of("P01", "P02", "P03", "P04");
    private static final DeliveryReport DELIVERED = new DeliveryReport(4, 4, 0, ImmutableList.of(), ImmutableMap.of());

    private Broadcaster broadcaster;
    private Tournament tournament;
    private RoundManager manager;

    @BeforeEach
    void setUp() {
        StandingsEngine standings = new StandingsEngine();
        PLAYERS.forEach(p -> standings.addPlayer(p, "Player " + p));
        SchedulePlan plan = MatchScheduler.buildPlan("L1", PLAYERS,
            List.of(new RefereeInfo("REF01", "http://localhost:8001/mcp")));
        tournament = Tournament.fromPlan(plan, standings);

        broadcaster = mock(Broadcaster.class);
        when(broadcaster.broadcast(anyList(), any(), any())).thenReturn(DELIVERED);

        List<Recipient> recipients = new ArrayList<>();
        PLAYERS.forEach(p -> recipients.add(new Recipient(p, "http://" + p + "/mcp")));
        manager = new RoundManager(tournament, broadcaster,
            new MessageBuilder(ObjectMapperFactory.create(), "league_manager"),
            () -> recipients,
            refereeId -> "http://localhost:8001/mcp");
    }

    @Test
    void startRound_announcesMatchesAndStartsThem() {
        manager.startRound(1);

        assertEquals(1, tournament.currentRound());
        assertEquals(RoundStatus.ANNOUNCED, tournament.round(1).status());
        tournament.round(1).matches().forEach(m -> assertEquals(MatchStatus.IN_PROGRESS, m.status()));

        ArgumentCaptor<JsonNode> message = ArgumentCaptor.forClass(JsonNode.class);
        verify(broadcaster).broadcast(anyList(), eq(RpcMethods.NOTIFY_ROUND_ANNOUNCEMENT), message.capture());
        assertEquals("ROUND_ANNOUNCEMENT", message.getValue().get("message_type").asText());
        assertEquals(2, message.getValue().get("matches").size());
        assertEquals("http://localhost:8001/mcp", message.getValue().get("matches").get(0).get("referee_endpoint").asText());
    }

    @Test
    void startRound_refusesToSkipAhead() {
        assertThrows(RoundLifecycleException.class, () -> manager.startRound(2));
        assertEquals(0, tournament.currentRound());
    }

    @Test
    void startRound_refusesToRestartARound() {
        manager.startRound(1);

        assertThrows(RoundLifecycleException.class, () -> manager.startRound(1));
    }

    @Test
    void markMatchComplete_returnsTrueOnlyForLastMatch() {
        manager.startRound(1);
        List<Match> matches = tournament.round(1).matches();

        assertFalse(manager.markMatchComplete(matches.get(0).matchId(), 1));
        assertFalse(manager.markMatchComplete(matches.get(0).matchId(), 1), "Repeated completion changes nothing");
        assertTrue(manager.markMatchComplete(matches.get(1).matchId(), 1));
        assertFalse(manager.markMatchComplete(matches.get(1).matchId(), 1));
    }

    @Test
    void markMatchComplete_abortedMatchesCountTowardCompletion() {
        manager.startRound(1);
        List<Match> matches = tournament.round(1).matches();

        manager.markMatchComplete(matches.get(0).matchId(), 1, MatchStatus.ABORTED);
        assertTrue(manager.markMatchComplete(matches.get(1).matchId(), 1, MatchStatus.COMPLETED));

        assertEquals(MatchStatus.ABORTED, matches.get(0).status());
        assertEquals(2, tournament.completedMatches());
    }

    @Test
    void markMatchComplete_rejectsMatchFromAnotherRound() {
        manager.startRound(1);
        String roundTwoMatch = tournament.round(2).matches().get(0).matchId();

        assertThrows(IllegalArgumentException.class, () -> manager.markMatchComplete(roundTwoMatch, 1));
    }

    @Test
    void markMatchComplete_rejectsRoundNotInProgress() {
        String match = tournament.round(1).matches().get(0).matchId();

        assertThrows(RoundLifecycleException.class, () -> manager.markMatchComplete(match, 1));
    }

    @Test
    void markMatchComplete_exactlyOneConcurrentCallerCompletesTheRound() throws InterruptedException {
        manager.startRound(1);
        List<Match> matches = tournament.round(1).matches();
        AtomicInteger completions = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(40);

        for (int i = 0; i < 40; i++) {
            String matchId = matches.get(i % 2).matchId();
            pool.submit(() -> {
                if (manager.markMatchComplete(matchId, 1)) {
                    completions.incrementAndGet();
                }
                done.countDown();
            });
        }
        assertTrue(done.await(5, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(1, completions.get());
    }

    @Test
    void completeRound_requiresAllMatchesFinished() {
        manager.startRound(1);
        manager.markMatchComplete(tournament.round(1).matches().get(0).matchId(), 1);

        assertThrows(RoundLifecycleException.class, () -> manager.completeRound(1));
    }

    @Test
    void fullLeagueRunsToTournamentEnd() {
        StandingsEngine standings = tournament.standings();
        for (int round = 1; round <= tournament.totalRounds(); round++) {
            manager.startRound(round);
            for (Match match : tournament.round(round).matches()) {
                standings.recordMatchResult(match.matchId(), match.playerAId(), match.playerBId(), match.playerAId());
                manager.markMatchComplete(match.matchId(), round);
            }
            assertFalse(manager.isTournamentComplete() && round < tournament.totalRounds());
            manager.completeRound(round);
        }

        assertTrue(manager.isTournamentComplete());
        manager.broadcastTournamentEnd();

        assertEquals(TournamentStage.COMPLETED, tournament.stage());
        ArgumentCaptor<JsonNode> end = ArgumentCaptor.forClass(JsonNode.class);
        verify(broadcaster).broadcast(anyList(), eq(RpcMethods.NOTIFY_TOURNAMENT_END), end.capture());
        // P01 is playerA in all of its matches
        assertEquals("P01", end.getValue().get("champion").asText());
        assertEquals(4, end.getValue().get("final_standings").size());
        verify(broadcaster, times(3)).broadcast(anyList(), eq(RpcMethods.NOTIFY_ROUND_COMPLETED), any());
    }

    @Test
    void broadcastTournamentEnd_refusedBeforeLastRound() {
        manager.startRound(1);

        assertThrows(RoundLifecycleException.class, () -> manager.broadcastTournamentEnd());
    }
}
