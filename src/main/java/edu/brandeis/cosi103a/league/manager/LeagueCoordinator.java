package edu.brandeis.cosi103a.league.manager;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import edu.brandeis.cosi103a.league.broadcast.Broadcaster;
import edu.brandeis.cosi103a.league.broadcast.DeliveryException;
import edu.brandeis.cosi103a.league.broadcast.MessageSender;
import edu.brandeis.cosi103a.league.broadcast.RetryPolicy;
import edu.brandeis.cosi103a.league.network.RpcClient;
import edu.brandeis.cosi103a.league.protocol.Acknowledgement;
import edu.brandeis.cosi103a.league.protocol.Envelope;
import edu.brandeis.cosi103a.league.protocol.MatchAssignment;
import edu.brandeis.cosi103a.league.protocol.MatchResultReport;
import edu.brandeis.cosi103a.league.protocol.MessageBuilder;
import edu.brandeis.cosi103a.league.protocol.MessageType;
import edu.brandeis.cosi103a.league.protocol.RegistrationRequest;
import edu.brandeis.cosi103a.league.protocol.RegistrationResponse;
import edu.brandeis.cosi103a.league.protocol.RpcMethods;
import edu.brandeis.cosi103a.league.protocol.StandingRow;
import edu.brandeis.cosi103a.league.protocol.StandingsResponse;
import edu.brandeis.cosi103a.league.protocol.TournamentStart;
import edu.brandeis.cosi103a.league.scheduler.MatchScheduler;
import edu.brandeis.cosi103a.league.scheduler.SchedulePlan;
import edu.brandeis.cosi103a.league.standings.PlayerStanding;
import edu.brandeis.cosi103a.league.standings.StandingsEngine;
import edu.brandeis.cosi103a.league.tournament.Match;
import edu.brandeis.cosi103a.league.tournament.MatchStatus;
import edu.brandeis.cosi103a.league.tournament.RoundLifecycleException;
import edu.brandeis.cosi103a.league.tournament.RoundManager;
import edu.brandeis.cosi103a.league.tournament.Tournament;
import edu.brandeis.cosi103a.league.tournament.TournamentStage;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * The league manager: admits agents, builds the plan, drives rounds and applies match
 * results.
 *
 * Result application (standings update plus match completion) is atomic under the
 * tournament lock, so concurrent reports can neither lose an update nor complete a round
 * twice. Round transitions run one at a time on a dedicated thread, so round {@code n+1}
 * is announced only after round {@code n} has been completed.
 */
@Service
@ConditionalOnProperty(name = "league.role", havingValue = "manager", matchIfMissing = true)
public class LeagueCoordinator {

    public static final String SENDER = "league_manager";

    private static final Logger log = LoggerFactory.getLogger(LeagueCoordinator.class);

    private enum Applied {
        DUPLICATE,
        RECORDED,
        ROUND_COMPLETE
    }

    private final String leagueId;
    private final AgentRegistry registry;
    private final LeagueStore store;
    private final MessageSender sender;
    private final Broadcaster broadcaster;
    private final SimpMessagingTemplate messagingTemplate;
    private final MessageBuilder messages;
    private final ExecutorService progression;
    private final ExecutorService dispatchPool;
    private final StandingsEngine standings = new StandingsEngine();
    private final Object lifecycleLock = new Object();
    private final boolean restoreAgents;

    private volatile TournamentStage stage = TournamentStage.REGISTRATION;
    private volatile Tournament tournament;
    private volatile RoundManager roundManager;

    @Autowired
    public LeagueCoordinator(
            RpcClient rpcClient,
            ObjectMapper objectMapper,
            RetryPolicy retryPolicy,
            SimpMessagingTemplate messagingTemplate,
            @Value("${league.id:league_2025_even_odd}") String leagueId,
            @Value("${league.data-dir:./data}") String dataDir,
            @Value("${league.registry.max-players:100}") int maxPlayers,
            @Value("${league.registry.max-referees:10}") int maxReferees,
            @Value("${league.registry.restore:true}") boolean restoreAgents) {
        this(leagueId,
            new AgentRegistry(maxPlayers, maxReferees, new TokenGenerator(), Clock.systemUTC()),
            new LeagueStore(Path.of(dataDir)),
            new MessageSender(rpcClient, retryPolicy),
            messagingTemplate,
            objectMapper,
            restoreAgents);
    }

    private LeagueCoordinator(String leagueId, AgentRegistry registry, LeagueStore store, MessageSender sender,
                              SimpMessagingTemplate messagingTemplate, ObjectMapper objectMapper, boolean restoreAgents) {
        this(leagueId, registry, store, sender, new Broadcaster(sender), messagingTemplate, objectMapper,
            Executors.newSingleThreadExecutor(new ThreadFactoryBuilder().setNameFormat("league-progress").build()),
            Executors.newCachedThreadPool(new ThreadFactoryBuilder().setNameFormat("match-dispatch-%d").setDaemon(true).build()),
            restoreAgents);
    }

    public LeagueCoordinator(String leagueId, AgentRegistry registry, LeagueStore store, MessageSender sender,
                             Broadcaster broadcaster, SimpMessagingTemplate messagingTemplate, ObjectMapper objectMapper,
                             ExecutorService progression, ExecutorService dispatchPool, boolean restoreAgents) {
        this.leagueId = leagueId;
        this.registry = registry;
        this.store = store;
        this.sender = sender;
        this.broadcaster = broadcaster;
        this.messagingTemplate = messagingTemplate;
        this.messages = new MessageBuilder(objectMapper, SENDER);
        this.progression = progression;
        this.dispatchPool = dispatchPool;
        this.restoreAgents = restoreAgents;
    }

    /**
     * Re-admits agents saved by a previous run of this manager.
     */
    @PostConstruct
    public void restoreAgents() {
        if (!restoreAgents) {
            return;
        }
        try {
            List<RegisteredAgent> saved = store.readAgents();
            registry.restore(saved);
            for (RegisteredAgent agent : saved) {
                if (agent.role() == AgentRole.PLAYER) {
                    standings.addPlayer(agent.agentId(), agent.displayName());
                }
            }
            if (!saved.isEmpty()) {
                log.info("Restored {} agents from {}", saved.size(), store.dataDir());
            }
        } catch (IOException e) {
            log.warn("Could not read saved agents from {}: {}", store.dataDir(), e.getMessage());
        }
    }

    public String leagueId() {
        return leagueId;
    }

    public AgentRegistry registry() {
        return registry;
    }

    public MessageBuilder messages() {
        return messages;
    }

    public RegistrationResponse registerPlayer(RegistrationRequest request) {
        return register(request, AgentRole.PLAYER);
    }

    public RegistrationResponse registerReferee(RegistrationRequest request) {
        return register(request, AgentRole.REFEREE);
    }

    private RegistrationResponse register(RegistrationRequest request, AgentRole role) {
        RegistrationResponse response;
        synchronized (lifecycleLock) {
            if (stage != TournamentStage.REGISTRATION) {
                return RegistrationResponse.rejected(leagueId, "League " + leagueId + " is already " + stage);
            }
            try {
                RegisteredAgent agent = role == AgentRole.PLAYER
                    ? registry.registerPlayer(request)
                    : registry.registerReferee(request);
                if (role == AgentRole.PLAYER) {
                    standings.addPlayer(agent.agentId(), agent.displayName());
                }
                response = RegistrationResponse.accepted(agent.agentId(), agent.authToken(), leagueId);
            } catch (RegistrationException e) {
                log.warn("Rejected {} registration from {}: {}", role, request.endpoint(), e.getMessage());
                return RegistrationResponse.rejected(leagueId, e.getMessage());
            }
        }
        persist("agents", () -> store.writeAgents(registry.all()));
        publishStatus();
        return response;
    }

    /**
     * Builds the full plan from the registered agents and starts round 1 in the background.
     *
     * @throws edu.brandeis.cosi103a.league.scheduler.ScheduleConfigurationException with fewer than two players or no referee
     * @throws RoundLifecycleException if the league already started
     */
    public LeagueStatus startLeague() {
        SchedulePlan plan;
        synchronized (lifecycleLock) {
            if (stage != TournamentStage.REGISTRATION) {
                throw new RoundLifecycleException("League " + leagueId + " is already " + stage);
            }
            List<String> playerIds = registry.players().stream().map(RegisteredAgent::agentId).toList();
            plan = MatchScheduler.buildPlan(leagueId, playerIds, registry.availableReferees());
            Tournament created = Tournament.fromPlan(plan, standings);
            roundManager = new RoundManager(created, broadcaster, messages, registry::playerRecipients, this::refereeEndpoint);
            tournament = created;
            stage = TournamentStage.RUNNING;
        }
        log.info("League {} starting: {} players, {} rounds, {} matches",
            leagueId, registry.players().size(), plan.totalRounds(), plan.totalMatches());
        persist("schedule", () -> store.writeSchedule(plan));

        SchedulePlan started = plan;
        submitProgression("start of league", () -> {
            TournamentStart start = new TournamentStart(leagueId, started.totalRounds(), started.totalMatches(),
                registry.players().stream().map(RegisteredAgent::agentId).collect(ImmutableList.toImmutableList()));
            broadcaster.broadcast(registry.playerRecipients(), RpcMethods.NOTIFY_TOURNAMENT_START,
                messages.build(MessageType.TOURNAMENT_START, start));
            beginRound(1);
        });
        publishStatus();
        return status();
    }

    /**
     * Applies a referee's report.
     *
     * @throws AuthenticationException if the sender is not the match's referee or its token is wrong
     * @throws IllegalArgumentException if the report does not fit the match
     * @throws RoundLifecycleException if the league has not started
     */
    public Acknowledgement reportMatchResult(Envelope envelope, MatchResultReport report) {
        String refereeId = envelope.senderId();
        registry.find(refereeId)
            .filter(agent -> agent.role() == AgentRole.REFEREE)
            .orElseThrow(() -> new AuthenticationException("Unknown referee " + refereeId));
        if (!registry.verifyToken(refereeId, envelope.authToken())) {
            throw new AuthenticationException("Invalid token for " + refereeId);
        }
        Tournament current = tournament;
        if (current == null) {
            throw new RoundLifecycleException("League " + leagueId + " has not started");
        }
        Match match = current.locked(() -> current.findMatch(report.matchId()))
            .orElseThrow(() -> new IllegalArgumentException("Unknown match " + report.matchId()));
        if (!match.refereeId().equals(refereeId)) {
            throw new AuthenticationException(refereeId + " is not the referee of " + match.matchId());
        }
        if (match.roundNumber() != report.roundId()) {
            throw new IllegalArgumentException("Match " + match.matchId() + " belongs to round " + match.roundNumber());
        }
        if (report.result() == null) {
            throw new IllegalArgumentException("Report for " + match.matchId() + " has no result");
        }

        Applied applied;
        if (report.isAborted()) {
            applied = applyResult(match, MatchStatus.ABORTED, null, report.result().reason());
        } else {
            String winner = report.result().winner();
            if (winner != null && !winner.equals(match.playerAId()) && !winner.equals(match.playerBId())) {
                throw new IllegalArgumentException("Winner " + winner + " did not play in " + match.matchId());
            }
            if (!report.hasValidChoices()) {
                throw new IllegalArgumentException("Report for " + match.matchId() + " contains an invalid choice");
            }
            applied = applyResult(match, MatchStatus.COMPLETED, winner, null);
        }
        return Acknowledgement.withStatus(applied == Applied.DUPLICATE ? Acknowledgement.DUPLICATE : Acknowledgement.RECORDED);
    }

    private Applied applyResult(Match match, MatchStatus outcome, String winner, String reason) {
        Tournament current = tournament;
        RoundManager rounds = roundManager;
        Applied applied = current.locked(() -> {
            if (match.status().isTerminal()) {
                return Applied.DUPLICATE;
            }
            if (outcome == MatchStatus.COMPLETED) {
                current.standings().recordMatchResult(match.matchId(), match.playerAId(), match.playerBId(), winner);
            }
            return rounds.markMatchComplete(match.matchId(), match.roundNumber(), outcome)
                ? Applied.ROUND_COMPLETE
                : Applied.RECORDED;
        });

        if (applied == Applied.DUPLICATE) {
            log.info("Ignoring repeated result for {}", match.matchId());
            return applied;
        }
        if (outcome == MatchStatus.ABORTED) {
            log.warn("Match {} aborted: {}", match.matchId(), reason);
        } else {
            log.info("Match {} recorded, {}", match.matchId(), winner != null ? "winner " + winner : "draw");
        }
        persistStandings();
        publishStatus();
        if (applied == Applied.ROUND_COMPLETE) {
            int roundNumber = match.roundNumber();
            submitProgression("end of round " + roundNumber, () -> finishRound(roundNumber));
        }
        return applied;
    }

    private void beginRound(int roundNumber) {
        roundManager.startRound(roundNumber);
        List<Match> matches = tournament.locked(() -> tournament.round(roundNumber).matches());
        ImmutableList<StandingRow> table = standingRows();
        CompletableFuture<?>[] dispatches = matches.stream()
            .map(match -> CompletableFuture.runAsync(() -> dispatch(match, table), dispatchPool))
            .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(dispatches).join();
        persistRounds();
        publishStatus();
    }

    private void dispatch(Match match, ImmutableList<StandingRow> table) {
        MatchAssignment assignment = new MatchAssignment(
            leagueId,
            match.roundNumber(),
            match.matchId(),
            match.playerAId(),
            playerEndpoint(match.playerAId()),
            match.playerBId(),
            playerEndpoint(match.playerBId()),
            table);
        try {
            sender.send(refereeEndpoint(match.refereeId()), RpcMethods.ASSIGN_MATCH,
                messages.build(MessageType.MATCH_ASSIGNMENT, assignment));
            log.debug("Assigned {} to {}", match.matchId(), match.refereeId());
        } catch (DeliveryException e) {
            log.error("Could not assign {} to referee {}: {}", match.matchId(), match.refereeId(), e.getMessage());
            applyResult(match, MatchStatus.ABORTED, null, "Referee " + match.refereeId() + " unreachable");
        }
    }

    private void finishRound(int roundNumber) {
        roundManager.completeRound(roundNumber);
        persistRounds();
        if (roundNumber < tournament.totalRounds()) {
            beginRound(roundNumber + 1);
        } else {
            roundManager.broadcastTournamentEnd();
            stage = TournamentStage.COMPLETED;
            persistStandings();
            publishStatus();
        }
    }

    private void submitProgression(String description, Runnable step) {
        progression.submit(() -> {
            try {
                step.run();
            } catch (RuntimeException e) {
                log.error("League {} failed during {}", leagueId, description, e);
            }
        });
    }

    public StandingsResponse getStandings() {
        return new StandingsResponse(leagueId, standingRows());
    }

    public ImmutableList<PlayerStanding> standings() {
        return standings.getStandings();
    }

    public LeagueStatus status() {
        int players = registry.players().size();
        int referees = registry.referees().size();
        Tournament current = tournament;
        if (current == null) {
            return LeagueStatus.registration(leagueId, players, referees);
        }
        TournamentStage currentStage = stage;
        return current.locked(() -> {
            Optional<String> champion = Optional.empty();
            if (currentStage == TournamentStage.COMPLETED) {
                ImmutableList<PlayerStanding> table = current.standings().getStandings();
                champion = table.isEmpty() ? Optional.empty() : Optional.of(table.get(0).playerId());
            }
            return new LeagueStatus(leagueId, currentStage, current.currentRound(), current.totalRounds(),
                current.completedMatches(), current.totalMatches(), players, referees, champion);
        });
    }

    private ImmutableList<StandingRow> standingRows() {
        return standings.getStandings().stream().map(StandingRow::of).collect(ImmutableList.toImmutableList());
    }

    private String refereeEndpoint(String refereeId) {
        return registry.find(refereeId).map(RegisteredAgent::endpoint).orElse(null);
    }

    private String playerEndpoint(String playerId) {
        return registry.find(playerId).map(RegisteredAgent::endpoint).orElse(null);
    }

    private void publishStatus() {
        try {
            messagingTemplate.convertAndSend("/topic/leagues/" + leagueId, status());
        } catch (RuntimeException e) {
            log.warn("Failed to publish progress for league {}: {}", leagueId, e.getMessage());
        }
    }

    private void persistRounds() {
        Tournament current = tournament;
        current.mutate(() -> persist("rounds", () -> store.writeRounds(leagueId, current.rounds())));
    }

    private void persistStandings() {
        Tournament current = tournament;
        current.mutate(() -> persist("standings", () -> store.writeStandings(leagueId, standings.getStandings())));
    }

    @FunctionalInterface
    private interface StoreWrite {
        void write() throws IOException;
    }

    private void persist(String what, StoreWrite write) {
        try {
            write.write();
        } catch (IOException e) {
            log.error("Failed to save {} of league {} to {}", what, leagueId, store.dataDir(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        progression.shutdown();
        try {
            if (!progression.awaitTermination(10, TimeUnit.SECONDS)) {
                progression.shutdownNow();
            }
        } catch (InterruptedException e) {
            progression.shutdownNow();
            Thread.currentThread().interrupt();
        }
        dispatchPool.shutdownNow();
        broadcaster.shutdown();
    }
}
