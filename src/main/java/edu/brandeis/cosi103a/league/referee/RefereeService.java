package edu.brandeis.cosi103a.league.referee;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import edu.brandeis.cosi103a.league.broadcast.MessageSender;
import edu.brandeis.cosi103a.league.broadcast.RetryPolicy;
import edu.brandeis.cosi103a.league.game.NumberDrawer;
import edu.brandeis.cosi103a.league.game.ParityScorer;
import edu.brandeis.cosi103a.league.game.SameChoicePolicy;
import edu.brandeis.cosi103a.league.network.RpcClient;
import edu.brandeis.cosi103a.league.protocol.Acknowledgement;
import edu.brandeis.cosi103a.league.protocol.MatchAssignment;
import edu.brandeis.cosi103a.league.protocol.MessageBuilder;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Referee agent: accepts match assignments and runs them in the background, at most
 * {@code league.referee.max-concurrent-matches} at a time.
 */
@Service
@ConditionalOnProperty(name = "league.role", havingValue = "referee")
public class RefereeService {

    public static final String ACCEPTED = "ACCEPTED";

    private static final Logger log = LoggerFactory.getLogger(RefereeService.class);

    private final MatchOrchestrator orchestrator;
    private final ObjectMapper objectMapper;
    private final ExecutorService matchPool;
    private final Set<String> assignedMatches = ConcurrentHashMap.newKeySet();
    private final Map<String, MatchOutcome> outcomes = new ConcurrentHashMap<>();
    private volatile String refereeId;
    private volatile MessageBuilder messages;

    @Autowired
    public RefereeService(
            RpcClient rpcClient,
            ObjectMapper objectMapper,
            RetryPolicy retryPolicy,
            @Value("${league.agent-id:REF01}") String refereeId,
            @Value("${league.manager-endpoint:}") String managerEndpoint,
            @Value("${league.referee.invitation-timeout-ms:5000}") long invitationTimeoutMs,
            @Value("${league.referee.choice-timeout-ms:30000}") long choiceTimeoutMs,
            @Value("${league.referee.max-concurrent-matches:2}") int maxConcurrentMatches,
            @Value("${league.referee.same-choice-policy:FIRST_PLAYER_WINS}") SameChoicePolicy sameChoicePolicy) {
        this(new MatchOrchestrator(
                rpcClient,
                new MessageSender(rpcClient, retryPolicy),
                new NumberDrawer.Secure(),
                new ParityScorer(sameChoicePolicy),
                new RefereeSettings(Duration.ofMillis(invitationTimeoutMs), Duration.ofMillis(choiceTimeoutMs),
                    managerEndpoint)),
            objectMapper, refereeId, maxConcurrentMatches);
    }

    public RefereeService(MatchOrchestrator orchestrator, ObjectMapper objectMapper, String refereeId,
                          int maxConcurrentMatches) {
        if (maxConcurrentMatches < 1) {
            throw new IllegalArgumentException("max concurrent matches must be at least 1");
        }
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
        this.refereeId = refereeId;
        this.messages = new MessageBuilder(objectMapper, "referee:" + refereeId);
        this.matchPool = Executors.newFixedThreadPool(maxConcurrentMatches, new ThreadFactoryBuilder()
            .setNameFormat("match-%d")
            .build());
    }

    /**
     * Adopts the id and token issued by the league manager. Later reports carry the token.
     */
    public void registered(String agentId, String authToken) {
        this.refereeId = agentId;
        this.messages = new MessageBuilder(objectMapper, "referee:" + agentId).authenticated(authToken);
    }

    /**
     * Queues a match for execution. A match id already running or finished here is not run again.
     *
     * @throws IllegalArgumentException if the assignment lacks ids or player endpoints
     */
    public Acknowledgement assignMatch(MatchAssignment assignment) {
        requirePresent(assignment.matchId(), "match_id");
        requirePresent(assignment.playerAId(), "player_A_id");
        requirePresent(assignment.playerBId(), "player_B_id");
        requirePresent(assignment.playerAEndpoint(), "player_A_endpoint");
        requirePresent(assignment.playerBEndpoint(), "player_B_endpoint");

        if (!assignedMatches.add(assignment.matchId())) {
            log.info("Match {} already assigned to {}", assignment.matchId(), refereeId);
            return Acknowledgement.withStatus(Acknowledgement.DUPLICATE);
        }
        MessageBuilder runMessages = messages;
        matchPool.submit(() -> outcomes.put(assignment.matchId(), orchestrator.run(assignment, runMessages)));
        log.info("Referee {} accepted match {}", refereeId, assignment.matchId());
        return Acknowledgement.withStatus(ACCEPTED);
    }

    public Optional<MatchOutcome> outcome(String matchId) {
        return Optional.ofNullable(outcomes.get(matchId));
    }

    public String refereeId() {
        return refereeId;
    }

    private static void requirePresent(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Match assignment is missing " + field);
        }
    }

    @PreDestroy
    public void shutdown() {
        matchPool.shutdown();
        try {
            if (!matchPool.awaitTermination(10, TimeUnit.SECONDS)) {
                matchPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            matchPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
