package edu.brandeis.cosi103a.league.manager;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.league.broadcast.Recipient;
import edu.brandeis.cosi103a.league.protocol.RegistrationRequest;
import edu.brandeis.cosi103a.league.scheduler.RefereeInfo;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Players and referees known to the league manager, in registration order, with the
 * tokens issued to them and whether they currently look healthy.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    public static final int DEFAULT_MAX_PLAYERS = 100;
    public static final int DEFAULT_MAX_REFEREES = 10;

    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    private final int maxPlayers;
    private final int maxReferees;
    private final TokenGenerator tokenGenerator;
    private final Clock clock;
    private final Map<String, RegisteredAgent> players = new LinkedHashMap<>();
    private final Map<String, RegisteredAgent> referees = new LinkedHashMap<>();
    private final Set<String> unavailable = new HashSet<>();

    public AgentRegistry() {
        this(DEFAULT_MAX_PLAYERS, DEFAULT_MAX_REFEREES, new TokenGenerator(), Clock.systemUTC());
    }

    public AgentRegistry(int maxPlayers, int maxReferees, TokenGenerator tokenGenerator, Clock clock) {
        this.maxPlayers = maxPlayers;
        this.maxReferees = maxReferees;
        this.tokenGenerator = tokenGenerator;
        this.clock = clock;
    }

    /**
     * @throws RegistrationException if the request is incomplete, the endpoint is taken or the league is full
     */
    public synchronized RegisteredAgent registerPlayer(RegistrationRequest request) {
        return register(AgentRole.PLAYER, request, players, maxPlayers, String.format("P%02d", players.size() + 1));
    }

    /**
     * @throws RegistrationException if the request is incomplete, the endpoint is taken or the league is full
     */
    public synchronized RegisteredAgent registerReferee(RegistrationRequest request) {
        return register(AgentRole.REFEREE, request, referees, maxReferees, String.format("REF%02d", referees.size() + 1));
    }

    private RegisteredAgent register(AgentRole role, RegistrationRequest request, Map<String, RegisteredAgent> agents,
                                     int limit, String agentId) {
        Set<ConstraintViolation<RegistrationRequest>> violations = VALIDATOR.validate(request);
        if (!violations.isEmpty()) {
            throw new RegistrationException(violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", ")));
        }
        if (request.gameTypes() != null && !request.gameTypes().isEmpty()
                && !request.gameTypes().contains(RegistrationRequest.EVEN_ODD)) {
            throw new RegistrationException("Only " + RegistrationRequest.EVEN_ODD + " is played in this league");
        }
        if (agents.size() >= limit) {
            throw new RegistrationException("League already has the maximum of " + limit + " " + role.name().toLowerCase(Locale.ROOT) + "s");
        }
        boolean endpointTaken = players.values().stream().anyMatch(a -> a.endpoint().equals(request.endpoint()))
            || referees.values().stream().anyMatch(a -> a.endpoint().equals(request.endpoint()));
        if (endpointTaken) {
            throw new RegistrationException("Endpoint " + request.endpoint() + " is already registered");
        }

        RegisteredAgent agent = new RegisteredAgent(
            agentId,
            role,
            request.displayName(),
            request.endpoint(),
            request.gameTypes() != null ? request.gameTypes() : ImmutableList.of(RegistrationRequest.EVEN_ODD),
            request.version(),
            request.maxConcurrentMatches() != null ? request.maxConcurrentMatches() : 1,
            tokenGenerator.generate(agentId),
            clock.instant());
        agents.put(agentId, agent);
        log.info("Registered {} {} ({}) at {}, token {}", role, agentId, agent.displayName(), agent.endpoint(),
            TokenGenerator.redact(agent.authToken()));
        return agent;
    }

    /**
     * Re-admits agents loaded from disk, keeping their ids and tokens.
     */
    public synchronized void restore(Collection<RegisteredAgent> agents) {
        for (RegisteredAgent agent : agents) {
            if (agent.role() == AgentRole.PLAYER) {
                players.put(agent.agentId(), agent);
            } else {
                referees.put(agent.agentId(), agent);
            }
        }
    }

    /**
     * Checks a presented token against the one issued to {@code agentId}, in constant time.
     */
    public synchronized boolean verifyToken(String agentId, String token) {
        if (agentId == null || token == null) {
            return false;
        }
        return find(agentId)
            .map(agent -> MessageDigest.isEqual(
                agent.authToken().getBytes(StandardCharsets.UTF_8),
                token.getBytes(StandardCharsets.UTF_8)))
            .orElse(false);
    }

    public synchronized Optional<RegisteredAgent> find(String agentId) {
        RegisteredAgent agent = players.get(agentId);
        return Optional.ofNullable(agent != null ? agent : referees.get(agentId));
    }

    public synchronized ImmutableList<RegisteredAgent> players() {
        return ImmutableList.copyOf(players.values());
    }

    public synchronized ImmutableList<RegisteredAgent> referees() {
        return ImmutableList.copyOf(referees.values());
    }

    public synchronized ImmutableList<RegisteredAgent> all() {
        return ImmutableList.<RegisteredAgent>builder().addAll(players.values()).addAll(referees.values()).build();
    }

    public synchronized List<Recipient> playerRecipients() {
        return players.values().stream()
            .map(p -> new Recipient(p.agentId(), p.endpoint()))
            .toList();
    }

    /**
     * Referees eligible for scheduling: every registered referee not currently marked unavailable.
     */
    public synchronized List<RefereeInfo> availableReferees() {
        return referees.values().stream()
            .filter(r -> !unavailable.contains(r.agentId()))
            .map(r -> new RefereeInfo(r.agentId(), r.endpoint()))
            .toList();
    }

    public synchronized void markAvailable(String agentId, boolean available) {
        if (available) {
            unavailable.remove(agentId);
        } else {
            unavailable.add(agentId);
        }
    }

    public synchronized boolean isAvailable(String agentId) {
        return !unavailable.contains(agentId);
    }
}
