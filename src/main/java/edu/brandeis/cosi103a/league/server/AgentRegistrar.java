package edu.brandeis.cosi103a.league.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.league.broadcast.DeliveryException;
import edu.brandeis.cosi103a.league.broadcast.MessageSender;
import edu.brandeis.cosi103a.league.broadcast.RetryPolicy;
import edu.brandeis.cosi103a.league.manager.TokenGenerator;
import edu.brandeis.cosi103a.league.network.RpcClient;
import edu.brandeis.cosi103a.league.player.PlayerAgent;
import edu.brandeis.cosi103a.league.protocol.MessageBuilder;
import edu.brandeis.cosi103a.league.protocol.MessageType;
import edu.brandeis.cosi103a.league.protocol.RegistrationRequest;
import edu.brandeis.cosi103a.league.protocol.RegistrationResponse;
import edu.brandeis.cosi103a.league.protocol.RpcMethods;
import edu.brandeis.cosi103a.league.referee.RefereeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Registers a player or referee process with the league manager once the application is up,
 * and hands the issued id (and token) to the local agent.
 */
@Component
public class AgentRegistrar {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistrar.class);

    static final String AGENT_VERSION = "1.0.0";

    private final MessageSender sender;
    private final ObjectMapper objectMapper;
    private final ObjectProvider<PlayerAgent> playerAgent;
    private final ObjectProvider<RefereeService> refereeService;
    private final String role;
    private final String displayName;
    private final String publicEndpoint;
    private final String managerEndpoint;
    private final int maxConcurrentMatches;

    public AgentRegistrar(
            RpcClient rpcClient,
            ObjectMapper objectMapper,
            RetryPolicy retryPolicy,
            ObjectProvider<PlayerAgent> playerAgent,
            ObjectProvider<RefereeService> refereeService,
            @Value("${league.role:manager}") String role,
            @Value("${league.display-name:${league.agent-id:agent}}") String displayName,
            @Value("${league.public-endpoint:http://localhost:${server.port:8080}/mcp}") String publicEndpoint,
            @Value("${league.manager-endpoint:}") String managerEndpoint,
            @Value("${league.referee.max-concurrent-matches:2}") int maxConcurrentMatches) {
        this.sender = new MessageSender(rpcClient, retryPolicy);
        this.objectMapper = objectMapper;
        this.playerAgent = playerAgent;
        this.refereeService = refereeService;
        this.role = role;
        this.displayName = displayName;
        this.publicEndpoint = publicEndpoint;
        this.managerEndpoint = managerEndpoint;
        this.maxConcurrentMatches = maxConcurrentMatches;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        register();
    }

    /**
     * Sends the registration request for this process's role.
     *
     * @return the manager's answer, or empty if this process does not register or the manager was unreachable
     */
    public Optional<RegistrationResponse> register() {
        if ("manager".equals(role)) {
            return Optional.empty();
        }
        if (managerEndpoint == null || managerEndpoint.isBlank()) {
            log.info("No league.manager-endpoint set, {} {} will not register", role, displayName);
            return Optional.empty();
        }

        boolean referee = "referee".equals(role);
        RegistrationRequest request = new RegistrationRequest(
            displayName,
            publicEndpoint,
            ImmutableList.of(RegistrationRequest.EVEN_ODD),
            AGENT_VERSION,
            referee ? maxConcurrentMatches : null);
        MessageBuilder messages = new MessageBuilder(objectMapper, role + ":" + displayName);

        RegistrationResponse response;
        try {
            JsonNode reply = sender.send(
                managerEndpoint,
                referee ? RpcMethods.REGISTER_REFEREE : RpcMethods.REGISTER_PLAYER,
                messages.build(referee ? MessageType.REFEREE_REGISTER_REQUEST : MessageType.LEAGUE_REGISTER_REQUEST, request));
            response = messages.payloadOf(reply, RegistrationResponse.class);
        } catch (DeliveryException e) {
            log.error("Could not register {} with {}: {}", displayName, managerEndpoint, e.getMessage());
            return Optional.empty();
        }

        if (!response.isAccepted()) {
            log.error("Registration of {} rejected: {}", displayName, response.reason());
            return Optional.of(response);
        }
        if (referee) {
            refereeService.ifAvailable(service -> service.registered(response.agentId(), response.authToken()));
        } else {
            playerAgent.ifAvailable(agent -> agent.registered(response.agentId()));
        }
        log.info("Registered {} as {} in {}, token {}", displayName, response.agentId(), response.leagueId(),
            response.authToken() != null ? TokenGenerator.redact(response.authToken()) : "none");
        return Optional.of(response);
    }
}
