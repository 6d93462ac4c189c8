package edu.brandeis.cosi103a.league.server;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import edu.brandeis.cosi103a.league.broadcast.Broadcaster;
import edu.brandeis.cosi103a.league.broadcast.MessageSender;
import edu.brandeis.cosi103a.league.manager.AgentRegistry;
import edu.brandeis.cosi103a.league.manager.LeagueCoordinator;
import edu.brandeis.cosi103a.league.manager.LeagueStatus;
import edu.brandeis.cosi103a.league.manager.LeagueStore;
import edu.brandeis.cosi103a.league.network.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.league.protocol.RegistrationRequest;
import edu.brandeis.cosi103a.league.tournament.RoundLifecycleException;
import edu.brandeis.cosi103a.league.tournament.TournamentStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.ResponseEntity;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for LeagueController backed by a real coordinator.
 */
class LeagueControllerTest {

    @TempDir
    Path tempDir;

    private LeagueCoordinator coordinator;
    private LeagueController controller;

    @BeforeEach
    void setUp() {
        coordinator = new LeagueCoordinator("L1", new AgentRegistry(), new LeagueStore(tempDir),
            mock(MessageSender.class), mock(Broadcaster.class), mock(SimpMessagingTemplate.class),
            ObjectMapperFactory.create(), MoreExecutors.newDirectExecutorService(),
            MoreExecutors.newDirectExecutorService(), false);
        controller = new LeagueController(coordinator);
    }

    @Test
    void status_beforeStart() {
        LeagueStatus status = controller.status();
        assertEquals(TournamentStage.REGISTRATION, status.stage());
        assertEquals(0, status.registeredPlayers());
    }

    @Test
    void standings_listsRegisteredPlayers() {
        register("Alice", "http://localhost:8101/mcp");
        register("Bob", "http://localhost:8102/mcp");

        assertEquals(2, controller.standings().size());
        assertEquals(0, controller.standings().get(0).points());
    }

    @Test
    void start_returnsAccepted() {
        register("Alice", "http://localhost:8101/mcp");
        register("Bob", "http://localhost:8102/mcp");
        coordinator.registerReferee(request("Ref", "http://localhost:8001/mcp"));

        ResponseEntity<LeagueStatus> response = controller.start();

        assertEquals(202, response.getStatusCode().value());
        assertEquals(1, response.getBody().totalRounds());
    }

    @Test
    void start_secondTimeIsConflict() {
        register("Alice", "http://localhost:8101/mcp");
        register("Bob", "http://localhost:8102/mcp");
        coordinator.registerReferee(request("Ref", "http://localhost:8001/mcp"));
        controller.start();

        RoundLifecycleException e = assertThrows(RoundLifecycleException.class, () -> controller.start());
        ResponseEntity<Map<String, String>> response = controller.handleConflict(e);
        assertEquals(409, response.getStatusCode().value());
        assertTrue(response.getBody().get("error").contains("already"));
    }

    @Test
    void start_withoutRefereeIsBadRequest() {
        register("Alice", "http://localhost:8101/mcp");
        register("Bob", "http://localhost:8102/mcp");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> controller.start());
        assertEquals(400, controller.handleBadRequest(e).getStatusCode().value());
    }

    private void register(String name, String endpoint) {
        coordinator.registerPlayer(request(name, endpoint));
    }

    private static RegistrationRequest request(String name, String endpoint) {
        return new RegistrationRequest(name, endpoint, ImmutableList.of(RegistrationRequest.EVEN_ODD), "1.0.0", 1);
    }
}
