package edu.brandeis.cosi103a.league.server;

import edu.brandeis.cosi103a.league.manager.LeagueCoordinator;
import edu.brandeis.cosi103a.league.manager.LeagueStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.SendTo;
import org.springframework.stereotype.Controller;

/**
 * WebSocket controller for league progress.
 * Clients subscribe to /topic/leagues/{leagueId}; further updates are pushed by {@link LeagueCoordinator}.
 */
@Controller
@ConditionalOnProperty(name = "league.role", havingValue = "manager", matchIfMissing = true)
public class LeagueProgressController {

    private final LeagueCoordinator coordinator;

    public LeagueProgressController(LeagueCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Returns the current status on subscription, or null for another league.
     */
    @MessageMapping("/leagues/{leagueId}/subscribe")
    @SendTo("/topic/leagues/{leagueId}")
    public LeagueStatus subscribeLeague(@DestinationVariable String leagueId) {
        return coordinator.leagueId().equals(leagueId) ? coordinator.status() : null;
    }
}
