package edu.brandeis.cosi103a.league.server;

import edu.brandeis.cosi103a.league.manager.LeagueCoordinator;
import edu.brandeis.cosi103a.league.manager.LeagueStatus;
import edu.brandeis.cosi103a.league.standings.PlayerStanding;
import edu.brandeis.cosi103a.league.tournament.RoundLifecycleException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST view of the league for dashboards and operators.
 */
@RestController
@RequestMapping("/api/league")
@ConditionalOnProperty(name = "league.role", havingValue = "manager", matchIfMissing = true)
public class LeagueController {

    private final LeagueCoordinator coordinator;

    public LeagueController(LeagueCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping("/status")
    public LeagueStatus status() {
        return coordinator.status();
    }

    @GetMapping("/standings")
    public List<PlayerStanding> standings() {
        return coordinator.standings();
    }

    /**
     * Starts the league with the agents registered so far.
     * Returns 202 Accepted; rounds are played in the background.
     */
    @PostMapping("/start")
    public ResponseEntity<LeagueStatus> start() {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(coordinator.startLeague());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(RoundLifecycleException.class)
    public ResponseEntity<Map<String, String>> handleConflict(RoundLifecycleException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", ex.getMessage()));
    }
}
