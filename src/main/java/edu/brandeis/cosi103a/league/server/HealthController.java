package edu.brandeis.cosi103a.league.server;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness probe polled by the league manager's health monitor.
 */
@RestController
public class HealthController {

    private final String role;

    public HealthController(@Value("${league.role:manager}") String role) {
        this.role = role;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok", "role", role);
    }
}
