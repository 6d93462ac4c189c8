package edu.brandeis.cosi103a.league.referee;

import java.time.Duration;

/**
 * Per-match deadlines and the coordinator to report to.
 */
public record RefereeSettings(
    Duration invitationTimeout,
    Duration choiceTimeout,
    String managerEndpoint
) {
    public static final Duration DEFAULT_INVITATION_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_CHOICE_TIMEOUT = Duration.ofSeconds(30);

    public static RefereeSettings defaults(String managerEndpoint) {
        return new RefereeSettings(DEFAULT_INVITATION_TIMEOUT, DEFAULT_CHOICE_TIMEOUT, managerEndpoint);
    }
}
