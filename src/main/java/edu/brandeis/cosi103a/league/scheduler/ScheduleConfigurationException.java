package edu.brandeis.cosi103a.league.scheduler;

/**
 * Raised when the scheduler is given input it cannot build a league from.
 * Never retried.
 */
public class ScheduleConfigurationException extends IllegalArgumentException {
    public ScheduleConfigurationException(String message) {
        super(message);
    }
}
