package edu.brandeis.cosi103a.league.broadcast;

/**
 * A message could not be delivered to one recipient after all permitted attempts.
 */
public class DeliveryException extends Exception {
    private final int attempts;

    public DeliveryException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
