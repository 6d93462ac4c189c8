package edu.brandeis.cosi103a.league.tournament;

/**
 * A round or match was driven out of order, e.g. starting a round twice or completing a
 * round with unfinished matches. Indicates a bug or a protocol error, never retried.
 */
public class RoundLifecycleException extends IllegalStateException {
    public RoundLifecycleException(String message) {
        super(message);
    }
}
