package edu.brandeis.cosi103a.league.game;

/**
 * Thrown when a peer or the local code breaks the match protocol. Fatal to the
 * single match it occurs in.
 */
public class ProtocolViolationException extends RuntimeException {
    public ProtocolViolationException(String message) {
        super(message);
    }
}
