package edu.brandeis.cosi103a.league.game;

/**
 * Thrown when a {@link GameSession} is asked to take an edge missing from its transition table.
 */
public class InvalidTransitionException extends ProtocolViolationException {
    private final GameState from;
    private final GameState to;

    public InvalidTransitionException(String matchId, GameState from, GameState to) {
        super("Match " + matchId + ": illegal transition " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public GameState from() {
        return from;
    }

    public GameState to() {
        return to;
    }
}
