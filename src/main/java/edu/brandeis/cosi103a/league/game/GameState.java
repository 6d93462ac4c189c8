package edu.brandeis.cosi103a.league.game;

/**
 * Phases of a single match as seen by its referee.
 */
public enum GameState {
    WAITING_FOR_PLAYERS,
    COLLECTING_CHOICES,
    DRAWING_NUMBER,
    EVALUATING,
    FINISHED,
    ABORTED;

    public boolean isTerminal() {
        return this == FINISHED || this == ABORTED;
    }
}
