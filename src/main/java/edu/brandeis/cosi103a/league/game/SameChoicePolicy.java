package edu.brandeis.cosi103a.league.game;

/**
 * How a match is scored when both players picked the symbol matching the drawn parity.
 */
public enum SameChoicePolicy {
    /** The first player in choice order takes the win. */
    FIRST_PLAYER_WINS,
    /** The match is a draw worth one point to each player. */
    DRAW
}
