package edu.brandeis.cosi103a.league.standings;

/**
 * Result of a meeting between two players, from the row player's point of view.
 */
public enum HeadToHead {
    WIN,
    LOSS,
    TIE;

    HeadToHead reverse() {
        switch (this) {
            case WIN:
                return LOSS;
            case LOSS:
                return WIN;
            default:
                return TIE;
        }
    }
}
