package edu.brandeis.cosi103a.league.player;

import edu.brandeis.cosi103a.league.game.ParityChoice;

/**
 * A player's decision policy.
 */
@FunctionalInterface
public interface ParityStrategy {

    ParityChoice choose(ChoiceContext context);
}
