package edu.brandeis.cosi103a.league.player;

import edu.brandeis.cosi103a.league.game.ParityChoice;

import java.util.Random;

/**
 * Picks even or odd uniformly at random. The default strategy.
 */
public class RandomParityStrategy implements ParityStrategy {
    private final Random random;

    public RandomParityStrategy() {
        this(new Random());
    }

    public RandomParityStrategy(Random random) {
        this.random = random;
    }

    @Override
    public ParityChoice choose(ChoiceContext context) {
        return random.nextBoolean() ? ParityChoice.EVEN : ParityChoice.ODD;
    }
}
