package edu.brandeis.cosi103a.league.game;

import java.security.SecureRandom;

/**
 * Source of the number drawn at the end of every match.
 */
@FunctionalInterface
public interface NumberDrawer {

    int MIN = 1;
    int MAX = 10;

    /**
     * Draws a number in [{@link #MIN}, {@link #MAX}].
     */
    int draw();

    /**
     * Draws from a cryptographically secure source so neither player can predict
     * or replay the outcome.
     */
    class Secure implements NumberDrawer {
        private final SecureRandom random;

        public Secure() {
            this.random = new SecureRandom();
        }

        @Override
        public int draw() {
            return MIN + random.nextInt(MAX - MIN + 1);
        }
    }
}
