package edu.brandeis.cosi103a.league.player;

import edu.brandeis.cosi103a.league.game.ParityChoice;

import java.util.Random;

/**
 * Wraps a strategy and sleeps a random time before each choice, to simulate slow or
 * distant players.
 *
 * Example usage:
 * <pre>
 * ParityStrategy slow = new DelayedParityStrategy(new RandomParityStrategy(), 25, 100);
 * </pre>
 */
public class DelayedParityStrategy implements ParityStrategy {
    private final ParityStrategy delegate;
    private final int minDelayMs;
    private final int maxDelayMs;
    private final Random random;

    /**
     * @param minDelayMs minimum delay in milliseconds (inclusive)
     * @param maxDelayMs maximum delay in milliseconds (inclusive)
     * @throws IllegalArgumentException if minDelayMs &lt; 0 or maxDelayMs &lt; minDelayMs
     */
    public DelayedParityStrategy(ParityStrategy delegate, int minDelayMs, int maxDelayMs) {
        if (minDelayMs < 0) {
            throw new IllegalArgumentException("minDelayMs must be non-negative");
        }
        if (maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= minDelayMs");
        }
        this.delegate = delegate;
        this.minDelayMs = minDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.random = new Random();
    }

    @Override
    public ParityChoice choose(ChoiceContext context) {
        int delay = minDelayMs + random.nextInt(maxDelayMs - minDelayMs + 1);
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while simulating player latency", e);
        }
        return delegate.choose(context);
    }
}
