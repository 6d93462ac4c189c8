package edu.brandeis.cosi103a.league.game;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The two symbols a player may choose in the parity game.
 */
public enum ParityChoice {
    EVEN("even"),
    ODD("odd");

    private final String wireValue;

    ParityChoice(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Parses a choice exactly as it appears on the wire. Anything other than
     * {@code "even"} or {@code "odd"} is rejected rather than coerced.
     */
    public static Optional<ParityChoice> fromWire(String value) {
        for (ParityChoice choice : values()) {
            if (choice.wireValue.equals(value)) {
                return Optional.of(choice);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the parity of the given number.
     */
    public static ParityChoice of(int number) {
        return number % 2 == 0 ? EVEN : ODD;
    }
}
