package edu.brandeis.cosi103a.league.manager;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Locale;

/**
 * Issues opaque bearer tokens of the form {@code tok_<agent id>_<16 random chars>}.
 */
public class TokenGenerator {

    private static final int RANDOM_CHARS = 16;
    private static final int REDACTED_PREFIX = 8;

    private final SecureRandom random = new SecureRandom();

    public String generate(String agentId) {
        byte[] bytes = new byte[12];
        random.nextBytes(bytes);
        String suffix = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes).substring(0, RANDOM_CHARS);
        return "tok_" + agentId.toLowerCase(Locale.ROOT) + "_" + suffix;
    }

    /**
     * Shortens a token for logs.
     */
    public static String redact(String token) {
        if (token == null) {
            return "null";
        }
        if (token.length() <= REDACTED_PREFIX) {
            return "***";
        }
        return token.substring(0, REDACTED_PREFIX) + "...";
    }
}
