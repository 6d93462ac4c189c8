package edu.brandeis.cosi103a.league.manager;

/**
 * A message did not carry valid credentials for the agent it claims to come from.
 */
public class AuthenticationException extends RuntimeException {
    public AuthenticationException(String message) {
        super(message);
    }
}
