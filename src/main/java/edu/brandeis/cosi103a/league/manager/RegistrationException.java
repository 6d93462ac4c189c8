package edu.brandeis.cosi103a.league.manager;

/**
 * A registration request was refused.
 */
public class RegistrationException extends RuntimeException {
    public RegistrationException(String message) {
        super(message);
    }
}
