package edu.brandeis.cosi103a.league.broadcast;

/**
 * A broadcast target. A null or blank endpoint means the recipient cannot be reached.
 */
public record Recipient(String id, String endpoint) {

    public boolean hasEndpoint() {
        return endpoint != null && !endpoint.isBlank();
    }
}
