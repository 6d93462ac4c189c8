package edu.brandeis.cosi103a.league.scheduler;

/**
 * An unordered pair of players, stored with the earlier-registered player first.
 */
public record Pairing(String playerA, String playerB) {
}
