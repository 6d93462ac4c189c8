package edu.brandeis.cosi103a.league.tournament;

/**
 * Coarse lifecycle of a league.
 */
public enum TournamentStage {
    REGISTRATION,
    RUNNING,
    COMPLETED
}
