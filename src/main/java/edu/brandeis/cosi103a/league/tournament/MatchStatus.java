package edu.brandeis.cosi103a.league.tournament;

public enum MatchStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
