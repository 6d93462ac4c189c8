package edu.brandeis.cosi103a.league.tournament;

public enum RoundStatus {
    PENDING,
    ANNOUNCED,
    COMPLETED
}
