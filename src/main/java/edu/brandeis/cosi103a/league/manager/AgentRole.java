package edu.brandeis.cosi103a.league.manager;

public enum AgentRole {
    PLAYER,
    REFEREE
}
