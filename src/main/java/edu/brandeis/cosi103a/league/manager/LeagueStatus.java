package edu.brandeis.cosi103a.league.manager;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.league.tournament.TournamentStage;

import java.util.Optional;

/**
 * Snapshot of league progress, returned by queries and pushed to progress subscribers.
 */
public record LeagueStatus(
    @JsonProperty("league_id") String leagueId,
    @JsonProperty("stage") TournamentStage stage,
    @JsonProperty("current_round") int currentRound,
    @JsonProperty("total_rounds") int totalRounds,
    @JsonProperty("completed_matches") int completedMatches,
    @JsonProperty("total_matches") int totalMatches,
    @JsonProperty("registered_players") int registeredPlayers,
    @JsonProperty("registered_referees") int registeredReferees,
    @JsonProperty("champion") Optional<String> champion
) {
    /**
     * Status while agents are still registering.
     */
    public static LeagueStatus registration(String leagueId, int players, int referees) {
        return new LeagueStatus(leagueId, TournamentStage.REGISTRATION, 0, 0, 0, 0, players, referees, Optional.empty());
    }
}
