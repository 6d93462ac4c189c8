package edu.brandeis.cosi103a.league.tournament;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.league.scheduler.ScheduledMatch;

/**
 * One scheduled match. Identity is fixed at creation; the terminal status is written once.
 */
public class Match {

    private final String matchId;
    private final int roundNumber;
    private final String playerAId;
    private final String playerBId;
    private final String refereeId;
    private MatchStatus status = MatchStatus.PENDING;

    public Match(String matchId, int roundNumber, String playerAId, String playerBId, String refereeId) {
        this.matchId = matchId;
        this.roundNumber = roundNumber;
        this.playerAId = playerAId;
        this.playerBId = playerBId;
        this.refereeId = refereeId;
    }

    public static Match from(ScheduledMatch scheduled) {
        return new Match(scheduled.matchId(), scheduled.roundNumber(), scheduled.playerAId(),
            scheduled.playerBId(), scheduled.refereeId());
    }

    void start() {
        if (status != MatchStatus.PENDING) {
            throw new RoundLifecycleException("Match " + matchId + " already " + status);
        }
        status = MatchStatus.IN_PROGRESS;
    }

    void finish(MatchStatus outcome) {
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("Not a final match status: " + outcome);
        }
        if (status.isTerminal()) {
            throw new RoundLifecycleException("Match " + matchId + " already " + status);
        }
        status = outcome;
    }

    @JsonProperty("match_id")
    public String matchId() {
        return matchId;
    }

    @JsonProperty("round_number")
    public int roundNumber() {
        return roundNumber;
    }

    @JsonProperty("player_A_id")
    public String playerAId() {
        return playerAId;
    }

    @JsonProperty("player_B_id")
    public String playerBId() {
        return playerBId;
    }

    @JsonProperty("referee_id")
    public String refereeId() {
        return refereeId;
    }

    @JsonProperty("status")
    public MatchStatus status() {
        return status;
    }
}
