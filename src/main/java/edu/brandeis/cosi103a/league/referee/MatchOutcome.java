package edu.brandeis.cosi103a.league.referee;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.league.game.GameResult;
import edu.brandeis.cosi103a.league.game.GameState;
import edu.brandeis.cosi103a.league.game.StateTransition;

import java.util.Optional;

/**
 * What a referee knows about a match once its orchestrator returns.
 */
public record MatchOutcome(
    @JsonProperty("match_id") String matchId,
    @JsonProperty("final_state") GameState finalState,
    @JsonProperty("result") Optional<GameResult> result,
    @JsonProperty("abort_reason") Optional<String> abortReason,
    @JsonProperty("history") ImmutableList<StateTransition> history,
    @JsonProperty("reported") boolean reported
) {
    public static MatchOutcome finished(String matchId, GameState state, GameResult result,
                                        ImmutableList<StateTransition> history, boolean reported) {
        return new MatchOutcome(matchId, state, Optional.of(result), Optional.empty(), history, reported);
    }

    public static MatchOutcome aborted(String matchId, GameState state, String reason,
                                       ImmutableList<StateTransition> history, boolean reported) {
        return new MatchOutcome(matchId, state, Optional.empty(), Optional.of(reason), history, reported);
    }
}
