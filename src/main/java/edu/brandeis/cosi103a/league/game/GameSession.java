package edu.brandeis.cosi103a.league.game;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSetMultimap;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Referee-side state of one match. Enforces the fixed transition table and keeps every
 * transition, with its timestamp, for audit.
 *
 * A session belongs to exactly one match execution and is not thread-safe.
 */
public class GameSession {

    private static final ImmutableSetMultimap<GameState, GameState> TRANSITIONS =
        ImmutableSetMultimap.<GameState, GameState>builder()
            .put(GameState.WAITING_FOR_PLAYERS, GameState.COLLECTING_CHOICES)
            .put(GameState.WAITING_FOR_PLAYERS, GameState.ABORTED)
            .put(GameState.COLLECTING_CHOICES, GameState.DRAWING_NUMBER)
            .put(GameState.COLLECTING_CHOICES, GameState.ABORTED)
            .put(GameState.DRAWING_NUMBER, GameState.EVALUATING)
            .put(GameState.EVALUATING, GameState.FINISHED)
            .build();

    private final String matchId;
    private final Clock clock;
    private final List<StateTransition> history = new ArrayList<>();
    private GameState state;

    public GameSession(String matchId) {
        this(matchId, Clock.systemUTC());
    }

    public GameSession(String matchId, Clock clock) {
        this.matchId = matchId;
        this.clock = clock;
        this.state = GameState.WAITING_FOR_PLAYERS;
        history.add(new StateTransition(state, clock.instant()));
    }

    public String matchId() {
        return matchId;
    }

    public GameState state() {
        return state;
    }

    public boolean canTransition(GameState target) {
        return TRANSITIONS.containsEntry(state, target);
    }

    /**
     * Moves the session to {@code target} and records it in the history.
     *
     * @throws InvalidTransitionException if the edge is not in the transition table
     */
    public void transition(GameState target) {
        if (!canTransition(target)) {
            throw new InvalidTransitionException(matchId, state, target);
        }
        state = target;
        history.add(new StateTransition(target, clock.instant()));
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public ImmutableList<StateTransition> history() {
        return ImmutableList.copyOf(history);
    }
}
