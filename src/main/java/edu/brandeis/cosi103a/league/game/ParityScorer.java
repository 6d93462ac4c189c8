package edu.brandeis.cosi103a.league.game;

import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides the winner of a parity game from the drawn number and both players' choices.
 *
 * The player whose choice matches the parity of the drawn number wins 3 points, the
 * other gets 0. When both choices match, the configured {@link SameChoicePolicy} applies;
 * when neither matches, the game is a draw worth 1 point each.
 *
 * Iteration order of the choices map is significant: it defines which player is "first".
 */
public final class ParityScorer {

    public static final int WIN_POINTS = 3;
    public static final int DRAW_POINTS = 1;
    public static final int LOSS_POINTS = 0;

    private final SameChoicePolicy sameChoicePolicy;

    public ParityScorer() {
        this(SameChoicePolicy.FIRST_PLAYER_WINS);
    }

    public ParityScorer(SameChoicePolicy sameChoicePolicy) {
        this.sameChoicePolicy = sameChoicePolicy;
    }

    /**
     * Computes the result of a game.
     *
     * @param drawnNumber the number drawn, in [1,10]
     * @param choices exactly two entries of player id to choice, in player order
     * @return the scored result
     * @throws IllegalArgumentException if the number is out of range or there are not exactly two players
     */
    public GameResult determineWinner(int drawnNumber, Map<String, ParityChoice> choices) {
        if (drawnNumber < NumberDrawer.MIN || drawnNumber > NumberDrawer.MAX) {
            throw new IllegalArgumentException("Drawn number out of range: " + drawnNumber);
        }
        if (choices.size() != 2) {
            throw new IllegalArgumentException("Expected choices from exactly two players, got " + choices.size());
        }
        ImmutableMap<String, ParityChoice> orderedChoices = ImmutableMap.copyOf(choices);
        ParityChoice parity = ParityChoice.of(drawnNumber);

        List<String> matching = new ArrayList<>();
        orderedChoices.forEach((playerId, choice) -> {
            if (choice == parity) {
                matching.add(playerId);
            }
        });

        Optional<String> winner;
        if (matching.size() == 1) {
            winner = Optional.of(matching.get(0));
        } else if (matching.size() == 2 && sameChoicePolicy == SameChoicePolicy.FIRST_PLAYER_WINS) {
            winner = Optional.of(matching.get(0));
        } else {
            winner = Optional.empty();
        }

        ImmutableMap.Builder<String, Integer> scores = ImmutableMap.builder();
        for (String playerId : orderedChoices.keySet()) {
            if (winner.isEmpty()) {
                scores.put(playerId, DRAW_POINTS);
            } else {
                scores.put(playerId, winner.get().equals(playerId) ? WIN_POINTS : LOSS_POINTS);
            }
        }

        return new GameResult(
            winner.isPresent() ? GameResult.Status.WIN : GameResult.Status.DRAW,
            winner,
            drawnNumber,
            parity,
            orderedChoices,
            scores.build()
        );
    }
}
