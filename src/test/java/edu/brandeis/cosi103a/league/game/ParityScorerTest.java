package edu.brandeis.cosi103a.league.game;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ParityScorerTest {

    private final ParityScorer scorer = new ParityScorer();

    @Test
    void determineWinner_evenNumberRewardsEvenChooser() {
        GameResult result = scorer.determineWinner(8, ImmutableMap.of("P01", ParityChoice.EVEN, "P02", ParityChoice.ODD));

        assertEquals(GameResult.Status.WIN, result.status());
        assertEquals(Optional.of("P01"), result.winnerPlayerId());
        assertEquals(ParityChoice.EVEN, result.numberParity());
        assertEquals(3, result.scores().get("P01"));
        assertEquals(0, result.scores().get("P02"));
    }

    @Test
    void determineWinner_oddNumberRewardsOddChooser() {
        GameResult result = scorer.determineWinner(7, ImmutableMap.of("P01", ParityChoice.EVEN, "P02", ParityChoice.ODD));

        assertEquals(Optional.of("P02"), result.winnerPlayerId());
        assertEquals(ParityChoice.ODD, result.numberParity());
        assertEquals(ImmutableMap.of("P01", 0, "P02", 3), result.scores());
    }

    @Test
    void determineWinner_bothMatchingGivesWinToFirstPlayer() {
        GameResult result = scorer.determineWinner(4, ImmutableMap.of("P02", ParityChoice.EVEN, "P01", ParityChoice.EVEN));

        // first entry in iteration order wins, not the lower id
        assertEquals(Optional.of("P02"), result.winnerPlayerId());
        assertFalse(result.isDraw());
    }

    @Test
    void determineWinner_bothMatchingIsDrawUnderDrawPolicy() {
        ParityScorer drawScorer = new ParityScorer(SameChoicePolicy.DRAW);

        GameResult result = drawScorer.determineWinner(3, ImmutableMap.of("P01", ParityChoice.ODD, "P02", ParityChoice.ODD));

        assertTrue(result.isDraw());
        assertEquals(Optional.empty(), result.winnerPlayerId());
        assertEquals(ImmutableMap.of("P01", 1, "P02", 1), result.scores());
    }

    @Test
    void determineWinner_neitherMatchingIsDraw() {
        GameResult result = scorer.determineWinner(5, ImmutableMap.of("P01", ParityChoice.EVEN, "P02", ParityChoice.EVEN));

        assertEquals(GameResult.Status.DRAW, result.status());
        assertEquals(1, result.scores().get("P01"));
        assertEquals(1, result.scores().get("P02"));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 11, -3})
    void determineWinner_rejectsOutOfRangeNumber(int drawn) {
        assertThrows(IllegalArgumentException.class,
            () -> scorer.determineWinner(drawn, ImmutableMap.of("P01", ParityChoice.EVEN, "P02", ParityChoice.ODD)));
    }

    @Test
    void determineWinner_requiresExactlyTwoPlayers() {
        assertThrows(IllegalArgumentException.class,
            () -> scorer.determineWinner(2, Map.of("P01", ParityChoice.EVEN)));
        assertThrows(IllegalArgumentException.class,
            () -> scorer.determineWinner(2, ImmutableMap.of(
                "P01", ParityChoice.EVEN, "P02", ParityChoice.ODD, "P03", ParityChoice.EVEN)));
    }

    @Test
    void scoresAlwaysSumToThreeOrTwo() {
        for (int drawn = NumberDrawer.MIN; drawn <= NumberDrawer.MAX; drawn++) {
            for (ParityChoice a : ParityChoice.values()) {
                for (ParityChoice b : ParityChoice.values()) {
                    GameResult result = scorer.determineWinner(drawn, ImmutableMap.of("A", a, "B", b));
                    int total = result.scores().values().stream().mapToInt(Integer::intValue).sum();
                    assertEquals(result.isDraw() ? 2 : 3, total, "drawn=" + drawn + " a=" + a + " b=" + b);
                }
            }
        }
    }
}
