package edu.brandeis.cosi103a.league.scheduler;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class RoundRobinSchedulerTest {

    @Test
    void generateRounds_fourPlayersMatchesCircleTable() {
        List<List<Pairing>> rounds = RoundRobinScheduler.generateRounds(List.of("P1", "P2", "P3", "P4"));

        assertEquals(List.of(
            List.of(new Pairing("P1", "P4"), new Pairing("P2", "P3")),
            List.of(new Pairing("P1", "P3"), new Pairing("P2", "P4")),
            List.of(new Pairing("P1", "P2"), new Pairing("P3", "P4"))), rounds);
    }

    @Test
    void generateRounds_twoPlayersIsOneMatch() {
        List<List<Pairing>> rounds = RoundRobinScheduler.generateRounds(List.of("A", "B"));

        assertEquals(List.of(List.of(new Pairing("A", "B"))), rounds);
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12})
    void generateRounds_coversEveryPairExactlyOnce(int n) {
        List<String> players = players(n);

        List<List<Pairing>> rounds = RoundRobinScheduler.generateRounds(players);

        Set<Set<String>> seen = new HashSet<>();
        for (List<Pairing> round : rounds) {
            for (Pairing pairing : round) {
                assertTrue(seen.add(Set.of(pairing.playerA(), pairing.playerB())),
                    "Pair " + pairing + " scheduled twice for n=" + n);
            }
        }
        assertEquals(n * (n - 1) / 2, seen.size(), "Every pair must be scheduled for n=" + n);
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12})
    void generateRounds_noPlayerTwiceInARound(int n) {
        for (List<Pairing> round : RoundRobinScheduler.generateRounds(players(n))) {
            Set<String> booked = new HashSet<>();
            for (Pairing pairing : round) {
                assertTrue(booked.add(pairing.playerA()), pairing.playerA() + " double booked");
                assertTrue(booked.add(pairing.playerB()), pairing.playerB() + " double booked");
            }
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12})
    void generateRounds_usesMinimalRoundCount(int n) {
        List<List<Pairing>> rounds = RoundRobinScheduler.generateRounds(players(n));

        assertEquals(n % 2 == 0 ? n - 1 : n, rounds.size());
        assertEquals(RoundRobinScheduler.roundCount(n), rounds.size());
        for (List<Pairing> round : rounds) {
            assertEquals(n / 2, round.size(), "Every round should seat all but the bye");
        }
    }

    @Test
    void generateRounds_orientsPairsByInputOrder() {
        List<String> players = List.of("zed", "amy", "bob", "cat", "dan");

        for (List<Pairing> round : RoundRobinScheduler.generateRounds(players)) {
            for (Pairing pairing : round) {
                assertTrue(players.indexOf(pairing.playerA()) < players.indexOf(pairing.playerB()),
                    "playerA should come first in the input list: " + pairing);
            }
        }
    }

    @Test
    void generateRounds_rejectsTooFewPlayers() {
        assertThrows(ScheduleConfigurationException.class, () -> RoundRobinScheduler.generateRounds(List.of("P1")));
        assertThrows(ScheduleConfigurationException.class, () -> RoundRobinScheduler.generateRounds(List.of()));
    }

    @Test
    void generateRounds_rejectsDuplicateIds() {
        assertThrows(ScheduleConfigurationException.class,
            () -> RoundRobinScheduler.generateRounds(List.of("P1", "P2", "P1")));
    }

    private static List<String> players(int n) {
        return new ArrayList<>(IntStream.rangeClosed(1, n).mapToObj(i -> String.format("P%02d", i)).toList());
    }
}
