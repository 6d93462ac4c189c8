package edu.brandeis.cosi103a.league.scheduler;

import java.util.*;

/**
 * Builds the round-robin pairing table for a player list.
 *
 * Uses the circle method: one player stays fixed while the others rotate one seat per
 * round, with an empty seat standing in for the bye when the player count is odd. The
 * result covers every unordered pair exactly once, never books a player twice in a round,
 * and has {@code n-1} rounds for even {@code n} and {@code n} rounds for odd {@code n}.
 */
public final class RoundRobinScheduler {

    private RoundRobinScheduler() {}

    /**
     * Generates all rounds of pairings.
     *
     * @param playerIds distinct player ids, at least two; order defines pair orientation
     * @return rounds in play order, each a list of disjoint pairings
     * @throws ScheduleConfigurationException on fewer than two players or duplicate ids
     */
    public static List<List<Pairing>> generateRounds(List<String> playerIds) {
        if (playerIds == null || playerIds.size() < 2) {
            throw new ScheduleConfigurationException("Need at least 2 players for a round-robin schedule");
        }
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < playerIds.size(); i++) {
            if (position.putIfAbsent(playerIds.get(i), i) != null) {
                throw new ScheduleConfigurationException("Duplicate player id: " + playerIds.get(i));
            }
        }

        List<String> seats = new ArrayList<>(playerIds);
        if (seats.size() % 2 == 1) {
            seats.add(null); // bye
        }
        int seatCount = seats.size();

        List<List<Pairing>> rounds = new ArrayList<>();
        for (int round = 0; round < seatCount - 1; round++) {
            List<Pairing> pairings = new ArrayList<>();
            for (int i = 0; i < seatCount / 2; i++) {
                String first = seats.get(i);
                String second = seats.get(seatCount - 1 - i);
                if (first == null || second == null) {
                    continue;
                }
                if (position.get(first) < position.get(second)) {
                    pairings.add(new Pairing(first, second));
                } else {
                    pairings.add(new Pairing(second, first));
                }
            }
            pairings.sort(Comparator
                .comparing((Pairing p) -> position.get(p.playerA()))
                .thenComparing(p -> position.get(p.playerB())));
            rounds.add(pairings);

            // Seat 0 stays, the last seat moves to seat 1
            seats.add(1, seats.remove(seatCount - 1));
        }
        return rounds;
    }

    /**
     * Number of rounds a league of {@code playerCount} players needs.
     */
    public static int roundCount(int playerCount) {
        return playerCount % 2 == 0 ? playerCount - 1 : playerCount;
    }
}
