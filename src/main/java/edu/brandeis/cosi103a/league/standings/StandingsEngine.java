package edu.brandeis.cosi103a.league.standings;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Table;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Accumulates match results into a ranked leaderboard.
 *
 * Ordering is by points descending, then the head-to-head tiebreak, then player id.
 * Head-to-head is consulted only when exactly two players share a point total; three or
 * more players on the same total are ordered by player id alone.
 *
 * Each call is atomic. Updates that must stay consistent with round bookkeeping are
 * additionally serialized by the owning tournament's lock.
 */
public class StandingsEngine {

    public static final int POINTS_PER_WIN = 3;
    public static final int POINTS_PER_TIE = 1;

    private final Map<String, Tally> tallies = new LinkedHashMap<>();
    private final Table<String, String, HeadToHead> headToHead = HashBasedTable.create();
    private final Set<String> recordedMatches = new HashSet<>();

    /**
     * Admits a player with an empty record. Re-adding an existing player is a no-op.
     */
    public synchronized void addPlayer(String playerId, String displayName) {
        tallies.putIfAbsent(playerId, new Tally(playerId, displayName));
    }

    public synchronized boolean hasPlayer(String playerId) {
        return tallies.containsKey(playerId);
    }

    /**
     * Applies one match result.
     *
     * @param winnerId the winner, or {@code null} for a tie
     * @return false if this match id was already recorded, in which case nothing changes
     * @throws IllegalArgumentException for unknown players or a winner not in the match
     */
    public synchronized boolean recordMatchResult(String matchId, String playerA, String playerB, String winnerId) {
        Tally a = requireTally(playerA);
        Tally b = requireTally(playerB);
        if (playerA.equals(playerB)) {
            throw new IllegalArgumentException("A player cannot play itself: " + playerA);
        }
        if (winnerId != null && !winnerId.equals(playerA) && !winnerId.equals(playerB)) {
            throw new IllegalArgumentException("Winner " + winnerId + " did not play in match " + matchId);
        }
        if (!recordedMatches.add(matchId)) {
            return false;
        }

        a.matchesPlayed++;
        b.matchesPlayed++;
        HeadToHead outcomeForA;
        if (winnerId == null) {
            a.ties++;
            b.ties++;
            outcomeForA = HeadToHead.TIE;
        } else if (winnerId.equals(playerA)) {
            a.wins++;
            b.losses++;
            outcomeForA = HeadToHead.WIN;
        } else {
            b.wins++;
            a.losses++;
            outcomeForA = HeadToHead.LOSS;
        }
        headToHead.put(playerA, playerB, outcomeForA);
        headToHead.put(playerB, playerA, outcomeForA.reverse());
        return true;
    }

    /**
     * Returns the ranked leaderboard. Calling it twice without new results yields the same list.
     */
    public synchronized ImmutableList<PlayerStanding> getStandings() {
        Map<Integer, List<String>> byPoints = tallies.values().stream()
            .collect(Collectors.groupingBy(Tally::points,
                Collectors.mapping(t -> t.playerId, Collectors.toList())));

        List<Tally> ordered = new ArrayList<>(tallies.values());
        Function<Tally, Integer> tiebreak = t -> tiebreakValue(t, byPoints.get(t.points()));
        ordered.sort(Comparator
            .comparing((Tally t) -> -t.points())
            .thenComparing(tiebreak)
            .thenComparing(t -> t.playerId));

        ImmutableList.Builder<PlayerStanding> standings = ImmutableList.builder();
        for (int i = 0; i < ordered.size(); i++) {
            standings.add(ordered.get(i).toStanding(i + 1));
        }
        return standings.build();
    }

    public synchronized Optional<HeadToHead> headToHead(String playerId, String opponentId) {
        return Optional.ofNullable(headToHead.get(playerId, opponentId));
    }

    private int tiebreakValue(Tally tally, List<String> samePoints) {
        if (samePoints == null || samePoints.size() != 2) {
            return 0;
        }
        String other = samePoints.get(0).equals(tally.playerId) ? samePoints.get(1) : samePoints.get(0);
        return headToHead.get(tally.playerId, other) == HeadToHead.LOSS ? 1 : 0;
    }

    private Tally requireTally(String playerId) {
        Tally tally = tallies.get(playerId);
        if (tally == null) {
            throw new IllegalArgumentException("Unknown player: " + playerId);
        }
        return tally;
    }

    private static final class Tally {
        private final String playerId;
        private final String displayName;
        private int wins;
        private int losses;
        private int ties;
        private int matchesPlayed;

        Tally(String playerId, String displayName) {
            this.playerId = playerId;
            this.displayName = displayName;
        }

        int points() {
            return POINTS_PER_WIN * wins + POINTS_PER_TIE * ties;
        }

        PlayerStanding toStanding(int rank) {
            return new PlayerStanding(playerId, displayName, wins, losses, ties, points(), matchesPlayed, rank);
        }
    }
}
