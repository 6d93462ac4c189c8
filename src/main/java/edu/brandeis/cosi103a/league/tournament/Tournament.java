package edu.brandeis.cosi103a.league.tournament;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import edu.brandeis.cosi103a.league.scheduler.ScheduledMatch;
import edu.brandeis.cosi103a.league.scheduler.SchedulePlan;
import edu.brandeis.cosi103a.league.standings.StandingsEngine;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The league aggregate: the full round plan, the current round and the standings.
 *
 * All reads and writes of rounds, matches and standings go through {@link #locked} or
 * {@link #mutate}, the single serialization point for league state.
 */
public class Tournament {

    private final String leagueId;
    private final ImmutableSortedMap<Integer, Round> rounds;
    private final StandingsEngine standings;
    private final ReentrantLock lock = new ReentrantLock();
    private int currentRound;
    private TournamentStage stage = TournamentStage.RUNNING;

    public Tournament(String leagueId, ImmutableSortedMap<Integer, Round> rounds, StandingsEngine standings) {
        this.leagueId = leagueId;
        this.rounds = rounds;
        this.standings = standings;
    }

    /**
     * Creates the aggregate from a schedule. Every player in the plan must already be
     * admitted to {@code standings}.
     */
    public static Tournament fromPlan(SchedulePlan plan, StandingsEngine standings) {
        ImmutableSortedMap.Builder<Integer, Round> rounds = ImmutableSortedMap.naturalOrder();
        for (int i = 0; i < plan.rounds().size(); i++) {
            ImmutableList.Builder<Match> matches = ImmutableList.builder();
            for (ScheduledMatch scheduled : plan.rounds().get(i)) {
                if (!standings.hasPlayer(scheduled.playerAId()) || !standings.hasPlayer(scheduled.playerBId())) {
                    throw new IllegalArgumentException("Match " + scheduled.matchId() + " has a player without a standing");
                }
                matches.add(Match.from(scheduled));
            }
            rounds.put(i + 1, new Round(i + 1, matches.build()));
        }
        return new Tournament(plan.leagueId(), rounds.build(), standings);
    }

    /**
     * Runs {@code action} while holding the league lock.
     */
    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} while holding the league lock.
     */
    public void mutate(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public String leagueId() {
        return leagueId;
    }

    public int totalRounds() {
        return rounds.size();
    }

    public int totalMatches() {
        return rounds.values().stream().mapToInt(r -> r.matches().size()).sum();
    }

    public int completedMatches() {
        return rounds.values().stream().mapToInt(r -> r.completedMatchIds().size()).sum();
    }

    /**
     * @throws IllegalArgumentException for a round number outside the plan
     */
    public Round round(int roundNumber) {
        Round round = rounds.get(roundNumber);
        if (round == null) {
            throw new IllegalArgumentException("No round " + roundNumber + " in league " + leagueId);
        }
        return round;
    }

    public ImmutableList<Round> rounds() {
        return rounds.values().asList();
    }

    public Optional<Match> findMatch(String matchId) {
        for (Round round : rounds.values()) {
            Optional<Match> match = round.match(matchId);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    public int currentRound() {
        return currentRound;
    }

    void advanceTo(int roundNumber) {
        if (roundNumber <= currentRound) {
            throw new RoundLifecycleException("Current round cannot move from " + currentRound + " to " + roundNumber);
        }
        currentRound = roundNumber;
    }

    public TournamentStage stage() {
        return stage;
    }

    void markCompleted() {
        stage = TournamentStage.COMPLETED;
    }

    public StandingsEngine standings() {
        return standings;
    }

    /**
     * True once the last round has been started and every round is completed.
     */
    public boolean isComplete() {
        return currentRound == totalRounds()
            && rounds.values().stream().allMatch(r -> r.status() == RoundStatus.COMPLETED);
    }
}
