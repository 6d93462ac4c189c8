package edu.brandeis.cosi103a.league.tournament;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.league.broadcast.Broadcaster;
import edu.brandeis.cosi103a.league.broadcast.DeliveryReport;
import edu.brandeis.cosi103a.league.broadcast.Recipient;
import edu.brandeis.cosi103a.league.protocol.MessageBuilder;
import edu.brandeis.cosi103a.league.protocol.MessageType;
import edu.brandeis.cosi103a.league.protocol.RoundAnnouncement;
import edu.brandeis.cosi103a.league.protocol.RoundCompleted;
import edu.brandeis.cosi103a.league.protocol.RpcMethods;
import edu.brandeis.cosi103a.league.protocol.TournamentEnd;
import edu.brandeis.cosi103a.league.standings.PlayerStanding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Sequences the rounds of a {@link Tournament}: announces each round, tracks match
 * completion, closes rounds and announces the end of the league.
 *
 * State changes happen under the tournament lock; broadcasts are sent after the lock is
 * released. Round {@code n+1} can only start once round {@code n} is completed.
 */
public class RoundManager {

    private static final Logger log = LoggerFactory.getLogger(RoundManager.class);

    private final Tournament tournament;
    private final Broadcaster broadcaster;
    private final MessageBuilder messages;
    private final Supplier<List<Recipient>> players;
    private final Function<String, String> refereeEndpoints;

    /**
     * @param players current broadcast recipients, read at every broadcast
     * @param refereeEndpoints resolves a referee id to the endpoint players are told about
     */
    public RoundManager(Tournament tournament, Broadcaster broadcaster, MessageBuilder messages,
                        Supplier<List<Recipient>> players, Function<String, String> refereeEndpoints) {
        this.tournament = tournament;
        this.broadcaster = broadcaster;
        this.messages = messages;
        this.players = players;
        this.refereeEndpoints = refereeEndpoints;
    }

    public Tournament tournament() {
        return tournament;
    }

    /**
     * Announces round {@code roundNumber} to all players and makes it the current round.
     *
     * @throws RoundLifecycleException if the round was already started or the previous round is not completed
     */
    public DeliveryReport startRound(int roundNumber) {
        RoundAnnouncement announcement = tournament.locked(() -> {
            Round round = tournament.round(roundNumber);
            if (round.status() != RoundStatus.PENDING) {
                throw new RoundLifecycleException("Round " + roundNumber + " is already " + round.status());
            }
            if (roundNumber > 1 && tournament.round(roundNumber - 1).status() != RoundStatus.COMPLETED) {
                throw new RoundLifecycleException("Round " + (roundNumber - 1) + " is not completed yet");
            }
            tournament.advanceTo(roundNumber);
            round.setStatus(RoundStatus.ANNOUNCED);
            round.matches().forEach(Match::start);

            ImmutableList.Builder<RoundAnnouncement.AnnouncedMatch> matches = ImmutableList.builder();
            for (Match match : round.matches()) {
                matches.add(new RoundAnnouncement.AnnouncedMatch(
                    match.matchId(),
                    match.playerAId(),
                    match.playerBId(),
                    match.refereeId(),
                    refereeEndpoints.apply(match.refereeId())));
            }
            return new RoundAnnouncement(tournament.leagueId(), roundNumber, matches.build());
        });

        log.info("Announcing round {}/{} of {} with {} matches",
            roundNumber, tournament.totalRounds(), tournament.leagueId(), announcement.matches().size());
        return broadcaster.broadcast(players.get(), RpcMethods.NOTIFY_ROUND_ANNOUNCEMENT,
            messages.build(MessageType.ROUND_ANNOUNCEMENT, announcement));
    }

    /**
     * Same as {@link #markMatchComplete(String, int, MatchStatus)} with {@link MatchStatus#COMPLETED}.
     */
    public boolean markMatchComplete(String matchId, int roundNumber) {
        return markMatchComplete(matchId, roundNumber, MatchStatus.COMPLETED);
    }

    /**
     * Records that a match of an announced round has finished.
     *
     * @return true exactly once per round, on the call that finishes its last outstanding match
     * @throws IllegalArgumentException if the match is not part of the round
     * @throws RoundLifecycleException if the round is not in progress
     */
    public boolean markMatchComplete(String matchId, int roundNumber, MatchStatus outcome) {
        return tournament.locked(() -> {
            Round round = tournament.round(roundNumber);
            Match match = round.match(matchId)
                .orElseThrow(() -> new IllegalArgumentException("Match " + matchId + " is not in round " + roundNumber));
            if (round.status() != RoundStatus.ANNOUNCED) {
                throw new RoundLifecycleException("Round " + roundNumber + " is " + round.status()
                    + ", cannot complete match " + matchId);
            }
            if (match.status().isTerminal()) {
                return false;
            }
            match.finish(outcome);
            return round.markComplete(matchId);
        });
    }

    /**
     * Closes a fully played round and tells every player, including which round comes next.
     *
     * @throws RoundLifecycleException if the round is not announced or still has unfinished matches
     */
    public DeliveryReport completeRound(int roundNumber) {
        RoundCompleted completed = tournament.locked(() -> {
            Round round = tournament.round(roundNumber);
            if (round.status() != RoundStatus.ANNOUNCED) {
                throw new RoundLifecycleException("Round " + roundNumber + " is " + round.status() + ", cannot complete it");
            }
            if (!round.isComplete()) {
                throw new RoundLifecycleException("Round " + roundNumber + " has "
                    + (round.matches().size() - round.completedMatchIds().size()) + " unfinished matches");
            }
            round.setStatus(RoundStatus.COMPLETED);
            Integer next = roundNumber < tournament.totalRounds() ? roundNumber + 1 : null;
            return new RoundCompleted(tournament.leagueId(), roundNumber, round.completedMatchIds().size(), next);
        });

        log.info("Round {}/{} of {} completed", roundNumber, tournament.totalRounds(), tournament.leagueId());
        return broadcaster.broadcast(players.get(), RpcMethods.NOTIFY_ROUND_COMPLETED,
            messages.build(MessageType.ROUND_COMPLETED, completed));
    }

    public boolean isTournamentComplete() {
        return tournament.locked(tournament::isComplete);
    }

    /**
     * Announces the champion and the final standings. Only legal once every round is completed.
     *
     * @throws RoundLifecycleException if the league is not complete
     */
    public DeliveryReport broadcastTournamentEnd() {
        TournamentEnd end = tournament.locked(() -> {
            if (!tournament.isComplete()) {
                throw new RoundLifecycleException("League " + tournament.leagueId() + " is not complete");
            }
            ImmutableList<PlayerStanding> finalStandings = tournament.standings().getStandings();
            String champion = finalStandings.isEmpty() ? null : finalStandings.get(0).playerId();
            tournament.markCompleted();
            return new TournamentEnd(tournament.leagueId(), tournament.totalRounds(), tournament.totalMatches(),
                champion, finalStandings);
        });

        log.info("League {} finished, champion {}", tournament.leagueId(), end.champion());
        return broadcaster.broadcast(players.get(), RpcMethods.NOTIFY_TOURNAMENT_END,
            messages.build(MessageType.TOURNAMENT_END, end));
    }
}
