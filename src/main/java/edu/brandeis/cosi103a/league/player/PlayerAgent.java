package edu.brandeis.cosi103a.league.player;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.league.game.ParityChoice;
import edu.brandeis.cosi103a.league.protocol.Acknowledgement;
import edu.brandeis.cosi103a.league.protocol.ChooseParityCall;
import edu.brandeis.cosi103a.league.protocol.ChooseParityResponse;
import edu.brandeis.cosi103a.league.protocol.GameInvitation;
import edu.brandeis.cosi103a.league.protocol.GameOver;
import edu.brandeis.cosi103a.league.protocol.InvitationResponse;
import edu.brandeis.cosi103a.league.protocol.RoundAnnouncement;
import edu.brandeis.cosi103a.league.protocol.RoundCompleted;
import edu.brandeis.cosi103a.league.protocol.StandingRow;
import edu.brandeis.cosi103a.league.protocol.TournamentEnd;
import edu.brandeis.cosi103a.league.protocol.TournamentStart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Player agent: accepts every invitation, answers choice requests through its
 * {@link ParityStrategy} and keeps what the league tells it.
 */
@Service
@ConditionalOnProperty(name = "league.role", havingValue = "player")
public class PlayerAgent {

    private static final Logger log = LoggerFactory.getLogger(PlayerAgent.class);

    private final ParityStrategy strategy;
    private final List<GameOver> history = new CopyOnWriteArrayList<>();
    private volatile String playerId;
    private volatile ImmutableList<StandingRow> lastStandings = ImmutableList.of();
    private volatile RoundAnnouncement currentRound;
    private volatile String champion;

    @Autowired
    public PlayerAgent(
            @Value("${league.agent-id:P01}") String playerId,
            @Value("${league.player.min-delay-ms:0}") int minDelayMs,
            @Value("${league.player.max-delay-ms:0}") int maxDelayMs) {
        this(maxDelayMs > 0
                ? new DelayedParityStrategy(new RandomParityStrategy(), minDelayMs, maxDelayMs)
                : new RandomParityStrategy(),
            playerId);
    }

    public PlayerAgent(ParityStrategy strategy, String playerId) {
        this.strategy = strategy;
        this.playerId = playerId;
    }

    public void registered(String agentId) {
        this.playerId = agentId;
    }

    public String playerId() {
        return playerId;
    }

    public InvitationResponse handleInvitation(GameInvitation invitation) {
        log.info("Player {} invited to {} as {} against {}",
            playerId, invitation.matchId(), invitation.role(), invitation.opponentId());
        return new InvitationResponse(true);
    }

    public ChooseParityResponse chooseParity(ChooseParityCall call) {
        ChoiceContext context = ChoiceContext.of(call);
        if (!context.standings().isEmpty()) {
            lastStandings = context.standings();
        }
        ParityChoice choice = strategy.choose(context);
        log.debug("Player {} chose {} in {}", playerId, choice.wireValue(), call.matchId());
        return new ChooseParityResponse(choice.wireValue());
    }

    public Acknowledgement onGameOver(GameOver gameOver) {
        history.add(gameOver);
        log.info("Player {}: match {} over, {}", playerId, gameOver.matchId(),
            gameOver.gameResult().winnerPlayerId().map(w -> "winner " + w).orElse("draw"));
        return Acknowledgement.ok();
    }

    public Acknowledgement onTournamentStart(TournamentStart start) {
        log.info("Player {}: league {} starts, {} rounds", playerId, start.leagueId(), start.totalRounds());
        return Acknowledgement.ok();
    }

    public Acknowledgement onRoundAnnouncement(RoundAnnouncement announcement) {
        currentRound = announcement;
        log.info("Player {}: round {} announced", playerId, announcement.roundId());
        return Acknowledgement.ok();
    }

    public Acknowledgement onRoundCompleted(RoundCompleted completed) {
        log.info("Player {}: round {} completed, next {}", playerId, completed.roundId(), completed.nextRoundId());
        return Acknowledgement.ok();
    }

    public Acknowledgement onTournamentEnd(TournamentEnd end) {
        champion = end.champion();
        if (end.finalStandings() != null) {
            lastStandings = end.finalStandings().stream().map(StandingRow::of).collect(ImmutableList.toImmutableList());
        }
        log.info("Player {}: league over, champion {}", playerId, end.champion());
        return Acknowledgement.ok();
    }

    public ImmutableList<GameOver> history() {
        return ImmutableList.copyOf(history);
    }

    public ImmutableList<StandingRow> lastStandings() {
        return lastStandings;
    }

    public Optional<RoundAnnouncement> currentRound() {
        return Optional.ofNullable(currentRound);
    }

    public Optional<String> champion() {
        return Optional.ofNullable(champion);
    }
}
