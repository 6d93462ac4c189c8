package edu.brandeis.cosi103a.league.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.league.network.dto.JsonRpcResponse;
import edu.brandeis.cosi103a.league.player.PlayerAgent;
import edu.brandeis.cosi103a.league.protocol.ChooseParityCall;
import edu.brandeis.cosi103a.league.protocol.GameInvitation;
import edu.brandeis.cosi103a.league.protocol.GameOver;
import edu.brandeis.cosi103a.league.protocol.MessageBuilder;
import edu.brandeis.cosi103a.league.protocol.MessageType;
import edu.brandeis.cosi103a.league.protocol.RoundAnnouncement;
import edu.brandeis.cosi103a.league.protocol.RoundCompleted;
import edu.brandeis.cosi103a.league.protocol.RpcMethods;
import edu.brandeis.cosi103a.league.protocol.TournamentEnd;
import edu.brandeis.cosi103a.league.protocol.TournamentStart;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.function.Function;

/**
 * JSON-RPC endpoint of a player. Replies continue the conversation of the request they answer.
 */
@RestController
@ConditionalOnProperty(name = "league.role", havingValue = "player")
public class PlayerRpcController {

    private final PlayerAgent agent;
    private final ObjectMapper objectMapper;
    private final JsonRpcDispatcher dispatcher;

    public PlayerRpcController(PlayerAgent agent, ObjectMapper objectMapper) {
        this.agent = agent;
        this.objectMapper = objectMapper;
        this.dispatcher = new JsonRpcDispatcher(objectMapper)
            .register(RpcMethods.HANDLE_GAME_INVITATION, handler(MessageType.GAME_JOIN_ACK, GameInvitation.class, agent::handleInvitation))
            .register(RpcMethods.CHOOSE_PARITY, handler(MessageType.CHOOSE_PARITY_RESPONSE, ChooseParityCall.class, agent::chooseParity))
            .register(RpcMethods.NOTIFY_MATCH_RESULT, handler(MessageType.ACK, GameOver.class, agent::onGameOver))
            .register(RpcMethods.NOTIFY_TOURNAMENT_START, handler(MessageType.ACK, TournamentStart.class, agent::onTournamentStart))
            .register(RpcMethods.NOTIFY_ROUND_ANNOUNCEMENT, handler(MessageType.ACK, RoundAnnouncement.class, agent::onRoundAnnouncement))
            .register(RpcMethods.NOTIFY_ROUND_COMPLETED, handler(MessageType.ACK, RoundCompleted.class, agent::onRoundCompleted))
            .register(RpcMethods.NOTIFY_TOURNAMENT_END, handler(MessageType.ACK, TournamentEnd.class, agent::onTournamentEnd));
    }

    private <T> JsonRpcDispatcher.Handler handler(MessageType replyType, Class<T> payloadType, Function<T, ?> action) {
        return (JsonNode params) -> {
            MessageBuilder messages = new MessageBuilder(objectMapper, "player:" + agent.playerId());
            return messages.reply(replyType, action.apply(messages.payloadOf(params, payloadType)), params);
        };
    }

    @PostMapping(value = "/mcp", produces = MediaType.APPLICATION_JSON_VALUE)
    public JsonRpcResponse handle(@RequestBody String body) {
        return dispatcher.dispatch(body);
    }
}
