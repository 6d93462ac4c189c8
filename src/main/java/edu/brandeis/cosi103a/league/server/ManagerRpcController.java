package edu.brandeis.cosi103a.league.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.league.manager.LeagueCoordinator;
import edu.brandeis.cosi103a.league.network.dto.JsonRpcResponse;
import edu.brandeis.cosi103a.league.protocol.MatchResultReport;
import edu.brandeis.cosi103a.league.protocol.MessageBuilder;
import edu.brandeis.cosi103a.league.protocol.MessageType;
import edu.brandeis.cosi103a.league.protocol.RegistrationRequest;
import edu.brandeis.cosi103a.league.protocol.RpcMethods;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * JSON-RPC endpoint of the league manager.
 */
@RestController
@ConditionalOnProperty(name = "league.role", havingValue = "manager", matchIfMissing = true)
public class ManagerRpcController {

    private final JsonRpcDispatcher dispatcher;

    public ManagerRpcController(LeagueCoordinator coordinator, ObjectMapper objectMapper) {
        MessageBuilder messages = coordinator.messages();
        this.dispatcher = new JsonRpcDispatcher(objectMapper)
            .register(RpcMethods.REGISTER_PLAYER, params -> messages.reply(MessageType.LEAGUE_REGISTER_RESPONSE,
                coordinator.registerPlayer(messages.payloadOf(params, RegistrationRequest.class)), params))
            .register(RpcMethods.REGISTER_REFEREE, params -> messages.reply(MessageType.REFEREE_REGISTER_RESPONSE,
                coordinator.registerReferee(messages.payloadOf(params, RegistrationRequest.class)), params))
            .register(RpcMethods.START_LEAGUE, params -> messages.reply(MessageType.LEAGUE_QUERY_RESPONSE,
                coordinator.startLeague(), params))
            .register(RpcMethods.REPORT_MATCH_RESULT, params -> messages.reply(MessageType.MATCH_RESULT_ACK,
                coordinator.reportMatchResult(messages.envelopeOf(params), messages.payloadOf(params, MatchResultReport.class)),
                params))
            .register(RpcMethods.GET_STANDINGS, params -> messages.reply(MessageType.LEAGUE_QUERY_RESPONSE,
                coordinator.getStandings(), params))
            .register(RpcMethods.GET_LEAGUE_STATUS, params -> messages.reply(MessageType.LEAGUE_QUERY_RESPONSE,
                coordinator.status(), params));
    }

    @PostMapping(value = "/mcp", produces = MediaType.APPLICATION_JSON_VALUE)
    public JsonRpcResponse handle(@RequestBody String body) {
        return dispatcher.dispatch(body);
    }
}
