package edu.brandeis.cosi103a.league.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.league.network.dto.JsonRpcResponse;
import edu.brandeis.cosi103a.league.protocol.MatchAssignment;
import edu.brandeis.cosi103a.league.protocol.MessageBuilder;
import edu.brandeis.cosi103a.league.protocol.MessageType;
import edu.brandeis.cosi103a.league.protocol.RpcMethods;
import edu.brandeis.cosi103a.league.referee.RefereeService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@ConditionalOnProperty(name = "league.role", havingValue = "referee")
public class RefereeRpcController {

    private final JsonRpcDispatcher dispatcher;

    public RefereeRpcController(RefereeService refereeService, ObjectMapper objectMapper) {
        this.dispatcher = new JsonRpcDispatcher(objectMapper)
            .register(RpcMethods.ASSIGN_MATCH, params -> {
                MessageBuilder messages = new MessageBuilder(objectMapper, "referee:" + refereeService.refereeId());
                return messages.reply(MessageType.ACK,
                    refereeService.assignMatch(messages.payloadOf(params, MatchAssignment.class)), params);
            });
    }

    @PostMapping(value = "/mcp", produces = MediaType.APPLICATION_JSON_VALUE)
    public JsonRpcResponse handle(@RequestBody String body) {
        return dispatcher.dispatch(body);
    }
}
