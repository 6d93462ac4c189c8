package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Wraps payloads in the protocol envelope on behalf of one sender.
 */
public class MessageBuilder {

    public static final String PROTOCOL = "league.v2";

    private final ObjectMapper objectMapper;
    private final String sender;
    private final Clock clock;
    private final String authToken;

    public MessageBuilder(ObjectMapper objectMapper, String sender) {
        this(objectMapper, sender, Clock.systemUTC(), null);
    }

    public MessageBuilder(ObjectMapper objectMapper, String sender, Clock clock) {
        this(objectMapper, sender, clock, null);
    }

    private MessageBuilder(ObjectMapper objectMapper, String sender, Clock clock, String authToken) {
        this.objectMapper = objectMapper;
        this.sender = sender;
        this.clock = clock;
        this.authToken = authToken;
    }

    /**
     * Returns a builder that also stamps {@code auth_token} on every message.
     */
    public MessageBuilder authenticated(String token) {
        return new MessageBuilder(objectMapper, sender, clock, token);
    }

    public String sender() {
        return sender;
    }

    /**
     * Builds a message that opens a new conversation.
     */
    public ObjectNode build(MessageType type, Object payload) {
        return build(type, payload, UUID.randomUUID().toString());
    }

    /**
     * Builds a reply that continues the conversation of {@code request}.
     */
    public ObjectNode reply(MessageType type, Object payload, JsonNode request) {
        JsonNode conversation = request == null ? null : request.get("conversation_id");
        String conversationId = conversation != null && conversation.isTextual()
            ? conversation.asText()
            : UUID.randomUUID().toString();
        return build(type, payload, conversationId);
    }

    public ObjectNode build(MessageType type, Object payload, String conversationId) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("protocol", PROTOCOL);
        message.put("message_type", type.name());
        message.put("sender", sender);
        message.put("timestamp", Instant.now(clock).toString());
        message.put("conversation_id", conversationId);
        if (authToken != null) {
            message.put("auth_token", authToken);
        }
        if (payload != null) {
            JsonNode body = objectMapper.valueToTree(payload);
            if (!body.isObject()) {
                throw new IllegalArgumentException("Payload for " + type + " must be a JSON object");
            }
            message.setAll((ObjectNode) body);
        }
        return message;
    }

    /**
     * Reads the envelope fields of an incoming message.
     */
    public Envelope envelopeOf(JsonNode message) {
        try {
            return objectMapper.treeToValue(message, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed message envelope", e);
        }
    }

    /**
     * Reads the payload of an incoming message as {@code type}.
     *
     * @throws IllegalArgumentException if the message does not match the payload shape
     */
    public <T> T payloadOf(JsonNode message, Class<T> type) {
        try {
            return objectMapper.treeToValue(message, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
