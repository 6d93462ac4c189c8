package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Header fields carried by every protocol message alongside its payload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Envelope(
    @JsonProperty("protocol") String protocol,
    @JsonProperty("message_type") String messageType,
    @JsonProperty("sender") String sender,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("conversation_id") String conversationId,
    @JsonProperty("auth_token") String authToken
) {
    /**
     * The agent id part of a {@code role:id} sender, or the whole sender if it has no role prefix.
     */
    public String senderId() {
        if (sender == null) {
            return null;
        }
        int colon = sender.indexOf(':');
        return colon >= 0 ? sender.substring(colon + 1) : sender;
    }
}
