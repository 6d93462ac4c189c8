package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegistrationResponse(
    @JsonProperty("status") String status,
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("auth_token") String authToken,
    @JsonProperty("league_id") String leagueId,
    @JsonProperty("reason") String reason
) {
    public static final String ACCEPTED = "ACCEPTED";
    public static final String REJECTED = "REJECTED";

    public static RegistrationResponse accepted(String agentId, String authToken, String leagueId) {
        return new RegistrationResponse(ACCEPTED, agentId, authToken, leagueId, null);
    }

    public static RegistrationResponse rejected(String leagueId, String reason) {
        return new RegistrationResponse(REJECTED, null, null, leagueId, reason);
    }

    @JsonIgnore
    public boolean isAccepted() {
        return ACCEPTED.equals(status);
    }
}
