package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic receipt for notifications and reports.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Acknowledgement(
    @JsonProperty("acknowledged") boolean acknowledged,
    @JsonProperty("status") String status
) {
    public static final String RECORDED = "RECORDED";
    public static final String DUPLICATE = "DUPLICATE";

    public static Acknowledgement ok() {
        return new Acknowledgement(true, null);
    }

    public static Acknowledgement withStatus(String status) {
        return new Acknowledgement(true, status);
    }
}
