package edu.brandeis.cosi103a.league.network.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON-RPC 2.0 error object.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcError(
    @JsonProperty("code") int code,
    @JsonProperty("message") String message
) {
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int UNAUTHORIZED = -32001;
}
