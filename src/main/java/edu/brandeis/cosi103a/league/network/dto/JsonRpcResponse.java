package edu.brandeis.cosi103a.league.network.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC 2.0 response envelope. Exactly one of {@code result} and {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcResponse(
    @JsonProperty("jsonrpc") String jsonrpc,
    @JsonProperty("result") JsonNode result,
    @JsonProperty("error") JsonRpcError error,
    @JsonProperty("id") JsonNode id
) {
    public static JsonRpcResponse success(JsonNode id, JsonNode result) {
        return new JsonRpcResponse(JsonRpcRequest.VERSION, result, null, id);
    }

    public static JsonRpcResponse failure(JsonNode id, int code, String message) {
        return new JsonRpcResponse(JsonRpcRequest.VERSION, null, new JsonRpcError(code, message), id);
    }
}
