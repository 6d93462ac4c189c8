package edu.brandeis.cosi103a.league.network.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.LongNode;

/**
 * JSON-RPC 2.0 request envelope.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcRequest(
    @JsonProperty("jsonrpc") String jsonrpc,
    @JsonProperty("method") String method,
    @JsonProperty("params") JsonNode params,
    @JsonProperty("id") JsonNode id
) {
    public static final String VERSION = "2.0";

    public static JsonRpcRequest of(String method, JsonNode params, long id) {
        return new JsonRpcRequest(VERSION, method, params, LongNode.valueOf(id));
    }
}
