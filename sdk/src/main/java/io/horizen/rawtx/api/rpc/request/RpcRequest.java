package io.horizen.rawtx.api.rpc.request;

import com.fasterxml.jackson.databind.JsonNode;
import io.horizen.rawtx.api.rpc.handler.RpcResponseException;
import io.horizen.rawtx.api.rpc.utils.RpcCode;
import io.horizen.rawtx.api.rpc.utils.RpcError;

import java.util.List;

/**
 * {"id":1,"jsonrpc":"2.0","method":"decoderawtransaction","params":["0100000001..."]}
 */
public class RpcRequest {
    public final String jsonrpc;
    public final RpcId id;
    public final String method;
    public final JsonNode params;

    private static final String mandatoryIdField = "id";
    private static final List<String> otherMandatoryFields = List.of("jsonrpc", "method");
    private static final String JSON_RPC_VERSION = "2.0";

    public RpcRequest(JsonNode json) throws RpcResponseException {
        if (!json.isObject()) {
            throw new RpcResponseException(RpcError.fromCode(RpcCode.InvalidRequest, "Request must be an object"), RpcId.none());
        }

        // checked first, the id is needed to answer any other error
        if (!json.has(mandatoryIdField)) {
            throw new RpcResponseException(RpcError.fromCode(RpcCode.InvalidRequest, String.format("missing field: %s", mandatoryIdField)), RpcId.none());
        }

        try {
            id = RpcId.fromJson(json.get(mandatoryIdField));
        } catch (IllegalArgumentException e) {
            throw new RpcResponseException(RpcError.fromCode(RpcCode.InvalidRequest, e.getMessage()), RpcId.none());
        }

        for (var field : otherMandatoryFields) {
            if (!json.has(field)) {
                throw new RpcResponseException(
                    RpcError.fromCode(RpcCode.InvalidRequest, String.format("missing field: %s", field)), id);
            }
            if (!json.get(field).isTextual()) {
                throw new RpcResponseException(
                    RpcError.fromCode(RpcCode.InvalidRequest, String.format("field must be string: %s", field)), id);
            }
        }

        jsonrpc = json.get("jsonrpc").asText();
        if (!jsonrpc.equals(JSON_RPC_VERSION)) {
            throw new RpcResponseException(RpcError.fromCode(RpcCode.InvalidRequest, "jsonrpc value is not valid"), id);
        }

        method = json.get("method").asText();
        // params might be null, which is allowed
        params = json.get("params");
    }

    @Override
    public String toString() {
        return String.format(
            "RpcRequest={jsonrpc='%s', id='%s', method='%s', params=%s}", jsonrpc, id, method, params);
    }
}
