package io.horizen.rawtx.api.rpc.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.horizen.rawtx.api.rpc.request.RpcId;
import io.horizen.rawtx.api.rpc.utils.RpcError;

public class RpcResponseError extends RpcResponse {
    @JsonProperty("error")
    protected final RpcError error;

    public RpcResponseError(RpcId id, RpcError error) {
        super(id);
        this.error = error;
    }

    public RpcError getError() {
        return error;
    }

    @Override
    public String toString() {
        return String.format("RpcResponseError{jsonrpc='%s', id='%s', error=%s}", jsonrpc, id, error);
    }
}
