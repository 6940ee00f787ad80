package io.horizen.rawtx.api.rpc.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.horizen.rawtx.api.rpc.request.RpcId;

public class RpcResponseSuccess extends RpcResponse {
    @JsonProperty("result")
    @JsonInclude
    protected final Object result;

    public RpcResponseSuccess(RpcId id, Object result) {
        super(id);
        this.result = result;
    }

    public Object getResult() {
        return result;
    }

    @Override
    public String toString() {
        return String.format("RpcResponseSuccess{jsonrpc='%s', id='%s', result=%s}", jsonrpc, id, result);
    }
}
