package io.horizen.rawtx.api.rpc.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.horizen.rawtx.api.rpc.json.RpcIdSerializer;
import io.horizen.rawtx.api.rpc.request.RpcId;

public abstract class RpcResponse {
    @JsonProperty("jsonrpc")
    protected final String jsonrpc = "2.0";

    @JsonProperty("id")
    @JsonSerialize(using = RpcIdSerializer.class)
    protected final RpcId id;

    public RpcResponse(RpcId id) {
        this.id = id;
    }

    public RpcId getId() {
        return id;
    }
}
