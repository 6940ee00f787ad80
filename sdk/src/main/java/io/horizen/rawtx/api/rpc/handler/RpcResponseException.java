package io.horizen.rawtx.api.rpc.handler;

import io.horizen.rawtx.api.rpc.request.RpcId;
import io.horizen.rawtx.api.rpc.utils.RpcError;

// Request validation failure that still knows which id to answer with.
public class RpcResponseException extends RpcException {
    public final RpcId id;

    public RpcResponseException(RpcError error, RpcId id) {
        super(error);
        this.id = id;
    }
}
