package io.horizen.rawtx.api.rpc.handler;

import io.horizen.rawtx.api.rpc.utils.RpcCode;
import io.horizen.rawtx.api.rpc.utils.RpcError;

/**
 * Failure of an RPC call, reported to the caller as the error object of the response.
 */
public class RpcException extends Exception {
    public final RpcError error;

    public RpcException(RpcError error) {
        super(error.toString());
        this.error = error;
    }

    public RpcException(RpcCode code, String data) {
        this(RpcError.fromCode(code, data));
    }
}
