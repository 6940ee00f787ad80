package io.horizen.rawtx.api.rpc.utils;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON-RPC error object. The message carries the detail after the code description,
 * the way the mainchain node reports it, e.g. "Invalid parameter: duplicated txid".
 */
public class RpcError {
    public final int code;
    public final String message;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String data;

    public RpcError(int code, String message, String data) {
        this.code = code;
        this.message = message;
        this.data = data;
    }

    public static RpcError fromCode(RpcCode code, String data) {
        String message = data == null ? code.message : code.message + ": " + data;
        return new RpcError(code.code, message, data);
    }

    public static RpcError fromCode(RpcCode code) {
        return fromCode(code, null);
    }

    public boolean is(RpcCode rpcCode) {
        return code == rpcCode.code;
    }

    @Override
    public String toString() {
        return String.format("RpcError{code=%d, message='%s'}", code, message);
    }
}
