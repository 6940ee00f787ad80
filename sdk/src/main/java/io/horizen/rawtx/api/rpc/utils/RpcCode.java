package io.horizen.rawtx.api.rpc.utils;

public enum RpcCode {
    // default json-rpc error codes
    ParseError(-32700, "Parse error"),
    InvalidRequest(-32600, "Invalid request"),
    MethodNotFound(-32601, "Method not found"),
    InvalidParams(-32602, "Invalid params"),
    InternalError(-32603, "Internal error"),

    // mainchain node error codes
    InvalidAddressOrKey(-5, "Invalid address or key"),
    InvalidParameter(-8, "Invalid parameter"),
    DeserializationError(-22, "Deserialization error");

    public final int code;
    public final String message;

    RpcCode(int code, String message) {
        this.code = code;
        this.message = message;
    }
}
