package io.horizen.rawtx.api.rpc.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.horizen.rawtx.api.rpc.request.RpcRequest;
import io.horizen.rawtx.api.rpc.response.RpcResponse;
import io.horizen.rawtx.api.rpc.response.RpcResponseError;
import io.horizen.rawtx.api.rpc.response.RpcResponseSuccess;
import io.horizen.rawtx.api.rpc.service.RpcService;
import io.horizen.rawtx.api.rpc.utils.RpcCode;
import io.horizen.rawtx.api.rpc.utils.RpcError;
import org.apache.logging.log4j.LogManager;

public class RpcHandler {
    private final RpcService rpcService;

    public RpcHandler(RpcService rpcService) {
        this.rpcService = rpcService;
    }

    public RpcResponse apply(RpcRequest request) {
        try {
            if (rpcService.hasMethod(request.method)) {
                var result = rpcService.execute(request);
                return new RpcResponseSuccess(request.id, result);
            }
            return new RpcResponseError(request.id, RpcError.fromCode(RpcCode.MethodNotFound));
        } catch (RpcException e) {
            return new RpcResponseError(request.id, e.error);
        } catch (Throwable e) {
            LogManager.getLogger().error("Unexpected exception: ", e);
            return new RpcResponseError(request.id, RpcError.fromCode(RpcCode.InternalError, e.getMessage()));
        }
    }

    // Validates a raw JSON request before dispatching it.
    public RpcResponse apply(JsonNode json) {
        try {
            return apply(new RpcRequest(json));
        } catch (RpcResponseException e) {
            return new RpcResponseError(e.id, e.error);
        }
    }
}
