package io.horizen.rawtx.api.rpc.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.horizen.rawtx.api.rpc.handler.RpcException;
import io.horizen.rawtx.api.rpc.json.RawTxJsonMapper;
import io.horizen.rawtx.api.rpc.request.RpcRequest;
import io.horizen.rawtx.api.rpc.utils.RpcCode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.Map;

/**
 * Dispatches requests to the {@link RpcMethod} annotated methods of the concrete service.
 * Positional params are bound to the method parameters with the JSON mapper.
 */
public class RpcService {
    private static final Logger logger = LogManager.getLogger();

    private final Map<String, Method> rpcMethods;
    private final ObjectMapper mapper;

    public RpcService() {
        rpcMethods = new HashMap<>();
        for (var method : this.getClass().getDeclaredMethods()) {
            var annotation = method.getAnnotation(RpcMethod.class);
            if (annotation == null) continue;
            if (rpcMethods.put(annotation.value(), method) != null)
                throw new IllegalStateException("Rpc method registered twice: " + annotation.value());
        }
        mapper = RawTxJsonMapper.getMapper();
    }

    public boolean hasMethod(String method) {
        return rpcMethods.containsKey(method);
    }

    private Object[] convertArgs(Method method, JsonNode params) throws RpcException {
        if (params != null && !params.isNull() && !params.isArray())
            throw new RpcException(RpcCode.InvalidParams, "params must be an array");

        var parameters = method.getParameterTypes();
        int required = parameters.length - method.getAnnotation(RpcMethod.class).optionalParameters();
        int given = params == null || params.isNull() ? 0 : params.size();
        if (given > parameters.length || given < required)
            throw new RpcException(RpcCode.InvalidParams, required == parameters.length
                    ? String.format("%d params expected, %d found", parameters.length, given)
                    : String.format("%d to %d params expected, %d found", required, parameters.length, given));

        var convertedArgs = new Object[parameters.length];
        for (int i = 0; i < given; i++) {
            JsonNode arg = params.get(i);
            if (arg.isNull())
                continue;
            try {
                convertedArgs[i] = mapper.convertValue(arg, parameters[i]);
            } catch (IllegalArgumentException err) {
                logger.trace("RPC call with invalid param {} for {}", i, method.getName(), err);
                throw new RpcException(RpcCode.InvalidParams, String.format("param %d has invalid type", i + 1));
            }
        }
        return convertedArgs;
    }

    public Object execute(RpcRequest req) throws Throwable {
        var method = rpcMethods.get(req.method);
        if (method == null) throw new RpcException(RpcCode.MethodNotFound, null);
        var args = convertArgs(method, req.params);
        try {
            logger.trace("RPC call: {}", req);
            return method.invoke(this, args);
        } catch (InvocationTargetException e) {
            // unpack and rethrow potential RpcException
            logger.trace("RPC call failed: {}", method.getName(), e);
            throw e.getCause();
        }
    }
}
