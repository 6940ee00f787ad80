package io.horizen.rawtx.api.rpc.service;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/***
 * Exposes a service method under the given JSON-RPC method name.
 * The last {@code optionalParameters} parameters may be left out by the caller and are then null.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface RpcMethod {
    String value();

    int optionalParameters() default 0;
}
