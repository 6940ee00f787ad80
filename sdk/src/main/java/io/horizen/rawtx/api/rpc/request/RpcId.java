package io.horizen.rawtx.api.rpc.request;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Request id, echoed back with the type it was received with: a non-negative number or a string.
 * Requests rejected before their id could be read are answered with a null id.
 */
public final class RpcId {
    private static final RpcId NONE = new RpcId(null, null);

    private final Long longId;
    private final String stringId;

    private RpcId(Long longId, String stringId) {
        this.longId = longId;
        this.stringId = stringId;
    }

    public static RpcId none() {
        return NONE;
    }

    public static RpcId of(long longId) {
        if (longId < 0)
            throw new IllegalArgumentException("Rpc Id can't be a negative number");
        return new RpcId(longId, null);
    }

    public static RpcId of(String stringId) {
        return new RpcId(null, Objects.requireNonNull(stringId));
    }

    public static RpcId fromJson(JsonNode jsonId) {
        switch (jsonId.getNodeType()) {
            case STRING:
                return of(jsonId.asText());
            case NUMBER:
                if (!jsonId.canConvertToLong())
                    throw new IllegalArgumentException("Rpc Id value is greater than datatype max value");
                return of(jsonId.asLong());
            case NULL:
                throw new IllegalArgumentException("Rpc Id can't be null");
            default:
                throw new IllegalArgumentException("Rpc Id is of invalid type");
        }
    }

    public Long getLongId() {
        return longId;
    }

    public String getStringId() {
        return stringId;
    }

    public boolean isNone() {
        return longId == null && stringId == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RpcId)) return false;
        RpcId other = (RpcId) o;
        return Objects.equals(longId, other.longId) && Objects.equals(stringId, other.stringId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(longId, stringId);
    }

    @Override
    public String toString() {
        if (stringId != null) return stringId;
        if (longId != null) return longId.toString();
        return null;
    }
}
