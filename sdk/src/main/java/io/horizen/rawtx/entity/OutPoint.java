package io.horizen.rawtx.entity;

import io.horizen.rawtx.utils.BytesReader;
import io.horizen.rawtx.utils.BytesUtils;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Objects;

// Reference to an output of a previous entity: (entity id, output index).
public final class OutPoint {
    public static final long MAX_INDEX = 0xFFFFFFFFL;

    private final byte[] entityId;
    private final long index;

    public OutPoint(byte[] entityId, long index) {
        Objects.requireNonNull(entityId, "entityId must be defined");
        if (entityId.length != BytesUtils.HASH_LENGTH)
            throw new IllegalArgumentException(String.format("Incorrect entity id length, %d expected, %d found",
                    BytesUtils.HASH_LENGTH, entityId.length));
        if (index < 0 || index > MAX_INDEX)
            throw new IllegalArgumentException("Invalid parameter, vout must be positive");
        this.entityId = Arrays.copyOf(entityId, entityId.length);
        this.index = index;
    }

    // Display order, as printed in hex.
    public byte[] entityId() {
        return Arrays.copyOf(entityId, entityId.length);
    }

    public String entityIdHex() {
        return BytesUtils.toHexString(entityId);
    }

    public long index() {
        return index;
    }

    public void writeTo(ByteArrayOutputStream stream) {
        stream.writeBytes(BytesUtils.reverseBytes(entityId));
        stream.writeBytes(BytesUtils.reversedIntBytes((int) index));
    }

    static OutPoint parse(BytesReader reader) {
        byte[] id = reader.readHash();
        long idx = reader.readUnsignedInt();
        return new OutPoint(id, idx);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OutPoint outPoint = (OutPoint) o;
        return index == outPoint.index && Arrays.equals(entityId, outPoint.entityId);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(entityId) + Long.hashCode(index);
    }

    @Override
    public String toString() {
        return String.format("OutPoint(%s, %d)", entityIdHex(), index);
    }
}
