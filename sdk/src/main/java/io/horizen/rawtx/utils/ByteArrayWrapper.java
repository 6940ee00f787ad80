package io.horizen.rawtx.utils;

import java.util.Arrays;
import java.util.Objects;

/**
 * Value wrapper making byte arrays usable as map keys and set elements: entity ids, block hashes, key ids.
 * The array is not copied, callers must not modify it afterwards.
 */
public final class ByteArrayWrapper implements Comparable<ByteArrayWrapper> {
    private final byte[] data;

    public ByteArrayWrapper(byte[] data) {
        this.data = Objects.requireNonNull(data, "data");
    }

    public byte[] data() {
        return data;
    }

    public int size() {
        return data.length;
    }

    public String toHexString() {
        return BytesUtils.toHexString(data);
    }

    @Override
    public String toString() {
        return toHexString();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof ByteArrayWrapper))
            return false;
        return Arrays.equals(data, ((ByteArrayWrapper) obj).data);
    }

    @Override
    public int hashCode() {
        // multiplicative hashing, Arrays.hashCode spreads short keys poorly
        int h = 1;
        for (byte b : data)
            h = h * (-1640531527) + b;
        return h;
    }

    // Unsigned lexicographic order.
    @Override
    public int compareTo(ByteArrayWrapper o) {
        return Arrays.compareUnsigned(data, o.data);
    }
}
