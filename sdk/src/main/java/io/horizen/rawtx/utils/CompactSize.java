package io.horizen.rawtx.utils;

/**
 * Length prefix of vectors in mainchain serialization: 1, 3, 5 or 9 bytes depending on the value.
 * Only the shortest encoding of a value is canonical.
 */
public final class CompactSize {
    // upper bound of any vector length or element count read from the wire
    public static final long MAX_SERIALIZED_COMPACT_SIZE = 0x02000000L;

    private final long value;
    private final int size;

    public CompactSize(long value, int size) {
        this.value = value;
        this.size = size;
    }

    public static CompactSize of(long value) {
        return new CompactSize(value, getSize(value));
    }

    public long value() {
        return value;
    }

    // Number of bytes the encoding takes, marker included.
    public int size() {
        return size;
    }

    public boolean isCanonical() {
        return size == getSize(value);
    }

    public static int getSize(long value) {
        if (Long.compareUnsigned(value, 0xFFFFFFFFL) > 0)
            return 9;
        if (value > 0xFFFFL)
            return 5;
        if (value >= 253)
            return 3;
        return 1;
    }
}
