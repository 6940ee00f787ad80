package io.horizen.rawtx.utils;

import java.util.Arrays;

/**
 * Forward-only cursor over a serialized mainchain structure.
 * Every read checks the remaining length and fails with IllegalArgumentException on truncation.
 */
public class BytesReader {
    private final byte[] bytes;
    private int offset;

    public BytesReader(byte[] bytes) {
        this(bytes, 0);
    }

    public BytesReader(byte[] bytes, int offset) {
        this.bytes = bytes;
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }

    public int remaining() {
        return bytes.length - offset;
    }

    public boolean hasRemaining() {
        return offset < bytes.length;
    }

    public int readInt() {
        int value = BytesUtils.getReversedInt(bytes, offset);
        offset += 4;
        return value;
    }

    public long readUnsignedInt() {
        return readInt() & 0xFFFFFFFFL;
    }

    public long readLong() {
        long value = BytesUtils.getReversedLong(bytes, offset);
        offset += 8;
        return value;
    }

    public long readCompactSize() {
        CompactSize size = BytesUtils.getCompactSize(bytes, offset);
        offset += size.size();
        return size.value();
    }

    public byte[] readBytes(int length) {
        if (length < 0 || remaining() < length)
            throw new IllegalArgumentException(String.format(
                    "Input data corrupted: %d bytes expected at offset %d, %d available", length, offset, remaining()));
        byte[] res = Arrays.copyOfRange(bytes, offset, offset + length);
        offset += length;
        return res;
    }

    public byte[] readVarBytes() {
        long length = readCompactSize();
        return readBytes((int) length);
    }

    // 256-bit value written in internal order, returned in display order.
    public byte[] readHash() {
        return BytesUtils.reverseBytes(readBytes(BytesUtils.HASH_LENGTH));
    }
}
