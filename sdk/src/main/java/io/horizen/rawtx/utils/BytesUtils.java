package io.horizen.rawtx.utils;

import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import com.google.common.primitives.Shorts;

import java.io.ByteArrayOutputStream;

public final class BytesUtils {
    private BytesUtils() {}

    public static final int HASH_LENGTH = 32;
    public static final int HASH160_LENGTH = 20;
    public static final int COMPRESSED_PUBLIC_KEY_LENGTH = 33;
    public static final int UNCOMPRESSED_PUBLIC_KEY_LENGTH = 65;

    // Get Reversed Short value from byte array starting from an offset position without copying an array
    public static short getReversedShort(byte[] bytes, int offset) {
        if(offset < 0 || bytes.length < offset + 2)
            throw new IllegalArgumentException("Value is out of array bounds");

        return Shorts.fromBytes(bytes[offset + 1],
                                bytes[offset]);
    }

    // Get Reversed Int value from byte array starting from an offset position without copying an array
    public static int getReversedInt(byte[] bytes, int offset) {
        if(offset < 0 || bytes.length < offset + 4)
            throw new IllegalArgumentException("Value is out of array bounds");

        return Ints.fromBytes(  bytes[offset + 3],
                                bytes[offset + 2],
                                bytes[offset + 1],
                                bytes[offset]);
    }

    // Get Reversed Long value from byte array starting from an offset position without copying an array
    public static long getReversedLong(byte[] bytes, int offset) {
        if(offset < 0 || bytes.length < offset + 8)
            throw new IllegalArgumentException("Value is out of array bounds");

        return Longs.fromBytes( bytes[offset + 7],
                                bytes[offset + 6],
                                bytes[offset + 5],
                                bytes[offset + 4],
                                bytes[offset + 3],
                                bytes[offset + 2],
                                bytes[offset + 1],
                                bytes[offset]);
    }

    // Little endian representation, as the mainchain writes integers.
    public static byte[] reversedIntBytes(int value) {
        return reverseBytes(Ints.toByteArray(value));
    }

    public static byte[] reversedLongBytes(long value) {
        return reverseBytes(Longs.toByteArray(value));
    }

    // Bitcoin `ReadCompactSize` method return value which length is from 1 to 9 bytes, starting from an offset position without copying an array.
    // Used in std::vectors serialization to store the length of the vector.
    public static CompactSize getCompactSize(byte[] bytes, int offset) {
        if(offset < 0 || bytes.length < offset + 1)
            throw new IllegalArgumentException("CompactSize: Value is out of array bounds");

        byte first = bytes[offset];
        int size;
        long value;
        switch(first) {
            case (byte)253:
                size = 3;
                value = BytesUtils.getReversedShort(bytes, offset + 1) & 0xFFFF;
                break;

            case (byte)254:
                size = 5;
                value = BytesUtils.getReversedInt(bytes, offset + 1) & 0xFFFFFFFFL;
                break;

            case (byte)255:
                size = 9;
                value = BytesUtils.getReversedLong(bytes, offset + 1);
                break;

            default:
                size = 1;
                value = first & 0xFF;
        }
        CompactSize compactSize = new CompactSize(value, size);
        if(!compactSize.isCanonical())
            throw new IllegalArgumentException("CompactSize: non-canonical value");
        if(Long.compareUnsigned(value, CompactSize.MAX_SERIALIZED_COMPACT_SIZE) > 0)
            throw new IllegalArgumentException("CompactSize: size too large");

        return compactSize;
    }

    // Get byte array representation of CompactSize value in LE as MC does.
    public static byte[] toCompactSizeBytes(CompactSize vi) {
        byte[] res = new byte[vi.size()];
        switch (vi.size()) {
            case 1:
                res[0] = (byte) (vi.value() & 255L);
                break;

            case 3:
                res[0] = (byte)253;
                res[1] = (byte) (vi.value() & 255L);
                res[2] = (byte) ((vi.value() >> 8) & 255L);
                break;

            case 5:
                res[0] = (byte)254;
                for (int i = 0; i < 4; i++)
                    res[i + 1] = (byte) ((vi.value() >> (8 * i)) & 255L);
                break;

            case 9:
                res[0] = (byte)255;
                for (int i = 0; i < 8; i++)
                    res[i + 1] = (byte) ((vi.value() >> (8 * i)) & 255L);
                break;

            default: throw new IllegalArgumentException("Incorrect size of CompactSize had been detected:" + vi.size());
        }
        return res;
    }

    public static byte[] toCompactSizeBytes(long value) {
        return toCompactSizeBytes(CompactSize.of(value));
    }

    // Length prefixed byte vector, the way scripts and solutions are serialized.
    public static void writeVarBytes(ByteArrayOutputStream stream, byte[] data) {
        stream.writeBytes(toCompactSizeBytes(data.length));
        stream.writeBytes(data);
    }

    // Get reversed copy of byte array
    public static byte[] reverseBytes(byte[] bytes) {
        byte[] res = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++)
            res[i] = bytes[bytes.length - 1 - i];
        return res;
    }

    // Get byte array from hex string;
    public static byte[] fromHexString(String hex) {
        return BaseEncoding.base16().lowerCase().decode(hex.toLowerCase());
    }

    // Get hex string representation of byte array
    public static String toHexString(byte[] bytes) {
        return BaseEncoding.base16().lowerCase().encode(bytes);
    }

    // Decode a 256-bit identifier given in display order, failing with the parameter name on malformed input.
    public static byte[] fromHashHexString(String hex, String paramName) {
        if (hex == null || hex.length() != HASH_LENGTH * 2)
            throw new IllegalArgumentException(String.format("%s must be of length %d (not %d, for '%s')",
                    paramName, HASH_LENGTH * 2, hex == null ? 0 : hex.length(), hex));
        try {
            return fromHexString(hex);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format("%s must be hexadecimal string (not '%s')", paramName, hex), e);
        }
    }
}
