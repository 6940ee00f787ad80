package io.horizen.rawtx.script;

// Little endian sign-magnitude integers, as arithmetic operands are encoded on the script stack.
public final class ScriptNumber {
    private ScriptNumber() {}

    public static byte[] encode(long value) {
        if (value == 0)
            return new byte[0];
        boolean negative = value < 0;
        long abs = Math.abs(value);
        byte[] buffer = new byte[9];
        int size = 0;
        while (abs != 0) {
            buffer[size++] = (byte) (abs & 0xff);
            abs >>>= 8;
        }
        if ((buffer[size - 1] & 0x80) != 0) {
            buffer[size++] = (byte) (negative ? 0x80 : 0x00);
        } else if (negative) {
            buffer[size - 1] |= (byte) 0x80;
        }
        byte[] result = new byte[size];
        System.arraycopy(buffer, 0, result, 0, size);
        return result;
    }

    public static long decode(byte[] data, int maxSize, boolean requireMinimal) {
        if (data.length > maxSize)
            throw new ScriptFormatException("Script number overflow");
        if (requireMinimal && data.length > 0) {
            // the most significant byte may be 0x00 or 0x80 only if the next byte has its sign bit set
            if ((data[data.length - 1] & 0x7f) == 0) {
                if (data.length <= 1 || (data[data.length - 2] & 0x80) == 0)
                    throw new ScriptFormatException("Non-minimally encoded script number");
            }
        }
        if (data.length == 0)
            return 0;
        long result = 0;
        for (int i = 0; i < data.length; i++)
            result |= ((long) (data[i] & 0xff)) << (8 * i);
        if ((data[data.length - 1] & 0x80) != 0)
            return -(result & ~(0x80L << (8 * (data.length - 1))));
        return result;
    }
}
