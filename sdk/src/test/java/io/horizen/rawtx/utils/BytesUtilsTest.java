package io.horizen.rawtx.utils;

import org.junit.Test;

import static org.junit.Assert.*;

public class BytesUtilsTest {

    @Test
    public void BytesUtilsTest_getReversedInt() {
        byte[] bytes = {1, 0, 0, 0, (byte) 0xff};
        assertEquals("Values expected to by equal", 1, BytesUtils.getReversedInt(bytes, 0));
        assertEquals("Values expected to by equal", 0xff000000, BytesUtils.getReversedInt(bytes, 1));

        boolean exceptionOccurred = false;
        try {
            BytesUtils.getReversedInt(bytes, 2);
        } catch (IllegalArgumentException e) {
            exceptionOccurred = true;
        }
        assertTrue("Offset is out of bound exception expected", exceptionOccurred);
    }

    @Test
    public void BytesUtilsTest_reversedBytes() {
        assertArrayEquals(new byte[]{4, 3, 2, 1}, BytesUtils.reversedIntBytes(0x01020304));
        assertArrayEquals(new byte[]{1, 0, 0, 0, 0, 0, 0, 0}, BytesUtils.reversedLongBytes(1L));
        assertEquals(0x0102030405060708L, BytesUtils.getReversedLong(BytesUtils.reversedLongBytes(0x0102030405060708L), 0));
    }

    @Test
    public void BytesUtilsTest_compactSize() {
        assertArrayEquals(new byte[]{(byte) 252}, BytesUtils.toCompactSizeBytes(252));
        assertArrayEquals(new byte[]{(byte) 253, (byte) 253, 0}, BytesUtils.toCompactSizeBytes(253));
        assertArrayEquals(new byte[]{(byte) 254, 0, 0, 1, 0}, BytesUtils.toCompactSizeBytes(0x10000));

        CompactSize size = BytesUtils.getCompactSize(new byte[]{7, (byte) 253, (byte) 0xff, (byte) 0xff}, 1);
        assertEquals(0xffff, size.value());
        assertEquals(3, size.size());
    }

    @Test
    public void BytesUtilsTest_nonCanonicalCompactSize() {
        byte[][] nonCanonical = {
                {(byte) 253, (byte) 252, 0},
                {(byte) 254, (byte) 0xff, (byte) 0xff, 0, 0},
                {(byte) 255, 1, 0, 0, 0, 0, 0, 0, 0}
        };
        for (byte[] bytes : nonCanonical) {
            try {
                BytesUtils.getCompactSize(bytes, 0);
                fail("Non canonical CompactSize must be rejected");
            } catch (IllegalArgumentException e) {
                assertTrue(e.getMessage().contains("non-canonical"));
            }
        }
    }

    @Test
    public void BytesUtilsTest_compactSizeTooLarge() {
        byte[] bytes = BytesUtils.toCompactSizeBytes(CompactSize.MAX_SERIALIZED_COMPACT_SIZE + 1);
        try {
            BytesUtils.getCompactSize(bytes, 0);
            fail("Too large CompactSize must be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("size too large"));
        }
    }

    @Test
    public void BytesUtilsTest_fromHashHexString() {
        String hex = "8e97b4a311d2c58c019e93e9f943156fcef7dfd78973515d8f284f1b410158ba";
        assertEquals(hex, BytesUtils.toHexString(BytesUtils.fromHashHexString(hex, "txid")));

        try {
            BytesUtils.fromHashHexString("abcd", "txid");
            fail("Short hash must be rejected");
        } catch (IllegalArgumentException e) {
            assertEquals("txid must be of length 64 (not 4, for 'abcd')", e.getMessage());
        }

        String notHex = hex.substring(0, 62) + "zz";
        try {
            BytesUtils.fromHashHexString(notHex, "txid");
            fail("Non hex hash must be rejected");
        } catch (IllegalArgumentException e) {
            assertEquals(String.format("txid must be hexadecimal string (not '%s')", notHex), e.getMessage());
        }
    }

    @Test
    public void BytesReaderTest_truncatedInput() {
        BytesReader reader = new BytesReader(new byte[]{2, 1});
        try {
            reader.readVarBytes();
            fail("Truncated input must be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("Input data corrupted"));
        }
    }
}
