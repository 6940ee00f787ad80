package io.horizen.rawtx.entity;

import com.google.common.primitives.Bytes;
import io.horizen.rawtx.fixtures.McEntityFixture;
import io.horizen.rawtx.utils.BytesUtils;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class McTransactionSerializerTest {
    private final McTransactionSerializer serializer = McTransactionSerializer.getSerializer();

    private McTransaction transaction(int seed) {
        return McEntityFixture.unsignedTransaction(
                Arrays.asList(new OutPoint(McEntityFixture.generateHash(seed), 1), new OutPoint(McEntityFixture.generateHash(seed + 1), 300)),
                Arrays.asList(McEntityFixture.payToKeyOutput(McEntityFixture.generateKey(seed), 1000),
                        McEntityFixture.payToKeyOutput(McEntityFixture.generateKey(seed + 1), 0)));
    }

    @Test
    public void parseSerializedTransaction() {
        McTransaction tx = transaction(1);
        tx.inputs().get(0).setUnlockingScript(new byte[]{0x51});
        byte[] bytes = serializer.toBytes(tx);

        McTransaction parsed = serializer.parseBytes(bytes);
        assertEquals("Version expected to be equal", tx.version(), parsed.version());
        assertEquals("Inputs number expected to be equal", 2, parsed.inputs().size());
        assertEquals(300, parsed.inputs().get(1).prevOut().index());
        assertArrayEquals(new byte[]{0x51}, parsed.inputs().get(0).unlockingScript());
        assertEquals(1000, parsed.outputs().get(0).value());
        assertEquals("Id expected to be equal", tx.idHex(), parsed.idHex());
        assertArrayEquals("Serialization must be canonical", bytes, serializer.toBytes(parsed));
    }

    @Test
    public void entityIdIsDoubleShaInDisplayOrder() {
        McTransaction tx = transaction(2);
        // outpoint hashes are written in internal order
        byte[] bytes = tx.bytes();
        byte[] firstPrevId = Arrays.copyOfRange(bytes, 5, 37);
        assertArrayEquals(BytesUtils.reverseBytes(McEntityFixture.generateHash(2)), firstPrevId);
        assertEquals(64, tx.idHex().length());
    }

    @Test
    public void shieldedTransactionKeepsJoinSplits() {
        byte[] joinSplit = McEntityFixture.generateNextBytes(ShieldedData.GROTH_JOINSPLIT_SIZE, 3);
        ShieldedData shielded = new ShieldedData(Collections.singletonList(joinSplit),
                McEntityFixture.generateNextBytes(ShieldedData.JOINSPLIT_PUBKEY_SIZE, 4),
                McEntityFixture.generateNextBytes(ShieldedData.JOINSPLIT_SIG_SIZE, 5));
        McTransaction base = transaction(3);
        McTransaction tx = new McTransaction(McTransaction.GROTH_TX_VERSION, base.inputs(), base.outputs(), 7, shielded);

        byte[] bytes = serializer.toBytes(tx);
        McTransaction parsed = serializer.parseBytes(bytes);

        assertEquals(McTransaction.GROTH_TX_VERSION, parsed.version());
        assertTrue(parsed.shieldedData().isPresent());
        assertEquals(1, parsed.shieldedData().get().joinSplitsCount());
        assertArrayEquals(bytes, parsed.bytes());
    }

    @Test
    public void parseAllReadsConcatenatedTransactions() {
        McTransaction first = transaction(4);
        McTransaction second = transaction(6);
        byte[] bytes = Bytes.concat(first.bytes(), second.bytes());

        List<McTransaction> txs = serializer.parseAll(bytes);
        assertEquals(2, txs.size());
        assertEquals(second.idHex(), txs.get(1).idHex());

        try {
            serializer.parseAll(new byte[0]);
            fail("Empty input must be rejected");
        } catch (IllegalArgumentException e) {
            assertEquals("Missing transaction", e.getMessage());
        }
    }

    @Test
    public void rejectMalformedTransactions() {
        byte[] bytes = transaction(5).bytes();

        byte[] extra = Arrays.copyOf(bytes, bytes.length + 2);
        try {
            serializer.parseBytes(extra);
            fail("Trailing bytes must be rejected");
        } catch (IllegalArgumentException e) {
            assertEquals("Found 2 extra byte(s) after transaction", e.getMessage());
        }

        byte[] truncated = Arrays.copyOf(bytes, bytes.length - 1);
        try {
            serializer.parseBytes(truncated);
            fail("Truncated transaction must be rejected");
        } catch (IllegalArgumentException e) {
            // expected
        }

        byte[] wrongVersion = Arrays.copyOf(bytes, bytes.length);
        wrongVersion[0] = 9;
        try {
            serializer.parseBytes(wrongVersion);
            fail("Unknown version must be rejected");
        } catch (IllegalArgumentException e) {
            assertEquals("Unsupported transaction version 9", e.getMessage());
        }
    }

    @Test
    public void copyIsIndependent() {
        McTransaction tx = transaction(7);
        McTransaction copy = tx.copy();
        copy.inputs().get(0).setUnlockingScript(new byte[]{1, 2, 3});

        assertEquals(0, tx.inputs().get(0).unlockingScript().length);
        assertNotEquals(tx.idHex(), copy.idHex());
    }
}
