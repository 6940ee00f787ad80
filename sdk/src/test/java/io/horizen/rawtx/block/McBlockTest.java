package io.horizen.rawtx.block;

import io.horizen.rawtx.entity.McTransaction;
import io.horizen.rawtx.fixtures.McEntityFixture;
import io.horizen.rawtx.utils.BytesUtils;
import io.horizen.rawtx.utils.MerkleTree;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class McBlockTest {

    private static List<McTransaction> transactions(int count) {
        List<McTransaction> txs = new ArrayList<>();
        for (int i = 0; i < count; i++)
            txs.add(McEntityFixture.fundingTransaction(i, Collections.singletonList(
                    McEntityFixture.payToKeyOutput(McEntityFixture.generateKey(1), 10 * (i + 1)))));
        return txs;
    }

    @Test
    public void createCommitsToEntities() {
        List<McTransaction> txs = transactions(3);
        McBlock block = McBlock.create(McEntityFixture.generateHash(1), txs, 1600000000L);

        List<byte[]> ids = Arrays.asList(txs.get(0).id(), txs.get(1).id(), txs.get(2).id());
        assertArrayEquals(MerkleTree.createMerkleTree(ids).rootHash(), block.header().hashMerkleRoot());
        assertArrayEquals(McEntityFixture.generateHash(1), block.header().hashPrevBlock());
        assertEquals(1, block.indexOf(txs.get(1).id()));
        assertEquals(-1, block.indexOf(McEntityFixture.generateHash(2)));
    }

    @Test
    public void headerSerialization() {
        McBlockHeader header = McBlock.create(McEntityFixture.generateHash(1), transactions(2), 1600000000L).header();
        byte[] bytes = header.bytes();

        // 4 + 3 * 32 + 4 + 4 + 32 + empty solution
        assertEquals(141, bytes.length);
        assertEquals("Version must be little endian", 4, bytes[0]);

        McBlockHeader parsed = McBlockHeader.parseBytes(bytes);
        assertEquals(header.hashHex(), parsed.hashHex());
        assertEquals(header.time(), parsed.time());
        assertEquals(header.bits(), parsed.bits());

        try {
            McBlockHeader.parseBytes(Arrays.copyOf(bytes, bytes.length + 2));
            fail("Trailing bytes must be rejected");
        } catch (IllegalArgumentException e) {
            assertEquals("Found 2 extra byte(s) after block header", e.getMessage());
        }
    }

    @Test
    public void hashDependsOnHeaderFields() {
        McBlockHeader header = McBlock.create(new byte[BytesUtils.HASH_LENGTH], transactions(1), 1L).header();
        assertEquals(BytesUtils.HASH_LENGTH, header.hash().length);
        assertNotEquals(header.hashHex(), McBlock.create(new byte[BytesUtils.HASH_LENGTH], transactions(1), 2L).header().hashHex());
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyBlock() {
        McBlock.create(new byte[BytesUtils.HASH_LENGTH], Collections.<McTransaction>emptyList(), 1L);
    }
}
