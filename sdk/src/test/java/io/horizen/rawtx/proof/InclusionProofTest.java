package io.horizen.rawtx.proof;

import io.horizen.rawtx.block.McBlock;
import io.horizen.rawtx.chain.ChainStateSnapshot;
import io.horizen.rawtx.chain.InMemoryChainState;
import io.horizen.rawtx.entity.McEntity;
import io.horizen.rawtx.entity.McTransaction;
import io.horizen.rawtx.fixtures.McEntityFixture;
import io.horizen.rawtx.utils.BytesUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;

public class InclusionProofTest {
    private final InclusionProofBuilder builder = new InclusionProofBuilder();
    private final InclusionProofVerifier verifier = new InclusionProofVerifier();

    private InMemoryChainState chain;
    private List<McTransaction> txs;
    private McBlock block;
    private ChainStateSnapshot snapshot;

    @Before
    public void setUp() {
        chain = new InMemoryChainState();
        txs = new ArrayList<>();
        for (int i = 0; i < 4; i++)
            txs.add(McEntityFixture.fundingTransaction(i, Collections.singletonList(
                    McEntityFixture.payToKeyOutput(McEntityFixture.generateKey(i + 1), 100 + i))));
        block = chain.connectBlock(txs, 1000);
    }

    @After
    public void tearDown() {
        if (snapshot != null)
            snapshot.close();
    }

    private ChainStateSnapshot snapshot() {
        if (snapshot != null)
            snapshot.close();
        snapshot = chain.openSnapshot();
        return snapshot;
    }

    private static List<String> hex(List<byte[]> ids) {
        List<String> res = new ArrayList<>();
        for (byte[] id : ids)
            res.add(BytesUtils.toHexString(id));
        return res;
    }

    private List<byte[]> ids(McEntity... entities) {
        List<byte[]> ids = new ArrayList<>();
        for (McEntity entity : entities)
            ids.add(entity.id());
        return ids;
    }

    @Test
    public void proveSubsetOfBlock() throws Exception {
        InclusionProof proof = builder.build(snapshot(), ids(txs.get(3), txs.get(1)), Optional.empty());

        assertArrayEquals(block.hash(), proof.header().hash());
        List<byte[]> proven = verifier.verify(snapshot(), proof.bytes());
        assertEquals("Matched ids expected in block order", hex(ids(txs.get(1), txs.get(3))), hex(proven));
    }

    @Test
    public void proveWithExplicitBlock() throws Exception {
        InclusionProof proof = builder.build(snapshot(), ids(txs.get(0)), Optional.of(block.hash()));
        assertEquals(hex(ids(txs.get(0))), hex(verifier.verify(snapshot(), proof)));
    }

    @Test
    public void allTargetsMustBeInTheBlock() {
        McTransaction unknown = McEntityFixture.fundingTransaction(99, Collections.singletonList(
                McEntityFixture.payToKeyOutput(McEntityFixture.generateKey(1), 1)));
        try {
            builder.build(snapshot(), ids(txs.get(1), unknown), Optional.empty());
            fail("Proof must not be built when a target is missing");
        } catch (InclusionProofException e) {
            assertTrue(e instanceof TargetsNotInBlockException);
            assertEquals(TargetsNotInBlockException.MESSAGE, e.getMessage());
        }
    }

    @Test
    public void targetsNotYetInBlock() {
        McTransaction pending = McEntityFixture.fundingTransaction(50, Collections.singletonList(
                McEntityFixture.payToKeyOutput(McEntityFixture.generateKey(1), 1)));
        chain.addToMempool(pending);
        try {
            builder.build(snapshot(), ids(pending), Optional.empty());
            fail("Mempool entity can not be proven");
        } catch (InclusionProofException e) {
            assertTrue(e instanceof ChainReferenceException);
            assertEquals("Transaction not yet in block", e.getMessage());
        }

        try {
            builder.build(snapshot(), ids(txs.get(0)), Optional.of(McEntityFixture.generateHash(5)));
            fail("Unknown block must be rejected");
        } catch (InclusionProofException e) {
            assertEquals("Block not found", e.getMessage());
        }
    }

    @Test
    public void invalidTargets() throws Exception {
        try {
            builder.build(snapshot(), Collections.emptyList(), Optional.empty());
            fail("Empty target list must be rejected");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            builder.build(snapshot(), ids(txs.get(2), txs.get(2)), Optional.empty());
            fail("Duplicated target must be rejected");
        } catch (IllegalArgumentException e) {
            assertEquals("Invalid parameter, duplicated txid: " + txs.get(2).idHex(), e.getMessage());
        }
    }

    @Test
    public void tamperedHashYieldsNoMatches() throws Exception {
        byte[] proofBytes = builder.build(snapshot(), ids(txs.get(1)), Optional.empty()).bytes();
        int firstHashOffset = block.header().bytes().length + 4 + 1;
        proofBytes[firstHashOffset + 10] ^= 0x01;

        assertTrue(verifier.verify(snapshot(), proofBytes).isEmpty());
    }

    @Test
    public void malformedProofBytes() throws Exception {
        byte[] proofBytes = builder.build(snapshot(), ids(txs.get(1)), Optional.empty()).bytes();

        try {
            verifier.verify(snapshot(), Arrays.copyOf(proofBytes, proofBytes.length + 1));
            fail("Trailing data must be rejected");
        } catch (MalformedProofException e) {
            assertEquals("Found 1 extra byte(s) after proof", e.getMessage());
        }

        try {
            verifier.verify(snapshot(), Arrays.copyOf(proofBytes, 50));
            fail("Truncated proof must be rejected");
        } catch (MalformedProofException e) {
            assertTrue(e.getMessage().startsWith("Proof decode failed: "));
        }
    }

    @Test
    public void proofOfDisconnectedBlock() throws Exception {
        byte[] proofBytes = builder.build(snapshot(), ids(txs.get(2)), Optional.empty()).bytes();
        snapshot.close();
        snapshot = null;
        chain.disconnectTip();

        try {
            verifier.verify(snapshot(), proofBytes);
            fail("Block outside the best chain must be rejected");
        } catch (ChainReferenceException e) {
            assertEquals(InclusionProofVerifier.BLOCK_NOT_IN_CHAIN, e.getMessage());
        }
    }

    @Test
    public void serializationIsCanonical() throws Exception {
        InclusionProof proof = builder.build(snapshot(), ids(txs.get(0), txs.get(3)), Optional.empty());
        byte[] bytes = InclusionProofSerializer.getSerializer().toBytes(proof);

        InclusionProof parsed = InclusionProofSerializer.getSerializer().parseBytes(bytes);
        assertEquals(proof.tree().leafCount(), parsed.tree().leafCount());
        assertArrayEquals(bytes, parsed.bytes());
    }
}
