package io.horizen.rawtx.chain;

import io.horizen.rawtx.block.McBlock;
import io.horizen.rawtx.entity.McTransaction;
import io.horizen.rawtx.entity.OutPoint;
import io.horizen.rawtx.fixtures.McEntityFixture;
import io.horizen.rawtx.sign.McPrivateKey;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.Assert.*;

public class InMemoryChainStateTest {
    private final McPrivateKey key = McEntityFixture.generateKey(1);

    @Test
    public void connectAndDisconnectBlocks() throws Exception {
        InMemoryChainState chain = new InMemoryChainState();
        assertEquals(-1, chain.height());

        McTransaction funding = McEntityFixture.fundingTransaction(1,
                Arrays.asList(McEntityFixture.payToKeyOutput(key, 100), McEntityFixture.payToKeyOutput(key, 200)));
        McBlock first = chain.connectBlock(Collections.singletonList(funding), 1000);

        McTransaction spending = McEntityFixture.unsignedTransaction(
                Collections.singletonList(new OutPoint(funding.id(), 1)),
                Collections.singletonList(McEntityFixture.payToKeyOutput(key, 150)));
        McBlock second = chain.connectBlock(Collections.singletonList(spending), 1100);
        assertEquals(1, chain.height());
        assertArrayEquals("Blocks expected to be linked", first.hash(), second.header().hashPrevBlock());

        try (ChainStateSnapshot snapshot = chain.openSnapshot()) {
            assertEquals(100, snapshot.resolveOutput(funding.id(), 0).get().value());
            assertFalse("Spent output expected to be gone", snapshot.resolveOutput(funding.id(), 1).isPresent());
            assertArrayEquals(second.hash(), snapshot.blockContaining(spending.id()).get());
            assertTrue(snapshot.isOnBestChain(second.hash()));
        }

        McBlock disconnected = chain.disconnectTip();
        assertArrayEquals(second.hash(), disconnected.hash());

        try (ChainStateSnapshot snapshot = chain.openSnapshot()) {
            assertEquals("Spent output expected to be restored", 200, snapshot.resolveOutput(funding.id(), 1).get().value());
            assertFalse(snapshot.resolveOutput(spending.id(), 0).isPresent());
            assertFalse(snapshot.blockContaining(spending.id()).isPresent());
            assertTrue("Disconnected block stays known", snapshot.loadBlock(second.hash()).isPresent());
            assertFalse(snapshot.isOnBestChain(second.hash()));
            assertTrue(snapshot.isOnBestChain(first.hash()));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void disconnectEmptyChain() {
        new InMemoryChainState().disconnectTip();
    }

    @Test
    public void mempoolOutputsAreResolved() {
        InMemoryChainState chain = new InMemoryChainState();
        McTransaction pending = McEntityFixture.fundingTransaction(2, Collections.singletonList(McEntityFixture.payToKeyOutput(key, 42)));
        chain.addToMempool(pending);

        try (ChainStateSnapshot snapshot = chain.openSnapshot()) {
            assertEquals(42, snapshot.resolveOutput(pending.id(), 0).get().value());
            assertFalse(snapshot.resolveOutput(pending.id(), 1).isPresent());
            assertFalse("Mempool entities are not in a block", snapshot.blockContaining(pending.id()).isPresent());
        }

        chain.connectBlock(Collections.singletonList(pending), 10);
        assertFalse("Mined entity expected to leave the mempool", chain.removeFromMempool(pending.id()));
    }

    @Test
    public void closedSnapshotCanNotBeUsed() {
        InMemoryChainState chain = new InMemoryChainState();
        ChainStateSnapshot snapshot = chain.openSnapshot();
        snapshot.close();
        snapshot.close();

        try {
            snapshot.resolveOutput(McEntityFixture.generateHash(1), 0);
            fail("Closed snapshot must not be readable");
        } catch (IllegalStateException e) {
            assertEquals("Chain state snapshot is closed", e.getMessage());
        }
    }

    @Test
    public void writersWaitForOpenSnapshots() throws Exception {
        InMemoryChainState chain = new InMemoryChainState();
        McTransaction funding = McEntityFixture.fundingTransaction(3, Collections.singletonList(McEntityFixture.payToKeyOutput(key, 1)));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<McBlock> connected;
            try (ChainStateSnapshot snapshot = chain.openSnapshot()) {
                connected = executor.submit(() -> chain.connectBlock(Collections.singletonList(funding), 1));
                try {
                    connected.get(200, TimeUnit.MILLISECONDS);
                    fail("Block must not be connected while a snapshot is open");
                } catch (TimeoutException e) {
                    // expected
                }
                assertFalse(snapshot.resolveOutput(funding.id(), 0).isPresent());
            }
            McBlock block = connected.get(5, TimeUnit.SECONDS);
            assertEquals(1, block.entityIds().size());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void loadEntities() {
        InMemoryChainState chain = new InMemoryChainState();
        McTransaction funding = McEntityFixture.fundingTransaction(2, Collections.singletonList(McEntityFixture.payToKeyOutput(key, 100)));
        McTransaction pending = McEntityFixture.unsignedTransaction(
                Collections.singletonList(new OutPoint(funding.id(), 0)),
                Collections.singletonList(McEntityFixture.payToKeyOutput(key, 90)));
        chain.connectBlock(Collections.singletonList(funding), 1000);
        chain.addToMempool(pending);

        try (ChainStateSnapshot snapshot = chain.openSnapshot()) {
            assertArrayEquals(funding.bytes(), snapshot.loadEntity(funding.id()).get().bytes());
            assertArrayEquals(pending.bytes(), snapshot.loadEntity(pending.id()).get().bytes());
            assertFalse(snapshot.loadEntity(McEntityFixture.generateHash(7)).isPresent());
        }

        chain.disconnectTip();
        try (ChainStateSnapshot snapshot = chain.openSnapshot()) {
            assertFalse("Disconnected entity expected to be gone", snapshot.loadEntity(funding.id()).isPresent());
        }
    }
}
