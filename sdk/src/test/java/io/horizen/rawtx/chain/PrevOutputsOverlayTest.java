package io.horizen.rawtx.chain;

import io.horizen.rawtx.entity.McTransaction;
import io.horizen.rawtx.entity.OutPoint;
import io.horizen.rawtx.fixtures.McEntityFixture;
import io.horizen.rawtx.script.StandardScripts;
import io.horizen.rawtx.sign.McPrivateKey;
import org.junit.Test;

import java.util.Collections;
import java.util.Optional;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

public class PrevOutputsOverlayTest {
    private final McPrivateKey key1 = McEntityFixture.generateKey(1);
    private final McPrivateKey key2 = McEntityFixture.generateKey(2);

    @Test
    public void unknownOutputsGetZeroValue() {
        ChainStateView backing = mock(ChainStateView.class);
        when(backing.resolveOutput(any(), anyLong())).thenReturn(Optional.empty());

        byte[] prevId = McEntityFixture.generateHash(1);
        byte[] script = StandardScripts.payToPubKeyHash(key1.keyId());
        PrevOutputsOverlay overlay = new PrevOutputsOverlay(backing,
                Collections.singletonList(new PrevOutput(new OutPoint(prevId, 3), script)));

        ResolvedOutput resolved = overlay.resolveOutput(prevId, 3).get();
        assertEquals(0, resolved.value());
        assertArrayEquals(script, resolved.lockingScript());
        assertFalse(overlay.resolveOutput(prevId, 2).isPresent());
    }

    @Test
    public void knownOutputsKeepTheirValue() {
        InMemoryChainState chain = new InMemoryChainState();
        McTransaction funding = McEntityFixture.fundingTransaction(1, Collections.singletonList(McEntityFixture.payToKeyOutput(key1, 500)));
        chain.connectBlock(Collections.singletonList(funding), 1);

        try (ChainStateSnapshot snapshot = chain.openSnapshot()) {
            PrevOutputsOverlay overlay = new PrevOutputsOverlay(snapshot, Collections.singletonList(
                    new PrevOutput(new OutPoint(funding.id(), 0), StandardScripts.payToPubKeyHash(key1.keyId()))));
            assertEquals(500, overlay.resolveOutput(funding.id(), 0).get().value());
            assertTrue(overlay.blockContaining(funding.id()).isPresent());
        }
    }

    @Test
    public void conflictingScriptIsRejected() {
        InMemoryChainState chain = new InMemoryChainState();
        McTransaction funding = McEntityFixture.fundingTransaction(1, Collections.singletonList(McEntityFixture.payToKeyOutput(key1, 500)));
        chain.connectBlock(Collections.singletonList(funding), 1);

        try (ChainStateSnapshot snapshot = chain.openSnapshot()) {
            new PrevOutputsOverlay(snapshot, Collections.singletonList(
                    new PrevOutput(new OutPoint(funding.id(), 0), StandardScripts.payToPubKeyHash(key2.keyId()))));
            fail("Script conflicting with the chain must be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("Previous output scriptPubKey mismatch:\nOP_DUP OP_HASH160"));
            assertTrue(e.getMessage().contains("\nvs:\n"));
        }
    }

    @Test
    public void chainQueriesAreDelegated() {
        ChainStateView backing = mock(ChainStateView.class);
        byte[] blockHash = McEntityFixture.generateHash(5);
        when(backing.isOnBestChain(blockHash)).thenReturn(true);

        PrevOutputsOverlay overlay = new PrevOutputsOverlay(backing, Collections.emptyList());
        assertTrue(overlay.isOnBestChain(blockHash));
        verify(backing).isOnBestChain(blockHash);
    }
}
