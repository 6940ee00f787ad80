package io.horizen.rawtx.entity;

import io.horizen.rawtx.fixtures.McEntityFixture;
import io.horizen.rawtx.sign.McPrivateKey;
import io.horizen.rawtx.utils.BytesUtils;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class McCertificateTest {

    private McCertificate certificate() {
        McPrivateKey key = McEntityFixture.generateKey(1);
        return McEntityFixture.certificate(10,
                Collections.singletonList(new McInput(new OutPoint(McEntityFixture.generateHash(1), 0), new byte[0], McInput.SEQUENCE_FINAL)),
                Collections.singletonList(McEntityFixture.payToKeyOutput(key, 500)),
                Arrays.asList(McEntityFixture.payToKeyOutput(key, 100), new McOutput(200, new byte[]{0x6a})));
    }

    @Test
    public void parseSerializedCertificate() {
        McCertificate cert = certificate();
        byte[] bytes = McCertificateSerializer.getSerializer().toBytes(cert);

        McCertificate parsed = McCertificateSerializer.getSerializer().parseBytes(bytes);
        assertEquals(McCertificate.SC_CERT_VERSION, parsed.version());
        assertArrayEquals(cert.scId(), parsed.scId());
        assertEquals(cert.epochNumber(), parsed.epochNumber());
        assertEquals(cert.quality(), parsed.quality());
        assertArrayEquals(cert.endEpochBlockHash(), parsed.endEpochBlockHash());
        assertEquals(1, parsed.firstBackwardTransferIndex());
        assertEquals(3, parsed.outputs().size());
        assertEquals(cert.idHex(), parsed.idHex());
    }

    @Test
    public void backwardTransfers() {
        McCertificate cert = certificate();

        assertFalse(cert.isBackwardTransfer(0));
        assertTrue(cert.isBackwardTransfer(1));
        assertFalse(cert.isBackwardTransfer(3));
        assertFalse(cert.backwardTransferInfo(0).isPresent());
        assertEquals(300, cert.backwardTransfersTotalAmount());

        BackwardTransferInfo decoded = cert.backwardTransferInfo(1).get();
        assertTrue(decoded.isDecoded());
        assertEquals(100, decoded.amount());
        assertEquals(BytesUtils.toHexString(BytesUtils.reverseBytes(McEntityFixture.generateKey(1).keyId())), decoded.pubKeyHashHex());

        BackwardTransferInfo undecoded = cert.backwardTransferInfo(2).get();
        assertFalse(undecoded.isDecoded());
        assertEquals(BackwardTransferInfo.DECODE_ERROR, undecoded.pubKeyHashHex());
    }

    @Test
    public void backwardTransferWithTruncatedPubKeyHash() {
        McPrivateKey key = McEntityFixture.generateKey(1);
        McCertificate cert = McEntityFixture.certificate(11,
                Collections.emptyList(),
                Collections.emptyList(),
                Arrays.asList(new McOutput(70, new byte[]{(byte) 0xa9, 0x14, 0x01, 0x02}),
                        McEntityFixture.payToKeyOutput(key, 30)));

        BackwardTransferInfo truncated = cert.backwardTransferInfo(0).get();
        assertFalse(truncated.isDecoded());
        assertFalse(truncated.pubKeyHash().isPresent());
        assertEquals(70, truncated.amount());
        assertEquals(BackwardTransferInfo.DECODE_ERROR, truncated.pubKeyHashHex());

        // other outputs still decode
        assertTrue(cert.backwardTransferInfo(1).get().isDecoded());
        assertEquals(100, cert.backwardTransfersTotalAmount());

        // a lone OP_HASH160 at the end of the script
        assertFalse(BackwardTransferInfo.decode(1, new byte[]{0x76, (byte) 0xa9}).isDecoded());
    }

    @Test
    public void rejectInvalidFields() {
        try {
            new McCertificate(new byte[31], 0, 0, new byte[32], new byte[McCertificate.SC_PROOF_SIZE],
                    Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
            fail("Short sidechain id must be rejected");
        } catch (IllegalArgumentException e) {
            assertEquals("Invalid scId length, 32 expected, 31 found", e.getMessage());
        }

        try {
            new McCertificate(new byte[32], -1, 0, new byte[32], new byte[McCertificate.SC_PROOF_SIZE],
                    Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
            fail("Negative epoch must be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("epochNumber"));
        }
    }

    @Test
    public void transactionBytesAreNotACertificate() {
        McTransaction tx = McEntityFixture.fundingTransaction(3, Collections.singletonList(new McOutput(1, new byte[0])));
        try {
            McCertificateSerializer.getSerializer().parseBytes(tx.bytes());
            fail("Transaction bytes must be rejected");
        } catch (IllegalArgumentException e) {
            assertEquals("Unsupported certificate version 1", e.getMessage());
        }
    }
}
