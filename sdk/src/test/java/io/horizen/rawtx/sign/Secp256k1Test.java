package io.horizen.rawtx.sign;

import io.horizen.rawtx.fixtures.McEntityFixture;
import io.horizen.rawtx.script.SignatureEncoding;
import io.horizen.rawtx.utils.BytesUtils;
import io.horizen.rawtx.utils.Utils;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.Assert.*;

public class Secp256k1Test {
    private final byte[] messageHash = Utils.doubleSHA256Hash("message".getBytes(StandardCharsets.UTF_8));

    @Test
    public void signAndVerify() {
        McPrivateKey key = McEntityFixture.generateKey(1);
        byte[] signature = key.sign(messageHash);

        assertTrue("Signature expected to be valid", Secp256k1.verify(messageHash, signature, key.publicKey()));
        assertFalse("Signature of another key expected to be invalid",
                Secp256k1.verify(messageHash, signature, McEntityFixture.generateKey(2).publicKey()));

        byte[] otherHash = Arrays.copyOf(messageHash, messageHash.length);
        otherHash[0] ^= 1;
        assertFalse("Signature of another message expected to be invalid", Secp256k1.verify(otherHash, signature, key.publicKey()));
    }

    @Test
    public void signaturesAreDeterministicLowSDer() {
        McPrivateKey key = McEntityFixture.generateKey(3);
        byte[] signature = key.sign(messageHash);
        assertArrayEquals(signature, key.sign(messageHash));

        byte[] withHashType = Arrays.copyOf(signature, signature.length + 1);
        withHashType[signature.length] = (byte) SigHashType.ALL.value();
        assertTrue(SignatureEncoding.isValidSignatureEncoding(withHashType));
        assertTrue(SignatureEncoding.isLowDerSignature(withHashType));
    }

    @Test
    public void malformedInputs() {
        McPrivateKey key = McEntityFixture.generateKey(1);
        assertFalse(Secp256k1.verify(messageHash, new byte[]{0x30, 0x00}, key.publicKey()));
        assertFalse(Secp256k1.verify(messageHash, new byte[]{1, 2, 3}, key.publicKey()));
        assertFalse(Secp256k1.verify(messageHash, key.sign(messageHash), new byte[]{0x02, 0x01}));
    }

    @Test
    public void privateKeyRange() {
        assertFalse(Secp256k1.isValidPrivateKey(new byte[32]));
        assertFalse(Secp256k1.isValidPrivateKey(new byte[31]));
        // curve order
        assertFalse(Secp256k1.isValidPrivateKey(BytesUtils.fromHexString("fffffffffffffffffffffffffffffffebaaedce6af48a03bbfd25e8cd0364141")));
        assertTrue(Secp256k1.isValidPrivateKey(BytesUtils.fromHexString("fffffffffffffffffffffffffffffffebaaedce6af48a03bbfd25e8cd0364140")));
    }

    @Test
    public void compressedPublicKey() {
        byte[] one = new byte[32];
        one[31] = 1;
        // generator point
        assertEquals("0279be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798",
                BytesUtils.toHexString(Secp256k1.getCompressedPublicKey(one)));
    }
}
