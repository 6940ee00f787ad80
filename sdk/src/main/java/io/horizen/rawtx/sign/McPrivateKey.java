package io.horizen.rawtx.sign;

import io.horizen.rawtx.utils.BytesUtils;
import io.horizen.rawtx.utils.Utils;

import java.util.Arrays;

/**
 * secp256k1 private key paired with its compressed public key.
 */
public final class McPrivateKey {
    private final byte[] privateKey;
    private final byte[] publicKey;
    private final byte[] keyId;

    public McPrivateKey(byte[] privateKey) {
        if (privateKey.length != Secp256k1.PRIVATE_KEY_SIZE) {
            throw new IllegalArgumentException(String.format(
                    "Incorrect private key length, %d expected, %d found",
                    Secp256k1.PRIVATE_KEY_SIZE,
                    privateKey.length
            ));
        }
        if (!Secp256k1.isValidPrivateKey(privateKey))
            throw new IllegalArgumentException("Private key outside allowed range");
        this.privateKey = Arrays.copyOf(privateKey, Secp256k1.PRIVATE_KEY_SIZE);
        this.publicKey = Secp256k1.getCompressedPublicKey(privateKey);
        this.keyId = Utils.Ripemd160Sha256Hash(publicKey);
    }

    public static McPrivateKey fromHex(String hex) {
        try {
            return new McPrivateKey(BytesUtils.fromHexString(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid private key: " + e.getMessage(), e);
        }
    }

    public byte[] publicKey() {
        return Arrays.copyOf(publicKey, publicKey.length);
    }

    // HASH160 of the compressed public key, as committed by P2PKH scripts.
    public byte[] keyId() {
        return Arrays.copyOf(keyId, keyId.length);
    }

    public byte[] sign(byte[] messageHash) {
        return Secp256k1.sign(privateKey, messageHash);
    }

    public byte[] privateKeyBytes() {
        return Arrays.copyOf(privateKey, Secp256k1.PRIVATE_KEY_SIZE);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == null) return false;
        if (!(obj instanceof McPrivateKey)) return false;
        if (obj == this) return true;
        var other = (McPrivateKey) obj;
        return Arrays.equals(privateKey, other.privateKey);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(privateKey);
    }

    @Override
    public String toString() {
        // Show only the first 4 bytes to protect the key
        return String.format("McPrivateKey{privateKey=%s}", BytesUtils.toHexString(privateKey).substring(0, 8));
    }
}
