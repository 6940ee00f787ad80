package io.horizen.rawtx.utils;

import org.apache.logging.log4j.LogManager;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.Security;

public final class Utils
{
    static {
        // for Ripemd160 hash
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private Utils() {}

    public static final int SHA256_LENGTH = 32;

    public static final byte[] ZEROS_HASH = new byte[SHA256_LENGTH];

    public static byte[] sha256Hash(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            LogManager.getLogger().error("Unexpected exception: ", e);
            throw new RuntimeException(e);  // Cannot happen.
        }
    }

    public static byte[] doubleSHA256Hash(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(bytes, 0, bytes.length);
            byte[] first = digest.digest();
            return digest.digest(first);
        } catch (NoSuchAlgorithmException e) {
            LogManager.getLogger().error("Unexpected exception: ", e);
            throw new RuntimeException(e);  // Cannot happen.
        }
    }

    // HASH160 of the mainchain: RIPEMD160(SHA256(data)), used for key ids and script hashes.
    public static byte[] Ripemd160Sha256Hash(byte[] bytes) {
        try {
            MessageDigest digest1 = MessageDigest.getInstance("SHA-256");
            MessageDigest digest2 = MessageDigest.getInstance("RIPEMD160");

            digest1.update(bytes, 0, bytes.length);
            byte[] first = digest1.digest();

            digest2.update(first, 0, first.length);
            return digest2.digest();
        } catch (NoSuchAlgorithmException e) {
            LogManager.getLogger().error("Unexpected exception: ", e);
            throw new RuntimeException(e);  // Cannot happen.
        }
    }

    public static byte[] doubleSHA256HashOfConcatenation(byte[] bytes1, byte[] bytes2) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(bytes1, 0, bytes1.length);
            digest.update(bytes2, 0, bytes2.length);
            byte[] first = digest.digest();
            return digest.digest(first);
        } catch (NoSuchAlgorithmException e) {
            LogManager.getLogger().error("Unexpected exception: ", e);
            throw new RuntimeException(e);  // Cannot happen.
        }
    }

    // Hash of two tree nodes held in display order, as the mainchain merkle tree combines them.
    public static byte[] merkleNodeHash(byte[] left, byte[] right) {
        return BytesUtils.reverseBytes(doubleSHA256HashOfConcatenation(
                BytesUtils.reverseBytes(left), BytesUtils.reverseBytes(right)));
    }
}
