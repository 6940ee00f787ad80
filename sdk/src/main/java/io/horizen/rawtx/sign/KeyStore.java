package io.horizen.rawtx.sign;

import java.util.Optional;

/**
 * Signing capability handed to the signer: private keys by key id and redeem scripts by script hash.
 */
public interface KeyStore {

    Optional<McPrivateKey> getKey(byte[] keyId);

    Optional<byte[]> getRedeemScript(byte[] scriptHash);

    boolean isEmpty();
}
