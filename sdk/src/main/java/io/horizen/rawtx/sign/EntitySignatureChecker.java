package io.horizen.rawtx.sign;

import io.horizen.rawtx.entity.McEntity;
import io.horizen.rawtx.script.SignatureChecker;

import java.util.Arrays;

// Checks signatures of one input against the digest of the entity it belongs to.
public class EntitySignatureChecker implements SignatureChecker {
    private final McEntity entity;
    private final int inputIndex;

    public EntitySignatureChecker(McEntity entity, int inputIndex) {
        this.entity = entity;
        this.inputIndex = inputIndex;
    }

    @Override
    public boolean checkSignature(byte[] signature, byte[] pubKey, byte[] scriptCode) {
        if (signature.length == 0)
            return false;
        int hashType = signature[signature.length - 1] & 0xff;
        byte[] der = Arrays.copyOf(signature, signature.length - 1);
        byte[] digest = SignatureHasher.hash(entity, inputIndex, scriptCode, hashType);
        return Secp256k1.verify(digest, der, pubKey);
    }
}
