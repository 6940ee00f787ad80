package io.horizen.rawtx.sign;

import io.horizen.rawtx.entity.McEntity;

public interface ScriptSigner {

    /**
     * Produces an unlocking script for one input.
     * Missing keys are not an error: the best partial script is returned, possibly an empty one.
     */
    byte[] sign(KeyStore keys, byte[] lockingScript, McEntity entity, int inputIndex, SigHashType sigHashType);
}
