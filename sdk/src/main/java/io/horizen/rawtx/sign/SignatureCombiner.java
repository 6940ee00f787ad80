package io.horizen.rawtx.sign;

import io.horizen.rawtx.entity.McEntity;

public interface SignatureCombiner {

    /**
     * Merges two unlocking scripts of the same input into the best one available.
     * A fully satisfying script is always preferred over a partial one.
     */
    byte[] combine(byte[] lockingScript, McEntity entity, int inputIndex, byte[] scriptA, byte[] scriptB);
}
