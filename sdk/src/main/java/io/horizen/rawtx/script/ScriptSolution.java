package io.horizen.rawtx.script;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Result of matching a locking script against the standard templates.
 * Solutions hold the template parameters: the public key for PUBKEY, the 20 byte hash for the
 * hash templates, and the m value, the public keys and the n value for MULTISIG.
 */
public final class ScriptSolution {
    private final ScriptType type;
    private final List<byte[]> solutions;

    ScriptSolution(ScriptType type, List<byte[]> solutions) {
        this.type = type;
        this.solutions = Collections.unmodifiableList(new ArrayList<>(solutions));
    }

    public ScriptType type() {
        return type;
    }

    public List<byte[]> solutions() {
        return solutions;
    }

    public byte[] solution(int index) {
        byte[] s = solutions.get(index);
        return Arrays.copyOf(s, s.length);
    }

    // Number of signatures needed to satisfy the script, 0 when it can not be signed.
    public int requiredSignatures() {
        switch (type) {
            case PUBKEY:
            case PUBKEYHASH:
            case PUBKEYHASH_REPLAY:
            case SCRIPTHASH:
            case SCRIPTHASH_REPLAY:
                return 1;
            case MULTISIG:
                return solutions.get(0)[0];
            default:
                return 0;
        }
    }

    public List<byte[]> multisigPubKeys() {
        if (type != ScriptType.MULTISIG)
            throw new IllegalStateException("Not a multisig script");
        return solutions.subList(1, solutions.size() - 1);
    }
}
