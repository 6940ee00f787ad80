package io.horizen.rawtx.chain;

import io.horizen.rawtx.entity.OutPoint;

import java.util.Arrays;
import java.util.Optional;

/**
 * Previous output described by the caller of a signing operation, for outputs the node may not know.
 */
public final class PrevOutput {
    private final OutPoint outPoint;
    private final byte[] lockingScript;
    private final byte[] redeemScript;

    public PrevOutput(OutPoint outPoint, byte[] lockingScript, byte[] redeemScript) {
        this.outPoint = outPoint;
        this.lockingScript = Arrays.copyOf(lockingScript, lockingScript.length);
        this.redeemScript = redeemScript == null ? null : Arrays.copyOf(redeemScript, redeemScript.length);
    }

    public PrevOutput(OutPoint outPoint, byte[] lockingScript) {
        this(outPoint, lockingScript, null);
    }

    public OutPoint outPoint() {
        return outPoint;
    }

    public byte[] lockingScript() {
        return Arrays.copyOf(lockingScript, lockingScript.length);
    }

    public Optional<byte[]> redeemScript() {
        return Optional.ofNullable(redeemScript).map(script -> Arrays.copyOf(script, script.length));
    }
}
