package io.horizen.rawtx.chain;

import java.util.Arrays;

// Locking script and value of an available previous output.
public final class ResolvedOutput {
    private final long value;
    private final byte[] lockingScript;

    public ResolvedOutput(long value, byte[] lockingScript) {
        this.value = value;
        this.lockingScript = Arrays.copyOf(lockingScript, lockingScript.length);
    }

    public long value() {
        return value;
    }

    public byte[] lockingScript() {
        return Arrays.copyOf(lockingScript, lockingScript.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedOutput)) return false;
        ResolvedOutput that = (ResolvedOutput) o;
        return value == that.value && Arrays.equals(lockingScript, that.lockingScript);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(value) + Arrays.hashCode(lockingScript);
    }
}
