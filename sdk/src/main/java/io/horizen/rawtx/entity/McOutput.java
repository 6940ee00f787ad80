package io.horizen.rawtx.entity;

import io.horizen.rawtx.utils.BytesReader;
import io.horizen.rawtx.utils.BytesUtils;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

public final class McOutput {
    private final long value;
    private final byte[] lockingScript;

    public McOutput(long value, byte[] lockingScript) {
        this.value = value;
        this.lockingScript = Arrays.copyOf(lockingScript, lockingScript.length);
    }

    // Amount in zatoshi. Negative only for the placeholder outputs written into SIGHASH_SINGLE digests.
    public long value() {
        return value;
    }

    public byte[] lockingScript() {
        return Arrays.copyOf(lockingScript, lockingScript.length);
    }

    public void writeTo(ByteArrayOutputStream stream) {
        stream.writeBytes(BytesUtils.reversedLongBytes(value));
        BytesUtils.writeVarBytes(stream, lockingScript);
    }

    static McOutput parse(BytesReader reader) {
        long value = reader.readLong();
        byte[] script = reader.readVarBytes();
        return new McOutput(value, script);
    }
}
