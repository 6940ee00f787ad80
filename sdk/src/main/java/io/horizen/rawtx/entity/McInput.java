package io.horizen.rawtx.entity;

import io.horizen.rawtx.utils.BytesReader;
import io.horizen.rawtx.utils.BytesUtils;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Entity input: the spent outpoint, its unlocking script and a sequence number.
 * The unlocking script is the only mutable part, it is replaced while signatures are combined.
 */
public final class McInput {
    public static final long SEQUENCE_FINAL = 0xFFFFFFFFL;

    private final OutPoint prevOut;
    private byte[] unlockingScript;
    private final long sequence;

    public McInput(OutPoint prevOut, byte[] unlockingScript, long sequence) {
        this.prevOut = prevOut;
        this.unlockingScript = Arrays.copyOf(unlockingScript, unlockingScript.length);
        this.sequence = sequence;
    }

    public OutPoint prevOut() {
        return prevOut;
    }

    public byte[] unlockingScript() {
        return Arrays.copyOf(unlockingScript, unlockingScript.length);
    }

    public void setUnlockingScript(byte[] script) {
        this.unlockingScript = Arrays.copyOf(script, script.length);
    }

    public long sequence() {
        return sequence;
    }

    public McInput copy() {
        return new McInput(prevOut, unlockingScript, sequence);
    }

    public void writeTo(ByteArrayOutputStream stream) {
        prevOut.writeTo(stream);
        BytesUtils.writeVarBytes(stream, unlockingScript);
        stream.writeBytes(BytesUtils.reversedIntBytes((int) sequence));
    }

    static McInput parse(BytesReader reader) {
        OutPoint prevOut = OutPoint.parse(reader);
        byte[] script = reader.readVarBytes();
        long sequence = reader.readUnsignedInt();
        return new McInput(prevOut, script, sequence);
    }
}
