package io.horizen.rawtx.script;

import java.util.Arrays;

public final class ScriptChunk {
    private final int opcode;
    private final byte[] data;
    private final byte[] raw;

    ScriptChunk(int opcode, byte[] data, byte[] raw) {
        this.opcode = opcode;
        this.data = data;
        this.raw = raw;
    }

    public int opcode() {
        return opcode;
    }

    public boolean isPushData() {
        return opcode <= Opcodes.OP_PUSHDATA4;
    }

    // Pushed bytes, empty for OP_0 and null for non-push operations.
    public byte[] data() {
        return data == null ? null : Arrays.copyOf(data, data.length);
    }

    // Encoded form of the chunk, opcode and length prefix included.
    byte[] raw() {
        return raw;
    }

    // A push that uses the shortest possible encoding.
    public boolean isMinimalPush() {
        if (!isPushData())
            return true;
        int length = data.length;
        if (length == 0)
            return opcode == Opcodes.OP_0;
        if (length == 1 && ((data[0] >= 1 && data[0] <= 16) || data[0] == (byte) 0x81))
            return false;
        if (length <= 75)
            return opcode == length;
        if (length <= 255)
            return opcode == Opcodes.OP_PUSHDATA1;
        if (length <= 65535)
            return opcode == Opcodes.OP_PUSHDATA2;
        return true;
    }

    @Override
    public String toString() {
        return isPushData() ? "PUSH(" + data.length + ")" : Opcodes.getOpCodeName(opcode);
    }
}
