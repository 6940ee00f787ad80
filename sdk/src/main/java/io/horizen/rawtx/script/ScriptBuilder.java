package io.horizen.rawtx.script;

import io.horizen.rawtx.utils.BytesUtils;

import java.io.ByteArrayOutputStream;

public class ScriptBuilder {
    private final ByteArrayOutputStream script = new ByteArrayOutputStream();

    public ScriptBuilder addOp(int opcode) {
        script.write(opcode);
        return this;
    }

    // Pushes data with the shortest length prefix. Empty data is pushed as OP_0.
    public ScriptBuilder addData(byte[] data) {
        int length = data.length;
        if (length < Opcodes.OP_PUSHDATA1) {
            script.write(length);
        } else if (length <= 0xff) {
            script.write(Opcodes.OP_PUSHDATA1);
            script.write(length);
        } else if (length <= 0xffff) {
            script.write(Opcodes.OP_PUSHDATA2);
            script.write(length & 0xff);
            script.write((length >> 8) & 0xff);
        } else {
            script.write(Opcodes.OP_PUSHDATA4);
            script.writeBytes(BytesUtils.reversedIntBytes(length));
        }
        script.writeBytes(data);
        return this;
    }

    public ScriptBuilder addNumber(long number) {
        if (number == -1)
            return addOp(Opcodes.OP_1NEGATE);
        if (number >= 0 && number <= 16)
            return addOp(Opcodes.encodeOpN((int) number));
        return addData(ScriptNumber.encode(number));
    }

    public ScriptBuilder addScript(byte[] raw) {
        script.writeBytes(raw);
        return this;
    }

    public byte[] build() {
        return script.toByteArray();
    }
}
