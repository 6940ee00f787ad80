package io.horizen.rawtx.script;

import io.horizen.rawtx.utils.BytesUtils;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

public final class ScriptParser {
    private ScriptParser() {}

    public static List<ScriptChunk> parse(byte[] script) {
        List<ScriptChunk> chunks = new ArrayList<>();
        int pos = 0;
        while (pos < script.length) {
            int start = pos;
            int opcode = script[pos++] & 0xff;
            byte[] data = null;
            if (opcode <= Opcodes.OP_PUSHDATA4) {
                long length;
                if (opcode < Opcodes.OP_PUSHDATA1) {
                    length = opcode;
                } else if (opcode == Opcodes.OP_PUSHDATA1) {
                    requireBytes(script, pos, 1);
                    length = script[pos] & 0xff;
                    pos += 1;
                } else if (opcode == Opcodes.OP_PUSHDATA2) {
                    requireBytes(script, pos, 2);
                    length = BytesUtils.getReversedShort(script, pos) & 0xffff;
                    pos += 2;
                } else {
                    requireBytes(script, pos, 4);
                    length = BytesUtils.getReversedInt(script, pos) & 0xffffffffL;
                    pos += 4;
                }
                requireBytes(script, pos, length);
                data = Arrays.copyOfRange(script, pos, pos + (int) length);
                pos += (int) length;
            }
            chunks.add(new ScriptChunk(opcode, data, Arrays.copyOfRange(script, start, pos)));
        }
        return chunks;
    }

    private static void requireBytes(byte[] script, int pos, long length) {
        if (script.length - pos < length)
            throw new ScriptFormatException(String.format("Script truncated: push of %d bytes at offset %d", length, pos));
    }

    // True if the script consists only of push operations, OP_1NEGATE and OP_1..OP_16 included.
    public static boolean isPushOnly(byte[] script) {
        try {
            for (ScriptChunk chunk : parse(script)) {
                if (chunk.opcode() > Opcodes.OP_16)
                    return false;
            }
            return true;
        } catch (ScriptFormatException e) {
            return false;
        }
    }

    // Items a push-only script leaves on the stack, the way signature scripts are combined.
    public static List<byte[]> pushedItems(byte[] script) {
        List<byte[]> items = new ArrayList<>();
        for (ScriptChunk chunk : parse(script)) {
            if (chunk.isPushData())
                items.add(chunk.data());
            else if (chunk.opcode() == Opcodes.OP_1NEGATE)
                items.add(ScriptNumber.encode(-1));
            else if (chunk.opcode() >= Opcodes.OP_1 && chunk.opcode() <= Opcodes.OP_16)
                items.add(ScriptNumber.encode(Opcodes.decodeOpN(chunk.opcode())));
            else
                throw new ScriptFormatException("Signature script is not push only");
        }
        return items;
    }

    // Removes every push of the given data, the way a signature is taken out of the script code.
    public static byte[] removePushes(byte[] script, byte[] data) {
        byte[] pattern = new ScriptBuilder().addData(data).build();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (ScriptChunk chunk : parse(script)) {
            if (!Arrays.equals(chunk.raw(), pattern))
                out.writeBytes(chunk.raw());
        }
        return out.toByteArray();
    }

    public static String toAsm(byte[] script) {
        StringJoiner asm = new StringJoiner(" ");
        try {
            for (ScriptChunk chunk : parse(script)) {
                if (chunk.opcode() > Opcodes.OP_0 && chunk.isPushData()) {
                    byte[] data = chunk.data();
                    if (data.length <= 4)
                        asm.add(String.valueOf(ScriptNumber.decode(data, 4, false)));
                    else
                        asm.add(BytesUtils.toHexString(data));
                } else {
                    asm.add(Opcodes.getOpCodeName(chunk.opcode()));
                }
            }
        } catch (ScriptFormatException e) {
            asm.add("[error]");
        }
        return asm.toString();
    }
}
