package io.horizen.rawtx.script;

import java.util.HashMap;
import java.util.Map;

// Mainchain script opcodes used by the standard templates.
public final class Opcodes {
    private Opcodes() {}

    public static final int OP_0 = 0x00;
    public static final int OP_PUSHDATA1 = 0x4c;
    public static final int OP_PUSHDATA2 = 0x4d;
    public static final int OP_PUSHDATA4 = 0x4e;
    public static final int OP_1NEGATE = 0x4f;
    public static final int OP_1 = 0x51;
    public static final int OP_16 = 0x60;
    public static final int OP_NOP = 0x61;
    public static final int OP_VERIFY = 0x69;
    public static final int OP_RETURN = 0x6a;
    public static final int OP_DROP = 0x75;
    public static final int OP_DUP = 0x76;
    public static final int OP_EQUAL = 0x87;
    public static final int OP_EQUALVERIFY = 0x88;
    public static final int OP_SHA256 = 0xa8;
    public static final int OP_HASH160 = 0xa9;
    public static final int OP_HASH256 = 0xaa;
    public static final int OP_CODESEPARATOR = 0xab;
    public static final int OP_CHECKSIG = 0xac;
    public static final int OP_CHECKSIGVERIFY = 0xad;
    public static final int OP_CHECKMULTISIG = 0xae;
    public static final int OP_CHECKMULTISIGVERIFY = 0xaf;
    public static final int OP_CHECKBLOCKATHEIGHT = 0xb4;

    private static final int[] DISABLED = {
            0x7e, 0x7f, 0x80, 0x81, // splice
            0x83, 0x84, 0x85, 0x86, // bitwise logic
            0x8d, 0x8e, 0x95, 0x96, 0x97, 0x98, 0x99 // arithmetic
    };

    private static final Map<Integer, String> names = new HashMap<>();

    static {
        names.put(OP_0, "0");
        names.put(OP_PUSHDATA1, "OP_PUSHDATA1");
        names.put(OP_PUSHDATA2, "OP_PUSHDATA2");
        names.put(OP_PUSHDATA4, "OP_PUSHDATA4");
        names.put(OP_1NEGATE, "-1");
        for (int op = OP_1; op <= OP_16; op++)
            names.put(op, String.valueOf(op - OP_1 + 1));
        names.put(OP_NOP, "OP_NOP");
        names.put(OP_VERIFY, "OP_VERIFY");
        names.put(OP_RETURN, "OP_RETURN");
        names.put(OP_DROP, "OP_DROP");
        names.put(OP_DUP, "OP_DUP");
        names.put(OP_EQUAL, "OP_EQUAL");
        names.put(OP_EQUALVERIFY, "OP_EQUALVERIFY");
        names.put(OP_SHA256, "OP_SHA256");
        names.put(OP_HASH160, "OP_HASH160");
        names.put(OP_HASH256, "OP_HASH256");
        names.put(OP_CODESEPARATOR, "OP_CODESEPARATOR");
        names.put(OP_CHECKSIG, "OP_CHECKSIG");
        names.put(OP_CHECKSIGVERIFY, "OP_CHECKSIGVERIFY");
        names.put(OP_CHECKMULTISIG, "OP_CHECKMULTISIG");
        names.put(OP_CHECKMULTISIGVERIFY, "OP_CHECKMULTISIGVERIFY");
        names.put(OP_CHECKBLOCKATHEIGHT, "OP_CHECKBLOCKATHEIGHT");
    }

    public static String getOpCodeName(int opcode) {
        return names.getOrDefault(opcode, "OP_UNKNOWN");
    }

    public static boolean isDisabled(int opcode) {
        for (int disabled : DISABLED) {
            if (disabled == opcode)
                return true;
        }
        return false;
    }

    // Small integer opcode value: OP_0 is 0, OP_1..OP_16 are 1..16.
    public static int decodeOpN(int opcode) {
        if (opcode == OP_0)
            return 0;
        if (opcode < OP_1 || opcode > OP_16)
            throw new IllegalArgumentException("Not a small integer opcode: " + opcode);
        return opcode - (OP_1 - 1);
    }

    public static int encodeOpN(int n) {
        if (n < 0 || n > 16)
            throw new IllegalArgumentException("Small integer out of range: " + n);
        return n == 0 ? OP_0 : OP_1 + n - 1;
    }
}
