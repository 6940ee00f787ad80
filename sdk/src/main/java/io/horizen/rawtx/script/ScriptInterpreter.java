package io.horizen.rawtx.script;

import io.horizen.rawtx.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static io.horizen.rawtx.script.Opcodes.*;

/**
 * Stack machine for the opcode subset used by the standard templates.
 * OP_CHECKBLOCKATHEIGHT only checks its operands are present: the referenced block is validated
 * by contextual rules, out of reach here.
 */
public final class ScriptInterpreter {
    private ScriptInterpreter() {}

    public static final int MAX_SCRIPT_SIZE = 10000;
    public static final int MAX_SCRIPT_ELEMENT_SIZE = 520;
    public static final int MAX_OPS_PER_SCRIPT = 201;
    public static final int MAX_STACK_SIZE = 1000;
    public static final int MAX_PUBKEYS_PER_MULTISIG = 20;

    private static final byte[] TRUE = new byte[]{1};
    private static final byte[] FALSE = new byte[0];

    public static ScriptError verifyScript(byte[] scriptSig,
                                           byte[] scriptPubKey,
                                           Set<ScriptVerifyFlag> flags,
                                           SignatureChecker checker) {
        if (flags.contains(ScriptVerifyFlag.SIGPUSHONLY) && !ScriptParser.isPushOnly(scriptSig))
            return ScriptError.SIG_PUSHONLY;

        List<byte[]> stack = new ArrayList<>();
        ScriptError error = evalScript(stack, scriptSig, flags, checker);
        if (error != ScriptError.OK)
            return error;

        List<byte[]> stackCopy = new ArrayList<>(stack);
        error = evalScript(stack, scriptPubKey, flags, checker);
        if (error != ScriptError.OK)
            return error;
        if (stack.isEmpty() || !castToBool(top(stack)))
            return ScriptError.EVAL_FALSE;

        if (flags.contains(ScriptVerifyFlag.P2SH) && StandardScripts.solve(scriptPubKey).type().isPayToScriptHash()) {
            // the signature script of a P2SH spend must be push only, the redeem script is its last push
            if (!ScriptParser.isPushOnly(scriptSig))
                return ScriptError.SIG_PUSHONLY;

            stack = stackCopy;
            if (stack.isEmpty())
                return ScriptError.EVAL_FALSE;
            byte[] redeemScript = stack.remove(stack.size() - 1);

            error = evalScript(stack, redeemScript, flags, checker);
            if (error != ScriptError.OK)
                return error;
            if (stack.isEmpty() || !castToBool(top(stack)))
                return ScriptError.EVAL_FALSE;
        }

        if (flags.contains(ScriptVerifyFlag.CLEANSTACK) && flags.contains(ScriptVerifyFlag.P2SH) && stack.size() != 1)
            return ScriptError.CLEANSTACK;

        return ScriptError.OK;
    }

    static ScriptError evalScript(List<byte[]> stack, byte[] script, Set<ScriptVerifyFlag> flags, SignatureChecker checker) {
        if (script.length > MAX_SCRIPT_SIZE)
            return ScriptError.SCRIPT_SIZE;

        List<ScriptChunk> chunks;
        try {
            chunks = ScriptParser.parse(script);
        } catch (ScriptFormatException e) {
            return ScriptError.BAD_OPCODE;
        }

        int opCount = 0;
        for (ScriptChunk chunk : chunks) {
            int opcode = chunk.opcode();

            if (chunk.isPushData() && chunk.data().length > MAX_SCRIPT_ELEMENT_SIZE)
                return ScriptError.PUSH_SIZE;
            if (opcode > OP_16 && ++opCount > MAX_OPS_PER_SCRIPT)
                return ScriptError.OP_COUNT;
            if (Opcodes.isDisabled(opcode))
                return ScriptError.DISABLED_OPCODE;

            if (chunk.isPushData()) {
                if (flags.contains(ScriptVerifyFlag.MINIMALDATA) && !chunk.isMinimalPush())
                    return ScriptError.MINIMALDATA;
                stack.add(chunk.data());
            } else if (opcode == OP_1NEGATE || (opcode >= OP_1 && opcode <= OP_16)) {
                stack.add(ScriptNumber.encode(opcode == OP_1NEGATE ? -1 : Opcodes.decodeOpN(opcode)));
            } else {
                ScriptError error;
                switch (opcode) {
                    case OP_NOP:
                        error = ScriptError.OK;
                        break;
                    case OP_VERIFY:
                        if (stack.isEmpty())
                            return ScriptError.INVALID_STACK_OPERATION;
                        if (!castToBool(top(stack)))
                            return ScriptError.VERIFY;
                        pop(stack);
                        error = ScriptError.OK;
                        break;
                    case OP_RETURN:
                        return ScriptError.OP_RETURN;
                    case OP_DROP:
                        if (stack.isEmpty())
                            return ScriptError.INVALID_STACK_OPERATION;
                        pop(stack);
                        error = ScriptError.OK;
                        break;
                    case OP_DUP:
                        if (stack.isEmpty())
                            return ScriptError.INVALID_STACK_OPERATION;
                        stack.add(top(stack));
                        error = ScriptError.OK;
                        break;
                    case OP_EQUAL:
                    case OP_EQUALVERIFY:
                        error = opEqual(stack, opcode == OP_EQUALVERIFY);
                        break;
                    case OP_SHA256:
                    case OP_HASH160:
                    case OP_HASH256:
                        if (stack.isEmpty())
                            return ScriptError.INVALID_STACK_OPERATION;
                        stack.add(hash(opcode, pop(stack)));
                        error = ScriptError.OK;
                        break;
                    case OP_CHECKSIG:
                    case OP_CHECKSIGVERIFY:
                        error = opCheckSig(stack, script, flags, checker, opcode == OP_CHECKSIGVERIFY);
                        break;
                    case OP_CHECKMULTISIG:
                    case OP_CHECKMULTISIGVERIFY: {
                        int[] ops = new int[]{opCount};
                        error = opCheckMultisig(stack, script, flags, checker, opcode == OP_CHECKMULTISIGVERIFY, ops);
                        opCount = ops[0];
                        break;
                    }
                    case OP_CHECKBLOCKATHEIGHT:
                        if (stack.size() < 2)
                            return ScriptError.INVALID_STACK_OPERATION;
                        pop(stack);
                        pop(stack);
                        error = ScriptError.OK;
                        break;
                    default:
                        return ScriptError.BAD_OPCODE;
                }
                if (error != ScriptError.OK)
                    return error;
            }

            if (stack.size() > MAX_STACK_SIZE)
                return ScriptError.STACK_SIZE;
        }
        return ScriptError.OK;
    }

    private static ScriptError opEqual(List<byte[]> stack, boolean verify) {
        if (stack.size() < 2)
            return ScriptError.INVALID_STACK_OPERATION;
        byte[] b = pop(stack);
        byte[] a = pop(stack);
        boolean equal = Arrays.equals(a, b);
        if (verify)
            return equal ? ScriptError.OK : ScriptError.EQUALVERIFY;
        stack.add(equal ? TRUE : FALSE);
        return ScriptError.OK;
    }

    private static ScriptError opCheckSig(List<byte[]> stack, byte[] script, Set<ScriptVerifyFlag> flags,
                                          SignatureChecker checker, boolean verify) {
        if (stack.size() < 2)
            return ScriptError.INVALID_STACK_OPERATION;
        byte[] sig = stack.get(stack.size() - 2);
        byte[] pubKey = stack.get(stack.size() - 1);

        byte[] scriptCode = ScriptParser.removePushes(script, sig);

        ScriptError error = SignatureEncoding.checkSignatureEncoding(sig, flags);
        if (error != ScriptError.OK)
            return error;
        error = SignatureEncoding.checkPubKeyEncoding(pubKey, flags);
        if (error != ScriptError.OK)
            return error;

        boolean success = sig.length > 0 && checker.checkSignature(sig, pubKey, scriptCode);
        pop(stack);
        pop(stack);
        if (verify)
            return success ? ScriptError.OK : ScriptError.CHECKSIGVERIFY;
        stack.add(success ? TRUE : FALSE);
        return ScriptError.OK;
    }

    private static ScriptError opCheckMultisig(List<byte[]> stack, byte[] script, Set<ScriptVerifyFlag> flags,
                                               SignatureChecker checker, boolean verify, int[] opCount) {
        boolean requireMinimal = flags.contains(ScriptVerifyFlag.MINIMALDATA);
        int i = 1;
        if (stack.size() < i)
            return ScriptError.INVALID_STACK_OPERATION;

        long keysCount;
        try {
            keysCount = ScriptNumber.decode(peek(stack, i), 4, requireMinimal);
        } catch (ScriptFormatException e) {
            return ScriptError.UNKNOWN_ERROR;
        }
        if (keysCount < 0 || keysCount > MAX_PUBKEYS_PER_MULTISIG)
            return ScriptError.PUBKEY_COUNT;
        opCount[0] += (int) keysCount;
        if (opCount[0] > MAX_OPS_PER_SCRIPT)
            return ScriptError.OP_COUNT;
        int ikey = ++i;
        i += (int) keysCount;
        if (stack.size() < i)
            return ScriptError.INVALID_STACK_OPERATION;

        long sigsCount;
        try {
            sigsCount = ScriptNumber.decode(peek(stack, i), 4, requireMinimal);
        } catch (ScriptFormatException e) {
            return ScriptError.UNKNOWN_ERROR;
        }
        if (sigsCount < 0 || sigsCount > keysCount)
            return ScriptError.SIG_COUNT;
        int isig = ++i;
        i += (int) sigsCount;
        if (stack.size() < i)
            return ScriptError.INVALID_STACK_OPERATION;

        // signatures can not sign themselves
        byte[] scriptCode = script;
        for (int k = 0; k < sigsCount; k++)
            scriptCode = ScriptParser.removePushes(scriptCode, peek(stack, isig + k));

        boolean success = true;
        long remainingKeys = keysCount;
        long remainingSigs = sigsCount;
        while (success && remainingSigs > 0) {
            byte[] sig = peek(stack, isig);
            byte[] pubKey = peek(stack, ikey);

            ScriptError error = SignatureEncoding.checkSignatureEncoding(sig, flags);
            if (error != ScriptError.OK)
                return error;
            error = SignatureEncoding.checkPubKeyEncoding(pubKey, flags);
            if (error != ScriptError.OK)
                return error;

            if (sig.length > 0 && checker.checkSignature(sig, pubKey, scriptCode)) {
                isig++;
                remainingSigs--;
            }
            ikey++;
            remainingKeys--;

            // more signatures left than keys means the check can no longer succeed
            if (remainingSigs > remainingKeys)
                success = false;
        }

        // pop the counts, keys and signatures, then the extra element consumed by CHECKMULTISIG
        for (int k = 1; k < i; k++)
            pop(stack);
        if (stack.isEmpty())
            return ScriptError.INVALID_STACK_OPERATION;
        if (flags.contains(ScriptVerifyFlag.NULLDUMMY) && top(stack).length != 0)
            return ScriptError.SIG_NULLDUMMY;
        pop(stack);

        if (verify)
            return success ? ScriptError.OK : ScriptError.CHECKMULTISIGVERIFY;
        stack.add(success ? TRUE : FALSE);
        return ScriptError.OK;
    }

    private static byte[] hash(int opcode, byte[] data) {
        switch (opcode) {
            case OP_SHA256:
                return Utils.sha256Hash(data);
            case OP_HASH160:
                return Utils.Ripemd160Sha256Hash(data);
            default:
                return Utils.doubleSHA256Hash(data);
        }
    }

    public static boolean castToBool(byte[] data) {
        for (int i = 0; i < data.length; i++) {
            if (data[i] != 0) {
                // negative zero is false
                return !(i == data.length - 1 && (data[i] & 0xff) == 0x80);
            }
        }
        return false;
    }

    private static byte[] top(List<byte[]> stack) {
        return stack.get(stack.size() - 1);
    }

    // Element at depth i, 1 being the top.
    private static byte[] peek(List<byte[]> stack, int i) {
        return stack.get(stack.size() - i);
    }

    private static byte[] pop(List<byte[]> stack) {
        return stack.remove(stack.size() - 1);
    }
}
