package io.horizen.rawtx.script;

import io.horizen.rawtx.utils.BytesUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.horizen.rawtx.script.Opcodes.*;

// Standard locking script templates: classification and construction.
public final class StandardScripts {
    private StandardScripts() {}

    public static final int MAX_PUBKEYS_PER_MULTISIG = 16;

    public static ScriptSolution solve(byte[] lockingScript) {
        List<ScriptChunk> chunks;
        try {
            chunks = ScriptParser.parse(lockingScript);
        } catch (ScriptFormatException e) {
            return nonStandard();
        }

        if (!chunks.isEmpty() && chunks.get(0).opcode() == OP_RETURN)
            return new ScriptSolution(ScriptType.NULL_DATA, Collections.emptyList());

        // OP_HASH160 <20> OP_EQUAL
        if (chunks.size() >= 3 && chunks.get(0).opcode() == OP_HASH160 && isPushOfSize(chunks.get(1), BytesUtils.HASH160_LENGTH)
                && chunks.get(2).opcode() == OP_EQUAL) {
            if (chunks.size() == 3)
                return new ScriptSolution(ScriptType.SCRIPTHASH, List.of(chunks.get(1).data()));
            if (hasReplayProtectionSuffix(chunks, 3))
                return new ScriptSolution(ScriptType.SCRIPTHASH_REPLAY, List.of(chunks.get(1).data()));
        }

        // OP_DUP OP_HASH160 <20> OP_EQUALVERIFY OP_CHECKSIG
        if (chunks.size() >= 5 && chunks.get(0).opcode() == OP_DUP && chunks.get(1).opcode() == OP_HASH160
                && isPushOfSize(chunks.get(2), BytesUtils.HASH160_LENGTH) && chunks.get(3).opcode() == OP_EQUALVERIFY
                && chunks.get(4).opcode() == OP_CHECKSIG) {
            if (chunks.size() == 5)
                return new ScriptSolution(ScriptType.PUBKEYHASH, List.of(chunks.get(2).data()));
            if (hasReplayProtectionSuffix(chunks, 5))
                return new ScriptSolution(ScriptType.PUBKEYHASH_REPLAY, List.of(chunks.get(2).data()));
        }

        // <pubkey> OP_CHECKSIG
        if (chunks.size() == 2 && chunks.get(1).opcode() == OP_CHECKSIG && chunks.get(0).isPushData()
                && isPubKeySized(chunks.get(0).data()))
            return new ScriptSolution(ScriptType.PUBKEY, List.of(chunks.get(0).data()));

        // m <pubkey>...<pubkey> n OP_CHECKMULTISIG
        if (chunks.size() >= 4 && chunks.get(chunks.size() - 1).opcode() == OP_CHECKMULTISIG) {
            ScriptSolution multisig = solveMultisig(chunks);
            if (multisig != null)
                return multisig;
        }
        return nonStandard();
    }

    private static ScriptSolution solveMultisig(List<ScriptChunk> chunks) {
        int mOp = chunks.get(0).opcode();
        int nOp = chunks.get(chunks.size() - 2).opcode();
        if (mOp < OP_1 || mOp > OP_16 || nOp < OP_1 || nOp > OP_16)
            return null;
        int m = Opcodes.decodeOpN(mOp);
        int n = Opcodes.decodeOpN(nOp);
        if (chunks.size() != n + 3 || m > n)
            return null;

        List<byte[]> solutions = new ArrayList<>();
        solutions.add(new byte[]{(byte) m});
        for (int i = 1; i <= n; i++) {
            ScriptChunk chunk = chunks.get(i);
            if (!chunk.isPushData() || !isPubKeySized(chunk.data()))
                return null;
            solutions.add(chunk.data());
        }
        solutions.add(new byte[]{(byte) n});
        return new ScriptSolution(ScriptType.MULTISIG, solutions);
    }

    // <block hash> <block height> OP_CHECKBLOCKATHEIGHT
    private static boolean hasReplayProtectionSuffix(List<ScriptChunk> chunks, int from) {
        return chunks.size() == from + 3
                && isParameterPush(chunks.get(from))
                && isParameterPush(chunks.get(from + 1))
                && chunks.get(from + 2).opcode() == OP_CHECKBLOCKATHEIGHT;
    }

    private static boolean isParameterPush(ScriptChunk chunk) {
        return chunk.opcode() <= OP_16 && chunk.opcode() != OP_1NEGATE
                && (!chunk.isPushData() || chunk.data().length <= BytesUtils.HASH_LENGTH);
    }

    private static boolean isPushOfSize(ScriptChunk chunk, int size) {
        return chunk.isPushData() && chunk.data().length == size;
    }

    private static boolean isPubKeySized(byte[] data) {
        return data.length == BytesUtils.COMPRESSED_PUBLIC_KEY_LENGTH || data.length == BytesUtils.UNCOMPRESSED_PUBLIC_KEY_LENGTH;
    }

    private static ScriptSolution nonStandard() {
        return new ScriptSolution(ScriptType.NONSTANDARD, Collections.emptyList());
    }

    public static byte[] payToPubKey(byte[] pubKey) {
        return new ScriptBuilder().addData(pubKey).addOp(OP_CHECKSIG).build();
    }

    public static byte[] payToPubKeyHash(byte[] pubKeyHash) {
        checkHash160(pubKeyHash);
        return new ScriptBuilder()
                .addOp(OP_DUP).addOp(OP_HASH160).addData(pubKeyHash).addOp(OP_EQUALVERIFY).addOp(OP_CHECKSIG)
                .build();
    }

    public static byte[] payToPubKeyHashReplay(byte[] pubKeyHash, byte[] blockHash, long blockHeight) {
        return new ScriptBuilder()
                .addScript(payToPubKeyHash(pubKeyHash))
                .addData(BytesUtils.reverseBytes(blockHash))
                .addNumber(blockHeight)
                .addOp(OP_CHECKBLOCKATHEIGHT)
                .build();
    }

    public static byte[] payToScriptHash(byte[] scriptHash) {
        checkHash160(scriptHash);
        return new ScriptBuilder().addOp(OP_HASH160).addData(scriptHash).addOp(OP_EQUAL).build();
    }

    public static byte[] payToScriptHashReplay(byte[] scriptHash, byte[] blockHash, long blockHeight) {
        return new ScriptBuilder()
                .addScript(payToScriptHash(scriptHash))
                .addData(BytesUtils.reverseBytes(blockHash))
                .addNumber(blockHeight)
                .addOp(OP_CHECKBLOCKATHEIGHT)
                .build();
    }

    public static byte[] multisig(int required, List<byte[]> pubKeys) {
        if (pubKeys.isEmpty() || pubKeys.size() > MAX_PUBKEYS_PER_MULTISIG)
            throw new IllegalArgumentException(String.format("Number of public keys must be between 1 and %d", MAX_PUBKEYS_PER_MULTISIG));
        if (required < 1 || required > pubKeys.size())
            throw new IllegalArgumentException(String.format(
                    "not enough keys supplied (got %d keys, but need at least %d to redeem)", pubKeys.size(), required));
        ScriptBuilder builder = new ScriptBuilder().addOp(Opcodes.encodeOpN(required));
        for (byte[] pubKey : pubKeys)
            builder.addData(pubKey);
        return builder.addOp(Opcodes.encodeOpN(pubKeys.size())).addOp(OP_CHECKMULTISIG).build();
    }

    private static void checkHash160(byte[] hash) {
        if (hash.length != BytesUtils.HASH160_LENGTH)
            throw new IllegalArgumentException(String.format("Incorrect hash length, %d expected, %d found",
                    BytesUtils.HASH160_LENGTH, hash.length));
    }
}
