package io.horizen.rawtx.sign;

import io.horizen.rawtx.entity.McEntity;
import io.horizen.rawtx.script.ScriptFormatException;
import io.horizen.rawtx.script.ScriptParser;
import io.horizen.rawtx.script.ScriptSolution;
import io.horizen.rawtx.script.ScriptVerifier;
import io.horizen.rawtx.script.ScriptVerifyFlag;
import io.horizen.rawtx.script.StandardScripts;
import io.horizen.rawtx.script.SignatureChecker;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges unlocking scripts of the same input.
 * A script that already satisfies the locking script wins, the first argument taking precedence when both do.
 * Otherwise the stacks are merged per template: multisig signatures are collected in public key order,
 * P2SH scripts are merged on their redeem script.
 */
public class StandardSignatureCombiner implements SignatureCombiner {
    private final ScriptVerifier verifier;

    public StandardSignatureCombiner(ScriptVerifier verifier) {
        this.verifier = verifier;
    }

    @Override
    public byte[] combine(byte[] lockingScript, McEntity entity, int inputIndex, byte[] scriptA, byte[] scriptB) {
        SignatureChecker checker = new EntitySignatureChecker(entity, inputIndex);
        if (isSatisfying(scriptA, lockingScript, checker))
            return scriptA;
        if (isSatisfying(scriptB, lockingScript, checker))
            return scriptB;

        List<byte[]> itemsA;
        List<byte[]> itemsB;
        try {
            itemsA = ScriptParser.pushedItems(scriptA);
        } catch (ScriptFormatException e) {
            return scriptB;
        }
        try {
            itemsB = ScriptParser.pushedItems(scriptB);
        } catch (ScriptFormatException e) {
            return scriptA;
        }

        List<byte[]> merged = combineStacks(lockingScript, checker, itemsA, itemsB);
        return StandardScriptSigner.pushAll(merged);
    }

    private boolean isSatisfying(byte[] unlockingScript, byte[] lockingScript, SignatureChecker checker) {
        return unlockingScript.length > 0
                && verifier.verify(unlockingScript, lockingScript, ScriptVerifyFlag.STANDARD_NONCONTEXTUAL_FLAGS, checker).isValid();
    }

    private List<byte[]> combineStacks(byte[] lockingScript, SignatureChecker checker, List<byte[]> itemsA, List<byte[]> itemsB) {
        ScriptSolution solution = StandardScripts.solve(lockingScript);
        switch (solution.type()) {
            case PUBKEY:
            case PUBKEYHASH:
            case PUBKEYHASH_REPLAY:
                // one signature: keep the side that has it
                if (itemsA.isEmpty() || itemsA.get(0).length == 0)
                    return itemsB;
                return itemsA;
            case SCRIPTHASH:
            case SCRIPTHASH_REPLAY: {
                if (itemsA.isEmpty() || itemsA.get(itemsA.size() - 1).length == 0)
                    return itemsB;
                if (itemsB.isEmpty() || itemsB.get(itemsB.size() - 1).length == 0)
                    return itemsA;
                byte[] redeemScript = itemsA.get(itemsA.size() - 1);
                ScriptSolution redeemSolution = StandardScripts.solve(redeemScript);
                if (redeemSolution.type().isPayToScriptHash())
                    return itemsA;
                List<byte[]> result = new ArrayList<>(combineStacks(redeemScript, checker,
                        itemsA.subList(0, itemsA.size() - 1), itemsB.subList(0, itemsB.size() - 1)));
                result.add(redeemScript);
                return result;
            }
            case MULTISIG:
                return combineMultisig(lockingScript, solution, checker, itemsA, itemsB);
            default:
                return itemsA.size() >= itemsB.size() ? itemsA : itemsB;
        }
    }

    private List<byte[]> combineMultisig(byte[] multisigScript, ScriptSolution solution, SignatureChecker checker,
                                         List<byte[]> itemsA, List<byte[]> itemsB) {
        List<byte[]> candidates = new ArrayList<>();
        for (byte[] item : itemsA)
            if (item.length > 0)
                candidates.add(item);
        for (byte[] item : itemsB)
            if (item.length > 0)
                candidates.add(item);

        int required = solution.requiredSignatures();
        List<byte[]> result = new ArrayList<>();
        result.add(new byte[0]);
        for (byte[] pubKey : solution.multisigPubKeys()) {
            if (result.size() > required)
                break;
            for (byte[] signature : candidates) {
                byte[] scriptCode = ScriptParser.removePushes(multisigScript, signature);
                if (checker.checkSignature(signature, pubKey, scriptCode)) {
                    result.add(signature);
                    break;
                }
            }
        }
        // missing signatures are filled with empty pushes
        while (result.size() <= required)
            result.add(new byte[0]);
        return result;
    }
}
