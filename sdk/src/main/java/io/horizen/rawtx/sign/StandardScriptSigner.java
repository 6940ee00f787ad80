package io.horizen.rawtx.sign;

import io.horizen.rawtx.entity.McEntity;
import io.horizen.rawtx.script.Opcodes;
import io.horizen.rawtx.script.ScriptBuilder;
import io.horizen.rawtx.script.ScriptSolution;
import io.horizen.rawtx.script.StandardScripts;
import io.horizen.rawtx.utils.Utils;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Signs inputs locked by the standard templates with the keys held by a {@link KeyStore}.
 * P2SH inputs are signed against the redeem script found in the store, which is then appended to the signatures.
 */
public class StandardScriptSigner implements ScriptSigner {

    @Override
    public byte[] sign(KeyStore keys, byte[] lockingScript, McEntity entity, int inputIndex, SigHashType sigHashType) {
        ScriptSolution solution = StandardScripts.solve(lockingScript);
        List<byte[]> items = new ArrayList<>(signStep(keys, lockingScript, solution, entity, inputIndex, sigHashType));

        if (solution.type().isPayToScriptHash() && !items.isEmpty()) {
            byte[] redeemScript = items.get(0);
            ScriptSolution redeemSolution = StandardScripts.solve(redeemScript);
            if (redeemSolution.type().isPayToScriptHash()) {
                // nested P2SH can not be spent
                items = Collections.emptyList();
            } else {
                items = new ArrayList<>(signStep(keys, redeemScript, redeemSolution, entity, inputIndex, sigHashType));
                items.add(redeemScript);
            }
        }
        return pushAll(items);
    }

    // Stack items satisfying one template. For P2SH the only item is the redeem script.
    private List<byte[]> signStep(KeyStore keys, byte[] scriptCode, ScriptSolution solution,
                                  McEntity entity, int inputIndex, SigHashType sigHashType) {
        List<byte[]> items = new ArrayList<>();
        switch (solution.type()) {
            case PUBKEY: {
                byte[] pubKey = solution.solution(0);
                signWith(keys, Utils.Ripemd160Sha256Hash(pubKey), scriptCode, entity, inputIndex, sigHashType)
                        .ifPresent(items::add);
                break;
            }
            case PUBKEYHASH:
            case PUBKEYHASH_REPLAY: {
                byte[] keyId = solution.solution(0);
                Optional<McPrivateKey> key = keys.getKey(keyId);
                if (key.isPresent()) {
                    items.add(createSignature(key.get(), scriptCode, entity, inputIndex, sigHashType));
                    items.add(key.get().publicKey());
                }
                break;
            }
            case SCRIPTHASH:
            case SCRIPTHASH_REPLAY:
                keys.getRedeemScript(solution.solution(0)).ifPresent(items::add);
                break;
            case MULTISIG: {
                // CHECKMULTISIG consumes one extra element
                items.add(new byte[0]);
                int required = solution.requiredSignatures();
                int signed = 0;
                for (byte[] pubKey : solution.multisigPubKeys()) {
                    if (signed >= required)
                        break;
                    Optional<byte[]> signature = signWith(keys, Utils.Ripemd160Sha256Hash(pubKey), scriptCode,
                            entity, inputIndex, sigHashType);
                    if (signature.isPresent()) {
                        items.add(signature.get());
                        signed++;
                    }
                }
                break;
            }
            default:
                break;
        }
        return items;
    }

    private Optional<byte[]> signWith(KeyStore keys, byte[] keyId, byte[] scriptCode,
                                      McEntity entity, int inputIndex, SigHashType sigHashType) {
        return keys.getKey(keyId).map(key -> createSignature(key, scriptCode, entity, inputIndex, sigHashType));
    }

    static byte[] createSignature(McPrivateKey key, byte[] scriptCode, McEntity entity, int inputIndex, SigHashType sigHashType) {
        byte[] digest = SignatureHasher.hash(entity, inputIndex, scriptCode, sigHashType.value());
        byte[] der = key.sign(digest);
        ByteArrayOutputStream signature = new ByteArrayOutputStream(der.length + 1);
        signature.writeBytes(der);
        signature.write(sigHashType.value());
        return signature.toByteArray();
    }

    // Serializes stack items as minimal pushes.
    static byte[] pushAll(List<byte[]> items) {
        ScriptBuilder builder = new ScriptBuilder();
        for (byte[] item : items) {
            if (item.length == 1 && item[0] >= 1 && item[0] <= 16)
                builder.addOp(Opcodes.encodeOpN(item[0]));
            else if (item.length == 1 && item[0] == (byte) 0x81)
                builder.addOp(Opcodes.OP_1NEGATE);
            else
                builder.addData(item);
        }
        return builder.build();
    }
}
