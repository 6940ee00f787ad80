package io.horizen.rawtx.combine;

import io.horizen.rawtx.chain.ChainStateView;
import io.horizen.rawtx.chain.ResolvedOutput;
import io.horizen.rawtx.entity.McEntity;
import io.horizen.rawtx.entity.McInput;
import io.horizen.rawtx.script.ScriptVerificationResult;
import io.horizen.rawtx.script.ScriptVerifier;
import io.horizen.rawtx.script.ScriptVerifyFlag;
import io.horizen.rawtx.script.StandardScriptVerifier;
import io.horizen.rawtx.sign.EntitySignatureChecker;
import io.horizen.rawtx.sign.KeyStore;
import io.horizen.rawtx.sign.ScriptSigner;
import io.horizen.rawtx.sign.SigHashType;
import io.horizen.rawtx.sign.SignatureCombiner;
import io.horizen.rawtx.sign.StandardScriptSigner;
import io.horizen.rawtx.sign.StandardSignatureCombiner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Signs an entity and merges the unlocking scripts of its independently signed variants.
 * <p>
 * Each input is handled on its own: the previous output is resolved, the input is signed with the available keys,
 * the scripts found in the base entity and in every variant are folded in, and the result is verified.
 * Failures are collected per input and never stop the other inputs from being processed.
 * The base entity and the variants are never modified, the result holds a new copy.
 */
public class SignatureCombinationEngine {
    private static final Logger logger = LogManager.getLogger();

    private final ScriptSigner signer;
    private final SignatureCombiner combiner;
    private final ScriptVerifier verifier;

    public SignatureCombinationEngine(ScriptSigner signer, SignatureCombiner combiner, ScriptVerifier verifier) {
        this.signer = signer;
        this.combiner = combiner;
        this.verifier = verifier;
    }

    public static SignatureCombinationEngine createDefault() {
        ScriptVerifier verifier = new StandardScriptVerifier();
        return new SignatureCombinationEngine(new StandardScriptSigner(), new StandardSignatureCombiner(verifier), verifier);
    }

    /**
     * @param chainState  view used to resolve previous outputs, unchanged for the whole call
     * @param base        entity to sign
     * @param variants    other signed versions of the same entity, in the order they were supplied
     * @param keys        signing keys, may be empty
     * @param sigHashType signature hash type of the new signatures
     */
    public CombinationResult combine(ChainStateView chainState,
                                     McEntity base,
                                     List<? extends McEntity> variants,
                                     KeyStore keys,
                                     SigHashType sigHashType) {
        checkVariants(base, variants);

        List<McEntity> sources = new ArrayList<>(variants.size() + 1);
        sources.add(base);
        sources.addAll(variants);

        McEntity merged = base.copy();
        List<McInput> inputs = merged.inputs();
        List<InputError> errors = new ArrayList<>();
        boolean signing = !keys.isEmpty();

        for (int i = 0; i < inputs.size(); i++) {
            McInput input = inputs.get(i);
            Optional<ResolvedOutput> prevOutput = chainState.resolveOutput(input.prevOut().entityId(), input.prevOut().index());
            if (prevOutput.isEmpty()) {
                input.setUnlockingScript(new byte[0]);
                errors.add(new InputError(i, input, InputError.INPUT_NOT_FOUND));
                logger.debug("Input {}: previous output {} not available", i, input.prevOut());
                continue;
            }
            byte[] lockingScript = prevOutput.get().lockingScript();

            input.setUnlockingScript(new byte[0]);
            if (signing && (!sigHashType.isSingle() || i < merged.outputs().size()))
                input.setUnlockingScript(signer.sign(keys, lockingScript, merged, i, sigHashType));

            for (McEntity source : sources) {
                byte[] candidate = source.inputs().get(i).unlockingScript();
                input.setUnlockingScript(combiner.combine(lockingScript, merged, i, input.unlockingScript(), candidate));
            }

            ScriptVerificationResult result = verifier.verify(input.unlockingScript(), lockingScript,
                    ScriptVerifyFlag.STANDARD_NONCONTEXTUAL_FLAGS, new EntitySignatureChecker(merged, i));
            if (!result.isValid()) {
                errors.add(new InputError(i, input, result.errorDescription()));
                logger.debug("Input {} failed verification: {}", i, result.error());
            } else {
                logger.debug("Input {} fully signed", i);
            }
        }

        return new CombinationResult(merged, errors);
    }

    private static void checkVariants(McEntity base, List<? extends McEntity> variants) {
        for (int v = 0; v < variants.size(); v++) {
            McEntity variant = variants.get(v);
            if (variant.type() != base.type())
                throw new IllegalArgumentException(String.format("Variant %d is a %s, %s expected",
                        v + 1, variant.type().name().toLowerCase(), base.type().name().toLowerCase()));
            if (variant.inputs().size() != base.inputs().size())
                throw new IllegalArgumentException(String.format("Variant %d has %d inputs, %d expected",
                        v + 1, variant.inputs().size(), base.inputs().size()));
            if (variant.outputs().size() != base.outputs().size())
                throw new IllegalArgumentException(String.format("Variant %d has %d outputs, %d expected",
                        v + 1, variant.outputs().size(), base.outputs().size()));
        }
    }
}
