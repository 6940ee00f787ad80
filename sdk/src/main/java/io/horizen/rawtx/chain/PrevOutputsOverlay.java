package io.horizen.rawtx.chain;

import io.horizen.rawtx.block.McBlock;
import io.horizen.rawtx.entity.McEntity;
import io.horizen.rawtx.entity.OutPoint;
import io.horizen.rawtx.script.ScriptParser;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Adds caller supplied previous outputs on top of another view.
 * Their value is taken from the backing view when it knows the output and is 0 otherwise.
 */
public class PrevOutputsOverlay implements ChainStateView {
    private final ChainStateView backing;
    private final Map<OutPoint, ResolvedOutput> overrides = new HashMap<>();

    public PrevOutputsOverlay(ChainStateView backing, List<PrevOutput> prevOutputs) {
        this.backing = backing;
        for (PrevOutput prevOutput : prevOutputs) {
            OutPoint outPoint = prevOutput.outPoint();
            byte[] lockingScript = prevOutput.lockingScript();
            Optional<ResolvedOutput> known = backing.resolveOutput(outPoint.entityId(), outPoint.index());
            long value = 0;
            if (known.isPresent()) {
                byte[] knownScript = known.get().lockingScript();
                if (!Arrays.equals(knownScript, lockingScript)) {
                    throw new IllegalArgumentException("Previous output scriptPubKey mismatch:\n"
                            + ScriptParser.toAsm(knownScript) + "\nvs:\n" + ScriptParser.toAsm(lockingScript));
                }
                value = known.get().value();
            }
            overrides.put(outPoint, new ResolvedOutput(value, lockingScript));
        }
    }

    @Override
    public Optional<ResolvedOutput> resolveOutput(byte[] entityId, long index) {
        ResolvedOutput output = overrides.get(new OutPoint(entityId, index));
        if (output != null)
            return Optional.of(output);
        return backing.resolveOutput(entityId, index);
    }

    @Override
    public Optional<McEntity> loadEntity(byte[] entityId) {
        return backing.loadEntity(entityId);
    }

    @Override
    public Optional<byte[]> blockContaining(byte[] entityId) {
        return backing.blockContaining(entityId);
    }

    @Override
    public Optional<McBlock> loadBlock(byte[] blockHash) {
        return backing.loadBlock(blockHash);
    }

    @Override
    public boolean isOnBestChain(byte[] blockHash) {
        return backing.isOnBestChain(blockHash);
    }
}
