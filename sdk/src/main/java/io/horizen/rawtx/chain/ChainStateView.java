package io.horizen.rawtx.chain;

import io.horizen.rawtx.block.McBlock;
import io.horizen.rawtx.entity.McEntity;

import java.util.Optional;

/**
 * Read access to chain and mempool state.
 * Implementations must stay unchanged for as long as a single signing or proof operation uses them.
 */
public interface ChainStateView {

    /**
     * Resolves an unspent output, looking at pending mempool entities before the confirmed state.
     *
     * @param entityId id of the entity that created the output, in display order
     * @param index    output index
     * @return the output, or empty if it is spent, unknown or out of range
     */
    Optional<ResolvedOutput> resolveOutput(byte[] entityId, long index);

    // Mempool entity, or one confirmed on the best chain.
    Optional<McEntity> loadEntity(byte[] entityId);

    // Hash of the best chain block that includes the entity.
    Optional<byte[]> blockContaining(byte[] entityId);

    Optional<McBlock> loadBlock(byte[] blockHash);

    boolean isOnBestChain(byte[] blockHash);
}
