package io.horizen.rawtx.proof;

import io.horizen.rawtx.block.McBlock;
import io.horizen.rawtx.chain.ChainStateView;
import io.horizen.rawtx.utils.ByteArrayWrapper;
import io.horizen.rawtx.utils.BytesUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a proof that every target entity id is part of one block.
 * The proof covers all the targets or is not built at all.
 */
public class InclusionProofBuilder {
    private static final Logger logger = LogManager.getLogger();

    /**
     * @param chainState view used to find and load the block
     * @param targetIds  entity ids to prove, display order, non-empty and distinct
     * @param blockHash  block to build the proof for; when empty the block is the one including a target
     */
    public InclusionProof build(ChainStateView chainState, List<byte[]> targetIds, Optional<byte[]> blockHash)
            throws InclusionProofException {
        Set<ByteArrayWrapper> targets = checkTargets(targetIds);

        byte[] resolvedHash;
        if (blockHash.isPresent()) {
            resolvedHash = blockHash.get();
        } else {
            resolvedHash = null;
            for (byte[] id : targetIds) {
                Optional<byte[]> containing = chainState.blockContaining(id);
                if (containing.isPresent()) {
                    resolvedHash = containing.get();
                    break;
                }
            }
            if (resolvedHash == null)
                throw new ChainReferenceException("Transaction not yet in block");
        }

        McBlock block = chainState.loadBlock(resolvedHash)
                .orElseThrow(() -> new ChainReferenceException("Block not found"));

        List<byte[]> leaves = block.entityIds();
        boolean[] matches = new boolean[leaves.size()];
        int found = 0;
        for (int i = 0; i < leaves.size(); i++) {
            if (targets.contains(new ByteArrayWrapper(leaves.get(i)))) {
                matches[i] = true;
                found++;
            }
        }
        if (found != targets.size())
            throw new TargetsNotInBlockException();

        PartialMerkleTree tree = PartialMerkleTree.build(leaves, matches);
        logger.debug("Built proof for {} of {} entities in block {}: {} hashes, {} bits",
                found, leaves.size(), block.header().hashHex(), tree.hashes().size(), tree.bits().size());
        return new InclusionProof(block.header(), tree);
    }

    private static Set<ByteArrayWrapper> checkTargets(List<byte[]> targetIds) {
        if (targetIds.isEmpty())
            throw new IllegalArgumentException("Invalid parameter, txids must not be empty");
        Set<ByteArrayWrapper> targets = new HashSet<>();
        for (byte[] id : targetIds) {
            if (id.length != BytesUtils.HASH_LENGTH)
                throw new IllegalArgumentException(String.format("Incorrect entity id length, %d expected, %d found",
                        BytesUtils.HASH_LENGTH, id.length));
            if (!targets.add(new ByteArrayWrapper(id)))
                throw new IllegalArgumentException("Invalid parameter, duplicated txid: " + BytesUtils.toHexString(id));
        }
        return targets;
    }
}
