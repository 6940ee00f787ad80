package io.horizen.rawtx.proof;

import io.horizen.rawtx.block.McBlockHeader;

// Header of the block and the pruned Merkle tree of its entity ids.
public final class InclusionProof {
    private final McBlockHeader header;
    private final PartialMerkleTree tree;

    public InclusionProof(McBlockHeader header, PartialMerkleTree tree) {
        this.header = header;
        this.tree = tree;
    }

    public McBlockHeader header() {
        return header;
    }

    public PartialMerkleTree tree() {
        return tree;
    }

    public byte[] bytes() {
        return InclusionProofSerializer.getSerializer().toBytes(this);
    }
}
