package io.horizen.rawtx.proof;

import io.horizen.rawtx.block.McBlockHeader;
import io.horizen.rawtx.utils.BytesReader;
import io.horizen.rawtx.utils.BytesUtils;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Wire format: header, leaf count (uint32), hashes (CompactSize count, 32 bytes each, reversed),
 * bitmask (CompactSize length, bits least significant first).
 */
public final class InclusionProofSerializer {
    private static final InclusionProofSerializer serializer = new InclusionProofSerializer();

    private InclusionProofSerializer() {
        super();
    }

    public static InclusionProofSerializer getSerializer() {
        return serializer;
    }

    public byte[] toBytes(InclusionProof proof) {
        PartialMerkleTree tree = proof.tree();
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        stream.writeBytes(proof.header().bytes());
        stream.writeBytes(BytesUtils.reversedIntBytes(tree.leafCount()));
        stream.writeBytes(BytesUtils.toCompactSizeBytes(tree.hashes().size()));
        for (byte[] hash : tree.hashes())
            stream.writeBytes(BytesUtils.reverseBytes(hash));
        BytesUtils.writeVarBytes(stream, tree.packedBits());
        return stream.toByteArray();
    }

    public InclusionProof parseBytes(byte[] bytes) throws MalformedProofException {
        try {
            BytesReader reader = new BytesReader(bytes);
            McBlockHeader header = McBlockHeader.parse(reader);

            long leafCount = reader.readUnsignedInt();
            if (leafCount > PartialMerkleTree.MAX_LEAF_COUNT)
                throw new MalformedProofException(String.format("Proof declares %d leaves, at most %d allowed",
                        leafCount, PartialMerkleTree.MAX_LEAF_COUNT));

            long hashCount = reader.readCompactSize();
            if (hashCount * BytesUtils.HASH_LENGTH > reader.remaining())
                throw new MalformedProofException(String.format("Proof declares %d hashes, data is too short", hashCount));
            List<byte[]> hashes = new ArrayList<>((int) hashCount);
            for (int i = 0; i < hashCount; i++)
                hashes.add(reader.readHash());

            byte[] packedBits = reader.readVarBytes();
            if (reader.hasRemaining())
                throw new MalformedProofException(String.format("Found %d extra byte(s) after proof", reader.remaining()));

            return new InclusionProof(header, new PartialMerkleTree((int) leafCount, PartialMerkleTree.unpackBits(packedBits), hashes));
        } catch (IllegalArgumentException e) {
            throw new MalformedProofException("Proof decode failed: " + e.getMessage(), e);
        }
    }
}
