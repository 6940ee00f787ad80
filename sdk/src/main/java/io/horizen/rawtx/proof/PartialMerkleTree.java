package io.horizen.rawtx.proof;

import io.horizen.rawtx.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Pruned Merkle tree proving that a subset of the leaves belongs to a root.
 * <p>
 * The tree is walked depth first, left to right. Every visited node contributes one bit telling whether it is
 * an ancestor of a matched leaf (or a matched leaf itself). Nodes with bit 0, and all leaves, contribute
 * their hash; the descent stops there. Nodes with bit 1 are recomputed from their children.
 * Hashes are held in display order.
 */
public final class PartialMerkleTree {
    // upper bound of the entities a block can hold, given the minimum entity size
    public static final int MAX_LEAF_COUNT = 2000000 / 60;

    private final int leafCount;
    private final List<Boolean> bits;
    private final List<byte[]> hashes;

    public PartialMerkleTree(int leafCount, List<Boolean> bits, List<byte[]> hashes) {
        this.leafCount = leafCount;
        this.bits = Collections.unmodifiableList(new ArrayList<>(bits));
        List<byte[]> hashesCopy = new ArrayList<>(hashes.size());
        for (byte[] hash : hashes)
            hashesCopy.add(Arrays.copyOf(hash, hash.length));
        this.hashes = Collections.unmodifiableList(hashesCopy);
    }

    public static PartialMerkleTree build(List<byte[]> leaves, boolean[] matches) {
        if (leaves.isEmpty())
            throw new IllegalArgumentException("Merkle tree must contain at least one leaf");
        if (leaves.size() != matches.length)
            throw new IllegalArgumentException("Leaves and matches size differ");

        List<Boolean> bits = new ArrayList<>();
        List<byte[]> hashes = new ArrayList<>();
        int height = treeHeight(leaves.size());
        traverseAndBuild(height, 0, leaves, matches, bits, hashes);
        return new PartialMerkleTree(leaves.size(), bits, hashes);
    }

    public int leafCount() {
        return leafCount;
    }

    public List<Boolean> bits() {
        return bits;
    }

    public List<byte[]> hashes() {
        return hashes;
    }

    /**
     * Number of hashes the bitmask implies for a tree of the declared leaf count.
     *
     * @throws MalformedProofException if the bitmask is exhausted before the walk completes,
     *                                 or bits are left over past the last byte used
     */
    public int expectedHashCount() throws MalformedProofException {
        checkLeafCount();
        int[] bitsUsed = new int[]{0};
        int[] hashCount = new int[]{0};
        if (!countHashes(treeHeight(leafCount), 0, bitsUsed, hashCount))
            throw new MalformedProofException("Proof bitmask is too short for the declared leaf count");
        checkAllBitsUsed(bitsUsed[0]);
        return hashCount[0];
    }

    /**
     * Recomputes the root and collects the matched leaves in leaf order.
     *
     * @param matched receives the matched leaf hashes
     * @return the recomputed root, in display order
     * @throws MalformedProofException if the proof is structurally invalid
     */
    public byte[] extractMatches(List<byte[]> matched) throws MalformedProofException {
        int expected = expectedHashCount();
        if (expected != hashes.size())
            throw new MalformedProofException(String.format(
                    "Proof hash count mismatch: bitmask implies %d, %d found", expected, hashes.size()));
        if (hashes.size() > leafCount)
            throw new MalformedProofException("Proof holds more hashes than leaves");

        int[] bitsUsed = new int[]{0};
        int[] hashesUsed = new int[]{0};
        List<byte[]> found = new ArrayList<>();
        byte[] root = traverseAndExtract(treeHeight(leafCount), 0, bitsUsed, hashesUsed, found);
        if (hashesUsed[0] != hashes.size())
            throw new MalformedProofException("Not all proof hashes were consumed");
        matched.addAll(found);
        return root;
    }

    private void checkLeafCount() throws MalformedProofException {
        if (leafCount <= 0)
            throw new MalformedProofException("Proof declares no leaves");
        if (leafCount > MAX_LEAF_COUNT)
            throw new MalformedProofException(String.format("Proof declares %d leaves, at most %d allowed", leafCount, MAX_LEAF_COUNT));
    }

    private void checkAllBitsUsed(int bitsUsed) throws MalformedProofException {
        if ((bitsUsed + 7) / 8 != (bits.size() + 7) / 8)
            throw new MalformedProofException("Proof bitmask has unused bytes");
    }

    private boolean countHashes(int height, int pos, int[] bitsUsed, int[] hashCount) {
        if (bitsUsed[0] >= bits.size())
            return false;
        boolean parentOfMatch = bits.get(bitsUsed[0]++);
        if (height == 0 || !parentOfMatch) {
            hashCount[0]++;
            return true;
        }
        if (!countHashes(height - 1, pos * 2, bitsUsed, hashCount))
            return false;
        if (pos * 2 + 1 < treeWidth(leafCount, height - 1))
            return countHashes(height - 1, pos * 2 + 1, bitsUsed, hashCount);
        return true;
    }

    private byte[] traverseAndExtract(int height, int pos, int[] bitsUsed, int[] hashesUsed, List<byte[]> matched)
            throws MalformedProofException {
        boolean parentOfMatch = bits.get(bitsUsed[0]++);
        if (height == 0 || !parentOfMatch) {
            byte[] hash = hashes.get(hashesUsed[0]++);
            if (height == 0 && parentOfMatch)
                matched.add(Arrays.copyOf(hash, hash.length));
            return hash;
        }
        byte[] left = traverseAndExtract(height - 1, pos * 2, bitsUsed, hashesUsed, matched);
        byte[] right;
        if (pos * 2 + 1 < treeWidth(leafCount, height - 1)) {
            right = traverseAndExtract(height - 1, pos * 2 + 1, bitsUsed, hashesUsed, matched);
            // identical siblings would let a different leaf set produce the same root
            if (Arrays.equals(left, right))
                throw new MalformedProofException("Proof contains identical sibling hashes");
        } else {
            right = left;
        }
        return Utils.merkleNodeHash(left, right);
    }

    private static void traverseAndBuild(int height, int pos, List<byte[]> leaves, boolean[] matches,
                                         List<Boolean> bits, List<byte[]> hashes) {
        boolean parentOfMatch = false;
        for (int p = pos << height; p < ((pos + 1) << height) && p < leaves.size(); p++)
            parentOfMatch |= matches[p];
        bits.add(parentOfMatch);
        if (height == 0 || !parentOfMatch) {
            hashes.add(calcHash(height, pos, leaves));
        } else {
            traverseAndBuild(height - 1, pos * 2, leaves, matches, bits, hashes);
            if (pos * 2 + 1 < treeWidth(leaves.size(), height - 1))
                traverseAndBuild(height - 1, pos * 2 + 1, leaves, matches, bits, hashes);
        }
    }

    private static byte[] calcHash(int height, int pos, List<byte[]> leaves) {
        if (height == 0)
            return leaves.get(pos);
        byte[] left = calcHash(height - 1, pos * 2, leaves);
        byte[] right = pos * 2 + 1 < treeWidth(leaves.size(), height - 1)
                ? calcHash(height - 1, pos * 2 + 1, leaves)
                : left;
        return Utils.merkleNodeHash(left, right);
    }

    private static int treeWidth(int leafCount, int height) {
        return (int) (((long) leafCount + (1L << height) - 1) >> height);
    }

    private static int treeHeight(int leafCount) {
        int height = 0;
        while (treeWidth(leafCount, height) > 1)
            height++;
        return height;
    }

    // Bits packed least significant first.
    public byte[] packedBits() {
        byte[] packed = new byte[(bits.size() + 7) / 8];
        for (int i = 0; i < bits.size(); i++) {
            if (bits.get(i))
                packed[i / 8] |= (byte) (1 << (i % 8));
        }
        return packed;
    }

    public static List<Boolean> unpackBits(byte[] packed) {
        List<Boolean> bits = new ArrayList<>(packed.length * 8);
        for (int i = 0; i < packed.length * 8; i++)
            bits.add((packed[i / 8] & (1 << (i % 8))) != 0);
        return bits;
    }
}
