package io.horizen.rawtx.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Full Merkle tree over the ordered entity ids of a mainchain block.
 * All node hashes are kept in display (reversed) byte order.
 */
public final class MerkleTree
{
    public static final int ROOT_HASH_LENGTH = 32;

    private final int leavesNumber;
    private final List<byte[]> merkleTree;
    private final boolean isMutated;

    private MerkleTree(int leavesNumber, List<byte[]> merkleTree, boolean isMutated) {
        this.leavesNumber = leavesNumber;
        this.merkleTree = merkleTree;
        this.isMutated = isMutated;
    }

    /* Note: follows the ZenCore CBlock::BuildMerkleTree method.

       If the number of hashes on a level is odd, the last one is duplicated
       before computing the next level. This makes [1,2,3,4,5,6] and
       [1,2,3,4,5,6,5,6] produce the same root (CVE-2012-2459), so two
       identical hashes at the end of a level mark the tree as mutated.
    */
    public static MerkleTree createMerkleTree(List<byte[]> leavesHashes) {
        if(leavesHashes == null || leavesHashes.isEmpty())
            throw new IllegalArgumentException("Non leaves provided. Merkle Tree can not be calculated.");

        ArrayList<byte[]> merkleTree = new ArrayList<>(leavesHashes);

        // offset in a merkleTree list.
        int offset = 0;
        // number of nodes on current level.
        int levelSize = merkleTree.size();
        boolean isMutated = false;

        // Note: Root level size is 1
        while(levelSize > 1) {
            for (int left = 0; left < levelSize; left += 2) {
                // Right can be the same as left if we have an odd number of nodes on the level.
                int right = Math.min(left + 1, levelSize - 1);
                byte[] leftBytes = merkleTree.get(offset + left);
                byte[] rightBytes = merkleTree.get(offset + right);

                if(right == left + 1 && right + 1 == levelSize && Arrays.equals(leftBytes, rightBytes)) {
                    isMutated = true;
                }
                merkleTree.add(Utils.merkleNodeHash(leftBytes, rightBytes));
            }
            offset += levelSize;
            levelSize = (levelSize + 1) / 2;
        }

        return new MerkleTree(leavesHashes.size(), merkleTree, isMutated);
    }

    public byte[] rootHash() {
        return merkleTree.get(merkleTree.size() - 1);
    }

    public int leavesNumber() {
        return leavesNumber;
    }

    public List<byte[]> leaves() {
        return merkleTree.subList(0, leavesNumber);
    }

    public boolean isMutated() {
        return isMutated;
    }
}
