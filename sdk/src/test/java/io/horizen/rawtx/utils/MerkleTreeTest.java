package io.horizen.rawtx.utils;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class MerkleTreeTest {

    // Test data receive from https://webbtc.com/block/000000000000000002775ff227222f47a46cad46b0f634db53c1a8737d7ecd41.json
    private static final String[] TRANSACTION_HASHES = {
            "b82c849c6abcd1ad17f4457333afc45723557348d2dda6974363253223b0f378",
            "1f4341337dde3bde02ba32919f12b0e73d668f26eaa8ca0e12ab2cff6e29a24e",
            "974f803832125b4dcc7ee9226e57cd9c39792663fdbd34ce63f2f6d052b3cf15",
            "2d9b08361ac900cb55c71516c513db868f38536ebac65c6de16e6db26367c970",
            "95ca7ba2319b55818eab3f20a6cc9b973f597204fb4632c717086a10f97211dc",
            "198dd7904fc9834464229bf4032b9487da096bb91e9c7ab0b40274fdd767015c",
            "23257ef24076bf37fcc6116ee0e94adebea09156424c98030e061e5206ac6ab9",
            "8e41093f3d767eae5d90ae8ddda0b5873d3587ed5be02d3875a1bee01cec1c06",
            "8e97b4a311d2c58c019e93e9f943156fcef7dfd78973515d8f284f1b410158ba"
    };

    private static List<byte[]> hashes() {
        ArrayList<byte[]> hashesAsBytes = new ArrayList<>();
        for (String s : TRANSACTION_HASHES)
            hashesAsBytes.add(BytesUtils.fromHexString(s));
        return hashesAsBytes;
    }

    @Test
    public void MerkleTreeTest_createMerkleTree() {
        MerkleTree merkleTree = MerkleTree.createMerkleTree(hashes());

        assertEquals("Leaves number expected to be equal", TRANSACTION_HASHES.length, merkleTree.leavesNumber());
        List<byte[]> actualLeaves = merkleTree.leaves();
        for (int i = 0; i < actualLeaves.size(); i++)
            assertEquals(String.format("Leaves expected to be equal. Leaf %d is different.", i),
                    TRANSACTION_HASHES[i], BytesUtils.toHexString(actualLeaves.get(i)));

        assertEquals("Calculated Merkle root should be the same as expected one",
                "29d000eee85f08b6482026be2d92d081d6f9418346e6b2e9fe2e9b985f24ed1e",
                BytesUtils.toHexString(merkleTree.rootHash()));
        assertFalse("Tree is not expected to be mutated", merkleTree.isMutated());
    }

    @Test
    public void MerkleTreeTest_singleLeaf() {
        byte[] leaf = BytesUtils.fromHexString(TRANSACTION_HASHES[0]);
        MerkleTree merkleTree = MerkleTree.createMerkleTree(Arrays.asList(leaf));

        assertArrayEquals("Root of a single leaf tree is the leaf itself", leaf, merkleTree.rootHash());
    }

    @Test
    public void MerkleTreeTest_mutatedTree() {
        List<byte[]> leaves = hashes().subList(0, 6);
        List<byte[]> duplicated = new ArrayList<>(leaves);
        duplicated.add(leaves.get(4));
        duplicated.add(leaves.get(5));

        MerkleTree original = MerkleTree.createMerkleTree(leaves);
        MerkleTree mutated = MerkleTree.createMerkleTree(duplicated);

        assertArrayEquals("Duplicated tail produces the same root", original.rootHash(), mutated.rootHash());
        assertFalse(original.isMutated());
        assertTrue(mutated.isMutated());
    }

    @Test(expected = IllegalArgumentException.class)
    public void MerkleTreeTest_noLeaves() {
        MerkleTree.createMerkleTree(new ArrayList<>());
    }
}
