package io.horizen.rawtx.block;

import io.horizen.rawtx.entity.McEntity;
import io.horizen.rawtx.utils.BytesUtils;
import io.horizen.rawtx.utils.MerkleTree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Block as seen by the proof engines: its header and the ordered ids of the entities it contains
 * (transactions first, then certificates).
 */
public final class McBlock {
    public static final int BLOCK_VERSION = 4;

    private final McBlockHeader header;
    private final List<byte[]> entityIds;

    public McBlock(McBlockHeader header, List<byte[]> entityIds) {
        if (entityIds.isEmpty())
            throw new IllegalArgumentException("Block must contain at least one entity");
        this.header = header;
        List<byte[]> ids = new ArrayList<>(entityIds.size());
        for (byte[] id : entityIds)
            ids.add(Arrays.copyOf(id, id.length));
        this.entityIds = Collections.unmodifiableList(ids);
    }

    // Builds a block on top of the given parent, with a header committing to the entities' Merkle root.
    public static McBlock create(byte[] hashPrevBlock, List<? extends McEntity> entities, long time) {
        List<byte[]> ids = new ArrayList<>(entities.size());
        for (McEntity entity : entities)
            ids.add(entity.id());
        byte[] merkleRoot = MerkleTree.createMerkleTree(ids).rootHash();
        McBlockHeader header = new McBlockHeader(BLOCK_VERSION, hashPrevBlock, merkleRoot,
                new byte[BytesUtils.HASH_LENGTH], time, 0x1f07ffffL, new byte[McBlockHeader.NONCE_LENGTH], new byte[0]);
        return new McBlock(header, ids);
    }

    public McBlockHeader header() {
        return header;
    }

    public byte[] hash() {
        return header.hash();
    }

    public List<byte[]> entityIds() {
        return entityIds;
    }

    public int indexOf(byte[] entityId) {
        for (int i = 0; i < entityIds.size(); i++) {
            if (Arrays.equals(entityIds.get(i), entityId))
                return i;
        }
        return -1;
    }
}
