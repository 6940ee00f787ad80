package io.horizen.rawtx.chain;

import io.horizen.rawtx.block.McBlock;
import io.horizen.rawtx.entity.McEntity;
import io.horizen.rawtx.entity.McInput;
import io.horizen.rawtx.entity.McOutput;
import io.horizen.rawtx.entity.OutPoint;
import io.horizen.rawtx.utils.ByteArrayWrapper;
import io.horizen.rawtx.utils.BytesUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Chain and mempool state kept in memory.
 * Writers take the write lock, readers go through {@link #openSnapshot()} which holds the read lock
 * until the snapshot is closed.
 */
public class InMemoryChainState implements ChainStateProvider {
    private static final Logger logger = LogManager.getLogger();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final List<ByteArrayWrapper> bestChain = new ArrayList<>();
    private final Map<ByteArrayWrapper, McBlock> blocks = new HashMap<>();
    private final Map<ByteArrayWrapper, BlockUndo> undoData = new HashMap<>();
    private final Map<ByteArrayWrapper, ByteArrayWrapper> entityToBlock = new HashMap<>();
    private final Map<ByteArrayWrapper, McEntity> confirmed = new HashMap<>();
    private final Map<OutPoint, ResolvedOutput> utxos = new HashMap<>();
    private final Map<ByteArrayWrapper, McEntity> mempool = new LinkedHashMap<>();

    private static final class BlockUndo {
        final Map<OutPoint, ResolvedOutput> spent = new HashMap<>();
        final List<OutPoint> created = new ArrayList<>();
    }

    /**
     * Appends a block with the given entities to the best chain.
     * Inputs spend their outputs from the UTXO set and the entities leave the mempool.
     */
    public McBlock connectBlock(List<? extends McEntity> entities, long time) {
        lock.writeLock().lock();
        try {
            byte[] prevHash = bestChain.isEmpty()
                    ? new byte[BytesUtils.HASH_LENGTH]
                    : bestChain.get(bestChain.size() - 1).data();
            McBlock block = McBlock.create(prevHash, entities, time);
            ByteArrayWrapper blockHash = new ByteArrayWrapper(block.hash());

            BlockUndo undo = new BlockUndo();
            for (McEntity entity : entities) {
                for (McInput input : entity.inputs()) {
                    ResolvedOutput spent = utxos.remove(input.prevOut());
                    if (spent != null)
                        undo.spent.put(input.prevOut(), spent);
                }
                List<McOutput> outputs = entity.outputs();
                for (int i = 0; i < outputs.size(); i++) {
                    OutPoint outPoint = new OutPoint(entity.id(), i);
                    utxos.put(outPoint, new ResolvedOutput(outputs.get(i).value(), outputs.get(i).lockingScript()));
                    undo.created.add(outPoint);
                }
                ByteArrayWrapper entityId = new ByteArrayWrapper(entity.id());
                entityToBlock.put(entityId, blockHash);
                confirmed.put(entityId, entity.copy());
                mempool.remove(entityId);
            }

            blocks.put(blockHash, block);
            undoData.put(blockHash, undo);
            bestChain.add(blockHash);
            logger.debug("Connected block {} at height {} with {} entities",
                    block.header().hashHex(), bestChain.size() - 1, entities.size());
            return block;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes the tip from the best chain and restores the outputs it spent.
     * The block stays known, so it can still be loaded but is no longer on the best chain.
     */
    public McBlock disconnectTip() {
        lock.writeLock().lock();
        try {
            if (bestChain.isEmpty())
                throw new IllegalStateException("Chain is empty");
            ByteArrayWrapper blockHash = bestChain.remove(bestChain.size() - 1);
            McBlock block = blocks.get(blockHash);
            BlockUndo undo = undoData.remove(blockHash);
            for (OutPoint created : undo.created)
                utxos.remove(created);
            utxos.putAll(undo.spent);
            for (byte[] entityId : block.entityIds()) {
                ByteArrayWrapper id = new ByteArrayWrapper(entityId);
                entityToBlock.remove(id);
                confirmed.remove(id);
            }
            logger.debug("Disconnected block {}", block.header().hashHex());
            return block;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void addToMempool(McEntity entity) {
        lock.writeLock().lock();
        try {
            mempool.put(new ByteArrayWrapper(entity.id()), entity);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean removeFromMempool(byte[] entityId) {
        lock.writeLock().lock();
        try {
            return mempool.remove(new ByteArrayWrapper(entityId)) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int height() {
        lock.readLock().lock();
        try {
            return bestChain.size() - 1;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ChainStateSnapshot openSnapshot() {
        return new Snapshot();
    }

    private final class Snapshot implements ChainStateSnapshot {
        private boolean closed = false;

        Snapshot() {
            lock.readLock().lock();
        }

        @Override
        public Optional<ResolvedOutput> resolveOutput(byte[] entityId, long index) {
            checkOpen();
            McEntity pending = mempool.get(new ByteArrayWrapper(entityId));
            if (pending != null) {
                List<McOutput> outputs = pending.outputs();
                if (index < 0 || index >= outputs.size())
                    return Optional.empty();
                McOutput output = outputs.get((int) index);
                return Optional.of(new ResolvedOutput(output.value(), output.lockingScript()));
            }
            if (index < 0 || index > OutPoint.MAX_INDEX)
                return Optional.empty();
            return Optional.ofNullable(utxos.get(new OutPoint(entityId, index)));
        }

        @Override
        public Optional<McEntity> loadEntity(byte[] entityId) {
            checkOpen();
            ByteArrayWrapper id = new ByteArrayWrapper(entityId);
            McEntity entity = mempool.get(id);
            if (entity == null)
                entity = confirmed.get(id);
            return Optional.ofNullable(entity).map(McEntity::copy);
        }

        @Override
        public Optional<byte[]> blockContaining(byte[] entityId) {
            checkOpen();
            return Optional.ofNullable(entityToBlock.get(new ByteArrayWrapper(entityId)))
                    .map(hash -> Arrays.copyOf(hash.data(), hash.size()));
        }

        @Override
        public Optional<McBlock> loadBlock(byte[] blockHash) {
            checkOpen();
            return Optional.ofNullable(blocks.get(new ByteArrayWrapper(blockHash)));
        }

        @Override
        public boolean isOnBestChain(byte[] blockHash) {
            checkOpen();
            ByteArrayWrapper hash = new ByteArrayWrapper(blockHash);
            return blocks.containsKey(hash) && bestChain.contains(hash);
        }

        private void checkOpen() {
            if (closed)
                throw new IllegalStateException("Chain state snapshot is closed");
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                lock.readLock().unlock();
            }
        }
    }
}
