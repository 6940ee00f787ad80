package io.horizen.rawtx.chain;

/**
 * A {@link ChainStateView} that holds the chain state read lock until closed.
 */
public interface ChainStateSnapshot extends ChainStateView, AutoCloseable {

    @Override
    void close();
}
