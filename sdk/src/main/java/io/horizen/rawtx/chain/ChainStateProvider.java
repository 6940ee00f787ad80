package io.horizen.rawtx.chain;

public interface ChainStateProvider {

    ChainStateSnapshot openSnapshot();
}
