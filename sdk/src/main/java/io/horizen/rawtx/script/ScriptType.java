package io.horizen.rawtx.script;

public enum ScriptType {
    NONSTANDARD("nonstandard"),
    PUBKEY("pubkey"),
    PUBKEYHASH("pubkeyhash"),
    PUBKEYHASH_REPLAY("pubkeyhashreplay"),
    SCRIPTHASH("scripthash"),
    SCRIPTHASH_REPLAY("scripthashreplay"),
    MULTISIG("multisig"),
    NULL_DATA("nulldata");

    private final String name;

    ScriptType(String name) {
        this.name = name;
    }

    public String typeName() {
        return name;
    }

    public boolean isPayToScriptHash() {
        return this == SCRIPTHASH || this == SCRIPTHASH_REPLAY;
    }

    public boolean isPayToPubKeyHash() {
        return this == PUBKEYHASH || this == PUBKEYHASH_REPLAY;
    }
}
