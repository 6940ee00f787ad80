package io.horizen.rawtx.api.rpc.types;

import io.horizen.rawtx.entity.McInput;

public class InputView {
    public final String txid;
    public final long vout;
    public final ScriptView scriptSig;
    public final long sequence;

    public InputView(McInput input) {
        this.txid = input.prevOut().entityIdHex();
        this.vout = input.prevOut().index();
        this.scriptSig = ScriptView.unlocking(input.unlockingScript());
        this.sequence = input.sequence();
    }
}
