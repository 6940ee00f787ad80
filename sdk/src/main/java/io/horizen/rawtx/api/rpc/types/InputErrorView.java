package io.horizen.rawtx.api.rpc.types;

import io.horizen.rawtx.combine.InputError;
import io.horizen.rawtx.utils.BytesUtils;

public class InputErrorView {
    public final String txid;
    public final long vout;
    public final String scriptSig;
    public final long sequence;
    public final String error;

    public InputErrorView(InputError inputError) {
        this.txid = inputError.priorIdHex();
        this.vout = inputError.outputIndex();
        this.scriptSig = BytesUtils.toHexString(inputError.unlockingScript());
        this.sequence = inputError.sequence();
        this.error = inputError.error();
    }
}
