package io.horizen.rawtx.api.rpc.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.horizen.rawtx.entity.BackwardTransferInfo;
import io.horizen.rawtx.entity.McOutput;

import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutputView {
    public final BigDecimal value;
    public final long valueZat;
    public final int n;
    public final ScriptView scriptPubKey;
    @JsonProperty("backward transfer")
    public final Boolean backwardTransfer;
    public final String pubkeyhash;

    public OutputView(McOutput output, int n) {
        this.value = ValueConverter.toCoins(output.value());
        this.valueZat = output.value();
        this.n = n;
        this.scriptPubKey = ScriptView.locking(output.lockingScript());
        this.backwardTransfer = null;
        this.pubkeyhash = null;
    }

    public OutputView(McOutput output, int n, BackwardTransferInfo backwardTransfer) {
        this.value = ValueConverter.toCoins(output.value());
        this.valueZat = output.value();
        this.n = n;
        this.scriptPubKey = ScriptView.locking(output.lockingScript());
        this.backwardTransfer = true;
        this.pubkeyhash = backwardTransfer.pubKeyHashHex();
    }
}
