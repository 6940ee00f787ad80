package io.horizen.rawtx.api.rpc.types;

import io.horizen.rawtx.entity.McOutput;
import io.horizen.rawtx.entity.McTransaction;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class TransactionView {
    public final String txid;
    public final int version;
    public final long locktime;
    public final List<InputView> vin;
    public final List<OutputView> vout;

    public TransactionView(McTransaction tx) {
        this.txid = tx.idHex();
        this.version = tx.version();
        this.locktime = tx.lockTime();
        this.vin = tx.inputs().stream().map(InputView::new).collect(Collectors.toList());
        List<McOutput> outputs = tx.outputs();
        this.vout = new ArrayList<>(outputs.size());
        for (int i = 0; i < outputs.size(); i++)
            this.vout.add(new OutputView(outputs.get(i), i));
    }
}
