package io.horizen.rawtx.api.rpc.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.horizen.rawtx.entity.McTransaction;
import io.horizen.rawtx.utils.BytesUtils;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RawTransactionView extends TransactionView {
    public final String hex;
    // Absent while the transaction is in the mempool.
    public final String blockhash;

    public RawTransactionView(McTransaction tx, String blockHash) {
        super(tx);
        this.hex = BytesUtils.toHexString(tx.bytes());
        this.blockhash = blockHash;
    }
}
