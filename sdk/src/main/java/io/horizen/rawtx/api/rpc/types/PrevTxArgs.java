package io.horizen.rawtx.api.rpc.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Previous output described by the caller: {"txid": "...", "vout": 0, "scriptPubKey": "...", "redeemScript": "..."}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PrevTxArgs {
    public final String txid;
    public final long vout;
    public final String scriptPubKey;
    public final String redeemScript;

    @JsonCreator
    public PrevTxArgs(
        @JsonProperty("txid") String txid,
        @JsonProperty("vout") Long vout,
        @JsonProperty("scriptPubKey") String scriptPubKey,
        @JsonProperty("redeemScript") String redeemScript
    ) {
        if (txid == null || vout == null || scriptPubKey == null)
            throw new IllegalArgumentException("Missing txid, vout or scriptPubKey in previous output");
        this.txid = txid;
        this.vout = vout;
        this.scriptPubKey = scriptPubKey;
        this.redeemScript = redeemScript;
    }
}
