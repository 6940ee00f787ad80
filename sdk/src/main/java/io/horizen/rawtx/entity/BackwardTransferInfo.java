package io.horizen.rawtx.entity;

import io.horizen.rawtx.utils.BytesUtils;

import java.util.Arrays;
import java.util.Optional;

/**
 * Destination of a backward transfer, decoded from its P2PKH locking script.
 * Decoding never fails: a script without a usable OP_HASH160 push yields a decode error marker.
 */
public final class BackwardTransferInfo {
    public static final String DECODE_ERROR = "<<Decode error>>";

    private static final byte OP_HASH160 = (byte) 0xa9;
    // OP_HASH160 followed by its push opcode
    private static final int PUBKEY_HASH_OFFSET = 2;

    private final long amount;
    private final byte[] pubKeyHash;

    private BackwardTransferInfo(long amount, byte[] pubKeyHash) {
        this.amount = amount;
        this.pubKeyHash = pubKeyHash;
    }

    public static BackwardTransferInfo decode(long amount, byte[] lockingScript) {
        for (int i = 0; i < lockingScript.length; i++) {
            if (lockingScript[i] == OP_HASH160) {
                int start = i + PUBKEY_HASH_OFFSET;
                if (start + BytesUtils.HASH160_LENGTH > lockingScript.length)
                    break;
                return new BackwardTransferInfo(amount,
                        Arrays.copyOfRange(lockingScript, start, start + BytesUtils.HASH160_LENGTH));
            }
        }
        return new BackwardTransferInfo(amount, null);
    }

    public long amount() {
        return amount;
    }

    public boolean isDecoded() {
        return pubKeyHash != null;
    }

    public Optional<byte[]> pubKeyHash() {
        return Optional.ofNullable(pubKeyHash).map(hash -> Arrays.copyOf(hash, hash.length));
    }

    // Hash shown byte-reversed, or the decode error marker.
    public String pubKeyHashHex() {
        return pubKeyHash == null ? DECODE_ERROR : BytesUtils.toHexString(BytesUtils.reverseBytes(pubKeyHash));
    }
}
