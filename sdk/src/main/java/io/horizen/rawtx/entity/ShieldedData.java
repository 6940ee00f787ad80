package io.horizen.rawtx.entity;

import io.horizen.rawtx.utils.BytesReader;
import io.horizen.rawtx.utils.BytesUtils;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Joinsplit descriptions of a shielded transaction. The content is never interpreted:
 * it is carried through decoding, signing and re-encoding unchanged.
 */
public final class ShieldedData {
    public static final int PHGR_JOINSPLIT_SIZE = 1802;
    public static final int GROTH_JOINSPLIT_SIZE = 1698;
    public static final int JOINSPLIT_PUBKEY_SIZE = 32;
    public static final int JOINSPLIT_SIG_SIZE = 64;

    private final List<byte[]> joinSplits;
    private final byte[] joinSplitPubKey;
    private final byte[] joinSplitSig;

    public ShieldedData(List<byte[]> joinSplits, byte[] joinSplitPubKey, byte[] joinSplitSig) {
        this.joinSplits = Collections.unmodifiableList(new ArrayList<>(joinSplits));
        this.joinSplitPubKey = Arrays.copyOf(joinSplitPubKey, joinSplitPubKey.length);
        this.joinSplitSig = Arrays.copyOf(joinSplitSig, joinSplitSig.length);
    }

    public static ShieldedData empty() {
        return new ShieldedData(Collections.emptyList(), new byte[JOINSPLIT_PUBKEY_SIZE], new byte[JOINSPLIT_SIG_SIZE]);
    }

    public int joinSplitsCount() {
        return joinSplits.size();
    }

    public void writeTo(ByteArrayOutputStream stream) {
        write(stream, joinSplitSig);
    }

    // The joinsplit signature commits to the transparent part, so digests are computed with a blank one.
    public void writeForSigning(ByteArrayOutputStream stream) {
        write(stream, new byte[JOINSPLIT_SIG_SIZE]);
    }

    private void write(ByteArrayOutputStream stream, byte[] signature) {
        stream.writeBytes(BytesUtils.toCompactSizeBytes(joinSplits.size()));
        for (byte[] joinSplit : joinSplits)
            stream.writeBytes(joinSplit);
        if (!joinSplits.isEmpty()) {
            stream.writeBytes(joinSplitPubKey);
            stream.writeBytes(signature);
        }
    }

    static ShieldedData parse(BytesReader reader, int joinSplitSize) {
        long count = reader.readCompactSize();
        List<byte[]> joinSplits = new ArrayList<>();
        for (long i = 0; i < count; i++)
            joinSplits.add(reader.readBytes(joinSplitSize));
        if (count == 0)
            return empty();
        byte[] pubKey = reader.readBytes(JOINSPLIT_PUBKEY_SIZE);
        byte[] sig = reader.readBytes(JOINSPLIT_SIG_SIZE);
        return new ShieldedData(joinSplits, pubKey, sig);
    }
}
