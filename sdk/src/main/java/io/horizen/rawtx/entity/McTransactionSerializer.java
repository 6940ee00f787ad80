package io.horizen.rawtx.entity;

import io.horizen.rawtx.utils.BytesReader;
import io.horizen.rawtx.utils.BytesUtils;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

public final class McTransactionSerializer {

    private static final McTransactionSerializer serializer = new McTransactionSerializer();

    private McTransactionSerializer() {
        super();
    }

    public static McTransactionSerializer getSerializer() {
        return serializer;
    }

    public byte[] toBytes(McTransaction tx) {
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        stream.writeBytes(BytesUtils.reversedIntBytes(tx.version()));
        EntityCodec.writeInputs(stream, tx.inputs());
        EntityCodec.writeOutputs(stream, tx.outputs());
        stream.writeBytes(BytesUtils.reversedIntBytes((int) tx.lockTime()));
        tx.shieldedData().ifPresent(data -> data.writeTo(stream));
        return stream.toByteArray();
    }

    public McTransaction parseBytes(byte[] bytes) {
        BytesReader reader = new BytesReader(bytes);
        McTransaction tx = parse(reader);
        if (reader.hasRemaining())
            throw new IllegalArgumentException(String.format("Found %d extra byte(s) after transaction", reader.remaining()));
        return tx;
    }

    // Reads one transaction at the current reader position.
    public McTransaction parse(BytesReader reader) {
        int version = reader.readInt();
        if (!McTransaction.isSupportedVersion(version))
            throw new IllegalArgumentException(String.format("Unsupported transaction version %d", version));

        List<McInput> inputs = EntityCodec.parseInputs(reader);
        List<McOutput> outputs = EntityCodec.parseOutputs(reader);
        long lockTime = reader.readUnsignedInt();

        ShieldedData shieldedData = null;
        if (McTransaction.hasShieldedData(version)) {
            int joinSplitSize = version == McTransaction.GROTH_TX_VERSION
                    ? ShieldedData.GROTH_JOINSPLIT_SIZE
                    : ShieldedData.PHGR_JOINSPLIT_SIZE;
            shieldedData = ShieldedData.parse(reader, joinSplitSize);
        }
        return new McTransaction(version, inputs, outputs, lockTime, shieldedData);
    }

    // Concatenated transactions, the way several signed variants are passed around.
    public List<McTransaction> parseAll(byte[] bytes) {
        BytesReader reader = new BytesReader(bytes);
        List<McTransaction> txs = new ArrayList<>();
        while (reader.hasRemaining())
            txs.add(parse(reader));
        if (txs.isEmpty())
            throw new IllegalArgumentException("Missing transaction");
        return txs;
    }
}
