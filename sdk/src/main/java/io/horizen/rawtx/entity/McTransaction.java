package io.horizen.rawtx.entity;

import io.horizen.rawtx.utils.BytesUtils;
import io.horizen.rawtx.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public final class McTransaction implements McEntity {
    public static final int TRANSPARENT_TX_VERSION = 1;
    public static final int PHGR_TX_VERSION = 2;
    public static final int GROTH_TX_VERSION = -3;

    private final int version;
    private final List<McInput> inputs;
    private final List<McOutput> outputs;
    private final long lockTime;
    private final ShieldedData shieldedData;

    public McTransaction(int version, List<McInput> inputs, List<McOutput> outputs, long lockTime, ShieldedData shieldedData) {
        if (!isSupportedVersion(version))
            throw new IllegalArgumentException(String.format("Unsupported transaction version %d", version));
        if (hasShieldedData(version) && shieldedData == null)
            throw new IllegalArgumentException("Shielded data expected for transaction version " + version);
        this.version = version;
        this.inputs = new ArrayList<>(inputs);
        this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
        this.lockTime = lockTime;
        this.shieldedData = hasShieldedData(version) ? shieldedData : null;
    }

    public McTransaction(List<McInput> inputs, List<McOutput> outputs, long lockTime) {
        this(TRANSPARENT_TX_VERSION, inputs, outputs, lockTime, null);
    }

    public static boolean isSupportedVersion(int version) {
        return version == TRANSPARENT_TX_VERSION || hasShieldedData(version);
    }

    static boolean hasShieldedData(int version) {
        return version == PHGR_TX_VERSION || version == GROTH_TX_VERSION;
    }

    @Override
    public McEntityType type() {
        return McEntityType.TRANSACTION;
    }

    @Override
    public int version() {
        return version;
    }

    @Override
    public List<McInput> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    @Override
    public List<McOutput> outputs() {
        return outputs;
    }

    public long lockTime() {
        return lockTime;
    }

    public Optional<ShieldedData> shieldedData() {
        return Optional.ofNullable(shieldedData);
    }

    @Override
    public byte[] bytes() {
        return McTransactionSerializer.getSerializer().toBytes(this);
    }

    @Override
    public byte[] id() {
        return BytesUtils.reverseBytes(Utils.doubleSHA256Hash(bytes()));
    }

    @Override
    public String idHex() {
        return BytesUtils.toHexString(id());
    }

    @Override
    public McTransaction copy() {
        List<McInput> inputsCopy = new ArrayList<>(inputs.size());
        for (McInput input : inputs)
            inputsCopy.add(input.copy());
        return new McTransaction(version, inputsCopy, outputs, lockTime, shieldedData);
    }

    @Override
    public String toString() {
        return String.format("McTransaction(id=%s, version=%d, inputs=%d, outputs=%d)", idHex(), version, inputs.size(), outputs.size());
    }
}
