package io.horizen.rawtx.entity;

import io.horizen.rawtx.utils.BytesUtils;
import io.horizen.rawtx.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Sidechain withdrawal certificate.
 * Outputs are kept as one list: regular outputs first, backward transfers from
 * {@link #firstBackwardTransferIndex()} onwards.
 */
public final class McCertificate implements McEntity {
    public static final int SC_CERT_VERSION = -5;
    public static final int SC_PROOF_SIZE = 771;

    private final byte[] scId;
    private final int epochNumber;
    private final long quality;
    private final byte[] endEpochBlockHash;
    private final byte[] scProof;
    private final List<McInput> inputs;
    private final List<McOutput> outputs;
    private final int firstBackwardTransferIndex;

    public McCertificate(byte[] scId,
                         int epochNumber,
                         long quality,
                         byte[] endEpochBlockHash,
                         byte[] scProof,
                         List<McInput> inputs,
                         List<McOutput> regularOutputs,
                         List<McOutput> backwardTransferOutputs) {
        checkLength(scId, BytesUtils.HASH_LENGTH, "scId");
        checkLength(endEpochBlockHash, BytesUtils.HASH_LENGTH, "endEpochBlockHash");
        checkLength(scProof, SC_PROOF_SIZE, "scProof");
        if (epochNumber < 0)
            throw new IllegalArgumentException("Invalid cert epochNumber parameter: must be non negative");
        if (quality < 0)
            throw new IllegalArgumentException("Invalid cert quality parameter: must be non negative");

        this.scId = Arrays.copyOf(scId, scId.length);
        this.epochNumber = epochNumber;
        this.quality = quality;
        this.endEpochBlockHash = Arrays.copyOf(endEpochBlockHash, endEpochBlockHash.length);
        this.scProof = Arrays.copyOf(scProof, scProof.length);
        this.inputs = new ArrayList<>(inputs);
        List<McOutput> allOutputs = new ArrayList<>(regularOutputs);
        allOutputs.addAll(backwardTransferOutputs);
        this.outputs = Collections.unmodifiableList(allOutputs);
        this.firstBackwardTransferIndex = regularOutputs.size();
    }

    private static void checkLength(byte[] value, int expected, String name) {
        if (value == null || value.length != expected)
            throw new IllegalArgumentException(String.format("Invalid %s length, %d expected, %d found",
                    name, expected, value == null ? 0 : value.length));
    }

    @Override
    public McEntityType type() {
        return McEntityType.CERTIFICATE;
    }

    @Override
    public int version() {
        return SC_CERT_VERSION;
    }

    @Override
    public List<McInput> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    @Override
    public List<McOutput> outputs() {
        return outputs;
    }

    public byte[] scId() {
        return Arrays.copyOf(scId, scId.length);
    }

    public int epochNumber() {
        return epochNumber;
    }

    public long quality() {
        return quality;
    }

    public byte[] endEpochBlockHash() {
        return Arrays.copyOf(endEpochBlockHash, endEpochBlockHash.length);
    }

    public byte[] scProof() {
        return Arrays.copyOf(scProof, scProof.length);
    }

    public int firstBackwardTransferIndex() {
        return firstBackwardTransferIndex;
    }

    public List<McOutput> regularOutputs() {
        return outputs.subList(0, firstBackwardTransferIndex);
    }

    public List<McOutput> backwardTransferOutputs() {
        return outputs.subList(firstBackwardTransferIndex, outputs.size());
    }

    public boolean isBackwardTransfer(int outputIndex) {
        return outputIndex >= firstBackwardTransferIndex && outputIndex < outputs.size();
    }

    // Empty if the output at the given index is not a backward transfer.
    public Optional<BackwardTransferInfo> backwardTransferInfo(int outputIndex) {
        if (!isBackwardTransfer(outputIndex))
            return Optional.empty();
        McOutput output = outputs.get(outputIndex);
        return Optional.of(BackwardTransferInfo.decode(output.value(), output.lockingScript()));
    }

    public long backwardTransfersTotalAmount() {
        long total = 0;
        for (McOutput output : backwardTransferOutputs())
            total = Math.addExact(total, output.value());
        return total;
    }

    @Override
    public byte[] bytes() {
        return McCertificateSerializer.getSerializer().toBytes(this);
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
    public McCertificate copy() {
        List<McInput> inputsCopy = new ArrayList<>(inputs.size());
        for (McInput input : inputs)
            inputsCopy.add(input.copy());
        return new McCertificate(scId, epochNumber, quality, endEpochBlockHash, scProof,
                inputsCopy, regularOutputs(), backwardTransferOutputs());
    }

    @Override
    public String toString() {
        return String.format("McCertificate(id=%s, scId=%s, epoch=%d, quality=%d, inputs=%d, outputs=%d, bwts=%d)",
                idHex(), BytesUtils.toHexString(scId), epochNumber, quality, inputs.size(),
                firstBackwardTransferIndex, outputs.size() - firstBackwardTransferIndex);
    }
}
