package io.horizen.rawtx.sign;

import io.horizen.rawtx.entity.McCertificate;
import io.horizen.rawtx.entity.McCertificateSerializer;
import io.horizen.rawtx.entity.McEntity;
import io.horizen.rawtx.entity.McEntityType;
import io.horizen.rawtx.entity.McInput;
import io.horizen.rawtx.entity.McOutput;
import io.horizen.rawtx.entity.McTransaction;
import io.horizen.rawtx.utils.BytesUtils;
import io.horizen.rawtx.utils.Utils;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Legacy mainchain signature digest.
 * Certificates commit to their sidechain fields in place of the transaction version header.
 */
public final class SignatureHasher {
    private SignatureHasher() {}

    // uint256 value one, the digest of SIGHASH_SINGLE inputs without a matching output
    private static final byte[] ONE = new byte[Utils.SHA256_LENGTH];

    static {
        ONE[0] = 1;
    }

    public static byte[] hash(McEntity entity, int inputIndex, byte[] scriptCode, int hashType) {
        List<McInput> inputs = entity.inputs();
        List<McOutput> outputs = entity.outputs();
        if (inputIndex < 0 || inputIndex >= inputs.size())
            return ONE.clone();

        int baseType = hashType & SigHashType.BASE_TYPE_MASK;
        boolean anyoneCanPay = (hashType & SigHashType.ANYONECANPAY_FLAG) != 0;
        boolean hashNone = baseType == SigHashType.NONE_FLAG;
        boolean hashSingle = baseType == SigHashType.SINGLE_FLAG;

        if (hashSingle && inputIndex >= outputs.size())
            return ONE.clone();

        ByteArrayOutputStream stream = new ByteArrayOutputStream();

        McCertificate certificate = null;
        if (entity.type() == McEntityType.CERTIFICATE) {
            certificate = (McCertificate) entity;
            McCertificateSerializer.writeHeader(stream, certificate);
        } else {
            stream.writeBytes(BytesUtils.reversedIntBytes(entity.version()));
        }

        // inputs
        int inputsCount = anyoneCanPay ? 1 : inputs.size();
        stream.writeBytes(BytesUtils.toCompactSizeBytes(inputsCount));
        for (int i = 0; i < inputsCount; i++) {
            int idx = anyoneCanPay ? inputIndex : i;
            McInput input = inputs.get(idx);
            input.prevOut().writeTo(stream);
            BytesUtils.writeVarBytes(stream, idx == inputIndex ? scriptCode : new byte[0]);
            long sequence = (idx != inputIndex && (hashNone || hashSingle)) ? 0 : input.sequence();
            stream.writeBytes(BytesUtils.reversedIntBytes((int) sequence));
        }

        // outputs
        List<McOutput> committed = new ArrayList<>();
        if (hashSingle) {
            for (int i = 0; i < inputIndex; i++)
                committed.add(new McOutput(-1, new byte[0]));
            committed.add(outputs.get(inputIndex));
        } else if (!hashNone) {
            committed.addAll(outputs);
        }

        if (certificate == null) {
            writeOutputs(stream, committed);
            McTransaction tx = (McTransaction) entity;
            stream.writeBytes(BytesUtils.reversedIntBytes((int) tx.lockTime()));
            tx.shieldedData().ifPresent(data -> data.writeForSigning(stream));
        } else {
            int split = Math.min(committed.size(), certificate.firstBackwardTransferIndex());
            writeOutputs(stream, committed.subList(0, split));
            writeOutputs(stream, committed.subList(split, committed.size()));
        }

        stream.writeBytes(BytesUtils.reversedIntBytes(hashType));
        return Utils.doubleSHA256Hash(stream.toByteArray());
    }

    private static void writeOutputs(ByteArrayOutputStream stream, List<McOutput> outputs) {
        stream.writeBytes(BytesUtils.toCompactSizeBytes(outputs.size()));
        for (McOutput output : outputs)
            output.writeTo(stream);
    }
}
