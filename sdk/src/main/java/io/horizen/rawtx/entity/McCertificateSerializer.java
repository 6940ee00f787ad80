package io.horizen.rawtx.entity;

import io.horizen.rawtx.utils.BytesReader;
import io.horizen.rawtx.utils.BytesUtils;

import java.io.ByteArrayOutputStream;
import java.util.List;

public final class McCertificateSerializer {

    private static final McCertificateSerializer serializer = new McCertificateSerializer();

    private McCertificateSerializer() {
        super();
    }

    public static McCertificateSerializer getSerializer() {
        return serializer;
    }

    public byte[] toBytes(McCertificate cert) {
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        writeHeader(stream, cert);
        EntityCodec.writeInputs(stream, cert.inputs());
        EntityCodec.writeOutputs(stream, cert.regularOutputs());
        EntityCodec.writeOutputs(stream, cert.backwardTransferOutputs());
        return stream.toByteArray();
    }

    // Certificate specific fields, also committed by the signature digest.
    public static void writeHeader(ByteArrayOutputStream stream, McCertificate cert) {
        stream.writeBytes(BytesUtils.reversedIntBytes(cert.version()));
        stream.writeBytes(BytesUtils.reverseBytes(cert.scId()));
        stream.writeBytes(BytesUtils.reversedIntBytes(cert.epochNumber()));
        stream.writeBytes(BytesUtils.reversedLongBytes(cert.quality()));
        stream.writeBytes(BytesUtils.reverseBytes(cert.endEpochBlockHash()));
        stream.writeBytes(cert.scProof());
    }

    public McCertificate parseBytes(byte[] bytes) {
        BytesReader reader = new BytesReader(bytes);
        McCertificate cert = parse(reader);
        if (reader.hasRemaining())
            throw new IllegalArgumentException(String.format("Found %d extra byte(s) after certificate", reader.remaining()));
        return cert;
    }

    public McCertificate parse(BytesReader reader) {
        int version = reader.readInt();
        if (version != McCertificate.SC_CERT_VERSION)
            throw new IllegalArgumentException(String.format("Unsupported certificate version %d", version));

        byte[] scId = reader.readHash();
        int epochNumber = reader.readInt();
        long quality = reader.readLong();
        byte[] endEpochBlockHash = reader.readHash();
        byte[] scProof = reader.readBytes(McCertificate.SC_PROOF_SIZE);
        List<McInput> inputs = EntityCodec.parseInputs(reader);
        List<McOutput> outputs = EntityCodec.parseOutputs(reader);
        List<McOutput> backwardTransfers = EntityCodec.parseOutputs(reader);

        return new McCertificate(scId, epochNumber, quality, endEpochBlockHash, scProof, inputs, outputs, backwardTransfers);
    }
}
