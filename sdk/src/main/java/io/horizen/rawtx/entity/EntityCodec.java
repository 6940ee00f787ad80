package io.horizen.rawtx.entity;

import io.horizen.rawtx.utils.BytesReader;
import io.horizen.rawtx.utils.BytesUtils;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

// Vector encodings shared by transactions and certificates.
final class EntityCodec {
    private EntityCodec() {}

    static void writeInputs(ByteArrayOutputStream stream, List<McInput> inputs) {
        stream.writeBytes(BytesUtils.toCompactSizeBytes(inputs.size()));
        for (McInput input : inputs)
            input.writeTo(stream);
    }

    static void writeOutputs(ByteArrayOutputStream stream, List<McOutput> outputs) {
        stream.writeBytes(BytesUtils.toCompactSizeBytes(outputs.size()));
        for (McOutput output : outputs)
            output.writeTo(stream);
    }

    static List<McInput> parseInputs(BytesReader reader) {
        long count = reader.readCompactSize();
        List<McInput> inputs = new ArrayList<>();
        for (long i = 0; i < count; i++)
            inputs.add(McInput.parse(reader));
        return inputs;
    }

    static List<McOutput> parseOutputs(BytesReader reader) {
        long count = reader.readCompactSize();
        List<McOutput> outputs = new ArrayList<>();
        for (long i = 0; i < count; i++) {
            McOutput output = McOutput.parse(reader);
            if (output.value() < 0)
                throw new IllegalArgumentException("Output value is negative");
            outputs.add(output);
        }
        return outputs;
    }
}
