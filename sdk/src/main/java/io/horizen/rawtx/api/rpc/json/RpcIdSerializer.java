package io.horizen.rawtx.api.rpc.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.horizen.rawtx.api.rpc.request.RpcId;

import java.io.IOException;

// Writes the id back with the type it was received with.
public class RpcIdSerializer extends JsonSerializer<RpcId> {
    @Override
    public void serialize(RpcId id, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        if (id.isNone())
            jsonGenerator.writeNull();
        else if (id.getLongId() != null)
            jsonGenerator.writeNumber(id.getLongId());
        else
            jsonGenerator.writeString(id.getStringId());
    }
}
