package io.horizen.rawtx.api.rpc.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public class RawTxJsonMapper {

    private static final ObjectMapper mapper;

    static {
        mapper = new ObjectMapper();
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    private RawTxJsonMapper() {
        // prevent instantiation
    }

    public static String serialize(Object value) throws Exception {
        return mapper.writeValueAsString(value);
    }

    public static <T> T deserialize(String json, Class<T> type) throws Exception {
        return mapper.readValue(json, type);
    }

    public static ObjectMapper getMapper() {
        // return copy to prevent outside modification of the mapper
        return mapper.copy();
    }
}
