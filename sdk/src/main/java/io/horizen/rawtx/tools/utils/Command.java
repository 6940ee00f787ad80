package io.horizen.rawtx.tools.utils;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Command name with its JSON argument object. Commands without argument get an empty object.
 */
public class Command {
    private final String name;
    private final JsonNode data;

    public Command(String name, JsonNode data) {
        this.name = name;
        this.data = data;
    }

    public String name() {
        return name;
    }

    public JsonNode data() {
        return data;
    }

    public boolean hasText(String field) {
        return data.has(field) && data.get(field).isTextual();
    }

    public boolean hasArray(String field) {
        return data.has(field) && data.get(field).isArray();
    }

    public String text(String field) {
        return data.get(field).asText();
    }
}
