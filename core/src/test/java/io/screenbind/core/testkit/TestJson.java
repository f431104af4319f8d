package io.screenbind.core.testkit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.screenbind.core.model.BindingContext;

/** JSON fixtures for tests. Single quotes in the input are turned into double quotes. */
public final class TestJson {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private TestJson() {}

    public static JsonNode json(String json) {
        try {
            return MAPPER.readTree(json.replace('\'', '"'));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid test JSON: " + json, e);
        }
    }

    public static ObjectNode obj(String json) {
        return (ObjectNode) json(json);
    }

    /** A context whose state is the given JSON object. */
    public static BindingContext state(String json) {
        return BindingContext.of(obj(json));
    }
}
