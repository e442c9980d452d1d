package com.dpw.robotqase.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;

import java.util.Optional;

public class JsonUtils {
    private JsonUtils() {
        // Private constructor to prevent instantiation
    }

    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static {
        OBJECT_MAPPER.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        OBJECT_MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        OBJECT_MAPPER.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    // Convert Object to JSON String
    public static String toJsonString(Object object) {
        try {
            return OBJECT_MAPPER.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Error converting object to JSON", e);
        }
    }

    // Read a single value from a JSON document, empty when the path or the document is missing
    public static <T> Optional<T> read(String json, String path, Class<T> type) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            Object value = JsonPath.read(json, path);
            return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
        } catch (PathNotFoundException | InvalidJsonException e) {
            return Optional.empty();
        }
    }
}
