package com.acme.mailflow.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;
import java.util.Map;

public final class Jsons {
    private static final ObjectMapper M = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};
    private static final TypeReference<List<Integer>> INTS = new TypeReference<>() {};

    private Jsons() {
    }

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch (Exception e) {
            throw new IllegalArgumentException("Cannot serialize " + o.getClass().getSimpleName(), e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return M.readValue(json, clazz);
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    "Cannot read " + clazz.getSimpleName() + " from payload: " + e.getMessage(), e);
        }
    }

    /** Reads a JSON object column; null or blank yields an empty map. */
    public static Map<String, Object> toMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return M.readValue(json, MAP);
        } catch (Exception e) {
            throw new IllegalArgumentException("Malformed JSON object: " + e.getMessage(), e);
        }
    }

    public static List<String> toStringList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return M.readValue(json, STRINGS);
        } catch (Exception e) {
            throw new IllegalArgumentException("Malformed JSON array: " + e.getMessage(), e);
        }
    }

    public static List<Integer> toIntList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return M.readValue(json, INTS);
        } catch (Exception e) {
            throw new IllegalArgumentException("Malformed JSON array: " + e.getMessage(), e);
        }
    }
}
