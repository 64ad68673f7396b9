package com.phonepe.triplestore.core.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.triplestore.core.errors.TripleStoreException;
import com.phonepe.triplestore.core.errors.ValidationError;
import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared Jackson setup
 */
@UtilityClass
public class JsonUtils {

    /**
     * Type of the opaque provenance and attribute maps
     */
    public static final TypeReference<Map<String, Object>> OPAQUE_MAP = new TypeReference<>() {
    };

    public static JsonMapper createMapper() {
        final var mapper = new JsonMapper();
        mapper.findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS);
        return mapper;
    }

    /**
     * Reads a value from JSON. Validation failures raised while building the value surface as the
     * {@link TripleStoreException} itself instead of the Jackson wrapper around it. Reading through a mapper directly
     * raises the Jackson exception, with the {@link ValidationError} as its cause.
     *
     * @throws ValidationError if the input is not valid JSON for the type
     */
    public static <T> T read(final ObjectMapper mapper, final String json, final Class<T> type) {
        try {
            return mapper.readValue(json, type);
        }
        catch (IOException e) {
            for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
                if (cause instanceof TripleStoreException storeException) {
                    throw storeException;
                }
            }
            throw new ValidationError("malformed %s json: %s".formatted(type.getSimpleName(), e.getMessage()), e);
        }
    }

    /**
     * Deep, unmodifiable copy of an opaque JSON-like map. Nested maps and collections are copied as well, so later
     * changes to the source are not visible through the copy.
     */
    public static Map<String, Object> immutableCopy(final Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        final var copy = new LinkedHashMap<String, Object>();
        source.forEach((key, value) -> copy.put(key, immutableValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object immutableValue(final Object value) {
        if (value instanceof Map<?, ?> map) {
            final var copy = new LinkedHashMap<Object, Object>();
            map.forEach((key, nested) -> copy.put(key, immutableValue(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            final var copy = new ArrayList<>(collection.size());
            collection.forEach(nested -> copy.add(immutableValue(nested)));
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Object[] array) {
            final var copy = new ArrayList<>(array.length);
            for (final var nested : array) {
                copy.add(immutableValue(nested));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
