package io.github.jbellis.refactor.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared Jackson configuration. Operation results and backup manifests are written with snake_case
 * property names, which is what callers of the engine consume.
 */
public class Json {

    private static final ObjectMapper MAPPER = createMapper();

    private Json() {
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize " + obj.getClass().getSimpleName() + " to JSON", e);
        }
    }

    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to deserialize JSON to " + type.getSimpleName(), e);
        }
    }

    /**
     * Reads a JSON document from disk. Unlike {@link #fromJson} the I/O failure is reported to the caller,
     * since a missing or corrupt file on disk is an expected condition.
     */
    public static <T> T read(Path file, Class<T> type) throws IOException {
        return MAPPER.readValue(Files.readAllBytes(file), type);
    }

    /**
     * Writes a JSON document to disk through {@link AtomicWrites}.
     */
    public static void write(Path file, Object value) throws IOException {
        AtomicWrites.atomicOverwrite(file, MAPPER.writeValueAsBytes(value));
    }
}
