package com.di.starnova.load;

import com.di.starnova.exception.PersistenceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.beam.sdk.transforms.SerializableFunction;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared Jackson setup for reports and for the JSON-lines hand-off between pipeline runs.
 */
public final class JsonSupport {

    private JsonSupport() {}

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** One JSON document per element, for {@code TextIO}. */
    public static <T> SerializableFunction<T, String> toJsonLine() {
        return (T value) -> {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new PersistenceException("Cannot serialise " + value.getClass().getSimpleName(), e);
            }
        };
    }

    /** Reads one JSON document, such as a written report. */
    public static <T> T read(Path file, Class<T> type) {
        try {
            return MAPPER.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new PersistenceException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    /** Reads a JSON-lines file; blank lines are skipped. */
    public static <T> List<T> readJsonLines(Path file, Class<T> type) {
        List<T> values = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    values.add(MAPPER.readValue(line, type));
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Cannot read " + file + ": " + e.getMessage(), e);
        }
        return values;
    }
}
