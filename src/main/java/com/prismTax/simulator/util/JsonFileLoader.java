package com.prismTax.simulator.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Utility class for loading JSON fixtures from the classpath.
 * Supports files that contain a single object or an array of objects.
 */
public class JsonFileLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonFileLoader.class);
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonFileLoader() {
    }

    /**
     * Loads a classpath resource as a UTF-8 string.
     *
     * @param resourcePath path to the file (e.g. "data/seed-profiles.json")
     * @throws IOException if the file cannot be read or doesn't exist
     */
    public static String loadAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = JsonFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Loads a JSON array and deserializes each element to the given type.
     *
     * @throws IOException if the file cannot be read, doesn't exist, or cannot be deserialized
     */
    public static <T> List<T> loadAsList(String resourcePath, Class<T> clazz) throws IOException {
        String jsonString = loadAsString(resourcePath);
        return objectMapper.readValue(jsonString,
                objectMapper.getTypeFactory().constructCollectionType(List.class, clazz));
    }

    /**
     * Same as {@link #loadAsList(String, Class)}, returning an empty list when the file is missing or invalid.
     */
    public static <T> List<T> loadAsListOrEmpty(String resourcePath, Class<T> clazz) {
        try {
            return loadAsList(resourcePath, clazz);
        } catch (IOException e) {
            log.warn("Failed to load JSON file from classpath: {}", resourcePath, e);
            return List.of();
        }
    }
}
