package com.waterCompliance.complianceDemo.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Utility class for loading JSON reference data from the classpath.
 * Threshold tables, the system catalog and recorded lab samples are all shipped as
 * classpath JSON and read through here.
 */
public class JsonFileLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonFileLoader.class);
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonFileLoader() {}

    /**
     * Loads a JSON file from the classpath as a String.
     *
     * @param resourcePath The path to the JSON file (e.g., "thresholds/threshold-table.json")
     * @return The JSON content as a String
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
     * Loads a JSON file from the classpath and deserializes it to a generic type
     * (maps of lists, nested collections).
     *
     * @param resourcePath The path to the JSON file
     * @param typeReference Target type
     * @param <T> The type to deserialize to
     * @return The deserialized value
     * @throws IOException if the file cannot be read, doesn't exist, or cannot be deserialized
     */
    public static <T> T loadAsObject(String resourcePath, TypeReference<T> typeReference) throws IOException {
        return objectMapper.readValue(loadAsString(resourcePath), typeReference);
    }

    /**
     * Loads a JSON file containing an array of JSON objects from the classpath
     * and deserializes it to a List of the specified type.
     *
     * @param resourcePath The path to the JSON file containing a JSON array
     * @param clazz The class to deserialize each JSON object into
     * @param <T> The type of objects in the list
     * @return A List of objects of the specified type
     * @throws IOException if the file cannot be read, doesn't exist, or cannot be deserialized
     */
    public static <T> List<T> loadAsList(String resourcePath, Class<T> clazz) throws IOException {
        String jsonString = loadAsString(resourcePath);
        return objectMapper.readValue(jsonString,
            objectMapper.getTypeFactory().constructCollectionType(List.class, clazz));
    }

    /**
     * Same as {@link #loadAsList(String, Class)} but returns an empty list when the
     * resource is missing or malformed. Used for optional fixture data.
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
