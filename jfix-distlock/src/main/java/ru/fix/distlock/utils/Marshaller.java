package ru.fix.distlock.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * JSON form of lock payloads stored in backends that keep arbitrary bytes.
 */
public final class Marshaller {
    private static final Logger logger = LoggerFactory.getLogger(Marshaller.class);

    private static final ObjectMapper mapper = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private Marshaller() {
    }

    public static String marshall(Object serializedObject) {
        try {
            return mapper.writeValueAsString(serializedObject);
        } catch (JsonProcessingException ex) {
            logger.trace("Failed to marshall pojo. Object details: {}", serializedObject, ex);
            throw new IllegalStateException(ex);
        }
    }

    public static byte[] marshallToBytes(Object serializedObject) {
        return marshall(serializedObject).getBytes(StandardCharsets.UTF_8);
    }

    public static <T> T unmarshall(String json, Class<T> targetType) throws IOException {
        try {
            return mapper.readValue(json, targetType);
        } catch (IOException ex) {
            logger.trace("Failed to unmarshall json text to type {}. Json: {}", targetType, json, ex);
            throw ex;
        }
    }

    public static <T> T unmarshall(byte[] content, Class<T> targetType) throws IOException {
        return unmarshall(new String(content, StandardCharsets.UTF_8), targetType);
    }
}
