package com.beacon.statusmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON codec for {@link StatusRecord} in its wire shape.
 *
 * <p>The {@code JavaTimeModule} writes instants as ISO-8601 strings rather than epoch numbers.
 */
public final class StatusRecordSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private StatusRecordSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Serializes a record to pretty-printed JSON.
     *
     * @throws StatusSerializationException if serialization fails
     */
    public static String serialize(StatusRecord record) {
        try {
            return MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new StatusSerializationException(
                    "Failed to serialize status record for " + record.serviceName(), e);
        }
    }

    /**
     * Deserializes a record from its JSON wire shape.
     *
     * @throws StatusSerializationException if the JSON is malformed or violates record invariants
     */
    public static StatusRecord deserialize(String json) {
        try {
            return MAPPER.readValue(json, StatusRecord.class);
        } catch (JsonProcessingException e) {
            throw new StatusSerializationException("Failed to deserialize status record", e);
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /** Thrown when a status record cannot be written or read as JSON. */
    public static class StatusSerializationException extends RuntimeException {
        public StatusSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
