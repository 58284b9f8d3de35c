package io.stategraph.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.stategraph.core.storage.ExecutionSnapshot;

/// Serializes execution snapshots to and from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = SnapshotSerializer.toJson(execution.toSnapshot("manual"));
/// ExecutionSnapshot restored = SnapshotSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. Uses one shared mapper; Jackson mappers are thread-safe once
/// configured.
///
/// @see StateGraphJacksonModule for the registered type handlers
public final class SnapshotSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private SnapshotSerializer() {}

    /// Serializes a snapshot to pretty-printed JSON.
    ///
    /// @param snapshot the snapshot, not null
    /// @return JSON document, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ExecutionSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize snapshot: " + e.getMessage(), e);
        }
    }

    /// Deserializes a snapshot from JSON.
    ///
    /// @param json JSON document, not null
    /// @return the snapshot, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static ExecutionSnapshot fromJson(String json) {
        try {
            return MAPPER.readValue(json, ExecutionSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize snapshot: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for state graph serialization.
    ///
    /// Registers:
    /// - `StateGraphJacksonModule` for core domain types
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new StateGraphJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
