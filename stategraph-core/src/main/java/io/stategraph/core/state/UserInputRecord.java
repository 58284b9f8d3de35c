package io.stategraph.core.state;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// External input supplied for a node, stored under `{nodeId}_user_input`.
///
/// Distinct from the node's `{nodeId}_result` record. There is at most one record per node
/// id; recording new input for the same node replaces it.
///
/// @param input the value supplied by the caller, may be null
/// @param timestamp when the input was recorded, not null
/// @param nodeId the node that requested the input, not null
/// @param triggeringOutput the node output that caused the request, not null
/// @param consumed whether the record already satisfied an edge under the consume policy
public record UserInputRecord(
        Object input,
        Instant timestamp,
        String nodeId,
        Map<String, Object> triggeringOutput,
        boolean consumed) {

    public UserInputRecord {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        triggeringOutput =
                triggeringOutput != null
                        ? Collections.unmodifiableMap(
                                new LinkedHashMap<>(triggeringOutput))
                        : Map.of();
    }

    /// Returns the input rendered as text, or an empty string when null.
    public String inputAsString() {
        return input == null ? "" : String.valueOf(input);
    }

    /// Returns a copy marked consumed.
    public UserInputRecord markConsumed() {
        return new UserInputRecord(input, timestamp, nodeId, triggeringOutput, true);
    }
}
