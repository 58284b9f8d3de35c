package io.stategraph.core.interaction;

import io.stategraph.core.graph.edge.EdgeRef;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Surfaced to the caller when an execution suspends on an input-gated edge.
///
/// The caller obtains a response (typically from a person) and passes it to
/// {@link io.stategraph.core.execution.GraphExecution#provideUserInput(Object)}.
///
/// @param executionId the suspended execution, not null
/// @param nodeId the node whose outgoing edge is blocked, not null
/// @param nodeOutput the node's full output record, not null
/// @param options choices the node proposed in its `options` field, not null (may be empty)
/// @param blockingEdge the edge waiting on input, not null
/// @param createdAt when the request was built, not null
public record InteractionRequest(
        String executionId,
        String nodeId,
        Map<String, Object> nodeOutput,
        List<String> options,
        EdgeRef blockingEdge,
        Instant createdAt) {

    public InteractionRequest {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(blockingEdge, "blockingEdge must not be null");
        nodeOutput =
                nodeOutput != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(nodeOutput))
                        : Map.of();
        options = options != null ? List.copyOf(options) : List.of();
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    /// Returns whether the node proposed enumerated choices.
    public boolean hasOptions() {
        return !options.isEmpty();
    }

    /// Returns the persistable pointer for this request.
    public PendingInteraction toPending() {
        return new PendingInteraction(nodeId, blockingEdge);
    }
}
