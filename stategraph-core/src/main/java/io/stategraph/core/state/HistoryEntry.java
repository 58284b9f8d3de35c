package io.stategraph.core.state;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable audit record of one state change.
///
/// Captures which node caused the change, the kind of operation, every field whose value
/// changed together with its new value, and any validation substitutions.
///
/// ### Contracts
/// - **Precondition**: `nodeId`, `operation` and `timestamp` must be provided
/// - **Postcondition**: Immutable after construction
///
/// @see StateHistory for the append-only sequence
public final class HistoryEntry {

    private final Instant timestamp;
    private final String nodeId;
    private final HistoryOperation operation;
    private final Map<String, Object> changes;
    private final List<FieldSubstitution> substitutions;
    private final String detail;

    private HistoryEntry(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "Timestamp required");
        this.nodeId = Objects.requireNonNull(builder.nodeId, "Node ID required");
        this.operation = Objects.requireNonNull(builder.operation, "Operation required");
        this.changes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.changes));
        this.substitutions = List.copyOf(builder.substitutions);
        this.detail = builder.detail;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns when the change was applied.
    ///
    /// @return the timestamp, not null
    public Instant getTimestamp() {
        return timestamp;
    }

    /// Returns the node whose output or input caused the change.
    ///
    /// @return the node ID, not null
    public String getNodeId() {
        return nodeId;
    }

    public HistoryOperation getOperation() {
        return operation;
    }

    /// Returns changed fields and their new values, in write order.
    ///
    /// @return unmodifiable map, never null (empty when nothing changed)
    public Map<String, Object> getChanges() {
        return changes;
    }

    /// Returns fields whose values were replaced by defaults during validation.
    ///
    /// @return unmodifiable list, never null
    public List<FieldSubstitution> getSubstitutions() {
        return substitutions;
    }

    /// Returns free-text detail such as a failure reason.
    ///
    /// @return the detail, may be null
    public String getDetail() {
        return detail;
    }

    /// Builder for {@link HistoryEntry}.
    public static final class Builder {
        private Instant timestamp = Instant.now();
        private String nodeId;
        private HistoryOperation operation;
        private Map<String, Object> changes = Map.of();
        private List<FieldSubstitution> substitutions = List.of();
        private String detail;

        private Builder() {}

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder operation(HistoryOperation operation) {
            this.operation = operation;
            return this;
        }

        public Builder changes(Map<String, Object> changes) {
            this.changes = changes != null ? changes : Map.of();
            return this;
        }

        public Builder substitutions(List<FieldSubstitution> substitutions) {
            this.substitutions = substitutions != null ? substitutions : List.of();
            return this;
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        public HistoryEntry build() {
            return new HistoryEntry(this);
        }
    }

    @Override
    public String toString() {
        return "HistoryEntry{"
                + operation
                + " node='"
                + nodeId
                + "', changes="
                + changes.keySet()
                + "}";
    }
}
