package io.stategraph.core.storage;

import io.stategraph.core.execution.ExecutionStatus;
import io.stategraph.core.interaction.PendingInteraction;
import io.stategraph.core.state.HistoryEntry;
import io.stategraph.core.state.StateSnapshot;
import io.stategraph.core.state.UserInputRecord;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable, persistable image of one execution.
///
/// Holds everything needed to continue the execution in another process: status, current
/// node, the pending edge pointer when suspended, the state store's contents and history,
/// and the visit path. The graph definition itself is referenced by id only.
///
/// ### Contracts
/// - **Precondition**: `graphId`, `executionId` and `status` must not be null
/// - **Precondition**: a `SUSPENDED` snapshot must carry a pending interaction
/// - **Postcondition**: all collections are immutable copies
///
/// @param graphId id of the graph definition, not null
/// @param executionId unique id of the execution, not null
/// @param status lifecycle status at capture time, not null
/// @param currentNodeId node the execution is at, may be null before start
/// @param pending the blocked edge when suspended, null otherwise
/// @param fields mapped global state fields, not null
/// @param results per-node output records, not null
/// @param userInputs per-node user-input records, not null
/// @param history state change history in order, not null
/// @param path node ids in visit order, not null
/// @param stepCount number of node invocations so far
/// @param entryInput input supplied to the first step, may be null
/// @param warnings non-fatal problems encountered so far, not null
/// @param createdAt capture time, not null
/// @param reason why the snapshot was taken, may be null
/// @see ExecutionStateRepository
public record ExecutionSnapshot(
        String graphId,
        String executionId,
        ExecutionStatus status,
        String currentNodeId,
        PendingInteraction pending,
        Map<String, Object> fields,
        Map<String, Map<String, Object>> results,
        Map<String, UserInputRecord> userInputs,
        List<HistoryEntry> history,
        List<String> path,
        int stepCount,
        Object entryInput,
        List<String> warnings,
        Instant createdAt,
        String reason) {

    /// Compact constructor with validation and defensive copying.
    public ExecutionSnapshot {
        Objects.requireNonNull(graphId, "graphId must not be null");
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (status == ExecutionStatus.SUSPENDED && pending == null) {
            throw new IllegalArgumentException(
                    "Suspended snapshot of " + executionId + " has no pending interaction");
        }
        fields = copy(fields);
        results = copy(results);
        userInputs = copy(userInputs);
        history = history != null ? List.copyOf(history) : List.of();
        path = path != null ? List.copyOf(path) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    /// Rebuilds the state view captured in this snapshot.
    ///
    /// @return the state, never null
    public StateSnapshot state() {
        return new StateSnapshot(fields, results, userInputs);
    }

    /// Returns whether the execution was waiting for input.
    public boolean isSuspended() {
        return status == ExecutionStatus.SUSPENDED;
    }

    /// Returns whether the execution had completed or failed.
    public boolean isTerminal() {
        return status.isTerminal();
    }

    // Values may be null, so Map.copyOf is not an option.
    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(source))
                : Map.of();
    }
}
