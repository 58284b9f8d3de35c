package io.stategraph.core.storage;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory execution state repository (default implementation).
///
/// Thread-safe, no external dependencies. Snapshots do not survive the process.
///
/// @see ExecutionStateRepository for contract
public final class InMemoryExecutionStateRepository implements ExecutionStateRepository {

    private final Map<String, ExecutionSnapshot> storage = new ConcurrentHashMap<>();

    @Override
    public void save(String executionId, ExecutionSnapshot snapshot) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        if (!executionId.equals(snapshot.executionId())) {
            throw new IllegalArgumentException(
                    "Snapshot of " + snapshot.executionId() + " saved under " + executionId);
        }
        storage.put(executionId, snapshot);
    }

    @Override
    public Optional<ExecutionSnapshot> load(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        return Optional.ofNullable(storage.get(executionId));
    }

    @Override
    public List<ExecutionSnapshot> findSuspended() {
        return storage.values().stream().filter(ExecutionSnapshot::isSuspended).toList();
    }

    @Override
    public List<ExecutionSnapshot> findByGraphId(String graphId) {
        Objects.requireNonNull(graphId, "graphId must not be null");
        return storage.values().stream().filter(s -> graphId.equals(s.graphId())).toList();
    }

    @Override
    public boolean delete(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        return storage.remove(executionId) != null;
    }

    /// Clears all data (useful for testing).
    public void clear() {
        storage.clear();
    }

    /// Returns the number of stored snapshots.
    public int size() {
        return storage.size();
    }
}
