package io.stategraph.core.storage;

import java.util.List;
import java.util.Optional;

/// Persistence boundary for execution snapshots.
///
/// The engine saves a snapshot whenever an execution suspends, completes or fails (and
/// after every step when the graph asks for it) and loads one to resume. Storage technology
/// is up to the implementation.
///
/// ### Usage
/// {@snippet :
/// // Resume a suspended execution in another process
/// ExecutionSnapshot snapshot = repository.load(executionId).orElseThrow();
/// GraphExecution execution = engine.resume(graph, snapshot.executionId());
/// execution.provideUserInput("yes");
/// }
///
/// @see ExecutionSnapshot for the stored representation
/// @see InMemoryExecutionStateRepository for the in-memory implementation
public interface ExecutionStateRepository {

    /// Saves or replaces the snapshot for an execution.
    ///
    /// @param executionId the execution id, not null
    /// @param snapshot the state to persist, not null
    /// @throws NullPointerException if an argument is null
    /// @throws IllegalArgumentException if the id differs from the snapshot's own id
    void save(String executionId, ExecutionSnapshot snapshot);

    /// Loads the latest snapshot for an execution.
    ///
    /// @param executionId the execution id, not null
    /// @return the snapshot if found, empty otherwise
    Optional<ExecutionSnapshot> load(String executionId);

    /// Finds all executions waiting for input.
    ///
    /// @return suspended snapshots, never null (may be empty)
    List<ExecutionSnapshot> findSuspended();

    /// Finds all executions of one graph.
    ///
    /// @param graphId the graph id, not null
    /// @return matching snapshots, never null (may be empty)
    List<ExecutionSnapshot> findByGraphId(String graphId);

    /// Deletes the snapshot for an execution.
    ///
    /// @param executionId the execution id, not null
    /// @return true if a snapshot was deleted, false if none existed
    boolean delete(String executionId);
}
