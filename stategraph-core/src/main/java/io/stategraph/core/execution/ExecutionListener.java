package io.stategraph.core.execution;

import io.stategraph.core.graph.edge.Edge;
import io.stategraph.core.graph.node.RawNodeOutput;
import io.stategraph.core.interaction.InteractionRequest;
import io.stategraph.core.state.ProjectionResult;
import io.stategraph.core.storage.ExecutionSnapshot;

/// Listener for execution lifecycle events.
///
/// All methods have default no-op implementations, so listeners override only the events
/// they care about.
///
/// ### Callback Lifecycle
/// Each step triggers callbacks in this order:
///
/// ```
/// onNodeStart(executionId, nodeId, visit)   about to invoke the node
/// onNodeComplete(executionId, output)       raw payload captured
/// onProjection(executionId, result)         state updated, history appended
/// onTransition(executionId, edge)           OR onSuspended / onCompleted / onFailed
/// onCheckpoint(snapshot)                    snapshot persisted
/// ```
///
/// @implNote Callbacks run on the thread driving the execution. Different executions may
/// call the same listener concurrently.
///
/// @see GraphEngine
public interface ExecutionListener {

    /// Called when an execution leaves `IDLE`.
    ///
    /// @param executionId the execution, not null
    /// @param graphId the graph being executed, not null
    default void onExecutionStarted(String executionId, String graphId) {}

    /// Called before a node is invoked.
    ///
    /// @param executionId the execution, not null
    /// @param nodeId the node about to run, not null
    /// @param visit 1-based visit count of the node
    default void onNodeStart(String executionId, String nodeId, int visit) {}

    /// Called after a node returned a payload, before projection.
    ///
    /// @param executionId the execution, not null
    /// @param output the raw payload with timing, not null
    default void onNodeComplete(String executionId, RawNodeOutput output) {}

    /// Called after the payload was projected into state.
    ///
    /// @param executionId the execution, not null
    /// @param result changed fields, substitutions or the malformed marker, not null
    default void onProjection(String executionId, ProjectionResult result) {}

    /// Called when an edge is traversed.
    ///
    /// @param executionId the execution, not null
    /// @param edge the traversed edge, not null
    default void onTransition(String executionId, Edge edge) {}

    /// Called when the execution suspends waiting for input.
    ///
    /// @param request what the execution is waiting for, not null
    default void onSuspended(InteractionRequest request) {}

    /// Called when input was recorded for a suspended execution.
    ///
    /// @param executionId the execution, not null
    /// @param nodeId the node the input was recorded for, not null
    default void onResumed(String executionId, String nodeId) {}

    /// Called when the execution completes.
    ///
    /// @param executionId the execution, not null
    /// @param result the final result, not null
    default void onCompleted(String executionId, ExecutionResult.Completed result) {}

    /// Called when the execution fails.
    ///
    /// @param executionId the execution, not null
    /// @param error the failure, not null
    default void onFailed(String executionId, GraphExecutionException error) {}

    /// Called after a snapshot was handed to the repository.
    ///
    /// @param snapshot the persisted snapshot, not null
    default void onCheckpoint(ExecutionSnapshot snapshot) {}

    /// No-op listener instance that ignores all events.
    ExecutionListener NOOP = new ExecutionListener() {};
}
