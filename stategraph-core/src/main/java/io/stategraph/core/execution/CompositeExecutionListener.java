package io.stategraph.core.execution;

import io.stategraph.core.graph.edge.Edge;
import io.stategraph.core.graph.node.RawNodeOutput;
import io.stategraph.core.interaction.InteractionRequest;
import io.stategraph.core.state.ProjectionResult;
import io.stategraph.core.storage.ExecutionSnapshot;

/// Fans out all execution lifecycle events to an ordered set of delegates.
///
/// @implNote Thread-safe if all delegates are thread-safe. Delegates are captured at
/// construction and never mutated.
///
/// @see LoggingExecutionListener
public final class CompositeExecutionListener implements ExecutionListener {

    private final ExecutionListener[] delegates;

    /// Creates a composite listener that dispatches to all delegates in order.
    ///
    /// @param delegates listeners to notify; must not be null, elements must not be null
    public CompositeExecutionListener(ExecutionListener... delegates) {
        this.delegates = delegates.clone();
    }

    @Override
    public void onExecutionStarted(String executionId, String graphId) {
        for (ExecutionListener d : delegates) d.onExecutionStarted(executionId, graphId);
    }

    @Override
    public void onNodeStart(String executionId, String nodeId, int visit) {
        for (ExecutionListener d : delegates) d.onNodeStart(executionId, nodeId, visit);
    }

    @Override
    public void onNodeComplete(String executionId, RawNodeOutput output) {
        for (ExecutionListener d : delegates) d.onNodeComplete(executionId, output);
    }

    @Override
    public void onProjection(String executionId, ProjectionResult result) {
        for (ExecutionListener d : delegates) d.onProjection(executionId, result);
    }

    @Override
    public void onTransition(String executionId, Edge edge) {
        for (ExecutionListener d : delegates) d.onTransition(executionId, edge);
    }

    @Override
    public void onSuspended(InteractionRequest request) {
        for (ExecutionListener d : delegates) d.onSuspended(request);
    }

    @Override
    public void onResumed(String executionId, String nodeId) {
        for (ExecutionListener d : delegates) d.onResumed(executionId, nodeId);
    }

    @Override
    public void onCompleted(String executionId, ExecutionResult.Completed result) {
        for (ExecutionListener d : delegates) d.onCompleted(executionId, result);
    }

    @Override
    public void onFailed(String executionId, GraphExecutionException error) {
        for (ExecutionListener d : delegates) d.onFailed(executionId, error);
    }

    @Override
    public void onCheckpoint(ExecutionSnapshot snapshot) {
        for (ExecutionListener d : delegates) d.onCheckpoint(snapshot);
    }
}
