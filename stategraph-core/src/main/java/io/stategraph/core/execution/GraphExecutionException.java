package io.stategraph.core.execution;

import io.stategraph.core.state.StateSnapshot;
import java.io.Serial;

/// Engine-level failure of one execution.
///
/// Always carries the id of the node being processed and the last consistent state
/// snapshot, so callers can decide whether to retry from a fresh entry or resume from
/// persisted state.
public class GraphExecutionException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4426390215387761093L;

    private final String nodeId;
    private final transient StateSnapshot lastSnapshot;

    public GraphExecutionException(String message, String nodeId, StateSnapshot lastSnapshot) {
        this(message, nodeId, lastSnapshot, null);
    }

    public GraphExecutionException(
            String message, String nodeId, StateSnapshot lastSnapshot, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
        this.lastSnapshot = lastSnapshot != null ? lastSnapshot : StateSnapshot.empty();
    }

    /// Returns the node being processed when the execution failed.
    ///
    /// @return node id, may be null if the failure happened before any node ran
    public String getNodeId() {
        return nodeId;
    }

    /// Returns global state as of the last completed projection.
    ///
    /// @return the snapshot, never null
    public StateSnapshot getLastSnapshot() {
        return lastSnapshot != null ? lastSnapshot : StateSnapshot.empty();
    }
}
