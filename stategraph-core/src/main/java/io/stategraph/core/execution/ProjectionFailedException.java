package io.stategraph.core.execution;

import io.stategraph.core.state.StateSnapshot;
import java.io.Serial;

/// Raised when a node's output is malformed and the graph treats that as fatal.
///
/// @see io.stategraph.core.graph.ProjectionFailurePolicy#FAIL
public class ProjectionFailedException extends GraphExecutionException {

    @Serial private static final long serialVersionUID = 8012297451820377716L;

    public ProjectionFailedException(String nodeId, String reason, StateSnapshot lastSnapshot) {
        super("Malformed output from node " + nodeId + ": " + reason, nodeId, lastSnapshot);
    }
}
