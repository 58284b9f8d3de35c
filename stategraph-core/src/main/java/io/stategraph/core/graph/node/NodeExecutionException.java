package io.stategraph.core.graph.node;

import java.io.Serial;

/// Thrown when a node handler fails to produce any output.
///
/// Fatal for the execution that invoked the node.
public class NodeExecutionException extends Exception {

    @Serial private static final long serialVersionUID = 2294190361620183467L;

    private final String nodeId;

    public NodeExecutionException(String nodeId, Throwable cause) {
        super("Node '" + nodeId + "' failed: " + cause.getMessage(), cause);
        this.nodeId = nodeId;
    }

    /// Returns the node whose handler failed.
    public String getNodeId() {
        return nodeId;
    }
}
