package io.stategraph.core.interaction;

import io.stategraph.core.graph.edge.EdgeRef;
import java.util.Objects;

/// Persisted pointer to the edge a suspended execution is waiting on.
///
/// Together with the state store contents this is all a resume needs; nothing lives on a
/// call stack.
///
/// @param nodeId the node whose outgoing edge is blocked, not null
/// @param edge the blocking edge, not null
public record PendingInteraction(String nodeId, EdgeRef edge) {

    public PendingInteraction {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(edge, "edge must not be null");
    }
}
