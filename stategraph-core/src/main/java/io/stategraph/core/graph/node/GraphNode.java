package io.stategraph.core.graph.node;

import java.util.Objects;

/// A computation unit registered under a stable identifier.
///
/// @implNote Immutable after construction. The handler itself may hold state; the engine
/// makes no assumption either way beyond "called once per visit".
public final class GraphNode {

    private final String id;
    private final NodeHandler handler;
    private final String description;

    public GraphNode(String id, NodeHandler handler, String description) {
        this.id = Objects.requireNonNull(id, "Node ID required");
        this.handler = Objects.requireNonNull(handler, "Handler required");
        this.description = description;
        if (id.isBlank()) {
            throw new IllegalArgumentException("Node ID must not be blank");
        }
    }

    public GraphNode(String id, NodeHandler handler) {
        this(id, handler, null);
    }

    public String getId() {
        return id;
    }

    public NodeHandler getHandler() {
        return handler;
    }

    /// Returns a human-readable description.
    ///
    /// @return the description, may be null
    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphNode node)) return false;
        return id.equals(node.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "GraphNode{id='" + id + "'}";
    }
}
