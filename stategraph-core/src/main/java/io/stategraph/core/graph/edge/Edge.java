package io.stategraph.core.graph.edge;

import java.util.Objects;

/// Directed, conditionally-taken transition between two nodes.
///
/// Created at build time and immutable thereafter. `index` is the build-time registration
/// order across the whole graph; when several outgoing edges of the same node hold at
/// once, the one with the lowest index wins.
///
/// @param index registration order, unique within the graph
/// @param source source node id, not null
/// @param target target node id, not null
/// @param condition predicate over the post-projection snapshot, not null
/// @param requiresExternalInput whether taking the edge needs a user-input record for the
///     source node
/// @param name label for logs and interaction requests, not null
public record Edge(
        int index,
        String source,
        String target,
        StateCondition condition,
        boolean requiresExternalInput,
        String name) {

    public Edge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        if (name == null || name.isBlank()) {
            name = source + "->" + target;
        }
    }

    /// Returns a serializable pointer to this edge.
    public EdgeRef ref() {
        return new EdgeRef(index, source, target, name);
    }

    @Override
    public String toString() {
        return "Edge#" + index + "{" + name + (requiresExternalInput ? ", input" : "") + "}";
    }
}
