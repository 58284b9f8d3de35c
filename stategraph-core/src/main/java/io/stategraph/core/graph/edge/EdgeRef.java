package io.stategraph.core.graph.edge;

/// Serializable pointer to an {@link Edge} of a graph.
///
/// Conditions are code and cannot be persisted, so suspended executions remember the
/// blocking edge by registration index and endpoints; the edge is re-resolved against the
/// graph definition on resume.
///
/// @param index the edge's registration index
/// @param source source node id, not null
/// @param target target node id, not null
/// @param name the edge label, not null
public record EdgeRef(int index, String source, String target, String name) {

    /// Returns whether `edge` is the edge this pointer was taken from.
    public boolean matches(Edge edge) {
        return edge.index() == index
                && edge.source().equals(source)
                && edge.target().equals(target);
    }
}
