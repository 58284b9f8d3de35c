package io.stategraph.core.graph;

import io.stategraph.core.graph.edge.Edge;
import io.stategraph.core.graph.edge.EdgeRef;
import io.stategraph.core.graph.node.NodeRegistry;
import io.stategraph.core.state.FieldMapping;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable graph definition: nodes, edges, entry node, field mapping and config.
///
/// Produced by {@link GraphBuilder#build()}. A graph may be shared by any number of
/// executions; each execution owns its own state.
///
/// ### Invariants
/// - every edge's source and target are nodes of this graph
/// - the entry node is a node of this graph
/// - edges keep their build-time registration order; {@link #outgoingEdges(String)}
///   returns them in that order, which is the tie-break order
/// - cycles are permitted; termination is the caller's concern, bounded only by
///   {@link GraphConfig#maxSteps()}
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see GraphBuilder
/// @see io.stategraph.core.execution.GraphEngine
public final class Graph {

    private final String id;
    private final NodeRegistry nodes;
    private final List<Edge> edges;
    private final Map<String, List<Edge>> outgoing;
    private final String entryNode;
    private final FieldMapping fieldMapping;
    private final GraphConfig config;

    Graph(
            String id,
            NodeRegistry nodes,
            List<Edge> edges,
            String entryNode,
            FieldMapping fieldMapping,
            GraphConfig config) {
        this.id = Objects.requireNonNull(id, "Graph ID required");
        this.nodes = Objects.requireNonNull(nodes, "nodes required");
        this.edges = List.copyOf(edges);
        this.entryNode = Objects.requireNonNull(entryNode, "Entry node required");
        this.fieldMapping = Objects.requireNonNull(fieldMapping, "fieldMapping required");
        this.config = Objects.requireNonNull(config, "config required");

        Map<String, List<Edge>> index = new LinkedHashMap<>();
        for (Edge edge : this.edges) {
            index.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
        }
        index.replaceAll((k, v) -> List.copyOf(v));
        this.outgoing = Collections.unmodifiableMap(index);
    }

    public String getId() {
        return id;
    }

    public NodeRegistry getNodes() {
        return nodes;
    }

    /// Returns all edges in registration order.
    ///
    /// @return unmodifiable list, never null
    public List<Edge> getEdges() {
        return edges;
    }

    /// Returns a node's outgoing edges in registration order.
    ///
    /// @param nodeId the source node, not null
    /// @return unmodifiable list, never null (empty for terminal-by-design nodes)
    public List<Edge> outgoingEdges(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    /// Returns the edge registered at the given position.
    ///
    /// @param index registration index
    /// @return the edge, never null
    /// @throws IllegalArgumentException if no edge has that index
    public Edge edge(int index) {
        if (index < 0 || index >= edges.size()) {
            throw new IllegalArgumentException("Edge index out of range: " + index);
        }
        return edges.get(index);
    }

    /// Resolves a persisted edge pointer against this definition.
    ///
    /// @param ref the pointer, not null
    /// @return the edge, or empty if this graph has no matching edge
    public Optional<Edge> resolve(EdgeRef ref) {
        if (ref.index() < 0 || ref.index() >= edges.size()) {
            return Optional.empty();
        }
        Edge edge = edges.get(ref.index());
        return ref.matches(edge) ? Optional.of(edge) : Optional.empty();
    }

    public String getEntryNode() {
        return entryNode;
    }

    public FieldMapping getFieldMapping() {
        return fieldMapping;
    }

    public GraphConfig getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return "Graph{id='"
                + id
                + "', nodes="
                + nodes.size()
                + ", edges="
                + edges.size()
                + ", entry='"
                + entryNode
                + "'}";
    }
}
