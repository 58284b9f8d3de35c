package io.stategraph.core.graph;

import io.stategraph.core.graph.edge.Edge;
import io.stategraph.core.graph.edge.StateCondition;
import io.stategraph.core.graph.node.GraphNode;
import io.stategraph.core.graph.node.NodeHandler;
import io.stategraph.core.graph.node.NodeRegistry;
import io.stategraph.core.state.FieldMapping;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Mutable assembler for an immutable {@link Graph}.
///
/// Nodes and edges are recorded in call order; edge order is the routing tie-break order.
/// After {@link #build()} the builder is frozen and every mutator throws
/// `IllegalStateException`.
///
/// ### Usage
/// {@snippet :
/// GraphBuilder builder = GraphBuilder.create("support");
/// builder.addNode("classify", classifier);
/// builder.addNode("answer", answerer);
/// builder.addEdge("classify", "answer", StateCondition.fieldEquals("status", "Success"));
/// builder.setEntryPoint("classify");
/// Graph graph = builder.build();
/// }
///
/// @implNote **Not thread-safe**. Assemble on one thread, then share the built graph.
public final class GraphBuilder {

    private String id;
    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    private String entryPoint;
    private FieldMapping fieldMapping = FieldMapping.empty();
    private GraphConfig config = GraphConfig.defaults();
    private boolean built;

    private GraphBuilder(String id) {
        this.id = id;
    }

    /// Starts a graph with the given id.
    ///
    /// @param id graph identifier used for persistence lookups, not null
    /// @return new builder, never null
    public static GraphBuilder create(String id) {
        return new GraphBuilder(Objects.requireNonNull(id, "id must not be null"));
    }

    public GraphBuilder id(String id) {
        checkNotBuilt();
        this.id = Objects.requireNonNull(id, "id must not be null");
        return this;
    }

    /// Registers a node.
    ///
    /// @param id unique node id within the graph, not null
    /// @param handler the computation, not null
    /// @return the registered node, never null
    /// @throws GraphValidationException if the id is already registered
    public GraphNode addNode(String id, NodeHandler handler) {
        return addNode(id, handler, null);
    }

    /// Registers a node with a description.
    ///
    /// @param id unique node id within the graph, not null
    /// @param handler the computation, not null
    /// @param description human-readable description, may be null
    /// @return the registered node, never null
    /// @throws GraphValidationException if the id is already registered
    public GraphNode addNode(String id, NodeHandler handler, String description) {
        checkNotBuilt();
        if (nodes.containsKey(id)) {
            throw new GraphValidationException("Duplicate node id: " + id);
        }
        GraphNode node = new GraphNode(id, handler, description);
        nodes.put(id, node);
        return node;
    }

    /// Adds an edge that does not require external input.
    ///
    /// @param source source node id, not null
    /// @param target target node id, not null
    /// @param condition predicate over state, not null
    /// @return the registered edge, never null
    public Edge addEdge(String source, String target, StateCondition condition) {
        return addEdge(source, target, condition, false);
    }

    /// Adds an edge.
    ///
    /// Endpoints are validated in {@link #build()}, so edges may be declared before their
    /// nodes.
    ///
    /// @param source source node id, not null
    /// @param target target node id, not null
    /// @param condition predicate over state, not null
    /// @param requiresExternalInput whether the edge waits for user input for `source`
    /// @return the registered edge, never null
    public Edge addEdge(
            String source, String target, StateCondition condition, boolean requiresExternalInput) {
        return addEdge(source, target, condition, requiresExternalInput, null);
    }

    /// Adds a named edge.
    ///
    /// @param source source node id, not null
    /// @param target target node id, not null
    /// @param condition predicate over state, not null
    /// @param requiresExternalInput whether the edge waits for user input for `source`
    /// @param name label used in logs and interaction requests, may be null
    /// @return the registered edge, never null
    public Edge addEdge(
            String source,
            String target,
            StateCondition condition,
            boolean requiresExternalInput,
            String name) {
        checkNotBuilt();
        Edge edge = new Edge(edges.size(), source, target, condition, requiresExternalInput, name);
        edges.add(edge);
        return edge;
    }

    /// Adds an unconditional edge.
    public Edge addEdge(String source, String target) {
        return addEdge(source, target, StateCondition.always());
    }

    public GraphBuilder setEntryPoint(String nodeId) {
        checkNotBuilt();
        this.entryPoint = Objects.requireNonNull(nodeId, "nodeId must not be null");
        return this;
    }

    public GraphBuilder fieldMapping(FieldMapping fieldMapping) {
        checkNotBuilt();
        this.fieldMapping = Objects.requireNonNull(fieldMapping, "fieldMapping must not be null");
        return this;
    }

    public GraphBuilder config(GraphConfig config) {
        checkNotBuilt();
        this.config = Objects.requireNonNull(config, "config must not be null");
        return this;
    }

    /// Validates and freezes the definition.
    ///
    /// @return the immutable graph, never null
    /// @throws GraphValidationException if there are no nodes, no entry point, an unknown
    ///     entry point, or an edge referencing an unknown node
    /// @throws IllegalStateException if called twice
    public Graph build() {
        checkNotBuilt();
        if (nodes.isEmpty()) {
            throw new GraphValidationException("Graph '" + id + "' has no nodes");
        }
        if (entryPoint == null) {
            throw new GraphValidationException("Graph '" + id + "' has no entry point");
        }
        if (!nodes.containsKey(entryPoint)) {
            throw new GraphValidationException(
                    "Entry point '" + entryPoint + "' is not a node of graph '" + id + "'");
        }
        for (Edge edge : edges) {
            if (!nodes.containsKey(edge.source())) {
                throw new GraphValidationException(
                        edge + " references unknown source node '" + edge.source() + "'");
            }
            if (!nodes.containsKey(edge.target())) {
                throw new GraphValidationException(
                        edge + " references unknown target node '" + edge.target() + "'");
            }
        }

        built = true;
        return new Graph(id, new NodeRegistry(nodes), edges, entryPoint, fieldMapping, config);
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("Graph '" + id + "' has already been built");
        }
    }
}
