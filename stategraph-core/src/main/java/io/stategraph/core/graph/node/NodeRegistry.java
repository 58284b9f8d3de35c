package io.stategraph.core.graph.node;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Immutable set of nodes keyed by id, with the glue to invoke them.
///
/// Registration order is preserved for iteration and diagnostics.
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see io.stategraph.core.graph.GraphBuilder for how registries are assembled
public final class NodeRegistry {

    private static final Logger logger = Logger.getLogger(NodeRegistry.class.getName());

    private final Map<String, GraphNode> nodes;

    /// Creates a registry from nodes in registration order.
    ///
    /// @param nodes nodes keyed by id, not null
    public NodeRegistry(Map<String, GraphNode> nodes) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    /// Invokes a node's handler and captures its raw payload.
    ///
    /// @param nodeId the node to invoke, not null
    /// @param context the visit context, not null
    /// @return the captured payload with timing, never null
    /// @throws IllegalArgumentException if no node has this id
    /// @throws NodeExecutionException if the handler throws
    public RawNodeOutput invoke(String nodeId, NodeContext context) throws NodeExecutionException {
        GraphNode node = getOrThrow(nodeId);
        Instant startedAt = Instant.now();
        Object payload;
        try {
            payload = node.getHandler().handle(context);
        } catch (Exception e) {
            logger.warning("Node " + nodeId + " failed: " + e);
            throw new NodeExecutionException(nodeId, e);
        }
        Duration duration = Duration.between(startedAt, Instant.now());
        logger.fine("Node " + nodeId + " returned in " + duration.toMillis() + "ms");
        return new RawNodeOutput(nodeId, payload, startedAt, duration);
    }

    public Optional<GraphNode> get(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /// Returns a node by id.
    ///
    /// @param nodeId the node id, not null
    /// @return the node, never null
    /// @throws IllegalArgumentException if no node has this id
    public GraphNode getOrThrow(String nodeId) {
        GraphNode node = nodes.get(Objects.requireNonNull(nodeId, "nodeId must not be null"));
        if (node == null) {
            throw new IllegalArgumentException("Node not found: " + nodeId);
        }
        return node;
    }

    public boolean contains(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    /// Returns all nodes in registration order.
    public Collection<GraphNode> all() {
        return nodes.values();
    }

    public int size() {
        return nodes.size();
    }
}
