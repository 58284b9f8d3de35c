package io.stategraph.core.graph;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Thread-safe in-memory {@link GraphRepository}.
public final class InMemoryGraphRepository implements GraphRepository {

    private final Map<String, Graph> graphs = new ConcurrentHashMap<>();

    @Override
    public void save(Graph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        graphs.put(graph.getId(), graph);
    }

    @Override
    public Optional<Graph> findById(String graphId) {
        Objects.requireNonNull(graphId, "graphId must not be null");
        return Optional.ofNullable(graphs.get(graphId));
    }

    @Override
    public List<Graph> findAll() {
        return List.copyOf(graphs.values());
    }

    @Override
    public boolean delete(String graphId) {
        Objects.requireNonNull(graphId, "graphId must not be null");
        return graphs.remove(graphId) != null;
    }
}
