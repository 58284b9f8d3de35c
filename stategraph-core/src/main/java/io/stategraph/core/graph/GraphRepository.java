package io.stategraph.core.graph;

import java.util.List;
import java.util.Optional;

/// Lookup of graph definitions by id.
///
/// Suspended executions persist only the graph id; resuming in another process finds
/// the definition here.
///
/// @see InMemoryGraphRepository
public interface GraphRepository {

    /// Registers or replaces a graph.
    ///
    /// @param graph the definition, not null
    void save(Graph graph);

    /// Finds a graph by id.
    ///
    /// @param graphId the graph id, not null
    /// @return the graph, or empty if unknown
    Optional<Graph> findById(String graphId);

    /// Lists all graphs.
    ///
    /// @return all registered graphs, never null
    List<Graph> findAll();

    /// Removes a graph.
    ///
    /// @param graphId the graph id, not null
    /// @return true if a graph was removed
    boolean delete(String graphId);
}
