package io.stategraph.core;

import io.stategraph.core.execution.ExecutionResult;
import io.stategraph.core.execution.GraphEngine;
import io.stategraph.core.execution.GraphExecution;
import io.stategraph.core.graph.Graph;
import io.stategraph.core.graph.GraphBuilder;
import io.stategraph.core.graph.GraphRepository;
import io.stategraph.core.storage.ExecutionSnapshot;
import io.stategraph.core.storage.ExecutionStateRepository;
import java.util.List;
import java.util.Objects;

/// Container holding the wired components of a state graph runtime.
///
/// Besides exposing the components, it resolves graphs by id so that a suspended execution
/// can be resumed knowing only its execution id.
///
/// ### Contracts
/// - **Postcondition**: all getters return the instances passed to the constructor
/// - **Invariant**: component references are immutable after construction
///
/// @apiNote Create instances through {@link StateGraphFactory}.
///
/// @see StateGraphFactory
public final class StateGraphEnvironment {

    private final StateGraphConfig config;
    private final GraphEngine engine;
    private final GraphRepository graphRepository;
    private final ExecutionStateRepository stateRepository;

    public StateGraphEnvironment(
            StateGraphConfig config,
            GraphEngine engine,
            GraphRepository graphRepository,
            ExecutionStateRepository stateRepository) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.graphRepository = Objects.requireNonNull(graphRepository, "graphRepository required");
        this.stateRepository = Objects.requireNonNull(stateRepository, "stateRepository required");
    }

    /// Starts a graph definition carrying this environment's defaults.
    ///
    /// @param graphId the graph id, not null
    /// @return a builder with the configured {@link io.stategraph.core.graph.GraphConfig}
    public GraphBuilder newGraph(String graphId) {
        return GraphBuilder.create(graphId).config(config.toGraphConfig());
    }

    /// Makes a graph resolvable by id.
    ///
    /// @param graph the definition, not null
    /// @return the same graph, never null
    public Graph register(Graph graph) {
        graphRepository.save(graph);
        return graph;
    }

    /// Runs a new execution of a registered graph.
    ///
    /// @param graphId id of a registered graph, not null
    /// @param input value handed to the entry node, may be null
    /// @return the first non-running result, never null
    /// @throws IllegalArgumentException if the graph is not registered
    public ExecutionResult execute(String graphId, Object input) {
        return engine.execute(graph(graphId), input);
    }

    /// Restores a persisted execution, finding its graph by id.
    ///
    /// @param executionId the execution, not null
    /// @return the restored execution, never null
    /// @throws IllegalArgumentException if the execution or its graph is unknown
    public GraphExecution resume(String executionId) {
        ExecutionSnapshot snapshot =
                engine.load(executionId)
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "Execution not found: " + executionId));
        return engine.resume(graph(snapshot.graphId()), executionId);
    }

    /// Supplies input to a suspended execution.
    ///
    /// @param executionId the suspended execution, not null
    /// @param value the input, may be null
    /// @return the next suspension or the terminal result, never null
    public ExecutionResult provideUserInput(String executionId, Object value) {
        return resume(executionId).provideUserInput(value);
    }

    /// Lists executions waiting for input.
    ///
    /// @return suspended snapshots, never null
    public List<ExecutionSnapshot> suspendedExecutions() {
        return stateRepository.findSuspended();
    }

    public StateGraphConfig getConfig() {
        return config;
    }

    public GraphEngine getEngine() {
        return engine;
    }

    public GraphRepository getGraphRepository() {
        return graphRepository;
    }

    public ExecutionStateRepository getStateRepository() {
        return stateRepository;
    }

    private Graph graph(String graphId) {
        return graphRepository
                .findById(graphId)
                .orElseThrow(() -> new IllegalArgumentException("Graph not found: " + graphId));
    }
}
