package io.stategraph.core.execution;

import io.stategraph.core.graph.Graph;
import io.stategraph.core.interaction.InteractionController;
import io.stategraph.core.output.MapNodeOutputParser;
import io.stategraph.core.output.NodeOutputParser;
import io.stategraph.core.state.StateStore;
import io.stategraph.core.storage.ExecutionSnapshot;
import io.stategraph.core.storage.ExecutionStateRepository;
import io.stategraph.core.storage.InMemoryExecutionStateRepository;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

/// Entry point for running graphs.
///
/// Creates executions, drives them to their first suspension or terminal state, and
/// resumes suspended executions from the {@link ExecutionStateRepository}. The engine
/// itself holds no per-execution state: every execution owns its own
/// {@link StateStore}, and everything needed to resume is in the repository.
///
/// ### Usage
/// {@snippet :
/// GraphEngine engine = new GraphEngine(repository, parser, ExecutionListener.NOOP);
/// ExecutionResult result = engine.execute(graph, "I want a refund");
/// if (result instanceof ExecutionResult.Suspended suspended) {
///     String executionId = suspended.request().executionId();
///     // later, possibly in another process
///     result = engine.provideUserInput(graph, executionId, "yes");
/// }
/// }
///
/// @implNote Thread-safe. Distinct executions may run concurrently; a single execution
/// serializes its own operations.
///
/// @see GraphExecution for the per-execution state machine
public class GraphEngine {

    private static final Logger logger = Logger.getLogger(GraphEngine.class.getName());

    private final ExecutionStateRepository repository;
    private final NodeOutputParser outputParser;
    private final ExecutionListener listener;
    private final InteractionController interactions = new InteractionController();

    /// Creates an engine with in-memory persistence and the map-only output parser.
    public GraphEngine() {
        this(
                new InMemoryExecutionStateRepository(),
                MapNodeOutputParser.INSTANCE,
                ExecutionListener.NOOP);
    }

    /// Creates an engine.
    ///
    /// @param repository receives suspended, completed and failed snapshots, not null
    /// @param outputParser interprets raw node payloads, not null
    /// @param listener lifecycle listener, may be null (defaults to no-op)
    public GraphEngine(
            ExecutionStateRepository repository,
            NodeOutputParser outputParser,
            ExecutionListener listener) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.outputParser = Objects.requireNonNull(outputParser, "outputParser must not be null");
        this.listener = listener != null ? listener : ExecutionListener.NOOP;
    }

    /// Creates an idle execution with a generated id.
    ///
    /// @param graph the definition to execute, not null
    /// @return a new execution with an empty state store, never null
    public GraphExecution newExecution(Graph graph) {
        return newExecution(graph, UUID.randomUUID().toString());
    }

    /// Creates an idle execution with the given id.
    ///
    /// @param graph the definition to execute, not null
    /// @param executionId unique id, not null
    /// @return a new execution with an empty state store, never null
    /// @throws IllegalArgumentException if the repository already holds that id
    public GraphExecution newExecution(Graph graph, String executionId) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(executionId, "executionId must not be null");
        if (repository.load(executionId).isPresent()) {
            throw new IllegalArgumentException("Execution id already in use: " + executionId);
        }
        StateStore store = new StateStore(graph.getFieldMapping(), outputParser);
        return new GraphExecution(graph, executionId, store, interactions, repository, listener);
    }

    /// Runs a new execution until it suspends, completes or fails.
    ///
    /// @param graph the definition to execute, not null
    /// @param input value handed to the entry node, may be null
    /// @return the first non-running result, never null
    public ExecutionResult execute(Graph graph, Object input) {
        GraphExecution execution = newExecution(graph);
        execution.start(input);
        return execution.run();
    }

    /// Restores a persisted execution.
    ///
    /// The graph is matched by id; a suspended execution is restored with its pending
    /// edge and a rebuilt interaction request.
    ///
    /// @param graph the definition the execution was started from, not null
    /// @param executionId the execution to restore, not null
    /// @return the restored execution, never null
    /// @throws IllegalArgumentException if no snapshot exists or it belongs to another graph
    public GraphExecution resume(Graph graph, String executionId) {
        Objects.requireNonNull(graph, "graph must not be null");
        ExecutionSnapshot snapshot =
                load(executionId)
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "Execution not found: " + executionId));
        return GraphExecution.restore(
                graph, snapshot, outputParser, interactions, repository, listener);
    }

    /// Restores a suspended execution and supplies its input.
    ///
    /// @param graph the definition the execution was started from, not null
    /// @param executionId the suspended execution, not null
    /// @param value the input, may be null
    /// @return the next suspension or the terminal result, never null
    /// @throws IllegalArgumentException if no snapshot exists
    /// @throws ExecutionStateException if the execution is not suspended
    public ExecutionResult provideUserInput(Graph graph, String executionId, Object value) {
        return resume(graph, executionId).provideUserInput(value);
    }

    /// Loads the persisted snapshot of an execution.
    ///
    /// @param executionId the execution, not null
    /// @return the snapshot, empty if unknown
    public Optional<ExecutionSnapshot> load(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        return repository.load(executionId);
    }

    /// Drops a persisted execution without resuming it.
    ///
    /// @param executionId the execution, not null
    /// @return true if a record was removed
    public boolean abandon(String executionId) {
        boolean removed = repository.delete(executionId);
        if (removed) {
            logger.info("Abandoned execution " + executionId);
        }
        return removed;
    }

    public ExecutionStateRepository getRepository() {
        return repository;
    }

    public NodeOutputParser getOutputParser() {
        return outputParser;
    }
}
