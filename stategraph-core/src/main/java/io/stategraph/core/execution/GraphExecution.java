package io.stategraph.core.execution;

import io.stategraph.core.graph.Graph;
import io.stategraph.core.graph.GraphConfig;
import io.stategraph.core.graph.ProjectionFailurePolicy;
import io.stategraph.core.graph.edge.ConditionEvaluationException;
import io.stategraph.core.graph.edge.Edge;
import io.stategraph.core.graph.edge.EdgeEvaluator;
import io.stategraph.core.graph.node.NodeContext;
import io.stategraph.core.graph.node.NodeExecutionException;
import io.stategraph.core.graph.node.RawNodeOutput;
import io.stategraph.core.interaction.InteractionController;
import io.stategraph.core.interaction.InteractionRequest;
import io.stategraph.core.interaction.PendingInteraction;
import io.stategraph.core.output.NodeOutputParser;
import io.stategraph.core.state.HistoryEntry;
import io.stategraph.core.state.ProjectionResult;
import io.stategraph.core.state.StateSnapshot;
import io.stategraph.core.state.StateStore;
import io.stategraph.core.storage.ExecutionSnapshot;
import io.stategraph.core.storage.ExecutionStateRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// One run of a {@link Graph}: its state store, position and lifecycle status.
///
/// Each step invokes the current node, projects its output into the execution's
/// {@link StateStore}, then evaluates the node's outgoing edges against the fresh state.
/// The earliest-registered edge whose condition holds is selected; if it requires external
/// input that has not been provided, the execution suspends instead of moving.
///
/// ### Lifecycle
/// ```
/// IDLE --start--> RUNNING --step--> RUNNING | SUSPENDED | COMPLETED | FAILED
/// SUSPENDED --provideUserInput--> RUNNING | SUSPENDED
/// ```
///
/// ### Contracts
/// - **Invariant**: edges are evaluated only against state that includes the latest
///   projection
/// - **Invariant**: `COMPLETED` and `FAILED` are final; further input is rejected
/// - **Postcondition**: every suspension, completion and failure is saved to the
///   {@link ExecutionStateRepository} before listeners are notified and before the result
///   is returned
/// - **Invariant**: a throwing {@link ExecutionListener} is logged and never changes the
///   outcome of a step
///
/// @implNote Thread-safe. Public operations synchronize on the execution, so concurrent
/// callers observe whole steps.
///
/// @see GraphEngine for creating and resuming executions
public final class GraphExecution {

    private static final Logger logger = Logger.getLogger(GraphExecution.class.getName());

    private final Graph graph;
    private final String executionId;
    private final StateStore store;
    private final EdgeEvaluator evaluator = new EdgeEvaluator();
    private final InteractionController interactions;
    private final ExecutionStateRepository repository;
    private final ExecutionListener listener;

    private final List<String> path = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final Map<String, Integer> visits = new HashMap<>();

    private ExecutionStatus status = ExecutionStatus.IDLE;
    private String currentNodeId;
    private Edge pendingEdge;
    private InteractionRequest pendingRequest;
    private ExecutionResult lastResult;
    private int stepCount;
    private Object entryInput;

    GraphExecution(
            Graph graph,
            String executionId,
            StateStore store,
            InteractionController interactions,
            ExecutionStateRepository repository,
            ExecutionListener listener) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.executionId = Objects.requireNonNull(executionId, "executionId must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.interactions = Objects.requireNonNull(interactions, "interactions must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.listener = listener != null ? listener : ExecutionListener.NOOP;
    }

    /// Rebuilds an execution from a persisted snapshot.
    ///
    /// @param graph the definition the snapshot was taken from, not null
    /// @param snapshot the persisted execution, not null
    /// @param parser output parser for future projections, not null
    /// @param interactions suspend/resume protocol, not null
    /// @param repository where further checkpoints go, not null
    /// @param listener lifecycle listener, may be null
    /// @return the restored execution, never null
    /// @throws IllegalArgumentException if the snapshot belongs to another graph
    /// @throws IllegalStateException if the pending edge no longer exists in the graph
    static GraphExecution restore(
            Graph graph,
            ExecutionSnapshot snapshot,
            NodeOutputParser parser,
            InteractionController interactions,
            ExecutionStateRepository repository,
            ExecutionListener listener) {
        if (!graph.getId().equals(snapshot.graphId())) {
            throw new IllegalArgumentException(
                    "Execution "
                            + snapshot.executionId()
                            + " belongs to graph '"
                            + snapshot.graphId()
                            + "', not '"
                            + graph.getId()
                            + "'");
        }

        StateStore store =
                StateStore.restore(
                        graph.getFieldMapping(), parser, snapshot.state(), snapshot.history());
        GraphExecution execution =
                new GraphExecution(
                        graph, snapshot.executionId(), store, interactions, repository, listener);

        execution.status = snapshot.status();
        execution.currentNodeId = snapshot.currentNodeId();
        execution.stepCount = snapshot.stepCount();
        execution.entryInput = snapshot.entryInput();
        execution.path.addAll(snapshot.path());
        execution.warnings.addAll(snapshot.warnings());
        for (String nodeId : snapshot.path()) {
            execution.visits.merge(nodeId, 1, Integer::sum);
        }

        StateSnapshot state = store.snapshot();
        switch (snapshot.status()) {
            case SUSPENDED -> {
                PendingInteraction pending = snapshot.pending();
                execution.pendingEdge =
                        graph.resolve(pending.edge())
                                .orElseThrow(
                                        () ->
                                                new IllegalStateException(
                                                        "Pending edge "
                                                                + pending.edge()
                                                                + " not found in graph '"
                                                                + graph.getId()
                                                                + "'"));
                execution.pendingRequest =
                        interactions.request(execution.executionId, execution.pendingEdge, state);
                execution.lastResult =
                        new ExecutionResult.Suspended(
                                execution.pendingRequest, state, execution.warnings);
            }
            case RUNNING -> execution.lastResult =
                    new ExecutionResult.Running(execution.currentNodeId);
            case COMPLETED -> execution.lastResult =
                    new ExecutionResult.Completed(
                            state,
                            execution.currentNodeId,
                            execution.path,
                            execution.warnings);
            case FAILED -> execution.lastResult =
                    new ExecutionResult.Failed(
                            new GraphExecutionException(
                                    snapshot.reason() != null
                                            ? snapshot.reason()
                                            : "Execution failed",
                                    execution.currentNodeId,
                                    state));
            case IDLE -> execution.lastResult = null;
        }

        logger.info(
                "Restored execution "
                        + execution.executionId
                        + " at node "
                        + execution.currentNodeId
                        + " ("
                        + execution.status
                        + ")");
        return execution;
    }

    /// Leaves `IDLE` and positions the execution on the graph's entry node.
    ///
    /// @param input value handed to the entry node's context, may be null
    /// @return a {@link ExecutionResult.Running} for the entry node, never null
    /// @throws ExecutionStateException if the execution was already started
    public synchronized ExecutionResult start(Object input) {
        if (status != ExecutionStatus.IDLE) {
            throw new ExecutionStateException(executionId, status, "start");
        }
        entryInput = input;
        currentNodeId = graph.getEntryNode();
        status = ExecutionStatus.RUNNING;
        lastResult = new ExecutionResult.Running(currentNodeId);

        logger.info("Starting execution " + executionId + " of graph " + graph.getId());
        if (graph.getConfig().checkpointEachStep()) {
            checkpoint("started");
        }
        notifyListener("start", l -> l.onExecutionStarted(executionId, graph.getId()));
        return lastResult;
    }

    /// Runs the current node and routes on the updated state.
    ///
    /// @return the outcome of this step, never null
    /// @throws ExecutionStateException if the execution is not running
    public synchronized ExecutionResult step() {
        if (status != ExecutionStatus.RUNNING) {
            throw new ExecutionStateException(executionId, status, "step");
        }

        String nodeId = currentNodeId;
        GraphConfig config = graph.getConfig();
        StateSnapshot before = store.snapshot();

        if (config.isBounded() && stepCount >= config.maxSteps()) {
            return fail(new StepLimitExceededException(config.maxSteps(), nodeId, before));
        }

        int visit = visits.merge(nodeId, 1, Integer::sum);
        stepCount++;
        path.add(nodeId);
        notifyListener("node start", l -> l.onNodeStart(executionId, nodeId, visit));

        RawNodeOutput raw;
        try {
            raw =
                    graph.getNodes()
                            .invoke(
                                    nodeId,
                                    new NodeContext(
                                            executionId,
                                            nodeId,
                                            visit,
                                            stepCount == 1 ? entryInput : null,
                                            before));
        } catch (NodeExecutionException e) {
            return fail(new GraphExecutionException(e.getMessage(), nodeId, before, e.getCause()));
        }
        notifyListener("node complete", l -> l.onNodeComplete(executionId, raw));

        ProjectionResult projection;
        try {
            projection = store.project(nodeId, raw.payload());
        } catch (RuntimeException e) {
            return fail(
                    new GraphExecutionException(
                            "Projection of node " + nodeId + " output failed: " + e.getMessage(),
                            nodeId,
                            store.snapshot(),
                            e));
        }
        notifyListener("projection", l -> l.onProjection(executionId, projection));

        if (projection.malformed()) {
            ProjectionFailurePolicy policy = config.projectionFailurePolicy();
            if (policy == ProjectionFailurePolicy.FAIL) {
                return fail(
                        new ProjectionFailedException(
                                nodeId, projection.failureReason(), store.snapshot()));
            }
            warnings.add(
                    "Malformed output from node " + nodeId + ": " + projection.failureReason());
            if (policy == ProjectionFailurePolicy.FALLBACK) {
                store.projectFallback(nodeId, config.fallbackFor(nodeId));
            }
        }

        return route(nodeId);
    }

    /// Steps until the execution suspends, completes or fails.
    ///
    /// Calling this on an execution that is not running returns its last result unchanged.
    ///
    /// @return the first non-running result, never null
    /// @throws ExecutionStateException if the execution was never started
    public synchronized ExecutionResult run() {
        if (status == ExecutionStatus.IDLE) {
            throw new ExecutionStateException(executionId, status, "run");
        }
        ExecutionResult result = lastResult;
        while (status == ExecutionStatus.RUNNING) {
            result = step();
        }
        return result;
    }

    /// Supplies external input for the edge this execution is suspended on.
    ///
    /// The input is recorded as `{node}_user_input` and the blocking edge alone is
    /// re-evaluated. If it is now passable the execution moves to its target and keeps
    /// running; otherwise it stays suspended with a refreshed request.
    ///
    /// @param value the input, may be null
    /// @return the next suspension or the terminal result, never null
    /// @throws ExecutionStateException if the execution is not suspended; the execution is
    ///     left unchanged
    public synchronized ExecutionResult provideUserInput(Object value) {
        if (status != ExecutionStatus.SUSPENDED) {
            throw new ExecutionStateException(executionId, status, "provide input to");
        }

        Edge edge = pendingEdge;
        boolean passable;
        try {
            passable =
                    interactions.resume(
                            store, edge, value, evaluator, graph.getConfig().userInputRetention());
        } catch (ConditionEvaluationException e) {
            return fail(conditionFailure(edge.source(), e));
        }
        notifyListener("resume", l -> l.onResumed(executionId, edge.source()));

        if (!passable) {
            return suspend(edge, store.snapshot());
        }
        transition(edge);
        return run();
    }

    /// Abandons the execution and releases its persisted record.
    ///
    /// @return true if the execution was cancelled, false if it had already finished
    public synchronized boolean cancel() {
        if (status.isTerminal()) {
            return false;
        }
        GraphExecutionException error =
                new GraphExecutionException(
                        "Execution cancelled", currentNodeId, store.snapshot());
        status = ExecutionStatus.FAILED;
        pendingEdge = null;
        pendingRequest = null;
        lastResult = new ExecutionResult.Failed(error);
        repository.delete(executionId);

        logger.info("Cancelled execution " + executionId);
        notifyListener("cancel", l -> l.onFailed(executionId, error));
        return true;
    }

    public String getExecutionId() {
        return executionId;
    }

    public Graph getGraph() {
        return graph;
    }

    public synchronized ExecutionStatus status() {
        return status;
    }

    /// Returns the node the execution is at: the next node to run while running, the
    /// blocked node while suspended, the last node once finished.
    ///
    /// @return node id, null before start
    public synchronized String currentNodeId() {
        return currentNodeId;
    }

    /// Returns the state change history.
    ///
    /// @return immutable list in append order, never null
    public List<HistoryEntry> history() {
        return store.history();
    }

    /// Returns the current global state.
    ///
    /// @return immutable snapshot, never null
    public StateSnapshot snapshot() {
        return store.snapshot();
    }

    /// Returns the interaction request while suspended.
    ///
    /// @return the request, empty unless suspended
    public synchronized Optional<InteractionRequest> pendingRequest() {
        return Optional.ofNullable(pendingRequest);
    }

    /// Returns non-fatal problems encountered so far, such as malformed node output.
    ///
    /// @return immutable copy, never null
    public synchronized List<String> warnings() {
        return List.copyOf(warnings);
    }

    /// Returns node ids in visit order.
    ///
    /// @return immutable copy, never null
    public synchronized List<String> path() {
        return List.copyOf(path);
    }

    public synchronized int stepCount() {
        return stepCount;
    }

    /// Returns the result of the most recent operation.
    ///
    /// @return the result, empty before start
    public synchronized Optional<ExecutionResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    /// Returns how many edge conditions this execution has evaluated.
    public long conditionEvaluations() {
        return evaluator.evaluationCount();
    }

    /// Captures the execution for persistence.
    ///
    /// @return snapshot without a reason, never null
    public ExecutionSnapshot toSnapshot() {
        return toSnapshot(null);
    }

    /// Captures the execution for persistence.
    ///
    /// @param reason why the snapshot is taken, may be null
    /// @return the snapshot, never null
    public synchronized ExecutionSnapshot toSnapshot(String reason) {
        StateSnapshot state = store.snapshot();
        PendingInteraction pending =
                pendingEdge != null
                        ? new PendingInteraction(pendingEdge.source(), pendingEdge.ref())
                        : null;
        return new ExecutionSnapshot(
                graph.getId(),
                executionId,
                status,
                currentNodeId,
                pending,
                state.fields(),
                state.results(),
                state.userInputs(),
                store.history(),
                path,
                stepCount,
                entryInput,
                warnings,
                Instant.now(),
                reason);
    }

    private ExecutionResult route(String nodeId) {
        StateSnapshot snapshot = store.snapshot();
        Optional<Edge> selected;
        try {
            selected = evaluator.selectFirst(graph.outgoingEdges(nodeId), snapshot);
        } catch (ConditionEvaluationException e) {
            return fail(conditionFailure(nodeId, e));
        }

        if (selected.isEmpty()) {
            return complete(nodeId, snapshot);
        }
        Edge edge = selected.get();
        if (!interactions.isSatisfied(edge, snapshot, graph.getConfig().userInputRetention())) {
            return suspend(edge, snapshot);
        }
        return transition(edge);
    }

    private ExecutionResult transition(Edge edge) {
        interactions.onTraversed(store, edge, graph.getConfig().userInputRetention());
        currentNodeId = edge.target();
        pendingEdge = null;
        pendingRequest = null;
        status = ExecutionStatus.RUNNING;
        lastResult = new ExecutionResult.Running(currentNodeId);

        if (graph.getConfig().checkpointEachStep()) {
            checkpoint("step " + stepCount);
        }
        notifyListener("transition", l -> l.onTransition(executionId, edge));
        return lastResult;
    }

    private ExecutionResult suspend(Edge edge, StateSnapshot snapshot) {
        status = ExecutionStatus.SUSPENDED;
        pendingEdge = edge;
        pendingRequest = interactions.suspend(executionId, edge, snapshot);
        InteractionRequest request = pendingRequest;
        lastResult = new ExecutionResult.Suspended(request, snapshot, warnings);

        checkpoint("awaiting input at " + edge.source());
        notifyListener("suspend", l -> l.onSuspended(request));
        return lastResult;
    }

    private ExecutionResult complete(String nodeId, StateSnapshot snapshot) {
        status = ExecutionStatus.COMPLETED;
        ExecutionResult.Completed completed =
                new ExecutionResult.Completed(snapshot, nodeId, path, warnings);
        lastResult = completed;

        logger.info("Execution " + executionId + " completed at node " + nodeId);
        checkpoint("completed");
        notifyListener("complete", l -> l.onCompleted(executionId, completed));
        return completed;
    }

    private ExecutionResult fail(GraphExecutionException error) {
        status = ExecutionStatus.FAILED;
        pendingEdge = null;
        pendingRequest = null;
        lastResult = new ExecutionResult.Failed(error);

        logger.warning("Execution " + executionId + " failed: " + error.getMessage());
        checkpoint(error.getMessage());
        notifyListener("failure", l -> l.onFailed(executionId, error));
        return lastResult;
    }

    private GraphExecutionException conditionFailure(
            String nodeId, ConditionEvaluationException e) {
        return new GraphExecutionException(
                "Condition of " + e.getEdge() + " failed: " + e.getCause().getMessage(),
                nodeId,
                store.snapshot(),
                e.getCause());
    }

    private void checkpoint(String reason) {
        ExecutionSnapshot snapshot = toSnapshot(reason);
        repository.save(executionId, snapshot);
        notifyListener("checkpoint", l -> l.onCheckpoint(snapshot));
    }

    private void notifyListener(String event, Consumer<ExecutionListener> call) {
        try {
            call.accept(listener);
        } catch (RuntimeException e) {
            logger.log(
                    Level.WARNING,
                    "Listener failed on " + event + " of execution " + executionId,
                    e);
        }
    }
}
