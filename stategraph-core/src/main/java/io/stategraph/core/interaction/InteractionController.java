package io.stategraph.core.interaction;

import io.stategraph.core.graph.UserInputRetention;
import io.stategraph.core.graph.edge.Edge;
import io.stategraph.core.graph.edge.EdgeEvaluator;
import io.stategraph.core.output.NodeOutput;
import io.stategraph.core.state.StateSnapshot;
import io.stategraph.core.state.StateStore;
import io.stategraph.core.state.UserInputRecord;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Suspend/resume protocol for edges that require external input.
///
/// An input-gated edge whose condition holds is passable only when its source node has a
/// usable `{source}_user_input` record. Usability depends on the graph's
/// {@link UserInputRetention}: under `PERSIST` any record counts; under `CONSUME` only a
/// record that has not yet satisfied an edge.
///
/// ### Contracts
/// - **Precondition**: callers evaluate the edge condition before asking for satisfaction
/// - **Postcondition**: {@link #resume} never touches `{source}_result`
///
/// @implNote Stateless and thread-safe. All state lives in the {@link StateStore}.
///
/// @see io.stategraph.core.execution.GraphExecution
public final class InteractionController {

    private static final Logger logger = Logger.getLogger(InteractionController.class.getName());

    /// Returns whether an edge can be traversed without suspending.
    ///
    /// @param edge the selected edge, not null
    /// @param snapshot state after the latest projection, not null
    /// @param retention reuse policy for user-input records, not null
    /// @return true for edges without an input gate, or when a usable record exists
    public boolean isSatisfied(Edge edge, StateSnapshot snapshot, UserInputRetention retention) {
        if (!edge.requiresExternalInput()) {
            return true;
        }
        Optional<UserInputRecord> record = snapshot.userInput(edge.source());
        if (record.isEmpty()) {
            return false;
        }
        return retention == UserInputRetention.PERSIST || !record.get().consumed();
    }

    /// Builds the request published when an execution suspends on an edge.
    ///
    /// @param executionId the execution being suspended, not null
    /// @param edge the blocking edge, not null
    /// @param snapshot state after the latest projection, not null
    /// @return the request, never null
    public InteractionRequest suspend(String executionId, Edge edge, StateSnapshot snapshot) {
        InteractionRequest request = request(executionId, edge, snapshot);
        logger.info(
                "Execution "
                        + executionId
                        + " waiting for input at node "
                        + edge.source()
                        + " on "
                        + edge.name());
        return request;
    }

    /// Builds the request for an edge without logging a suspension.
    ///
    /// Used when a suspended execution is restored from a snapshot.
    ///
    /// @param executionId the suspended execution, not null
    /// @param edge the blocking edge, not null
    /// @param snapshot current state, not null
    /// @return the request, never null
    public InteractionRequest request(String executionId, Edge edge, StateSnapshot snapshot) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(edge, "edge must not be null");

        Map<String, Object> output = snapshot.result(edge.source()).orElse(Map.of());
        return new InteractionRequest(
                executionId,
                edge.source(),
                output,
                NodeOutput.of(output).options(),
                edge.ref(),
                Instant.now());
    }

    /// Records input for the blocked node and re-evaluates the blocking edge.
    ///
    /// @apiNote **Side effects**: creates or replaces `{source}_user_input` and appends a
    /// history entry, whether or not the edge becomes passable
    ///
    /// @param store the execution's state store, not null
    /// @param edge the blocking edge, not null
    /// @param input the supplied value, may be null
    /// @param evaluator evaluator used for the condition, not null
    /// @param retention reuse policy for user-input records, not null
    /// @return true if the edge is now passable
    public boolean resume(
            StateStore store,
            Edge edge,
            Object input,
            EdgeEvaluator evaluator,
            UserInputRetention retention) {
        store.recordUserInput(edge.source(), input);
        StateSnapshot snapshot = store.snapshot();
        boolean passable =
                evaluator.evaluate(edge, snapshot) && isSatisfied(edge, snapshot, retention);
        if (!passable) {
            logger.info("Input for node " + edge.source() + " did not satisfy " + edge.name());
        }
        return passable;
    }

    /// Applies the retention policy after an input-gated edge was traversed.
    ///
    /// @param store the execution's state store, not null
    /// @param edge the traversed edge, not null
    /// @param retention reuse policy for user-input records, not null
    public void onTraversed(StateStore store, Edge edge, UserInputRetention retention) {
        if (edge.requiresExternalInput() && retention == UserInputRetention.CONSUME) {
            store.markUserInputConsumed(edge.source());
        }
    }
}
