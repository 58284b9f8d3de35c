package io.stategraph.core.graph.edge;

import io.stategraph.core.state.StateSnapshot;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/// Evaluates edge conditions against a state snapshot.
///
/// Evaluation is a pure function of the edge and the snapshot; the only side effects are
/// logging and an invocation counter.
///
/// ### Tie-break
/// {@link #selectFirst} walks edges in registration order and returns the first whose
/// condition holds. Later edges are not evaluated once a match is found.
///
/// @implNote Thread-safe.
public final class EdgeEvaluator {

    private static final Logger logger = Logger.getLogger(EdgeEvaluator.class.getName());

    private final AtomicLong evaluations = new AtomicLong();

    /// Evaluates one edge.
    ///
    /// @param edge the edge to test, not null
    /// @param snapshot the state to test against, not null
    /// @return whether the edge's condition holds
    /// @throws ConditionEvaluationException if the condition throws
    public boolean evaluate(Edge edge, StateSnapshot snapshot) {
        Objects.requireNonNull(edge, "edge must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        evaluations.incrementAndGet();

        boolean result;
        try {
            result = edge.condition().test(snapshot);
        } catch (RuntimeException e) {
            throw new ConditionEvaluationException(edge, e);
        }
        logger.fine(edge + " evaluated " + result);
        return result;
    }

    /// Returns the earliest-registered edge whose condition holds.
    ///
    /// @param edges candidate edges, in registration order, not null
    /// @param snapshot the state to test against, not null
    /// @return the winning edge, or empty if none holds
    /// @throws ConditionEvaluationException if a condition throws
    public Optional<Edge> selectFirst(List<Edge> edges, StateSnapshot snapshot) {
        for (Edge edge : edges) {
            if (evaluate(edge, snapshot)) {
                return Optional.of(edge);
            }
        }
        return Optional.empty();
    }

    /// Returns how many conditions this evaluator has tested.
    public long evaluationCount() {
        return evaluations.get();
    }
}
