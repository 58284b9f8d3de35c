package io.stategraph.core.graph.edge;

import io.stategraph.core.state.StateSnapshot;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Predicate over an immutable state snapshot, attached to an {@link Edge}.
///
/// Conditions receive the snapshot by value, so they can neither observe a projection in
/// progress nor change state. Implementations must be side-effect free with respect to
/// state; the same condition may be evaluated many times in one execution.
///
/// ### Usage
/// {@snippet :
/// StateCondition succeeded = StateCondition.fieldEquals("stage", "A")
///     .and(StateCondition.fieldEquals("status", "Success"));
/// }
///
/// @see EdgeEvaluator
@FunctionalInterface
public interface StateCondition {

    /// Tests the condition.
    ///
    /// @param state the snapshot taken after the latest projection, not null
    /// @return true if the edge may be taken
    boolean test(StateSnapshot state);

    default StateCondition and(StateCondition other) {
        Objects.requireNonNull(other, "other must not be null");
        return state -> test(state) && other.test(state);
    }

    default StateCondition or(StateCondition other) {
        Objects.requireNonNull(other, "other must not be null");
        return state -> test(state) || other.test(state);
    }

    default StateCondition negate() {
        return state -> !test(state);
    }

    /// Condition that always holds.
    static StateCondition always() {
        return state -> true;
    }

    /// Condition that never holds.
    static StateCondition never() {
        return state -> false;
    }

    /// Holds when the field equals `expected`.
    ///
    /// @param field state field name, not null
    /// @param expected expected value, may be null
    static StateCondition fieldEquals(String field, Object expected) {
        Objects.requireNonNull(field, "field must not be null");
        return state -> state.fieldEquals(field, expected);
    }

    /// Holds when the field equals any of `values`.
    static StateCondition fieldIn(String field, Object... values) {
        Objects.requireNonNull(field, "field must not be null");
        List<Object> allowed = Arrays.asList(values);
        return state -> state.get(field).map(allowed::contains).orElse(false);
    }

    /// Holds when the field is present and `Boolean.TRUE` (or the string `true`).
    static StateCondition isTrue(String field) {
        Objects.requireNonNull(field, "field must not be null");
        return state -> state.getBoolean(field).orElse(false);
    }

    /// Holds when the node has an unconsumed user-input record.
    ///
    /// @param nodeId the node whose input is required, not null
    static StateCondition hasUserInput(String nodeId) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        return state -> state.userInput(nodeId).map(r -> !r.consumed()).orElse(false);
    }
}
