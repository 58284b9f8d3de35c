package io.stategraph.core.graph.node;

import io.stategraph.core.state.StateSnapshot;
import java.util.Objects;
import java.util.Optional;

/// Everything a {@link NodeHandler} may read during one visit.
///
/// @param executionId the execution this visit belongs to, not null
/// @param nodeId the node being visited, not null
/// @param visit 1-based visit count of this node within the execution
/// @param entryInput the execution's entry input, present only on the first step
/// @param state global state as of the start of the visit, not null
public record NodeContext(
        String executionId, String nodeId, int visit, Object entryInput, StateSnapshot state) {

    public NodeContext {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }

    /// Returns the entry input, which is only supplied to the first step.
    ///
    /// @return the entry input, empty on later steps
    public Optional<Object> input() {
        return Optional.ofNullable(entryInput);
    }
}
