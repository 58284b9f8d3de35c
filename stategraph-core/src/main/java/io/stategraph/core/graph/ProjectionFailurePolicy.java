package io.stategraph.core.graph;

/// What the engine does when a node's output cannot be interpreted.
public enum ProjectionFailurePolicy {

    /// Leave state untouched, record a warning and keep routing on existing state.
    WARN,

    /// Write the graph's fallback record for the node, then keep routing.
    FALLBACK,

    /// Fail the execution.
    FAIL
}
