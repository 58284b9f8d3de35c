package io.stategraph.core.state;

/// Kind of change recorded by a {@link HistoryEntry}.
public enum HistoryOperation {

    /// A node's output was projected into global state.
    PROJECT,

    /// A node's output could not be interpreted; global state was left untouched.
    PROJECTION_FAILURE,

    /// A fallback record was written in place of malformed output.
    FALLBACK,

    /// External input was recorded for a node.
    USER_INPUT,

    /// A user-input record satisfied an edge and was marked consumed.
    USER_INPUT_CONSUMED
}
