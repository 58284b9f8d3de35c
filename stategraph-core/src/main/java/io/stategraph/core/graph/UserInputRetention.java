package io.stategraph.core.graph;

/// Whether a user-input record keeps satisfying input-gated edges after first use.
public enum UserInputRetention {

    /// The record satisfies every later evaluation of edges from the same node.
    PERSIST,

    /// The record is marked consumed once it satisfies an edge; revisiting the node
    /// requires fresh input.
    CONSUME
}
