package io.stategraph.core.graph.node;

/// A computation step invoked once per visit.
///
/// The engine treats handlers as black boxes: a handler reads whatever it needs from the
/// {@link NodeContext} and returns a structured payload, typically a `Map` of named
/// fields or JSON text. The payload is interpreted by the graph's
/// {@link io.stategraph.core.output.NodeOutputParser} and projected into global state.
///
/// ### Contracts
/// - **Precondition**: called synchronously, once per visit, from the execution's thread
/// - **Postcondition**: returns a payload, or throws to signal an unrecoverable failure
/// - **Invariant**: handlers do not mutate global state directly
///
/// @see NodeRegistry#invoke for the invocation glue
@FunctionalInterface
public interface NodeHandler {

    /// Runs the node.
    ///
    /// @param context entry input, state snapshot and identifiers for this visit, not null
    /// @return the raw payload, may be null (reported as malformed output)
    /// @throws Exception if the node cannot produce any output
    Object handle(NodeContext context) throws Exception;
}
