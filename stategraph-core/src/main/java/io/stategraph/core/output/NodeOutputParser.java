package io.stategraph.core.output;

/// Interprets a node's raw payload as a {@link NodeOutput} record.
///
/// Decouples payload interpretation from any specific JSON library so that
/// {@code stategraph-core} remains dependency-free. The Jackson-based implementation,
/// which also understands JSON text embedded in prose or code fences, lives in
/// {@code stategraph-serialization} as {@code JacksonNodeOutputParser}.
///
/// @see MapNodeOutputParser for the default implementation
/// @see io.stategraph.core.state.StateStore#project
@FunctionalInterface
public interface NodeOutputParser {

    /// Parses a raw payload.
    ///
    /// @param payload the object returned by a node handler, may be null
    /// @return the parsed record, never null
    /// @throws NodeOutputParseException if the payload has no field/value structure
    NodeOutput parse(Object payload) throws NodeOutputParseException;
}
