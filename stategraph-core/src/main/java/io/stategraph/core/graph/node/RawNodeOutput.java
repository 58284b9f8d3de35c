package io.stategraph.core.graph.node;

import java.time.Duration;
import java.time.Instant;

/// Payload captured from one handler invocation, before interpretation.
///
/// @param nodeId the invoked node, not null
/// @param payload whatever the handler returned, may be null
/// @param startedAt when the invocation began, not null
/// @param duration how long the handler ran, not null
public record RawNodeOutput(String nodeId, Object payload, Instant startedAt, Duration duration) {}
