package io.stategraph.core.graph;

import java.io.Serial;

/// Thrown at build time when a graph definition is structurally invalid.
///
/// Raised for duplicate node ids, a missing or unknown entry point, and edges that
/// reference unknown nodes. No execution can start from an invalid graph.
public class GraphValidationException extends RuntimeException {

    @Serial private static final long serialVersionUID = -1180429837569302231L;

    public GraphValidationException(String message) {
        super(message);
    }
}
