package io.stategraph.core.graph.edge;

import java.io.Serial;

/// Thrown when an edge condition itself throws during evaluation.
public class ConditionEvaluationException extends RuntimeException {

    @Serial private static final long serialVersionUID = 7710328594431086512L;

    private final Edge edge;

    public ConditionEvaluationException(Edge edge, Throwable cause) {
        super("Condition of " + edge + " failed: " + cause.getMessage(), cause);
        this.edge = edge;
    }

    public Edge getEdge() {
        return edge;
    }
}
