package io.stategraph.core.execution;

import io.stategraph.core.state.StateSnapshot;
import java.io.Serial;

/// Raised when an execution reaches the graph's configured step bound.
public class StepLimitExceededException extends GraphExecutionException {

    @Serial private static final long serialVersionUID = -3571029736128804471L;

    private final int maxSteps;

    public StepLimitExceededException(int maxSteps, String nodeId, StateSnapshot lastSnapshot) {
        super(
                "Step limit of " + maxSteps + " reached before visiting node " + nodeId,
                nodeId,
                lastSnapshot);
        this.maxSteps = maxSteps;
    }

    public int getMaxSteps() {
        return maxSteps;
    }
}
