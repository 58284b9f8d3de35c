package io.stategraph.core.execution;

import java.io.Serial;

/// Rejects an operation that the execution's current status does not allow.
///
/// Thrown, for example, when input is provided to an execution that is not suspended.
/// The execution is left unchanged.
public class ExecutionStateException extends IllegalStateException {

    @Serial private static final long serialVersionUID = 2093318740662395318L;

    private final String executionId;
    private final ExecutionStatus status;

    public ExecutionStateException(String executionId, ExecutionStatus status, String operation) {
        super(
                "Cannot "
                        + operation
                        + " execution "
                        + executionId
                        + " in status "
                        + status);
        this.executionId = executionId;
        this.status = status;
    }

    public String getExecutionId() {
        return executionId;
    }

    public ExecutionStatus getStatus() {
        return status;
    }
}
