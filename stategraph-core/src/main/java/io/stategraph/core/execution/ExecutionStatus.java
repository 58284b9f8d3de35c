package io.stategraph.core.execution;

/// Lifecycle state of a {@link GraphExecution}.
///
/// `IDLE -> RUNNING -> {SUSPENDED, COMPLETED, FAILED}`; `SUSPENDED -> RUNNING` on resume.
/// `COMPLETED` and `FAILED` are terminal.
public enum ExecutionStatus {
    IDLE,
    RUNNING,
    SUSPENDED,
    COMPLETED,
    FAILED;

    /// Returns whether no further transitions are possible.
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
