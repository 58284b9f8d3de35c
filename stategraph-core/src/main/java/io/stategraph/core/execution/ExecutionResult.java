package io.stategraph.core.execution;

import io.stategraph.core.interaction.InteractionRequest;
import io.stategraph.core.state.StateSnapshot;
import java.util.List;
import java.util.Objects;

/// Outcome of advancing a {@link GraphExecution}.
///
/// Suspension is an ordinary value, not an exception: a caller receiving {@link Suspended}
/// can persist nothing further, return, and later resume from the repository in any
/// process.
///
/// ### Permitted Subtypes
/// - {@link Running} - one step done, the execution moved to another node
/// - {@link Suspended} - waiting for external input on an edge
/// - {@link Completed} - no outgoing edge fired
/// - {@link Failed} - unrecoverable error
public sealed interface ExecutionResult {

    /// Returns the execution status this result corresponds to.
    ExecutionStatus status();

    /// Returns whether no further steps can follow this result.
    default boolean isTerminal() {
        return status().isTerminal();
    }

    /// One step completed and the execution transitioned.
    ///
    /// @param nodeId the node that will run next, not null
    record Running(String nodeId) implements ExecutionResult {

        public Running {
            Objects.requireNonNull(nodeId, "nodeId must not be null");
        }

        @Override
        public ExecutionStatus status() {
            return ExecutionStatus.RUNNING;
        }
    }

    /// The selected edge requires input that has not been provided.
    ///
    /// @param request what the execution is waiting for, not null
    /// @param state global state at suspension, not null
    /// @param warnings non-fatal problems encountered before suspending, not null
    record Suspended(InteractionRequest request, StateSnapshot state, List<String> warnings)
            implements ExecutionResult {

        public Suspended {
            Objects.requireNonNull(request, "request must not be null");
            Objects.requireNonNull(state, "state must not be null");
            warnings = warnings != null ? List.copyOf(warnings) : List.of();
        }

        @Override
        public ExecutionStatus status() {
            return ExecutionStatus.SUSPENDED;
        }

        public boolean hasWarnings() {
            return !warnings.isEmpty();
        }
    }

    /// No outgoing edge of the last node fired.
    ///
    /// @param finalState global state after the last projection, not null
    /// @param terminalNodeId the last node executed, not null
    /// @param path node ids in visit order, not null
    /// @param warnings non-fatal problems encountered on the way, not null
    record Completed(
            StateSnapshot finalState,
            String terminalNodeId,
            List<String> path,
            List<String> warnings)
            implements ExecutionResult {

        public Completed {
            Objects.requireNonNull(finalState, "finalState must not be null");
            Objects.requireNonNull(terminalNodeId, "terminalNodeId must not be null");
            path = path != null ? List.copyOf(path) : List.of();
            warnings = warnings != null ? List.copyOf(warnings) : List.of();
        }

        @Override
        public ExecutionStatus status() {
            return ExecutionStatus.COMPLETED;
        }

        public boolean hasWarnings() {
            return !warnings.isEmpty();
        }
    }

    /// The execution failed and accepts no further input.
    ///
    /// @param error failure with node id and last consistent snapshot, not null
    record Failed(GraphExecutionException error) implements ExecutionResult {

        public Failed {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public ExecutionStatus status() {
            return ExecutionStatus.FAILED;
        }

        public String nodeId() {
            return error.getNodeId();
        }

        public StateSnapshot lastSnapshot() {
            return error.getLastSnapshot();
        }
    }
}
