package io.stategraph.core.execution;

import io.stategraph.core.graph.edge.Edge;
import io.stategraph.core.graph.node.RawNodeOutput;
import io.stategraph.core.interaction.InteractionRequest;
import io.stategraph.core.state.ProjectionResult;
import io.stategraph.core.storage.ExecutionSnapshot;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Logs the execution lifecycle through `java.util.logging`.
///
/// ### Log Format
/// ```
/// [executionId] started graph graphId
/// [executionId] > nodeId (visit n)
/// [executionId] < nodeId in 12 ms
/// [executionId] projected nodeId: [stage, status, nodeId_result]
/// [executionId] nodeId -> target via name
/// [executionId] suspended at nodeId, options [yes, no]
/// [executionId] completed at nodeId after n steps
/// [executionId] failed at nodeId: message
/// ```
///
/// Node and projection events log at FINE, lifecycle events at INFO, failures at WARNING.
///
/// @see CompositeExecutionListener
public class LoggingExecutionListener implements ExecutionListener {

    private static final Logger logger =
            Logger.getLogger(LoggingExecutionListener.class.getName());

    @Override
    public void onExecutionStarted(String executionId, String graphId) {
        logger.info("[" + executionId + "] started graph " + graphId);
    }

    @Override
    public void onNodeStart(String executionId, String nodeId, int visit) {
        logger.fine("[" + executionId + "] > " + nodeId + " (visit " + visit + ")");
    }

    @Override
    public void onNodeComplete(String executionId, RawNodeOutput output) {
        logger.fine(
                "["
                        + executionId
                        + "] < "
                        + output.nodeId()
                        + " in "
                        + output.duration().toMillis()
                        + " ms");
    }

    @Override
    public void onProjection(String executionId, ProjectionResult result) {
        if (result.malformed()) {
            logger.warning(
                    "["
                            + executionId
                            + "] malformed output from "
                            + result.nodeId()
                            + ": "
                            + result.failureReason());
            return;
        }
        logger.fine(
                "["
                        + executionId
                        + "] projected "
                        + result.nodeId()
                        + ": "
                        + result.changedFields());
    }

    @Override
    public void onTransition(String executionId, Edge edge) {
        logger.info(
                "["
                        + executionId
                        + "] "
                        + edge.source()
                        + " -> "
                        + edge.target()
                        + " via "
                        + edge.name());
    }

    @Override
    public void onSuspended(InteractionRequest request) {
        logger.info(
                "["
                        + request.executionId()
                        + "] suspended at "
                        + request.nodeId()
                        + ", options "
                        + request.options());
    }

    @Override
    public void onResumed(String executionId, String nodeId) {
        logger.info("[" + executionId + "] input received for " + nodeId);
    }

    @Override
    public void onCompleted(String executionId, ExecutionResult.Completed result) {
        logger.info(
                "["
                        + executionId
                        + "] completed at "
                        + result.terminalNodeId()
                        + " after "
                        + result.path().size()
                        + " steps");
    }

    @Override
    public void onFailed(String executionId, GraphExecutionException error) {
        logger.log(
                Level.WARNING,
                "[" + executionId + "] failed at " + error.getNodeId() + ": " + error.getMessage(),
                error.getCause());
    }

    @Override
    public void onCheckpoint(ExecutionSnapshot snapshot) {
        logger.fine(
                "["
                        + snapshot.executionId()
                        + "] checkpoint "
                        + snapshot.status()
                        + " ("
                        + snapshot.reason()
                        + ")");
    }
}
