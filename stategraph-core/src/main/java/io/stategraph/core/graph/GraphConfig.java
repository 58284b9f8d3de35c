package io.stategraph.core.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Execution behaviour settings carried by a {@link Graph}.
///
/// @param maxSteps upper bound on node invocations per execution, `0` for unbounded
/// @param projectionFailurePolicy handling of malformed node output, not null
/// @param userInputRetention reuse policy for user-input records, not null
/// @param checkpointEachStep whether every step is persisted, not only suspend/terminal
/// @param fallbackOutput fields written by {@link ProjectionFailurePolicy#FALLBACK}; `stage`
///     defaults to the node id when absent, not null
public record GraphConfig(
        int maxSteps,
        ProjectionFailurePolicy projectionFailurePolicy,
        UserInputRetention userInputRetention,
        boolean checkpointEachStep,
        Map<String, Object> fallbackOutput) {

    /// Fallback record used when none is configured.
    public static final Map<String, Object> DEFAULT_FALLBACK_OUTPUT = defaultFallback();

    public GraphConfig {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must not be negative: " + maxSteps);
        }
        Objects.requireNonNull(projectionFailurePolicy, "projectionFailurePolicy required");
        Objects.requireNonNull(userInputRetention, "userInputRetention required");
        fallbackOutput =
                fallbackOutput != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(fallbackOutput))
                        : DEFAULT_FALLBACK_OUTPUT;
    }

    /// Returns the default configuration: unbounded, warn on malformed output, persistent
    /// user input, checkpoint only on suspend and terminal states.
    public static GraphConfig defaults() {
        return new GraphConfig(
                0,
                ProjectionFailurePolicy.WARN,
                UserInputRetention.PERSIST,
                false,
                DEFAULT_FALLBACK_OUTPUT);
    }

    public GraphConfig withMaxSteps(int maxSteps) {
        return new GraphConfig(
                maxSteps,
                projectionFailurePolicy,
                userInputRetention,
                checkpointEachStep,
                fallbackOutput);
    }

    public GraphConfig withProjectionFailurePolicy(ProjectionFailurePolicy policy) {
        return new GraphConfig(
                maxSteps, policy, userInputRetention, checkpointEachStep, fallbackOutput);
    }

    public GraphConfig withUserInputRetention(UserInputRetention retention) {
        return new GraphConfig(
                maxSteps, projectionFailurePolicy, retention, checkpointEachStep, fallbackOutput);
    }

    public GraphConfig withCheckpointEachStep(boolean checkpointEachStep) {
        return new GraphConfig(
                maxSteps,
                projectionFailurePolicy,
                userInputRetention,
                checkpointEachStep,
                fallbackOutput);
    }

    public GraphConfig withFallbackOutput(Map<String, Object> fallbackOutput) {
        return new GraphConfig(
                maxSteps,
                projectionFailurePolicy,
                userInputRetention,
                checkpointEachStep,
                fallbackOutput);
    }

    /// Returns whether a step bound is configured.
    public boolean isBounded() {
        return maxSteps > 0;
    }

    /// Builds the fallback record for a node.
    ///
    /// @param nodeId the node whose output was malformed, not null
    /// @return fallback fields with `stage` defaulted to the node id, never null
    public Map<String, Object> fallbackFor(String nodeId) {
        Map<String, Object> fallback = new LinkedHashMap<>();
        fallback.put("stage", nodeId);
        fallback.putAll(fallbackOutput);
        return fallback;
    }

    private static Map<String, Object> defaultFallback() {
        Map<String, Object> fallback = new LinkedHashMap<>();
        fallback.put("status", "Success");
        fallback.put("confidence", 0.5);
        fallback.put("fallback", true);
        return Collections.unmodifiableMap(fallback);
    }
}
