package io.stategraph.core;

import io.stategraph.core.graph.GraphConfig;
import io.stategraph.core.graph.ProjectionFailurePolicy;
import io.stategraph.core.graph.UserInputRetention;
import java.util.Locale;
import java.util.Properties;

/// Configuration options for a state graph environment.
///
/// Supplies the defaults for every graph created through
/// {@link StateGraphEnvironment#newGraph(String)} and selects the execution storage backend.
/// Use the {@link Builder} or {@link #fromProperties(Properties)}.
///
/// ### Default Values
/// - `stategraph.max-steps`: `0` (unbounded)
/// - `stategraph.projection-failure-policy`: `warn`
/// - `stategraph.user-input-retention`: `persist`
/// - `stategraph.checkpoint-each-step`: `false`
/// - `stategraph.storage`: `memory`
/// - `stategraph.storage.directory`: `.stategraph/executions` (only used by `file` storage)
///
/// @implNote **Not thread-safe**. Configure before passing to {@link StateGraphFactory};
/// do not modify after environment creation.
///
/// @see StateGraphFactory#createEnvironment(StateGraphConfig)
public class StateGraphConfig {

    public static final String MAX_STEPS = "stategraph.max-steps";
    public static final String PROJECTION_FAILURE_POLICY = "stategraph.projection-failure-policy";
    public static final String USER_INPUT_RETENTION = "stategraph.user-input-retention";
    public static final String CHECKPOINT_EACH_STEP = "stategraph.checkpoint-each-step";
    public static final String STORAGE = "stategraph.storage";
    public static final String STORAGE_DIRECTORY = "stategraph.storage.directory";

    public static final String MEMORY_STORAGE = "memory";

    private int maxSteps = 0;
    private ProjectionFailurePolicy projectionFailurePolicy = ProjectionFailurePolicy.WARN;
    private UserInputRetention userInputRetention = UserInputRetention.PERSIST;
    private boolean checkpointEachStep = false;
    private String storageType = MEMORY_STORAGE;
    private String storageDirectory = ".stategraph/executions";

    /// Creates a configuration with default values.
    public StateGraphConfig() {}

    /// Reads configuration from properties; missing keys keep their defaults.
    ///
    /// @param properties source properties, not null
    /// @return the configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed; the message names the key
    public static StateGraphConfig fromProperties(Properties properties) {
        StateGraphConfig config = new StateGraphConfig();

        String maxSteps = trimmed(properties, MAX_STEPS);
        if (maxSteps != null) {
            try {
                config.setMaxSteps(Integer.parseInt(maxSteps));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid " + MAX_STEPS + ": '" + maxSteps + "'", e);
            }
        }

        String policy = trimmed(properties, PROJECTION_FAILURE_POLICY);
        if (policy != null) {
            config.setProjectionFailurePolicy(
                    parseEnum(ProjectionFailurePolicy.class, PROJECTION_FAILURE_POLICY, policy));
        }

        String retention = trimmed(properties, USER_INPUT_RETENTION);
        if (retention != null) {
            config.setUserInputRetention(
                    parseEnum(UserInputRetention.class, USER_INPUT_RETENTION, retention));
        }

        String checkpoint = trimmed(properties, CHECKPOINT_EACH_STEP);
        if (checkpoint != null) {
            config.setCheckpointEachStep(Boolean.parseBoolean(checkpoint));
        }

        String storage = trimmed(properties, STORAGE);
        if (storage != null) {
            config.setStorageType(storage.toLowerCase(Locale.ROOT));
        }

        String directory = trimmed(properties, STORAGE_DIRECTORY);
        if (directory != null) {
            config.setStorageDirectory(directory);
        }
        return config;
    }

    /// Reads configuration from JVM system properties.
    ///
    /// @return the configuration, never null
    public static StateGraphConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /// Returns the per-graph settings these options imply.
    ///
    /// @return graph config with the default fallback record, never null
    public GraphConfig toGraphConfig() {
        return new GraphConfig(
                maxSteps,
                projectionFailurePolicy,
                userInputRetention,
                checkpointEachStep,
                GraphConfig.DEFAULT_FALLBACK_OUTPUT);
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    /// Sets the step bound per execution.
    ///
    /// @param maxSteps bound, `0` for unbounded, not negative
    public void setMaxSteps(int maxSteps) {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("Invalid " + MAX_STEPS + ": " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    public ProjectionFailurePolicy getProjectionFailurePolicy() {
        return projectionFailurePolicy;
    }

    public void setProjectionFailurePolicy(ProjectionFailurePolicy projectionFailurePolicy) {
        this.projectionFailurePolicy = projectionFailurePolicy;
    }

    public UserInputRetention getUserInputRetention() {
        return userInputRetention;
    }

    public void setUserInputRetention(UserInputRetention userInputRetention) {
        this.userInputRetention = userInputRetention;
    }

    public boolean isCheckpointEachStep() {
        return checkpointEachStep;
    }

    public void setCheckpointEachStep(boolean checkpointEachStep) {
        this.checkpointEachStep = checkpointEachStep;
    }

    /// Returns the execution storage backend type.
    ///
    /// @return `"memory"` or the type of a registered
    ///     {@link io.stategraph.core.storage.ExecutionStateRepositoryProvider}, never null
    public String getStorageType() {
        return storageType;
    }

    public void setStorageType(String storageType) {
        this.storageType = storageType;
    }

    public String getStorageDirectory() {
        return storageDirectory;
    }

    public void setStorageDirectory(String storageDirectory) {
        this.storageDirectory = storageDirectory;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    private static String trimmed(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, value.replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + key + ": '" + value + "'", e);
        }
    }

    /// Fluent builder for {@link StateGraphConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final StateGraphConfig config = new StateGraphConfig();

        public Builder maxSteps(int maxSteps) {
            config.setMaxSteps(maxSteps);
            return this;
        }

        public Builder projectionFailurePolicy(ProjectionFailurePolicy policy) {
            config.projectionFailurePolicy = policy;
            return this;
        }

        public Builder userInputRetention(UserInputRetention retention) {
            config.userInputRetention = retention;
            return this;
        }

        public Builder checkpointEachStep(boolean checkpointEachStep) {
            config.checkpointEachStep = checkpointEachStep;
            return this;
        }

        /// Sets the storage backend type.
        ///
        /// @param storageType `"memory"` or a provider's type such as `"file"`, not null
        /// @return this builder for chaining, never null
        public Builder storageType(String storageType) {
            config.storageType = storageType;
            return this;
        }

        public Builder storageDirectory(String storageDirectory) {
            config.storageDirectory = storageDirectory;
            return this;
        }

        /// Builds and returns the configured instance.
        ///
        /// @return the configured instance, never null
        public StateGraphConfig build() {
            return config;
        }
    }
}
