package io.stategraph.core;

import io.stategraph.core.execution.ExecutionListener;
import io.stategraph.core.execution.GraphEngine;
import io.stategraph.core.graph.GraphRepository;
import io.stategraph.core.graph.InMemoryGraphRepository;
import io.stategraph.core.output.MapNodeOutputParser;
import io.stategraph.core.output.NodeOutputParser;
import io.stategraph.core.storage.ExecutionStateRepository;
import io.stategraph.core.storage.ExecutionStateRepositoryProvider;
import io.stategraph.core.storage.InMemoryExecutionStateRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/// Factory for creating and wiring {@link StateGraphEnvironment} instances.
///
/// ### Usage Patterns
///
/// **Quick start** (in-memory storage, map payloads only):
/// {@snippet :
/// StateGraphEnvironment env = StateGraphFactory.createEnvironment();
/// }
///
/// **Builder with explicit components**:
/// {@snippet :
/// StateGraphEnvironment env = StateGraphFactory.builder()
///     .config(StateGraphConfig.fromProperties(properties))
///     .outputParser(new JacksonNodeOutputParser())
///     .listener(new LoggingExecutionListener())
///     .build();
/// }
///
/// @implNote Storage types other than `memory` are resolved against the providers given to
/// the builder, or, if none were given, those found by `ServiceLoader`.
///
/// @see StateGraphEnvironment
/// @see StateGraphConfig
public final class StateGraphFactory {

    private static final Logger logger = Logger.getLogger(StateGraphFactory.class.getName());

    private StateGraphFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment with default configuration.
    ///
    /// @return a fully-configured environment, never null
    public static StateGraphEnvironment createEnvironment() {
        return createEnvironment(new StateGraphConfig());
    }

    /// Creates an environment with custom configuration.
    ///
    /// @param config environment configuration, not null
    /// @return a fully-configured environment, never null
    /// @throws IllegalStateException if the storage type has no provider
    public static StateGraphEnvironment createEnvironment(StateGraphConfig config) {
        return builder().config(config).build();
    }

    /// Creates a new builder.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    static ExecutionStateRepository createStateRepository(
            StateGraphConfig config, List<ExecutionStateRepositoryProvider> providers) {
        String type = config.getStorageType();
        if (type == null || StateGraphConfig.MEMORY_STORAGE.equals(type)) {
            return new InMemoryExecutionStateRepository();
        }
        for (ExecutionStateRepositoryProvider provider : providers) {
            if (type.equals(provider.storageType())) {
                logger.info("Using '" + type + "' execution storage");
                return provider.create(config);
            }
        }
        throw new IllegalStateException(
                "No execution storage provider for "
                        + StateGraphConfig.STORAGE
                        + "="
                        + type);
    }

    private static List<ExecutionStateRepositoryProvider> discoverProviders() {
        List<ExecutionStateRepositoryProvider> providers = new ArrayList<>();
        ServiceLoader.load(ExecutionStateRepositoryProvider.class).forEach(providers::add);
        return providers;
    }

    /// Fluent builder for {@link StateGraphEnvironment}.
    public static class Builder {

        private StateGraphConfig config = new StateGraphConfig();
        private NodeOutputParser outputParser = MapNodeOutputParser.INSTANCE;
        private ExecutionListener listener = ExecutionListener.NOOP;
        private ExecutionStateRepository stateRepository;
        private GraphRepository graphRepository;
        private final List<ExecutionStateRepositoryProvider> providers = new ArrayList<>();

        private Builder() {}

        public Builder config(StateGraphConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /// Sets the parser used for all node payloads.
        ///
        /// @param outputParser the parser, not null
        /// @return this builder for chaining, never null
        public Builder outputParser(NodeOutputParser outputParser) {
            this.outputParser = Objects.requireNonNull(outputParser, "outputParser required");
            return this;
        }

        public Builder listener(ExecutionListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            return this;
        }

        /// Uses the given repository instead of the configured storage type.
        ///
        /// @param stateRepository the repository, not null
        /// @return this builder for chaining, never null
        public Builder stateRepository(ExecutionStateRepository stateRepository) {
            this.stateRepository =
                    Objects.requireNonNull(stateRepository, "stateRepository required");
            return this;
        }

        public Builder graphRepository(GraphRepository graphRepository) {
            this.graphRepository =
                    Objects.requireNonNull(graphRepository, "graphRepository required");
            return this;
        }

        /// Adds a storage provider; disables `ServiceLoader` discovery.
        ///
        /// @param provider the provider, not null
        /// @return this builder for chaining, never null
        public Builder repositoryProvider(ExecutionStateRepositoryProvider provider) {
            providers.add(Objects.requireNonNull(provider, "provider must not be null"));
            return this;
        }

        /// Wires the environment.
        ///
        /// @return the environment, never null
        /// @throws IllegalStateException if the storage type has no provider
        public StateGraphEnvironment build() {
            ExecutionStateRepository states =
                    stateRepository != null
                            ? stateRepository
                            : createStateRepository(
                                    config, providers.isEmpty() ? discoverProviders() : providers);
            GraphRepository graphs =
                    graphRepository != null ? graphRepository : new InMemoryGraphRepository();
            GraphEngine engine = new GraphEngine(states, outputParser, listener);
            return new StateGraphEnvironment(config, engine, graphs, states);
        }
    }
}
