package io.stategraph.core.storage;

import io.stategraph.core.StateGraphConfig;

/// Creates an {@link ExecutionStateRepository} for one storage type.
///
/// Modules outside the core register implementations through `java.util.ServiceLoader`
/// or pass them to {@link io.stategraph.core.StateGraphFactory.Builder} directly; the
/// `stategraph.storage` setting selects one by {@link #storageType()}.
public interface ExecutionStateRepositoryProvider {

    /// Returns the storage type this provider handles, e.g. `"file"`.
    ///
    /// @return lower-case type identifier, never null
    String storageType();

    /// Creates the repository.
    ///
    /// @param config the environment configuration, not null
    /// @return a new repository, never null
    ExecutionStateRepository create(StateGraphConfig config);
}
