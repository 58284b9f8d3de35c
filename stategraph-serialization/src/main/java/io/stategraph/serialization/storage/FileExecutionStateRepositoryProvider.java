package io.stategraph.serialization.storage;

import io.stategraph.core.StateGraphConfig;
import io.stategraph.core.storage.ExecutionStateRepository;
import io.stategraph.core.storage.ExecutionStateRepositoryProvider;
import java.nio.file.Path;

/// Provides {@link FileExecutionStateRepository} for `stategraph.storage=file`.
///
/// Registered through `META-INF/services`, so adding this module to the class path is
/// enough for {@link io.stategraph.core.StateGraphFactory} to find it.
public final class FileExecutionStateRepositoryProvider
        implements ExecutionStateRepositoryProvider {

    public static final String STORAGE_TYPE = "file";

    @Override
    public String storageType() {
        return STORAGE_TYPE;
    }

    @Override
    public ExecutionStateRepository create(StateGraphConfig config) {
        return new FileExecutionStateRepository(Path.of(config.getStorageDirectory()));
    }
}
