package io.stategraph.serialization.storage;

import java.io.Serial;

/// Unchecked exception for storage failures.
///
/// Wraps {@link java.io.IOException} so that
/// {@link io.stategraph.core.storage.ExecutionStateRepository}, which declares no checked
/// exceptions, can be implemented on top of the file system.
///
/// @see FileExecutionStateRepository
public class PersistenceException extends RuntimeException {

    @Serial private static final long serialVersionUID = 5215683071190418830L;

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
