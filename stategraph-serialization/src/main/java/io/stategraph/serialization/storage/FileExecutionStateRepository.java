package io.stategraph.serialization.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.stategraph.core.storage.ExecutionSnapshot;
import io.stategraph.core.storage.ExecutionStateRepository;
import io.stategraph.serialization.SnapshotSerializer;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/// File-system execution state repository storing one JSON document per execution.
///
/// Each snapshot lives in `{directory}/{executionId}.json`. A save writes a temporary
/// file in the same directory and moves it over the previous document, so readers never
/// see a partially written snapshot.
///
/// ### Contracts
/// - **Precondition**: execution ids consist of letters, digits, `-`, `_` and `.`, and do
///   not start with `.`
/// - **Postcondition**: `save` is idempotent per execution id
///
/// @implNote Thread-safe within one process: all operations synchronize on the
/// repository. Concurrent writers in several processes are not coordinated beyond the
/// atomic replace.
///
/// @see SnapshotSerializer for the document format
public class FileExecutionStateRepository implements ExecutionStateRepository {

    private static final Logger logger =
            Logger.getLogger(FileExecutionStateRepository.class.getName());

    private static final String EXTENSION = ".json";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_\\-][A-Za-z0-9_.\\-]*");

    private final Path directory;
    private final ObjectMapper objectMapper;

    /// Creates a repository using {@link SnapshotSerializer#createMapper()}.
    ///
    /// @param directory where documents are stored; created on first save, not null
    public FileExecutionStateRepository(Path directory) {
        this(directory, SnapshotSerializer.createMapper());
    }

    /// Creates a repository.
    ///
    /// @param directory where documents are stored; created on first save, not null
    /// @param objectMapper mapper configured with the state graph module, not null
    public FileExecutionStateRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public synchronized void save(String executionId, ExecutionSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Path target = fileFor(executionId);
        if (!executionId.equals(snapshot.executionId())) {
            throw new IllegalArgumentException(
                    "Snapshot of " + snapshot.executionId() + " saved under " + executionId);
        }

        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, executionId + ".", ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), snapshot);
                move(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to save execution " + executionId, e);
        }
        logger.fine("Saved execution " + executionId + " (" + snapshot.status() + ")");
    }

    @Override
    public synchronized Optional<ExecutionSnapshot> load(String executionId) {
        Path file = fileFor(executionId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    @Override
    public synchronized List<ExecutionSnapshot> findSuspended() {
        return findAll(ExecutionSnapshot::isSuspended);
    }

    @Override
    public synchronized List<ExecutionSnapshot> findByGraphId(String graphId) {
        Objects.requireNonNull(graphId, "graphId must not be null");
        return findAll(s -> graphId.equals(s.graphId()));
    }

    @Override
    public synchronized boolean delete(String executionId) {
        try {
            return Files.deleteIfExists(fileFor(executionId));
        } catch (IOException e) {
            throw new PersistenceException("Failed to delete execution " + executionId, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    private List<ExecutionSnapshot> findAll(Predicate<ExecutionSnapshot> filter) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<ExecutionSnapshot> matches = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file :
                    files.filter(f -> f.getFileName().toString().endsWith(EXTENSION))
                            .sorted(Comparator.comparing(Path::getFileName))
                            .toList()) {
                ExecutionSnapshot snapshot = read(file);
                if (filter.test(snapshot)) {
                    matches.add(snapshot);
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to list " + directory, e);
        }
        return matches;
    }

    private ExecutionSnapshot read(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), ExecutionSnapshot.class);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + file, e);
        }
    }

    private Path fileFor(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        if (!SAFE_ID.matcher(executionId).matches()) {
            throw new IllegalArgumentException("Unsafe execution id: " + executionId);
        }
        return directory.resolve(executionId + EXTENSION);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(
                    source,
                    target,
                    StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
