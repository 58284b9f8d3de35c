package io.stategraph.serialization.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stategraph.core.execution.ExecutionResult;
import io.stategraph.core.execution.ExecutionStatus;
import io.stategraph.core.execution.GraphEngine;
import io.stategraph.core.graph.Graph;
import io.stategraph.core.graph.GraphBuilder;
import io.stategraph.core.graph.edge.EdgeRef;
import io.stategraph.core.graph.edge.StateCondition;
import io.stategraph.core.interaction.PendingInteraction;
import io.stategraph.core.state.FieldMapping;
import io.stategraph.core.storage.ExecutionSnapshot;
import io.stategraph.serialization.output.JacksonNodeOutputParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileExecutionStateRepositoryTest {

    @TempDir Path tempDir;

    private FileExecutionStateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new FileExecutionStateRepository(tempDir.resolve("executions"));
    }

    private static ExecutionSnapshot snapshot(
            String graphId, String executionId, ExecutionStatus status) {
        PendingInteraction pending =
                status == ExecutionStatus.SUSPENDED
                        ? new PendingInteraction("A", new EdgeRef(0, "A", "B", "approve"))
                        : null;
        return new ExecutionSnapshot(
                graphId,
                executionId,
                status,
                "A",
                pending,
                Map.of("stage", "A"),
                Map.of("A", Map.of("stage", "A")),
                Map.of(),
                List.of(),
                List.of("A"),
                1,
                "hello",
                List.of(),
                Instant.now(),
                "test");
    }

    private List<String> fileNames() throws IOException {
        try (Stream<Path> files = Files.list(repository.getDirectory())) {
            return files.map(f -> f.getFileName().toString()).sorted().toList();
        }
    }

    @Nested
    class Persistence {

        @Test
        void shouldSaveAndLoadFromJsonFile() throws Exception {
            // Given
            ExecutionSnapshot snapshot = snapshot("g", "exec-1", ExecutionStatus.SUSPENDED);

            // When
            repository.save("exec-1", snapshot);

            // Then
            assertThat(fileNames()).containsExactly("exec-1.json");
            ExecutionSnapshot loaded = repository.load("exec-1").orElseThrow();
            assertThat(loaded.pending()).isEqualTo(snapshot.pending());
            assertThat(loaded.fields()).isEqualTo(snapshot.fields());
            assertThat(loaded.entryInput()).isEqualTo("hello");
            assertThat(loaded.createdAt()).isEqualTo(snapshot.createdAt());
        }

        @Test
        void shouldReturnEmptyForUnknownExecution() {
            assertThat(repository.load("missing")).isEmpty();
            assertThat(repository.findSuspended()).isEmpty();
        }

        @Test
        void shouldOverwriteWithoutLeavingTemporaryFiles() throws Exception {
            repository.save("exec-1", snapshot("g", "exec-1", ExecutionStatus.SUSPENDED));
            repository.save("exec-1", snapshot("g", "exec-1", ExecutionStatus.COMPLETED));

            assertThat(fileNames()).containsExactly("exec-1.json");
            assertThat(repository.load("exec-1").orElseThrow().status())
                    .isEqualTo(ExecutionStatus.COMPLETED);
        }

        @Test
        void shouldQueryBySuspensionAndGraph() {
            repository.save("e1", snapshot("g", "e1", ExecutionStatus.SUSPENDED));
            repository.save("e2", snapshot("g", "e2", ExecutionStatus.FAILED));
            repository.save("e3", snapshot("h", "e3", ExecutionStatus.SUSPENDED));

            assertThat(repository.findSuspended())
                    .extracting(ExecutionSnapshot::executionId)
                    .containsExactly("e1", "e3");
            assertThat(repository.findByGraphId("g"))
                    .extracting(ExecutionSnapshot::executionId)
                    .containsExactly("e1", "e2");
        }

        @Test
        void shouldDeleteFile() throws Exception {
            repository.save("e1", snapshot("g", "e1", ExecutionStatus.COMPLETED));

            assertThat(repository.delete("e1")).isTrue();
            assertThat(repository.delete("e1")).isFalse();
            assertThat(fileNames()).isEmpty();
        }
    }

    @Nested
    class Validation {

        @Test
        void shouldRejectPathTraversal() {
            assertThatThrownBy(() -> repository.load("../secrets"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unsafe execution id");
            assertThatThrownBy(() -> repository.delete(".hidden"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRejectSnapshotUnderForeignId() {
            ExecutionSnapshot snapshot = snapshot("g", "e1", ExecutionStatus.COMPLETED);

            assertThatThrownBy(() -> repository.save("e2", snapshot))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldWrapUnreadableFile() throws Exception {
            Files.createDirectories(repository.getDirectory());
            Files.writeString(repository.getDirectory().resolve("broken.json"), "{oops");

            assertThatThrownBy(() -> repository.load("broken"))
                    .isInstanceOf(PersistenceException.class)
                    .hasMessageContaining("broken.json");
        }
    }

    @Nested
    class Resumption {

        @Test
        void shouldResumeInFreshEngineFromDisk() {
            // Given
            GraphBuilder builder =
                    GraphBuilder.create("approval").fieldMapping(FieldMapping.identity("stage"));
            builder.addNode("draft", context -> "```json\n{\"stage\": \"draft\"}\n```");
            builder.addNode("publish", context -> "{\"stage\": \"publish\"}");
            builder.addEdge("draft", "publish", StateCondition.always(), true, "sign-off");
            Graph graph = builder.setEntryPoint("draft").build();

            GraphEngine first =
                    new GraphEngine(repository, new JacksonNodeOutputParser(), null);
            ExecutionResult suspended = first.execute(graph, null);
            String executionId = ((ExecutionResult.Suspended) suspended).request().executionId();

            // When
            FileExecutionStateRepository reopened =
                    new FileExecutionStateRepository(repository.getDirectory());
            GraphEngine second = new GraphEngine(reopened, new JacksonNodeOutputParser(), null);
            ExecutionResult result = second.provideUserInput(graph, executionId, "approved");

            // Then
            assertThat(result).isInstanceOf(ExecutionResult.Completed.class);
            ExecutionSnapshot saved = reopened.load(executionId).orElseThrow();
            assertThat(saved.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(saved.fields()).containsEntry("stage", "publish");
            assertThat(saved.userInputs().get("draft").input()).isEqualTo("approved");
        }
    }
}
