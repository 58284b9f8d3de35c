package io.stategraph.core.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stategraph.core.execution.ExecutionStatus;
import io.stategraph.core.graph.edge.EdgeRef;
import io.stategraph.core.interaction.PendingInteraction;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryExecutionStateRepositoryTest {

    private InMemoryExecutionStateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryExecutionStateRepository();
    }

    static ExecutionSnapshot snapshot(String graphId, String executionId, ExecutionStatus status) {
        PendingInteraction pending =
                status == ExecutionStatus.SUSPENDED
                        ? new PendingInteraction("A", new EdgeRef(0, "A", "B", "A->B"))
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
                null,
                List.of(),
                Instant.now(),
                null);
    }

    @Test
    void shouldSaveAndLoad() {
        ExecutionSnapshot snapshot = snapshot("g", "e1", ExecutionStatus.COMPLETED);

        repository.save("e1", snapshot);

        assertThat(repository.load("e1")).contains(snapshot);
        assertThat(repository.load("e2")).isEmpty();
    }

    @Test
    void shouldOverwriteOnSave() {
        repository.save("e1", snapshot("g", "e1", ExecutionStatus.SUSPENDED));
        repository.save("e1", snapshot("g", "e1", ExecutionStatus.COMPLETED));

        assertThat(repository.size()).isEqualTo(1);
        assertThat(repository.load("e1").orElseThrow().status())
                .isEqualTo(ExecutionStatus.COMPLETED);
    }

    @Test
    void shouldRejectSnapshotUnderForeignId() {
        assertThatThrownBy(() -> repository.save("e2", snapshot("g", "e1", ExecutionStatus.FAILED)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFindSuspendedAndByGraph() {
        repository.save("e1", snapshot("g", "e1", ExecutionStatus.SUSPENDED));
        repository.save("e2", snapshot("g", "e2", ExecutionStatus.COMPLETED));
        repository.save("e3", snapshot("h", "e3", ExecutionStatus.SUSPENDED));

        assertThat(repository.findSuspended())
                .extracting(ExecutionSnapshot::executionId)
                .containsExactlyInAnyOrder("e1", "e3");
        assertThat(repository.findByGraphId("g"))
                .extracting(ExecutionSnapshot::executionId)
                .containsExactlyInAnyOrder("e1", "e2");
    }

    @Test
    void shouldDeleteAndClear() {
        repository.save("e1", snapshot("g", "e1", ExecutionStatus.COMPLETED));
        repository.save("e2", snapshot("g", "e2", ExecutionStatus.COMPLETED));

        assertThat(repository.delete("e1")).isTrue();
        assertThat(repository.delete("e1")).isFalse();

        repository.clear();
        assertThat(repository.size()).isZero();
    }
}
