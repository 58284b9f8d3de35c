package io.stategraph.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stategraph.core.execution.ExecutionResult;
import io.stategraph.core.execution.ExecutionStatus;
import io.stategraph.core.execution.GraphEngine;
import io.stategraph.core.graph.Graph;
import io.stategraph.core.graph.GraphBuilder;
import io.stategraph.core.graph.edge.StateCondition;
import io.stategraph.core.output.MapNodeOutputParser;
import io.stategraph.core.state.FieldMapping;
import io.stategraph.core.state.FieldNormalizers;
import io.stategraph.core.state.FieldRule;
import io.stategraph.core.state.HistoryEntry;
import io.stategraph.core.state.HistoryOperation;
import io.stategraph.core.storage.ExecutionSnapshot;
import io.stategraph.core.storage.InMemoryExecutionStateRepository;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SnapshotSerializerTest {

    private InMemoryExecutionStateRepository repository;
    private ExecutionSnapshot suspended;

    @BeforeEach
    void setUp() {
        repository = new InMemoryExecutionStateRepository();
        GraphEngine engine =
                new GraphEngine(repository, MapNodeOutputParser.INSTANCE, null);

        FieldMapping mapping =
                FieldMapping.builder()
                        .map("stage", "stage")
                        .field(
                                FieldRule.builder("confidence")
                                        .normalizer(FieldNormalizers.clamp(0.0, 1.0))
                                        .defaultValue(0.5)
                                        .build())
                        .build();
        GraphBuilder builder = GraphBuilder.create("support").fieldMapping(mapping);
        builder.addNode("classify", context -> Map.of("stage", "classify", "confidence", 0.9));
        builder.addNode(
                "confirm",
                context ->
                        Map.of(
                                "stage", "confirm",
                                "confidence", "sure",
                                "options", List.of("refund", "credit")));
        builder.addNode("refund", context -> Map.of("stage", "refund"));
        builder.addEdge("classify", "confirm");
        builder.addEdge("confirm", "refund", StateCondition.always(), true, "choose");
        Graph graph = builder.setEntryPoint("classify").build();

        ExecutionResult result = engine.execute(graph, "I was charged twice");
        String executionId = ((ExecutionResult.Suspended) result).request().executionId();
        suspended = repository.load(executionId).orElseThrow();
    }

    @Nested
    class RoundTrip {

        @Test
        void shouldPreserveSuspendedExecution() {
            // When
            ExecutionSnapshot restored = SnapshotSerializer.fromJson(
                    SnapshotSerializer.toJson(suspended));

            // Then
            assertThat(restored.graphId()).isEqualTo("support");
            assertThat(restored.executionId()).isEqualTo(suspended.executionId());
            assertThat(restored.status()).isEqualTo(ExecutionStatus.SUSPENDED);
            assertThat(restored.currentNodeId()).isEqualTo("confirm");
            assertThat(restored.pending()).isEqualTo(suspended.pending());
            assertThat(restored.fields()).isEqualTo(suspended.fields());
            assertThat(restored.results()).isEqualTo(suspended.results());
            assertThat(restored.path()).containsExactly("classify", "confirm");
            assertThat(restored.stepCount()).isEqualTo(2);
            assertThat(restored.entryInput()).isEqualTo("I was charged twice");
            assertThat(restored.createdAt()).isEqualTo(suspended.createdAt());
            assertThat(restored.reason()).isEqualTo(suspended.reason());
        }

        @Test
        void shouldPreserveHistoryWithSubstitutions() {
            ExecutionSnapshot restored =
                    SnapshotSerializer.fromJson(SnapshotSerializer.toJson(suspended));

            List<HistoryEntry> history = restored.history();
            assertThat(history)
                    .extracting(HistoryEntry::getOperation)
                    .containsExactly(HistoryOperation.PROJECT, HistoryOperation.PROJECT);
            assertThat(history.get(1).getNodeId()).isEqualTo("confirm");
            assertThat(history.get(1).getSubstitutions())
                    .singleElement()
                    .satisfies(
                            substitution -> {
                                assertThat(substitution.field()).isEqualTo("confidence");
                                assertThat(substitution.rejectedValue()).isEqualTo("sure");
                                assertThat(substitution.defaultValue()).isEqualTo(0.5);
                            });
            assertThat(history.get(0).getTimestamp())
                    .isEqualTo(suspended.history().get(0).getTimestamp());
        }
    }

    @Nested
    class Format {

        @Test
        void shouldWriteIsoTimestampsAndOmitDerivedFlags() {
            String json = SnapshotSerializer.toJson(suspended);

            assertThat(json)
                    .contains("\"createdAt\" : \"" + suspended.createdAt() + "\"")
                    .contains("\"status\" : \"SUSPENDED\"")
                    .doesNotContain("\"suspended\"")
                    .doesNotContain("\"terminal\"");
        }

        @Test
        void shouldIgnoreUnknownProperties() {
            String json =
                    SnapshotSerializer.toJson(suspended)
                            .replaceFirst("\\{", "{\n  \"schemaVersion\" : 2,");

            ExecutionSnapshot restored = SnapshotSerializer.fromJson(json);

            assertThat(restored.executionId()).isEqualTo(suspended.executionId());
        }

        @Test
        void shouldRejectSuspendedSnapshotWithoutPendingEdge() {
            String json =
                    "{\"graphId\":\"g\",\"executionId\":\"e\",\"status\":\"SUSPENDED\"}";

            assertThatThrownBy(() -> SnapshotSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Failed to deserialize snapshot");
        }

        @Test
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> SnapshotSerializer.fromJson("{not json"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
