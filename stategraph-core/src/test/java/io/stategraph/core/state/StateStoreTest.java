package io.stategraph.core.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stategraph.core.output.MapNodeOutputParser;
import io.stategraph.core.output.NodeOutput;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StateStoreTest {

    private StateStore store;

    @BeforeEach
    void setUp() {
        store = new StateStore(supportMapping());
    }

    static FieldMapping supportMapping() {
        return FieldMapping.builder()
                .field(
                        FieldRule.builder("stage")
                                .whenMissing((Function<String, Object>) nodeId -> nodeId)
                                .build())
                .field(FieldRule.builder("status").whenMissing("Success").build())
                .field(
                        FieldRule.builder("confidence")
                                .normalizer(FieldNormalizers.clamp(0.0, 1.0))
                                .defaultValue(0.5)
                                .build())
                .field(
                        FieldRule.builder("requires_human")
                                .normalizer(FieldNormalizers.toBoolean())
                                .defaultValue(false)
                                .build())
                .map("intent_type", "intent")
                .build();
    }

    @Nested
    class Projection {

        @Test
        void shouldWriteMappedFieldsAndKeepWholeRecordUnderResultKey() {
            // Given
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("stage", "classify");
            output.put("status", "Success");
            output.put("confidence", 0.9);
            output.put("intent_type", "refund");
            output.put("note", "free text");

            // When
            ProjectionResult result = store.project("classify", NodeOutput.of(output));

            // Then
            assertThat(result.malformed()).isFalse();
            assertThat(store.snapshot().fields())
                    .containsEntry("stage", "classify")
                    .containsEntry("status", "Success")
                    .containsEntry("confidence", 0.9)
                    .containsEntry("intent", "refund")
                    .doesNotContainKey("note")
                    .doesNotContainKey("intent_type");
            assertThat(store.get("classify_result")).contains(output);
        }

        @Test
        void shouldAppendExactlyOneEntryListingEveryChangedField() {
            store.project("A", NodeOutput.of(Map.of("stage", "A", "status", "Success")));

            List<HistoryEntry> history = store.history();
            assertThat(history).hasSize(1);
            assertThat(history.get(0).getOperation()).isEqualTo(HistoryOperation.PROJECT);
            assertThat(history.get(0).getNodeId()).isEqualTo("A");
            assertThat(history.get(0).getChanges())
                    .containsOnlyKeys("stage", "status", "A_result");
        }

        @Test
        void shouldRecordEmptyChangeSetWhenReplayingSameOutput() {
            NodeOutput output = NodeOutput.of(Map.of("stage", "A", "status", "Success"));
            store.project("A", output);
            StateSnapshot before = store.snapshot();

            ProjectionResult replay = store.project("A", output);

            assertThat(replay.changes()).isEmpty();
            assertThat(store.snapshot()).isEqualTo(before);
            assertThat(store.history()).hasSize(2);
        }

        @Test
        void shouldApplyMissingValueDefaults() {
            store.project("triage", NodeOutput.of(Map.of("confidence", 0.7)));

            assertThat(store.get("stage")).contains("triage");
            assertThat(store.get("status")).contains("Success");
        }

        @Test
        void shouldLeaveUnmappedFieldsOnlyInNodeRecord() {
            store.project("A", NodeOutput.of(Map.of("booking_id", "B-17")));

            assertThat(store.get("booking_id")).isEmpty();
            assertThat(store.snapshot().result("A")).hasValueSatisfying(
                    record -> assertThat(record).containsEntry("booking_id", "B-17"));
        }

        @Test
        void shouldKeepLaterProjectionsOfOtherNodesSeparate() {
            store.project("A", NodeOutput.of(Map.of("stage", "A")));
            store.project("B", NodeOutput.of(Map.of("stage", "B")));

            assertThat(store.get("stage")).contains("B");
            assertThat(store.snapshot().results()).containsOnlyKeys("A", "B");
        }
    }

    @Nested
    class Validation {

        @Test
        void shouldSubstituteDefaultForInvalidValueAndRecordIt() {
            ProjectionResult result =
                    store.project("A", NodeOutput.of(Map.of("confidence", "very high")));

            assertThat(store.get("confidence")).contains(0.5);
            assertThat(result.hasSubstitutions()).isTrue();
            FieldSubstitution substitution = result.substitutions().get(0);
            assertThat(substitution.field()).isEqualTo("confidence");
            assertThat(substitution.rejectedValue()).isEqualTo("very high");
            assertThat(substitution.defaultValue()).isEqualTo(0.5);
            assertThat(store.history().get(0).getSubstitutions()).containsExactly(substitution);
        }

        @Test
        void shouldClampOutOfRangeNumbersWithoutSubstitution() {
            ProjectionResult result = store.project("A", NodeOutput.of(Map.of("confidence", 7)));

            assertThat(store.get("confidence")).contains(1.0);
            assertThat(result.hasSubstitutions()).isFalse();
        }

        @Test
        void shouldNormalizeTextualBooleans() {
            store.project("A", NodeOutput.of(Map.of("requires_human", "yes")));

            assertThat(store.get("requires_human")).contains(true);
        }

        @Test
        void shouldTreatThrowingNormalizerAsRejection() {
            // Given
            StateStore scored =
                    new StateStore(
                            FieldMapping.builder()
                                    .field(FieldRule.builder("stage").build())
                                    .field(
                                            FieldRule.builder("score")
                                                    .normalizer(
                                                            value ->
                                                                    ((Number) value).doubleValue())
                                                    .defaultValue(0.0)
                                                    .build())
                                    .build());

            // When
            ProjectionResult result =
                    scored.project("A", NodeOutput.of(Map.of("stage", "A", "score", "high")));

            // Then
            assertThat(scored.get("stage")).contains("A");
            assertThat(scored.get("score")).contains(0.0);
            assertThat(result.substitutions()).hasSize(1);
            FieldSubstitution substitution = result.substitutions().get(0);
            assertThat(substitution.field()).isEqualTo("score");
            assertThat(substitution.rejectedValue()).isEqualTo("high");
            assertThat(substitution.reason()).startsWith("ClassCastException");
            assertThat(scored.history()).hasSize(1);
            assertThat(scored.history().get(0).getOperation()).isEqualTo(HistoryOperation.PROJECT);
            assertThat(scored.history().get(0).getSubstitutions()).containsExactly(substitution);
            assertThat(scored.snapshot().results()).containsKey("A");
        }

        @Test
        void shouldNotWriteEarlierFieldsBeforeEveryRuleIsNormalized() {
            // Given
            FieldNormalizer rejecting =
                    value -> {
                        throw new IllegalArgumentException("rejected");
                    };
            StateStore chained =
                    new StateStore(
                            FieldMapping.builder()
                                    .field(FieldRule.builder("stage").build())
                                    .field(
                                            FieldRule.builder("confidence")
                                                    .normalizer(
                                                            FieldNormalizers.clamp(0.0, 1.0)
                                                                    .andThen(rejecting))
                                                    .defaultValue(0.5)
                                                    .build())
                                    .build());

            // When
            chained.project("A", NodeOutput.of(Map.of("stage", "A", "confidence", 0.9)));

            // Then
            assertThat(chained.snapshot().fields())
                    .containsOnly(Map.entry("stage", "A"), Map.entry("confidence", 0.5));
            assertThat(chained.history()).hasSize(1);
            assertThat(chained.history().get(0).getChanges())
                    .containsOnlyKeys("stage", "confidence", StateKeys.resultKey("A"));
        }
    }

    @Nested
    class MalformedOutput {

        @Test
        void shouldRecordFailureAndLeaveStateUntouched() {
            // Given
            store.project("A", NodeOutput.of(Map.of("stage", "A")));
            StateSnapshot before = store.snapshot();

            // When
            ProjectionResult result = store.project("B", (Object) "not a record");

            // Then
            assertThat(result.malformed()).isTrue();
            assertThat(result.failureReason()).isNotBlank();
            assertThat(store.snapshot()).isEqualTo(before);
            assertThat(store.history()).hasSize(2);
            assertThat(store.history().get(1).getOperation())
                    .isEqualTo(HistoryOperation.PROJECTION_FAILURE);
            assertThat(store.history().get(1).getChanges()).isEmpty();
        }

        @Test
        void shouldRejectNullPayload() {
            ProjectionResult result = store.project("A", (Object) null);

            assertThat(result.malformed()).isTrue();
            assertThat(store.snapshot().fields()).isEmpty();
        }

        @Test
        void shouldWriteFallbackRecordDirectly() {
            Map<String, Object> fallback = new LinkedHashMap<>();
            fallback.put("stage", "A");
            fallback.put("status", "Success");
            fallback.put("fallback", true);

            Map<String, Object> changes = store.projectFallback("A", fallback);

            assertThat(changes).containsOnlyKeys("stage", "status", "fallback");
            assertThat(store.get("fallback")).contains(true);
            assertThat(store.history().get(0).getOperation()).isEqualTo(HistoryOperation.FALLBACK);
        }
    }

    @Nested
    class UserInput {

        @Test
        void shouldStoreInputSeparatelyFromNodeResult() {
            // Given
            Map<String, Object> output = Map.of("stage", "A", "options", List.of("yes", "no"));
            store.project("A", NodeOutput.of(output));

            // When
            UserInputRecord record = store.recordUserInput("A", "yes");

            // Then
            assertThat(record.input()).isEqualTo("yes");
            assertThat(record.nodeId()).isEqualTo("A");
            assertThat(record.triggeringOutput()).isEqualTo(output);
            assertThat(record.consumed()).isFalse();
            assertThat(store.get("A_user_input")).contains(record);
            assertThat(store.get("A_result")).contains(output);

            HistoryEntry entry = store.history().get(1);
            assertThat(entry.getOperation()).isEqualTo(HistoryOperation.USER_INPUT);
            assertThat(entry.getChanges()).containsEntry("A_user_input", "yes");
        }

        @Test
        void shouldReplaceEarlierInputForSameNode() {
            store.recordUserInput("A", "yes");
            store.recordUserInput("A", "no");

            assertThat(store.snapshot().userInputs()).hasSize(1);
            assertThat(store.snapshot().userInput("A"))
                    .hasValueSatisfying(r -> assertThat(r.input()).isEqualTo("no"));
        }

        @Test
        void shouldMarkRecordConsumedOnce() {
            store.recordUserInput("A", "yes");

            assertThat(store.markUserInputConsumed("A")).isTrue();
            assertThat(store.markUserInputConsumed("A")).isFalse();
            assertThat(store.snapshot().userInput("A"))
                    .hasValueSatisfying(r -> assertThat(r.consumed()).isTrue());
            assertThat(store.history().get(1).getOperation())
                    .isEqualTo(HistoryOperation.USER_INPUT_CONSUMED);
        }

        @Test
        void shouldNotMarkMissingRecord() {
            assertThat(store.markUserInputConsumed("A")).isFalse();
            assertThat(store.history()).isEmpty();
        }
    }

    @Nested
    class Reads {

        @Test
        void shouldReturnDefensiveCopyFromGetAll() {
            store.project("A", NodeOutput.of(Map.of("stage", "A")));

            Map<String, Object> all = store.getAll();
            all.put("stage", "tampered");

            assertThat(store.get("stage")).contains("A");
            assertThat(all).containsKey("A_result");
        }

        @Test
        void shouldNotExposeLaterChangesThroughSnapshot() {
            store.project("A", NodeOutput.of(Map.of("stage", "A")));
            StateSnapshot snapshot = store.snapshot();

            store.project("B", NodeOutput.of(Map.of("stage", "B")));

            assertThat(snapshot.get("stage")).contains("A");
        }

        @Test
        void shouldExposeImmutableHistory() {
            store.project("A", NodeOutput.of(Map.of("stage", "A")));

            assertThatThrownBy(() -> store.history().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void shouldReturnEmptyForUnknownKeys() {
            assertThat(store.get("missing")).isEmpty();
            assertThat(store.get("missing_result")).isEmpty();
            assertThat(store.get("missing_user_input")).isEmpty();
        }
    }

    @Nested
    class Restore {

        @Test
        void shouldRebuildEquivalentStore() {
            store.project("A", NodeOutput.of(Map.of("stage", "A", "confidence", 0.8)));
            store.recordUserInput("A", "yes");

            StateStore restored =
                    StateStore.restore(
                            supportMapping(),
                            MapNodeOutputParser.INSTANCE,
                            store.snapshot(),
                            store.history());

            assertThat(restored.snapshot()).isEqualTo(store.snapshot());
            assertThat(restored.history()).hasSize(2);

            restored.project("B", NodeOutput.of(Map.of("stage", "B")));
            assertThat(restored.history()).hasSize(3);
            assertThat(store.history()).hasSize(2);
        }
    }

    @Nested
    class Concurrency {

        @Test
        void shouldKeepHistoryTotallyOrderedUnderConcurrentProjections() throws Exception {
            int threads = 8;
            int perThread = 50;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                for (int t = 0; t < threads; t++) {
                    String nodeId = "node-" + t;
                    pool.submit(
                            () -> {
                                start.await();
                                for (int i = 0; i < perThread; i++) {
                                    store.project(
                                            nodeId, NodeOutput.of(Map.of("confidence", i / 100.0)));
                                }
                                return null;
                            });
                }
                start.countDown();
                pool.shutdown();
                assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
            } finally {
                pool.shutdownNow();
            }

            List<HistoryEntry> history = store.history();
            assertThat(history).hasSize(threads * perThread);
            assertThat(history).allSatisfy(
                    entry -> assertThat(entry.getOperation()).isEqualTo(HistoryOperation.PROJECT));
            for (int t = 0; t < threads; t++) {
                String nodeId = "node-" + t;
                assertThat(history).filteredOn(entry -> entry.getNodeId().equals(nodeId))
                        .hasSize(perThread);
            }
        }
    }
}
