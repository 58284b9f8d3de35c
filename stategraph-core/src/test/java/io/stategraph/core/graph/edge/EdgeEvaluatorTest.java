package io.stategraph.core.graph.edge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stategraph.core.state.FieldMapping;
import io.stategraph.core.state.StateSnapshot;
import io.stategraph.core.state.StateStore;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EdgeEvaluatorTest {

    private EdgeEvaluator evaluator;
    private StateStore store;

    @BeforeEach
    void setUp() {
        evaluator = new EdgeEvaluator();
        store = new StateStore(FieldMapping.identity("intent", "requires_human", "priority"));
    }

    private static Edge edge(int index, String target, StateCondition condition) {
        return new Edge(index, "A", target, condition, false, null);
    }

    @Nested
    class Selection {

        @Test
        void shouldPickEarliestRegisteredTrueEdge() {
            // Given
            List<Edge> edges =
                    List.of(
                            edge(0, "B", StateCondition.never()),
                            edge(1, "C", StateCondition.always()),
                            edge(2, "D", StateCondition.always()));

            // When
            var selected = evaluator.selectFirst(edges, StateSnapshot.empty());

            // Then
            assertThat(selected).hasValueSatisfying(e -> assertThat(e.target()).isEqualTo("C"));
            assertThat(evaluator.evaluationCount()).isEqualTo(2);
        }

        @Test
        void shouldReturnEmptyWhenNoConditionHolds() {
            List<Edge> edges = List.of(edge(0, "B", StateCondition.never()));

            assertThat(evaluator.selectFirst(edges, StateSnapshot.empty())).isEmpty();
            assertThat(evaluator.selectFirst(List.of(), StateSnapshot.empty())).isEmpty();
        }

        @Test
        void shouldWrapThrowingCondition() {
            Edge broken =
                    edge(
                            0,
                            "B",
                            state -> {
                                throw new IllegalStateException("boom");
                            });

            assertThatThrownBy(() -> evaluator.evaluate(broken, StateSnapshot.empty()))
                    .isInstanceOf(ConditionEvaluationException.class)
                    .hasCauseInstanceOf(IllegalStateException.class)
                    .satisfies(
                            e ->
                                    assertThat(((ConditionEvaluationException) e).getEdge())
                                            .isSameAs(broken));
        }
    }

    @Nested
    class Conditions {

        @Test
        void shouldMatchFieldValues() {
            store.project("A", Map.of("intent", "billing", "priority", 2));
            StateSnapshot state = store.snapshot();

            assertThat(StateCondition.fieldEquals("intent", "billing").test(state)).isTrue();
            assertThat(StateCondition.fieldEquals("intent", "refund").test(state)).isFalse();
            assertThat(StateCondition.fieldIn("intent", "refund", "billing").test(state)).isTrue();
            assertThat(StateCondition.fieldIn("missing", "x").test(state)).isFalse();
        }

        @Test
        void shouldTreatAbsentFieldAsNull() {
            assertThat(StateCondition.fieldEquals("intent", null).test(StateSnapshot.empty()))
                    .isTrue();
        }

        @Test
        void shouldReadBooleanFlags() {
            store.project("A", Map.of("requires_human", "true"));

            assertThat(StateCondition.isTrue("requires_human").test(store.snapshot())).isTrue();
            assertThat(StateCondition.isTrue("missing").test(store.snapshot())).isFalse();
        }

        @Test
        void shouldSeeOnlyUnconsumedUserInput() {
            StateCondition hasInput = StateCondition.hasUserInput("A");
            assertThat(hasInput.test(store.snapshot())).isFalse();

            store.recordUserInput("A", "yes");
            assertThat(hasInput.test(store.snapshot())).isTrue();

            store.markUserInputConsumed("A");
            assertThat(hasInput.test(store.snapshot())).isFalse();
        }

        @Test
        void shouldCombineConditions() {
            store.project("A", Map.of("intent", "billing", "requires_human", true));
            StateSnapshot state = store.snapshot();
            StateCondition billing = StateCondition.fieldEquals("intent", "billing");
            StateCondition human = StateCondition.isTrue("requires_human");

            assertThat(billing.and(human).test(state)).isTrue();
            assertThat(billing.and(human.negate()).test(state)).isFalse();
            assertThat(StateCondition.never().or(billing).test(state)).isTrue();
        }
    }
}
