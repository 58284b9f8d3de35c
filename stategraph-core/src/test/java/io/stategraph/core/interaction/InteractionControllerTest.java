package io.stategraph.core.interaction;

import static org.assertj.core.api.Assertions.assertThat;

import io.stategraph.core.graph.UserInputRetention;
import io.stategraph.core.graph.edge.Edge;
import io.stategraph.core.graph.edge.EdgeEvaluator;
import io.stategraph.core.graph.edge.StateCondition;
import io.stategraph.core.state.FieldMapping;
import io.stategraph.core.state.HistoryEntry;
import io.stategraph.core.state.HistoryOperation;
import io.stategraph.core.state.StateStore;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InteractionControllerTest {

    private final InteractionController controller = new InteractionController();
    private final EdgeEvaluator evaluator = new EdgeEvaluator();

    private StateStore store;
    private Edge gated;
    private Edge open;

    @BeforeEach
    void setUp() {
        store = new StateStore(FieldMapping.identity("stage"));
        gated = new Edge(0, "confirm", "refund", StateCondition.always(), true, "approve");
        open = new Edge(1, "confirm", "close", StateCondition.always(), false, null);
    }

    @Nested
    class Gating {

        @Test
        void shouldPassEdgesWithoutInputGate() {
            assertThat(controller.isSatisfied(open, store.snapshot(), UserInputRetention.CONSUME))
                    .isTrue();
        }

        @Test
        void shouldBlockGatedEdgeUntilInputExists() {
            assertThat(controller.isSatisfied(gated, store.snapshot(), UserInputRetention.PERSIST))
                    .isFalse();

            store.recordUserInput("confirm", "yes");

            assertThat(controller.isSatisfied(gated, store.snapshot(), UserInputRetention.PERSIST))
                    .isTrue();
        }

        @Test
        void shouldHonourRetentionForConsumedRecords() {
            store.recordUserInput("confirm", "yes");
            store.markUserInputConsumed("confirm");

            assertThat(controller.isSatisfied(gated, store.snapshot(), UserInputRetention.PERSIST))
                    .isTrue();
            assertThat(controller.isSatisfied(gated, store.snapshot(), UserInputRetention.CONSUME))
                    .isFalse();
        }
    }

    @Nested
    class Requests {

        @Test
        void shouldCarryNodeOutputAndOptions() {
            // Given
            store.project("confirm", Map.of("stage", "confirm", "options", List.of("yes", "no")));

            // When
            InteractionRequest request = controller.suspend("exec-1", gated, store.snapshot());

            // Then
            assertThat(request.executionId()).isEqualTo("exec-1");
            assertThat(request.nodeId()).isEqualTo("confirm");
            assertThat(request.nodeOutput()).containsEntry("stage", "confirm");
            assertThat(request.options()).containsExactly("yes", "no");
            assertThat(request.hasOptions()).isTrue();
            assertThat(request.blockingEdge()).isEqualTo(gated.ref());
            assertThat(request.toPending())
                    .isEqualTo(new PendingInteraction("confirm", gated.ref()));
        }

        @Test
        void shouldBuildEmptyRequestForNodeWithoutRecord() {
            InteractionRequest request = controller.request("exec-1", gated, store.snapshot());

            assertThat(request.nodeOutput()).isEmpty();
            assertThat(request.hasOptions()).isFalse();
        }
    }

    @Nested
    class Resume {

        @Test
        void shouldRecordInputAndPassSatisfiedEdge() {
            boolean passable =
                    controller.resume(store, gated, "yes", evaluator, UserInputRetention.PERSIST);

            assertThat(passable).isTrue();
            assertThat(store.snapshot().userInput("confirm"))
                    .hasValueSatisfying(r -> assertThat(r.input()).isEqualTo("yes"));
        }

        @Test
        void shouldStayBlockedWhenConditionRejectsInput() {
            Edge needsYes =
                    new Edge(
                            0,
                            "confirm",
                            "refund",
                            state ->
                                    state.userInput("confirm")
                                            .map(r -> "yes".equals(r.input()))
                                            .orElse(false),
                            true,
                            null);

            boolean passable =
                    controller.resume(store, needsYes, "no", evaluator, UserInputRetention.PERSIST);

            assertThat(passable).isFalse();
            assertThat(store.history())
                    .extracting(HistoryEntry::getOperation)
                    .containsExactly(HistoryOperation.USER_INPUT);
        }

        @Test
        void shouldConsumeRecordOnTraversalUnderConsumePolicy() {
            store.recordUserInput("confirm", "yes");

            controller.onTraversed(store, gated, UserInputRetention.CONSUME);

            assertThat(store.snapshot().userInput("confirm"))
                    .hasValueSatisfying(r -> assertThat(r.consumed()).isTrue());
        }

        @Test
        void shouldKeepRecordOnTraversalUnderPersistPolicy() {
            store.recordUserInput("confirm", "yes");

            controller.onTraversed(store, gated, UserInputRetention.PERSIST);

            assertThat(store.snapshot().userInput("confirm"))
                    .hasValueSatisfying(r -> assertThat(r.consumed()).isFalse());
        }
    }
}
