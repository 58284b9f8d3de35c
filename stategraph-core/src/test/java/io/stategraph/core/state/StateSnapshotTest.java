package io.stategraph.core.state;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StateSnapshotTest {

    private static final Instant AT = Instant.parse("2026-01-15T10:00:00Z");

    @Test
    void shouldTreatUserInputAsPartOfIdentity() {
        // Given
        Map<String, Object> fields = Map.of("stage", "A");
        UserInputRecord input = new UserInputRecord("yes", AT, "A", Map.of(), false);

        // When
        StateSnapshot without = new StateSnapshot(fields, Map.of(), Map.of());
        StateSnapshot with = new StateSnapshot(fields, Map.of(), Map.of("A", input));

        // Then
        assertThat(with).isNotEqualTo(without);
        assertThat(with.hashCode()).isNotEqualTo(without.hashCode());
    }

    @Test
    void shouldHashEqualSnapshotsAlike() {
        UserInputRecord input = new UserInputRecord("yes", AT, "A", Map.of(), false);

        StateSnapshot first =
                new StateSnapshot(Map.of("stage", "A"), Map.of(), Map.of("A", input));
        StateSnapshot second =
                new StateSnapshot(Map.of("stage", "A"), Map.of(), Map.of("A", input));

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
    }
}
