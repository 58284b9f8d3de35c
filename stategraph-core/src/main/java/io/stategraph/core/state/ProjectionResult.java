package io.stategraph.core.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Outcome of one {@link StateStore#project} call.
///
/// @param nodeId the projected node, not null
/// @param changes changed fields and their new values, not null
/// @param substitutions validation substitutions applied, not null
/// @param malformed whether the output could not be interpreted at all
/// @param failureReason why the output was malformed, null otherwise
public record ProjectionResult(
        String nodeId,
        Map<String, Object> changes,
        List<FieldSubstitution> substitutions,
        boolean malformed,
        String failureReason) {

    public ProjectionResult {
        changes = Collections.unmodifiableMap(new LinkedHashMap<>(changes));
        substitutions = List.copyOf(substitutions);
    }

    static ProjectionResult applied(
            String nodeId, Map<String, Object> changes, List<FieldSubstitution> substitutions) {
        return new ProjectionResult(nodeId, changes, substitutions, false, null);
    }

    static ProjectionResult malformed(String nodeId, String reason) {
        return new ProjectionResult(nodeId, Map.of(), List.of(), true, reason);
    }

    /// Returns the names of fields whose value changed.
    public Set<String> changedFields() {
        return changes.keySet();
    }

    public boolean hasSubstitutions() {
        return !substitutions.isEmpty();
    }
}
