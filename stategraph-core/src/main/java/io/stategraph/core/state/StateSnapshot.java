package io.stategraph.core.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable view of global state at one observation point.
///
/// Passed by value to edge conditions and node handlers so that they never observe a
/// projection in progress. Three namespaces are exposed through {@link #get(String)}:
/// - mapped state fields (`stage`, `status`, ...)
/// - per-node output records under `{nodeId}_result`
/// - per-node user-input records under `{nodeId}_user_input`
///
/// @implNote Immutable and thread-safe. Values inside node records are shared with the
/// store, which never mutates them.
///
/// @see StateStore#snapshot()
public final class StateSnapshot {

    private static final StateSnapshot EMPTY = new StateSnapshot(Map.of(), Map.of(), Map.of());

    private final Map<String, Object> fields;
    private final Map<String, Map<String, Object>> results;
    private final Map<String, UserInputRecord> userInputs;

    public StateSnapshot(
            Map<String, Object> fields,
            Map<String, Map<String, Object>> results,
            Map<String, UserInputRecord> userInputs) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.userInputs = Collections.unmodifiableMap(new LinkedHashMap<>(userInputs));
    }

    public static StateSnapshot empty() {
        return EMPTY;
    }

    /// Looks up a state field or a reserved per-node key.
    ///
    /// @param key field name, `{nodeId}_result` or `{nodeId}_user_input`, not null
    /// @return the value, empty if absent or null
    public Optional<Object> get(String key) {
        if (fields.containsKey(key)) {
            return Optional.ofNullable(fields.get(key));
        }
        if (key.endsWith(StateKeys.USER_INPUT_SUFFIX)) {
            String nodeId = stripSuffix(key, StateKeys.USER_INPUT_SUFFIX);
            return Optional.ofNullable(userInputs.get(nodeId));
        }
        if (key.endsWith(StateKeys.RESULT_SUFFIX)) {
            String nodeId = stripSuffix(key, StateKeys.RESULT_SUFFIX);
            return Optional.ofNullable(results.get(nodeId));
        }
        return Optional.empty();
    }

    /// Returns a field as a string, or empty if absent.
    public Optional<String> getString(String key) {
        return get(key).map(String::valueOf);
    }

    /// Returns a numeric field, parsing numeric strings; empty if absent or not numeric.
    public Optional<Double> getNumber(String key) {
        Object value = get(key).orElse(null);
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /// Returns a boolean field; strings are parsed with `Boolean.parseBoolean`.
    public Optional<Boolean> getBoolean(String key) {
        Object value = get(key).orElse(null);
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        if (value instanceof String s) {
            return Optional.of(Boolean.parseBoolean(s.trim()));
        }
        return Optional.empty();
    }

    /// Returns whether the field holds a value equal to `expected`.
    public boolean fieldEquals(String key, Object expected) {
        return get(key).map(v -> v.equals(expected)).orElse(expected == null);
    }

    /// Returns a node's verbatim output record.
    ///
    /// @param nodeId the node, not null
    /// @return the record, empty if the node has not run
    public Optional<Map<String, Object>> result(String nodeId) {
        return Optional.ofNullable(results.get(nodeId));
    }

    /// Returns a node's user-input record.
    ///
    /// @param nodeId the node, not null
    /// @return the record, empty if no input was supplied
    public Optional<UserInputRecord> userInput(String nodeId) {
        return Optional.ofNullable(userInputs.get(nodeId));
    }

    /// Returns mapped state fields only.
    public Map<String, Object> fields() {
        return fields;
    }

    public Map<String, Map<String, Object>> results() {
        return results;
    }

    public Map<String, UserInputRecord> userInputs() {
        return userInputs;
    }

    /// Flattens all three namespaces into one map keyed as {@link #get(String)} expects.
    ///
    /// @return a new mutable map, never null
    public Map<String, Object> asMap() {
        Map<String, Object> all = new LinkedHashMap<>(fields);
        results.forEach((nodeId, record) -> all.put(StateKeys.resultKey(nodeId), record));
        userInputs.forEach((nodeId, record) -> all.put(StateKeys.userInputKey(nodeId), record));
        return all;
    }

    private static String stripSuffix(String key, String suffix) {
        return key.substring(0, key.length() - suffix.length());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateSnapshot other)) return false;
        return fields.equals(other.fields)
                && results.equals(other.results)
                && userInputs.equals(other.userInputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, results, userInputs);
    }

    @Override
    public String toString() {
        return "StateSnapshot{fields=" + fields + ", results=" + results.keySet() + "}";
    }
}
