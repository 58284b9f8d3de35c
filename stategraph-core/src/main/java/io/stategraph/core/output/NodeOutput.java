package io.stategraph.core.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable field/value record captured from one node invocation.
///
/// The record is kept verbatim as the node's `{id}_result` entry, including fields the
/// graph's field mapping does not project into global state. Field order is the order in
/// which the parser produced them.
///
/// ### Contracts
/// - **Postcondition**: the field map is unmodifiable; null values are permitted
/// - **Invariant**: never changes after construction
///
/// @see NodeOutputParser for how raw payloads become records
/// @see io.stategraph.core.state.StateStore#project
public final class NodeOutput {

    /// Output field holding enumerated choices proposed to a human.
    public static final String OPTIONS_FIELD = "options";

    private static final NodeOutput EMPTY = new NodeOutput(Map.of());

    private final Map<String, Object> fields;

    private NodeOutput(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /// Creates a record from a field map.
    ///
    /// @param fields field name to value, not null
    /// @return new record, never null
    public static NodeOutput of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            copy.put(Objects.requireNonNull(entry.getKey(), "field name"), entry.getValue());
        }
        return new NodeOutput(copy);
    }

    /// Returns a record with no fields.
    public static NodeOutput empty() {
        return EMPTY;
    }

    /// Returns all fields.
    ///
    /// @return unmodifiable field map, never null
    public Map<String, Object> fields() {
        return fields;
    }

    public boolean contains(String field) {
        return fields.containsKey(field);
    }

    /// Returns a field value.
    ///
    /// @param field field name, not null
    /// @return the value, empty if absent or null
    public Optional<Object> get(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    /// Returns the enumerated options the node proposed, if any.
    ///
    /// Reads the `options` field when it is a list; elements are converted with
    /// `String.valueOf`.
    ///
    /// @return option labels in order, never null (may be empty)
    public List<String> options() {
        Object value = fields.get(OPTIONS_FIELD);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<String> options = new ArrayList<>(list.size());
        for (Object option : list) {
            options.add(String.valueOf(option));
        }
        return List.copyOf(options);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeOutput other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "NodeOutput" + fields;
    }
}
