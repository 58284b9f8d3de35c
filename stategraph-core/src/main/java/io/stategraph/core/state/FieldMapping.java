package io.stategraph.core.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Fixed, ordered table of output-field to state-field rules.
///
/// Declared once per graph. Fields of a node's output that have no rule here are never
/// projected into global state; they survive only inside the node's `{id}_result` record.
///
/// ### Usage
/// {@snippet :
/// FieldMapping mapping = FieldMapping.builder()
///     .map("stage", "stage")
///     .map("status", "status")
///     .field(FieldRule.builder("confidence")
///         .normalizer(FieldNormalizers.clamp(0.0, 1.0))
///         .defaultValue(0.5)
///         .build())
///     .build();
/// }
///
/// @implNote Immutable and thread-safe after construction. Rule order is the
/// declaration order and is the order in which fields are projected.
///
/// @see FieldRule
/// @see StateStore#project
public final class FieldMapping {

    private static final FieldMapping EMPTY = new FieldMapping(List.of());

    private final List<FieldRule> rules;
    private final Map<String, FieldRule> bySource;

    private FieldMapping(List<FieldRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
        Map<String, FieldRule> index = new LinkedHashMap<>();
        for (FieldRule rule : rules) {
            index.put(rule.getSourceField(), rule);
        }
        this.bySource = Collections.unmodifiableMap(index);
    }

    /// Returns a mapping with no rules; nothing is projected into global state.
    ///
    /// @return the empty mapping, never null
    public static FieldMapping empty() {
        return EMPTY;
    }

    /// Creates an identity mapping (`name -> name`) for the given fields.
    ///
    /// @param fields output field names, not null
    /// @return new mapping, never null
    public static FieldMapping identity(String... fields) {
        Builder builder = builder();
        for (String field : fields) {
            builder.map(field, field);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the rules in declaration order.
    ///
    /// @return unmodifiable list, never null
    public List<FieldRule> getRules() {
        return rules;
    }

    /// Finds the rule for an output field.
    ///
    /// @param sourceField output field name, not null
    /// @return the rule, or empty if the field is unmapped
    public Optional<FieldRule> ruleFor(String sourceField) {
        return Optional.ofNullable(bySource.get(sourceField));
    }

    /// Returns whether the output field is projected into global state.
    public boolean isMapped(String sourceField) {
        return bySource.containsKey(sourceField);
    }

    public int size() {
        return rules.size();
    }

    @Override
    public String toString() {
        return "FieldMapping" + rules;
    }

    /// Builder for {@link FieldMapping}.
    public static final class Builder {
        private final List<FieldRule> rules = new ArrayList<>();
        private final Set<String> sources = new HashSet<>();

        private Builder() {}

        public Builder map(String sourceField, String targetField) {
            return field(FieldRule.of(sourceField, targetField));
        }

        public Builder field(FieldRule rule) {
            if (!sources.add(rule.getSourceField())) {
                throw new IllegalArgumentException(
                        "Field '" + rule.getSourceField() + "' is mapped more than once");
            }
            rules.add(rule);
            return this;
        }

        public FieldMapping build() {
            return new FieldMapping(rules);
        }
    }
}
