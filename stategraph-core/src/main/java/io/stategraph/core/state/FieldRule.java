package io.stategraph.core.state;

import java.util.Objects;
import java.util.function.Function;

/// One row of a {@link FieldMapping}: how an output field becomes a state field.
///
/// ### Structure
/// - **sourceField**: field name in the node's raw output record
/// - **targetField**: field name in global state
/// - **normalizer**: validation/normalization rule, identity by default
/// - **defaultValue**: value substituted when the normalizer rejects the raw value
/// - **missingDefault**: optional value derived from the node id, written when the
///   field is absent from the output (for example `stage := node id`)
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see FieldMapping
/// @see StateStore#project
public final class FieldRule {

    private final String sourceField;
    private final String targetField;
    private final FieldNormalizer normalizer;
    private final Object defaultValue;
    private final Function<String, Object> missingDefault;

    private FieldRule(Builder builder) {
        this.sourceField = Objects.requireNonNull(builder.sourceField, "sourceField required");
        this.targetField =
                builder.targetField != null ? builder.targetField : builder.sourceField;
        this.normalizer = builder.normalizer;
        this.defaultValue = builder.defaultValue;
        this.missingDefault = builder.missingDefault;
    }

    /// Creates a plain one-to-one rule without validation.
    ///
    /// @param sourceField output field name, not null
    /// @param targetField state field name, not null
    /// @return new rule, never null
    public static FieldRule of(String sourceField, String targetField) {
        return builder(sourceField).target(targetField).build();
    }

    /// Starts a rule for the given output field; the target defaults to the same name.
    ///
    /// @param sourceField output field name, not null
    /// @return new builder, never null
    public static Builder builder(String sourceField) {
        return new Builder(sourceField);
    }

    public String getSourceField() {
        return sourceField;
    }

    public String getTargetField() {
        return targetField;
    }

    public FieldNormalizer getNormalizer() {
        return normalizer;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    /// Returns whether a value is written when the field is missing from the output.
    ///
    /// @return true if a missing-value default is declared
    public boolean hasMissingDefault() {
        return missingDefault != null;
    }

    /// Computes the missing-value default for a node.
    ///
    /// @param nodeId the node whose output lacks the field, not null
    /// @return the default value, may be null
    /// @throws IllegalStateException if no missing-value default is declared
    public Object missingDefaultFor(String nodeId) {
        if (missingDefault == null) {
            throw new IllegalStateException("No missing default declared for " + sourceField);
        }
        return missingDefault.apply(nodeId);
    }

    @Override
    public String toString() {
        return "FieldRule{" + sourceField + " -> " + targetField + "}";
    }

    /// Builder for {@link FieldRule}.
    public static final class Builder {
        private final String sourceField;
        private String targetField;
        private FieldNormalizer normalizer = FieldNormalizer.IDENTITY;
        private Object defaultValue;
        private Function<String, Object> missingDefault;

        private Builder(String sourceField) {
            this.sourceField = sourceField;
        }

        public Builder target(String targetField) {
            this.targetField = targetField;
            return this;
        }

        public Builder normalizer(FieldNormalizer normalizer) {
            this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        /// Writes a constant when the field is absent from the output.
        public Builder whenMissing(Object value) {
            this.missingDefault = nodeId -> value;
            return this;
        }

        /// Writes a value derived from the node id when the field is absent from the output.
        public Builder whenMissing(Function<String, Object> fromNodeId) {
            this.missingDefault = Objects.requireNonNull(fromNodeId, "fromNodeId must not be null");
            return this;
        }

        public FieldRule build() {
            return new FieldRule(this);
        }
    }
}
