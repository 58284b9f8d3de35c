package io.stategraph.core.state;

/// Validation and normalization rule for a single mapped state field.
///
/// Applied by {@link StateStore#project} to every mapped field present in a node's output
/// before the value is written into global state.
///
/// ### Contracts
/// - **Precondition**: `value` is the raw value taken from the node output, may be null
/// - **Postcondition**: returns the value to store, or throws {@link FieldValidationException}
/// - **Invariant**: implementations are pure and side-effect free
///
/// @see FieldNormalizers for the built-in rules
/// @see FieldRule for where normalizers are declared
@FunctionalInterface
public interface FieldNormalizer {

    /// Normalizes a raw field value.
    ///
    /// @param value the raw value from the node output, may be null
    /// @return the normalized value, may be null
    /// @throws FieldValidationException if the value cannot be accepted
    Object normalize(Object value);

    /// Returns a normalizer applying this rule and then `next`.
    ///
    /// @param next the rule to apply to this rule's output, not null
    /// @return composed normalizer, never null
    default FieldNormalizer andThen(FieldNormalizer next) {
        return value -> next.normalize(normalize(value));
    }

    /// Normalizer that accepts every value unchanged.
    FieldNormalizer IDENTITY = value -> value;
}
