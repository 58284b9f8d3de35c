package io.stategraph.core.state;

/// Records that a mapped field failed validation and its default was written instead.
///
/// @param field the state field name, not null
/// @param rejectedValue the value the node produced, may be null
/// @param defaultValue the value written to global state, may be null
/// @param reason the validation message, not null
public record FieldSubstitution(
        String field, Object rejectedValue, Object defaultValue, String reason) {}
