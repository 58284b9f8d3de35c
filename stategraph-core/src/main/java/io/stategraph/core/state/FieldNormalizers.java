package io.stategraph.core.state;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/// Built-in {@link FieldNormalizer} implementations.
///
/// All returned normalizers are stateless and safe to share between graphs.
public final class FieldNormalizers {

    private FieldNormalizers() {}

    /// Clamps a numeric value into `[min, max]`.
    ///
    /// Numeric strings are parsed. Values that are not numbers (or are NaN) are rejected.
    ///
    /// @param min lower bound, inclusive
    /// @param max upper bound, inclusive
    /// @return clamping normalizer, never null
    /// @throws IllegalArgumentException if `min > max`
    public static FieldNormalizer clamp(double min, double max) {
        if (min > max) {
            throw new IllegalArgumentException("min " + min + " is greater than max " + max);
        }
        return value -> {
            double number = toDouble(value);
            if (Double.isNaN(number)) {
                throw new FieldValidationException("Value is not a number: " + value);
            }
            return Math.max(min, Math.min(max, number));
        };
    }

    /// Accepts only the listed values (compared with `equals`).
    ///
    /// @param allowed accepted values, not null
    /// @return membership normalizer, never null
    public static FieldNormalizer oneOf(Object... allowed) {
        List<Object> values = Arrays.asList(allowed);
        return value -> {
            if (!values.contains(value)) {
                throw new FieldValidationException(
                        "Value " + value + " is not one of " + values);
            }
            return value;
        };
    }

    /// Accepts only non-null instances of `type`.
    ///
    /// @param type required value type, not null
    /// @return type-checking normalizer, never null
    public static FieldNormalizer ofType(Class<?> type) {
        Objects.requireNonNull(type, "type must not be null");
        return value -> {
            if (!type.isInstance(value)) {
                throw new FieldValidationException(
                        "Expected "
                                + type.getSimpleName()
                                + " but got "
                                + (value == null ? "null" : value.getClass().getSimpleName()));
            }
            return value;
        };
    }

    /// Accepts non-blank strings, trimming surrounding whitespace.
    ///
    /// @return string normalizer, never null
    public static FieldNormalizer nonBlank() {
        return value -> {
            if (!(value instanceof String s) || s.isBlank()) {
                throw new FieldValidationException("Expected a non-blank string: " + value);
            }
            return s.trim();
        };
    }

    /// Coerces `Boolean` values and the strings `true`/`false`/`yes`/`no` to a boolean.
    ///
    /// @return boolean normalizer, never null
    public static FieldNormalizer toBoolean() {
        return value -> {
            if (value instanceof Boolean b) {
                return b;
            }
            if (value instanceof String s) {
                switch (s.trim().toLowerCase(Locale.ROOT)) {
                    case "true", "yes" -> {
                        return Boolean.TRUE;
                    }
                    case "false", "no" -> {
                        return Boolean.FALSE;
                    }
                    default -> {}
                }
            }
            throw new FieldValidationException("Expected a boolean: " + value);
        };
    }

    private static double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new FieldValidationException("Value is not a number: " + s, e);
            }
        }
        throw new FieldValidationException("Value is not a number: " + value);
    }
}
