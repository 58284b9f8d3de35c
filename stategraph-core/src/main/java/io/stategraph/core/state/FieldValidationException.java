package io.stategraph.core.state;

import java.io.Serial;

/// Thrown by a {@link FieldNormalizer} when a value cannot be accepted for a state field.
///
/// The state store never lets this escape a projection: the field's declared default is
/// substituted and the rejection is recorded as a {@link FieldSubstitution}.
public class FieldValidationException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4817203345120987655L;

    public FieldValidationException(String message) {
        super(message);
    }

    public FieldValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
