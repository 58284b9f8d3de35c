package io.stategraph.core.output;

import java.io.Serial;

/// Thrown when a raw node payload cannot be interpreted as a field/value record.
///
/// @see NodeOutputParser#parse(Object)
public class NodeOutputParseException extends Exception {

    @Serial private static final long serialVersionUID = -3160517740212389901L;

    public NodeOutputParseException(String message) {
        super(message);
    }

    public NodeOutputParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
