package io.reloop.core.exception;

import java.io.Serial;

/// Thrown when an operation is not allowed in the session's current state, such as
/// advancing before validating or after a terminal signal.
public class IllegalIterationStateException extends IterationException {

    @Serial private static final long serialVersionUID = 8814730296615042261L;

    public IllegalIterationStateException(String taskId, String message) {
        super(taskId, message);
    }
}
