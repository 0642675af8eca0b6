package io.reloop.core.exception;

import java.io.Serial;

/// Thrown when a session is started for a task that already has an active chain.
public class DuplicateActiveSessionException extends IterationException {

    @Serial private static final long serialVersionUID = 7203921456640311952L;

    public DuplicateActiveSessionException(String taskId) {
        super(taskId, "Task already has an active iteration session: " + taskId);
    }
}
