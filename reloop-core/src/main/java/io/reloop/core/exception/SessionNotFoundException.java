package io.reloop.core.exception;

import java.io.Serial;

/// Thrown when no live iteration session exists for a task.
public class SessionNotFoundException extends IterationException {

    @Serial private static final long serialVersionUID = 5521387264109847732L;

    public SessionNotFoundException(String taskId) {
        super(taskId, "No active iteration session for task: " + taskId);
    }
}
