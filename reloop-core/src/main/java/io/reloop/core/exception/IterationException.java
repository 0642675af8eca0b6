package io.reloop.core.exception;

import java.io.Serial;

/// Base class for iteration contract violations.
///
/// These exceptions are fatal to the call that raised them and surface to the
/// caller unchanged. They indicate a concurrency race or caller misuse, never an
/// environmental problem; evaluator failures are recorded in the validation
/// report instead.
public abstract class IterationException extends RuntimeException {

    @Serial private static final long serialVersionUID = -2283516750841950314L;

    private final String taskId;

    protected IterationException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    /// Returns the task the violation concerns.
    ///
    /// @return the task id, may be null when not task-specific
    public String getTaskId() {
        return taskId;
    }
}
