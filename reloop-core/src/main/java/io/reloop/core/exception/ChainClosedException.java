package io.reloop.core.exception;

import java.io.Serial;

/// Thrown when appending to or closing a chain that has reached a terminal status.
public class ChainClosedException extends IterationException {

    @Serial private static final long serialVersionUID = 1938475012765530871L;

    public ChainClosedException(String taskId) {
        super(taskId, "Iteration session for task " + taskId + " is closed");
    }
}
