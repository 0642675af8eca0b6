package io.reloop.core.exception;

import java.io.Serial;

/// Thrown when a caller advances past the configured iteration ceiling.
///
/// A correct caller observes the `ESCALATE` signal from validation first; this
/// exception therefore indicates a programming error on the caller's side.
public class MaxIterationsExceededException extends IterationException {

    @Serial private static final long serialVersionUID = -6652089731164528407L;

    public MaxIterationsExceededException(String taskId, int maxIterations) {
        super(
                taskId,
                "Task " + taskId + " reached its ceiling of " + maxIterations + " iterations");
    }
}
