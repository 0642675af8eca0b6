package io.reloop.core.exception;

import java.io.Serial;

/// Thrown when an append is based on a checkpoint that is no longer the latest.
///
/// Signals a concurrent advance of the same chain. The caller should resume the
/// latest checkpoint and re-validate before advancing again.
public class StaleChainException extends IterationException {

    @Serial private static final long serialVersionUID = -4870162913157448305L;

    private final long expectedSequence;
    private final long actualSequence;

    public StaleChainException(String taskId, long expectedSequence, long actualSequence) {
        super(
                taskId,
                "Checkpoint chain for task "
                        + taskId
                        + " moved on: based on sequence "
                        + expectedSequence
                        + " but latest is "
                        + actualSequence);
        this.expectedSequence = expectedSequence;
        this.actualSequence = actualSequence;
    }

    public long getExpectedSequence() {
        return expectedSequence;
    }

    public long getActualSequence() {
        return actualSequence;
    }
}
