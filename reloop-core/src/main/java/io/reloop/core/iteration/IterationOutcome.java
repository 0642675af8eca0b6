package io.reloop.core.iteration;

import io.reloop.core.checkpoint.ChainStatus;

/// Outcome a caller reports when completing a session.
public enum IterationOutcome {
    SUCCESS(ChainStatus.COMPLETED),
    BLOCKED(ChainStatus.BLOCKED),
    ESCALATED(ChainStatus.ESCALATED);

    private final ChainStatus chainStatus;

    IterationOutcome(ChainStatus chainStatus) {
        this.chainStatus = chainStatus;
    }

    /// Returns the terminal chain status recorded for this outcome.
    ///
    /// @return the chain status, never null
    public ChainStatus chainStatus() {
        return chainStatus;
    }
}
