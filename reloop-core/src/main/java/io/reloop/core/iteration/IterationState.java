package io.reloop.core.iteration;

import io.reloop.core.checkpoint.ChainStatus;

/// State of a task's iteration session.
///
/// ```
/// UNINITIALIZED -> ACTIVE -> { COMPLETED | BLOCKED | ESCALATED }
/// ```
/// The three right-hand states are terminal.
public enum IterationState {
    UNINITIALIZED,
    ACTIVE,
    COMPLETED,
    BLOCKED,
    ESCALATED;

    static IterationState of(ChainStatus status) {
        return switch (status) {
            case ACTIVE -> ACTIVE;
            case COMPLETED -> COMPLETED;
            case BLOCKED -> BLOCKED;
            case ESCALATED -> ESCALATED;
        };
    }
}
