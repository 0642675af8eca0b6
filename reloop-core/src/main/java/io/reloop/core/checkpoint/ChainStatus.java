package io.reloop.core.checkpoint;

/// Lifecycle status of a checkpoint chain.
public enum ChainStatus {
    ACTIVE,
    COMPLETED,
    BLOCKED,
    ESCALATED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
