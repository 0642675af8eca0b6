package io.reloop.core.signal;

/// What the iteration loop should do after a validation pass.
///
/// {@link #ESCALATE} is produced only by the safety guard stack; the
/// {@link CompletionSignalDetector} yields one of the other three.
public enum CompletionSignal {
    /// Keep iterating.
    CONTINUE,
    /// The caller declared the task done.
    COMPLETE,
    /// The caller declared it cannot proceed.
    BLOCKED,
    /// A safety guard halted the loop.
    ESCALATE;

    /// Returns whether this signal ends the loop.
    ///
    /// @return `true` for every signal except {@link #CONTINUE}
    public boolean isTerminal() {
        return this != CONTINUE;
    }
}
