package io.reloop.core.iteration;

import io.reloop.core.checkpoint.Checkpoint;
import io.reloop.core.checkpoint.CheckpointChain;

/// Listener for iteration lifecycle events.
///
/// All methods have no-op defaults, so listeners override only what they need.
/// Callbacks run on the caller's thread after the corresponding state change has
/// been stored. A listener that throws does not undo that change.
///
/// @see IterationController
public interface IterationListener {

    /// Called after a session's first checkpoint is created.
    ///
    /// @param checkpoint the first checkpoint, not null
    default void onStart(Checkpoint checkpoint) {}

    /// Called after each validation pass.
    ///
    /// @param taskId the task, not null
    /// @param verdict the verdict returned to the caller, not null
    default void onValidated(String taskId, IterationVerdict verdict) {}

    /// Called after a checkpoint for the next iteration is appended.
    ///
    /// @param checkpoint the appended checkpoint, not null
    default void onAdvance(Checkpoint checkpoint) {}

    /// Called after a session is closed.
    ///
    /// @param chain the closed chain, not null
    default void onComplete(CheckpointChain chain) {}
}
