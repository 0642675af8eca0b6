package io.reloop.core.iteration;

/// Snapshot of a task's session for status queries.
///
/// @param taskId the task
/// @param state current session state
/// @param iterationNumber current iteration, 0 when uninitialized
/// @param checkpointId newest checkpoint id, null when uninitialized
/// @param summary closing summary of a terminal session, otherwise null
public record IterationStatus(
        String taskId,
        IterationState state,
        int iterationNumber,
        String checkpointId,
        String summary) {}
