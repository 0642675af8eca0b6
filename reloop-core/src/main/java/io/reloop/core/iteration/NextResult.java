package io.reloop.core.iteration;

/// Result of {@link IterationController#next}.
///
/// @param iterationNumber the new iteration number
/// @param checkpointId id of the appended checkpoint
public record NextResult(int iterationNumber, String checkpointId) {}
