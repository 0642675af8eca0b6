package io.reloop.core.iteration;

/// Result of {@link IterationController#start}.
///
/// @param checkpointId id of the first checkpoint
/// @param iterationNumber always 1
public record StartResult(String checkpointId, int iterationNumber) {}
