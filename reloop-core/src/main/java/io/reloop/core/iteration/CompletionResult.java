package io.reloop.core.iteration;

import java.time.Instant;

/// Result of {@link IterationController#complete}.
///
/// @param totalIterations iterations run in the session
/// @param finalScore validation score of the last validated iteration, 0 if none
/// @param closedAt when the chain was closed
/// @param summary the stored closing summary
public record CompletionResult(
        int totalIterations, int finalScore, Instant closedAt, String summary) {}
