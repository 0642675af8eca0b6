package io.reloop.core.checkpoint;

import io.reloop.core.validation.ValidationReport;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Content of the next checkpoint to append to a chain.
///
/// @param iterationNumber the new iteration number, one past the base checkpoint
/// @param history history inherited from the base and extended, not null
/// @param report report of the iteration just finished, not null
/// @param agentContext caller context for the new iteration, may be null
/// @param completionPromisesSeen patterns detected so far, may be null
public record CheckpointUpdate(
        int iterationNumber,
        List<HistoryEntry> history,
        ValidationReport report,
        Map<String, Object> agentContext,
        List<String> completionPromisesSeen) {

    public CheckpointUpdate {
        Objects.requireNonNull(history, "history must not be null");
        Objects.requireNonNull(report, "report must not be null");
    }
}
