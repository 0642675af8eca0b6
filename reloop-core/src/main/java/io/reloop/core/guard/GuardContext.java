package io.reloop.core.guard;

import io.reloop.core.checkpoint.HistoryEntry;
import io.reloop.core.iteration.IterationConfig;
import io.reloop.core.signal.CompletionSignal;
import io.reloop.core.validation.ValidationReport;
import java.util.List;
import java.util.Objects;

/// Inputs shared by every {@link SafetyGuard}.
///
/// `history` already ends with the entry for `report`, so guards that look at
/// trends see the current iteration as their newest sample.
///
/// @param config the session config, not null
/// @param history validated iterations including the current one, not null
/// @param report the current iteration's report, not null
/// @param detectedSignal what the completion detector found this round, not null
public record GuardContext(
        IterationConfig config,
        List<HistoryEntry> history,
        ValidationReport report,
        CompletionSignal detectedSignal) {

    public GuardContext {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(detectedSignal, "detectedSignal must not be null");
        history = history != null ? List.copyOf(history) : List.of();
    }
}
