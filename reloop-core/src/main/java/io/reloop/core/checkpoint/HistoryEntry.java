package io.reloop.core.checkpoint;

import io.reloop.core.validation.ValidationReport;
import io.reloop.core.validation.ValidationResult;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// One validated iteration in a checkpoint chain's history.
///
/// @param iterationNumber the iteration that was validated
/// @param validationScore the report's score
/// @param passed the report's `overallPassed`
/// @param timestamp when the iteration was validated, not null
/// @param checkpointId the checkpoint the iteration ran on, not null
/// @param failureMessages messages of the results that did not pass, never null
/// @param notes notes the caller attached when advancing, may be null
public record HistoryEntry(
        int iterationNumber,
        int validationScore,
        boolean passed,
        Instant timestamp,
        String checkpointId,
        List<String> failureMessages,
        String notes) {

    public HistoryEntry {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(checkpointId, "checkpointId must not be null");
        failureMessages = failureMessages != null ? List.copyOf(failureMessages) : List.of();
    }

    /// Summarizes a report as a history entry.
    ///
    /// @param report the iteration's report, not null
    /// @param checkpointId the checkpoint the iteration ran on, not null
    /// @param notes caller notes, may be null
    /// @return the entry, never null
    public static HistoryEntry from(ValidationReport report, String checkpointId, String notes) {
        List<String> failures =
                report.failures().stream()
                        .map(HistoryEntry::describeFailure)
                        .toList();
        return new HistoryEntry(
                report.iterationNumber(),
                report.validationScore(),
                report.overallPassed(),
                report.validatedAt(),
                checkpointId,
                failures,
                notes);
    }

    private static String describeFailure(ValidationResult result) {
        return result.getRuleName() + ": " + result.getMessage();
    }
}
