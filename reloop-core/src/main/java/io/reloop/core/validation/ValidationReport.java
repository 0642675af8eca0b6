package io.reloop.core.validation;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/// Aggregated outcome of one validation pass.
///
/// Build instances with {@link #of(String, int, List, Instant)}, which derives the
/// counts and score from the results. The canonical constructor exists for
/// deserialization of stored reports.
///
/// ### Scoring
/// `validationScore = floor(100 * passedRules / totalRules)`. Errored results count
/// as failures, so evaluator crashes never inflate apparent success. A report with
/// no results scores 100 and passes. Flooring keeps 100 reserved for reports
/// where every rule passed.
///
/// @param taskId the validated task, not null
/// @param iterationNumber the iteration the report belongs to
/// @param results per-rule results sorted by rule name, never null
/// @param overallPassed whether every result passed without error
/// @param totalRules number of evaluated (enabled) rules
/// @param passedRules results that passed without error
/// @param failedRules results that failed without error
/// @param erroredRules results carrying an evaluator error
/// @param totalDurationMs sum of result durations
/// @param validationScore score in `[0, 100]`
/// @param validatedAt completion time of the pass, not null
public record ValidationReport(
        String taskId,
        int iterationNumber,
        List<ValidationResult> results,
        boolean overallPassed,
        int totalRules,
        int passedRules,
        int failedRules,
        int erroredRules,
        long totalDurationMs,
        int validationScore,
        Instant validatedAt) {

    public ValidationReport {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(validatedAt, "validatedAt must not be null");
        results = results != null ? List.copyOf(results) : List.of();
    }

    /// Creates a report from raw results, computing counts and score.
    ///
    /// @param taskId the validated task, not null
    /// @param iterationNumber the iteration number
    /// @param results per-rule results in any order, not null
    /// @param validatedAt completion time, not null
    /// @return the report, never null
    public static ValidationReport of(
            String taskId, int iterationNumber, List<ValidationResult> results, Instant validatedAt) {
        List<ValidationResult> sorted =
                results.stream()
                        .sorted(Comparator.comparing(ValidationResult::getRuleName))
                        .toList();

        int passed = 0;
        int failed = 0;
        int errored = 0;
        long duration = 0;
        for (ValidationResult result : sorted) {
            if (result.hasError()) {
                errored++;
            } else if (result.isPassed()) {
                passed++;
            } else {
                failed++;
            }
            duration += result.getDurationMs();
        }

        int total = sorted.size();
        int score = total == 0 ? 100 : (100 * passed) / total;
        boolean overallPassed = failed == 0 && errored == 0;

        return new ValidationReport(
                taskId,
                iterationNumber,
                sorted,
                overallPassed,
                total,
                passed,
                failed,
                errored,
                duration,
                score,
                validatedAt);
    }

    /// Returns the results that did not pass, errored ones included.
    ///
    /// @return failing results in rule-name order, never null
    public List<ValidationResult> failures() {
        return results.stream().filter(r -> !r.countsAsPassed()).toList();
    }
}
