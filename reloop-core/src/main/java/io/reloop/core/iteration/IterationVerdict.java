package io.reloop.core.iteration;

import io.reloop.core.guard.Escalation;
import io.reloop.core.hook.StopHookResult;
import io.reloop.core.signal.CompletionSignal;
import io.reloop.core.validation.ValidationReport;
import java.util.List;
import java.util.Objects;

/// Result of {@link IterationController#validate}.
///
/// Verdicts are recorded with the checkpoint they were computed on, so
/// {@link IterationController#next} and {@link IterationController#complete} see
/// them from any controller sharing the store.
///
/// @param overallPassed whether every enabled rule passed
/// @param validationScore the report's score in `[0, 100]`
/// @param signal what the caller should do next, not null
/// @param detectedPattern completion or blocked pattern found in the output, may be null
/// @param feedback failure messages and escalation reason for the caller, never null
/// @param escalation the guard or hook decision when `signal` is ESCALATE, otherwise null
/// @param stopHook the deciding stop hook result, null when the session has no hooks
///     or a guard escalated first
/// @param report the full validation report, not null
public record IterationVerdict(
        boolean overallPassed,
        int validationScore,
        CompletionSignal signal,
        String detectedPattern,
        List<String> feedback,
        Escalation escalation,
        StopHookResult stopHook,
        ValidationReport report) {

    public IterationVerdict {
        Objects.requireNonNull(signal, "signal must not be null");
        Objects.requireNonNull(report, "report must not be null");
        feedback = feedback != null ? List.copyOf(feedback) : List.of();
    }

    /// Returns the stop hook's prompt for the agent's next iteration.
    ///
    /// @return the prompt, or null when no hook supplied one
    public String nextPrompt() {
        return stopHook != null ? stopHook.nextPrompt() : null;
    }
}
