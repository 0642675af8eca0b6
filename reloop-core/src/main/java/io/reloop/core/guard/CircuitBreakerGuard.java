package io.reloop.core.guard;

import io.reloop.core.checkpoint.HistoryEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Escalates after a streak of consecutive failed validations.
///
/// The streak is counted backwards from the newest history entry and stops at the
/// first passing one, so a single success resets the breaker. It measures the
/// current streak, not lifetime failures.
public final class CircuitBreakerGuard implements SafetyGuard {

    public static final String NAME = "circuit_breaker";

    @Override
    public Optional<Escalation> check(GuardContext context) {
        int threshold = context.config().getCircuitBreakerThreshold();
        int streak = consecutiveFailures(context.history());
        if (streak < threshold) {
            return Optional.empty();
        }

        HistoryEntry last = context.history().get(context.history().size() - 1);
        List<String> evidence = new ArrayList<>();
        evidence.add(streak + " consecutive failed validations (threshold " + threshold + ")");
        evidence.add(
                last.failureMessages().isEmpty()
                        ? "last failure: score " + last.validationScore()
                        : "last failure: " + last.failureMessages().get(0));
        return Optional.of(new Escalation(NAME, "circuit breaker open", evidence));
    }

    /// Counts failed entries at the end of the history.
    ///
    /// @param history validated iterations, oldest first, not null
    /// @return length of the trailing failure streak
    static int consecutiveFailures(List<HistoryEntry> history) {
        int streak = 0;
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).passed()) {
                break;
            }
            streak++;
        }
        return streak;
    }
}
