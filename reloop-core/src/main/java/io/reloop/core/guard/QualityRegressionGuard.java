package io.reloop.core.guard;

import io.reloop.core.checkpoint.HistoryEntry;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/// Escalates when validation scores keep declining.
///
/// Looks at the newest `regressionWindow` scores (at least 3). Fires only if every
/// score is strictly lower than the one before it and the total drop from first to
/// last exceeds `regressionDropThreshold` points. A flat step or any recovery
/// inside the window suppresses it, which filters out single-iteration noise.
public final class QualityRegressionGuard implements SafetyGuard {

    public static final String NAME = "quality_regression";

    static final int MIN_WINDOW = 3;

    @Override
    public Optional<Escalation> check(GuardContext context) {
        int window = Math.max(MIN_WINDOW, context.config().getRegressionWindow());
        List<HistoryEntry> history = context.history();
        if (history.size() < window) {
            return Optional.empty();
        }

        List<HistoryEntry> recent = history.subList(history.size() - window, history.size());
        for (int i = 1; i < recent.size(); i++) {
            if (recent.get(i).validationScore() >= recent.get(i - 1).validationScore()) {
                return Optional.empty();
            }
        }

        int drop =
                recent.get(0).validationScore() - recent.get(recent.size() - 1).validationScore();
        if (drop <= context.config().getRegressionDropThreshold()) {
            return Optional.empty();
        }

        String trend =
                recent.stream()
                        .map(e -> String.valueOf(e.validationScore()))
                        .collect(Collectors.joining(" -> "));
        return Optional.of(
                new Escalation(
                        NAME,
                        "quality regression detected",
                        List.of("scores " + trend, "drop of " + drop + " points")));
    }
}
