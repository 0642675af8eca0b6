package io.reloop.core.guard;

import io.reloop.core.signal.CompletionSignal;
import java.util.List;
import java.util.Optional;

/// Escalates when the last allowed iteration ends without a completion signal.
public final class IterationCeilingGuard implements SafetyGuard {

    public static final String NAME = "max_iterations";

    @Override
    public Optional<Escalation> check(GuardContext context) {
        int iteration = context.report().iterationNumber();
        int max = context.config().getMaxIterations();
        if (iteration >= max && context.detectedSignal() != CompletionSignal.COMPLETE) {
            return Optional.of(
                    new Escalation(
                            NAME,
                            "max iterations reached",
                            List.of("iteration " + iteration + " of " + max)));
        }
        return Optional.empty();
    }
}
