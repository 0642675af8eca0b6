package io.reloop.core.hook;

import io.reloop.core.validation.ValidationReport;
import io.reloop.core.validation.ValidationResult;
import java.util.List;

/// Completes once every rule passes; otherwise continues with a prompt listing the
/// failures.
///
/// A pass with no rules never completes through this hook.
public final class ValidationStopHook implements StopHook {

    public static final String ID = "validation";

    @Override
    public String getHookId() {
        return ID;
    }

    @Override
    public StopHookDecision evaluate(StopHookContext context) {
        return judge(context.report());
    }

    static StopHookDecision judge(ValidationReport report) {
        List<ValidationResult> failures = report.failures();
        if (failures.isEmpty() && report.totalRules() > 0) {
            return StopHookDecision.complete("All validation rules passed");
        }
        return StopHookDecision.keepGoing(
                failures.size() + " validation rule(s) failed",
                failures.isEmpty() ? null : fixPrompt(failures));
    }

    static String fixPrompt(List<ValidationResult> failures) {
        StringBuilder prompt =
                new StringBuilder("Continue iteration. Fix the following validation failures:");
        for (ValidationResult failure : failures) {
            prompt.append("\n- ")
                    .append(failure.getRuleName())
                    .append(": ")
                    .append(failure.getMessage());
        }
        return prompt.toString();
    }
}
