package io.reloop.core.hook;

import io.reloop.core.validation.ValidationReport;
import java.util.Objects;
import java.util.Set;

/// Inputs handed to every {@link StopHook} of a chain.
///
/// @param taskId the task being validated, not null
/// @param iterationNumber the validated iteration
/// @param agentOutput the agent's output for this pass, may be null
/// @param report the validation report of this pass, not null
/// @param promises promise tags found in `agentOutput`, never null
public record StopHookContext(
        String taskId,
        int iterationNumber,
        String agentOutput,
        ValidationReport report,
        Set<PromiseTag> promises) {

    public StopHookContext {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(report, "report must not be null");
        promises = promises != null ? Set.copyOf(promises) : Set.of();
    }

    /// Builds the context, scanning the output for promise tags.
    public static StopHookContext of(
            String taskId, int iterationNumber, String agentOutput, ValidationReport report) {
        return new StopHookContext(
                taskId, iterationNumber, agentOutput, report, PromiseTag.scan(agentOutput));
    }

    public boolean promised(PromiseTag tag) {
        return promises.contains(tag);
    }
}
