package io.reloop.core.validation.evaluator;

import io.reloop.core.validation.RuleOutcome;
import io.reloop.core.validation.ValidationContext;
import java.util.Map;

/// Caller-provided check referenced by {@link io.reloop.core.validation.rule.CustomRule}s.
///
/// Validators are registered in a {@link CustomValidatorRegistry} when the engine is
/// built. Iteration configs naming an unregistered id are rejected when the session
/// starts, not when the rule first runs.
///
/// ### Example
/// {@snippet :
/// public class NoTodoValidator implements CustomValidator {
///     public String getValidatorId() { return "no-todo"; }
///
///     public RuleOutcome validate(Map<String, Object> config, ValidationContext ctx) {
///         boolean clean = ctx.agentOutput() == null || !ctx.agentOutput().contains("TODO");
///         return new RuleOutcome(clean, clean ? "No TODO markers" : "TODO markers left", Map.of());
///     }
/// }
/// }
///
/// @implNote Implementations must be thread-safe; one instance serves every task.
public interface CustomValidator {

    /// Returns the id rules use to reference this validator.
    ///
    /// @return the validator id, matching `[A-Za-z0-9_.-]+`, never null
    String getValidatorId();

    /// Runs the check.
    ///
    /// @param config the rule's opaque configuration, never null
    /// @param context read-only inputs for this pass, not null
    /// @return the outcome, never null
    /// @throws EvaluatorException if the check could not be performed
    RuleOutcome validate(Map<String, Object> config, ValidationContext context)
            throws EvaluatorException;
}
