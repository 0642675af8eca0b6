package io.reloop.core.validation.evaluator;

import io.reloop.core.validation.RuleOutcome;
import io.reloop.core.validation.ValidationContext;
import io.reloop.core.validation.rule.ValidationRule;

/// Checks one concrete condition described by a rule.
///
/// ### Contracts
/// - **Precondition**: `rule` is enabled; the engine skips disabled rules
/// - **Postcondition**: returns a pass/fail outcome, or throws {@link EvaluatorException}
///   when the condition cannot be determined
///
/// @implNote Implementations must be stateless with respect to individual calls and
/// safe for concurrent use across tasks.
///
/// @param <R> the rule type this evaluator handles
/// @see io.reloop.core.validation.ValidationEngine
@FunctionalInterface
public interface RuleEvaluator<R extends ValidationRule> {

    /// Evaluates the rule against the given context.
    ///
    /// @param rule the rule to check, not null
    /// @param context read-only inputs for this pass, not null
    /// @return the outcome, never null
    /// @throws EvaluatorException if the check could not be performed
    RuleOutcome evaluate(R rule, ValidationContext context) throws EvaluatorException;
}
