package io.reloop.core.validation.evaluator;

import io.reloop.core.validation.RuleOutcome;
import io.reloop.core.validation.ValidationContext;
import io.reloop.core.validation.rule.CustomRule;
import java.util.Objects;

/// Dispatches {@link CustomRule}s to the validator registered under their id.
///
/// An unregistered id yields an evaluator error for that rule only.
public final class CustomRuleEvaluator implements RuleEvaluator<CustomRule> {

    private final CustomValidatorRegistry registry;

    public CustomRuleEvaluator(CustomValidatorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public RuleOutcome evaluate(CustomRule rule, ValidationContext context)
            throws EvaluatorException {
        CustomValidator validator =
                registry.get(rule.validatorId())
                        .orElseThrow(
                                () ->
                                        new EvaluatorException(
                                                "Custom validator not registered: "
                                                        + rule.validatorId()));
        RuleOutcome outcome = validator.validate(rule.config(), context);
        if (outcome == null) {
            throw new EvaluatorException(
                    "Custom validator returned no outcome: " + rule.validatorId());
        }
        return outcome;
    }
}
