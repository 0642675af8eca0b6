package io.reloop.core.validation;

import io.reloop.core.validation.evaluator.CommandRuleEvaluator;
import io.reloop.core.validation.evaluator.ContentPatternRuleEvaluator;
import io.reloop.core.validation.evaluator.CoverageRuleEvaluator;
import io.reloop.core.validation.evaluator.CustomRuleEvaluator;
import io.reloop.core.validation.evaluator.EvaluatorException;
import io.reloop.core.validation.evaluator.FileExistenceRuleEvaluator;
import io.reloop.core.validation.rule.CommandRule;
import io.reloop.core.validation.rule.ContentPatternRule;
import io.reloop.core.validation.rule.CoverageRule;
import io.reloop.core.validation.rule.CustomRule;
import io.reloop.core.validation.rule.FileExistenceRule;
import io.reloop.core.validation.rule.ValidationRule;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Orchestrates validation rules for one iteration and aggregates a report.
///
/// Each enabled rule is evaluated exactly once by the evaluator for its type.
/// Disabled rules are skipped and excluded from every count. Rules are independent,
/// so evaluation order does not affect correctness; the report sorts results by
/// name for display.
///
/// ### Error Isolation
/// An evaluator that throws, whether an {@link EvaluatorException} or an unexpected
/// runtime exception, produces an errored {@link ValidationResult}. One bad rule
/// never aborts the report.
///
/// @implNote Thread-safe. Evaluators are stateless; concurrent passes for
/// different tasks share one engine.
///
/// @see ValidationReport for scoring
public final class ValidationEngine {

    private static final Logger logger = Logger.getLogger(ValidationEngine.class.getName());

    private final CommandRuleEvaluator commandEvaluator;
    private final ContentPatternRuleEvaluator contentEvaluator;
    private final CoverageRuleEvaluator coverageEvaluator;
    private final FileExistenceRuleEvaluator fileEvaluator;
    private final CustomRuleEvaluator customEvaluator;
    private final Clock clock;

    public ValidationEngine(
            CommandRuleEvaluator commandEvaluator,
            ContentPatternRuleEvaluator contentEvaluator,
            CoverageRuleEvaluator coverageEvaluator,
            FileExistenceRuleEvaluator fileEvaluator,
            CustomRuleEvaluator customEvaluator,
            Clock clock) {
        this.commandEvaluator = Objects.requireNonNull(commandEvaluator, "commandEvaluator");
        this.contentEvaluator = Objects.requireNonNull(contentEvaluator, "contentEvaluator");
        this.coverageEvaluator = Objects.requireNonNull(coverageEvaluator, "coverageEvaluator");
        this.fileEvaluator = Objects.requireNonNull(fileEvaluator, "fileEvaluator");
        this.customEvaluator = Objects.requireNonNull(customEvaluator, "customEvaluator");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /// Validates a rule set.
    ///
    /// @param rules the configured rules, not null
    /// @param context read-only inputs, not null
    /// @param taskId the task being validated, not null
    /// @param iterationNumber the current iteration
    /// @return the aggregated report, never null
    public ValidationReport validate(
            List<ValidationRule> rules,
            ValidationContext context,
            String taskId,
            int iterationNumber) {
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(taskId, "taskId must not be null");

        List<ValidationResult> results = new ArrayList<>();
        for (ValidationRule rule : rules) {
            if (!rule.enabled()) {
                continue;
            }
            results.add(evaluate(rule, context));
        }

        ValidationReport report =
                ValidationReport.of(taskId, iterationNumber, results, clock.instant());
        logger.info(
                String.format(
                        "Validated task %s iteration %d: %d/%d passed, %d errored, score %d",
                        taskId,
                        iterationNumber,
                        report.passedRules(),
                        report.totalRules(),
                        report.erroredRules(),
                        report.validationScore()));
        return report;
    }

    /// Evaluates a single rule, capturing any failure as an errored result.
    ///
    /// @param rule the rule, not null
    /// @param context read-only inputs, not null
    /// @return the result, never null
    public ValidationResult evaluate(ValidationRule rule, ValidationContext context) {
        long start = System.nanoTime();
        try {
            RuleOutcome outcome = dispatch(rule, context);
            return ValidationResult.builder()
                    .ruleName(rule.name())
                    .passed(outcome.passed())
                    .message(outcome.message())
                    .details(outcome.details())
                    .durationMs(elapsedMs(start))
                    .timestamp(clock.instant())
                    .build();
        } catch (EvaluatorException e) {
            logger.warning("Rule '" + rule.name() + "' could not be evaluated: " + e.getMessage());
            return errored(rule, e.getMessage(), start);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Rule '" + rule.name() + "' evaluator crashed", e);
            return errored(
                    rule,
                    e.getClass().getSimpleName()
                            + (e.getMessage() != null ? ": " + e.getMessage() : ""),
                    start);
        }
    }

    private RuleOutcome dispatch(ValidationRule rule, ValidationContext context)
            throws EvaluatorException {
        return switch (rule.type()) {
            case COMMAND -> commandEvaluator.evaluate((CommandRule) rule, context);
            case CONTENT_PATTERN -> contentEvaluator.evaluate((ContentPatternRule) rule, context);
            case COVERAGE -> coverageEvaluator.evaluate((CoverageRule) rule, context);
            case FILE_EXISTENCE -> fileEvaluator.evaluate((FileExistenceRule) rule, context);
            case CUSTOM -> customEvaluator.evaluate((CustomRule) rule, context);
        };
    }

    private ValidationResult errored(ValidationRule rule, String error, long start) {
        return ValidationResult.builder()
                .ruleName(rule.name())
                .passed(false)
                .message("Validation error: " + error)
                .error(error)
                .durationMs(elapsedMs(start))
                .timestamp(clock.instant())
                .build();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
