package io.reloop.core.iteration;

import io.reloop.core.exception.InvalidIterationConfigException;
import io.reloop.core.validation.evaluator.EvaluatorException;
import io.reloop.core.validation.evaluator.PatternCompiler;
import io.reloop.core.validation.rule.CommandRule;
import io.reloop.core.validation.rule.ContentPatternRule;
import io.reloop.core.validation.rule.CoverageRule;
import io.reloop.core.validation.rule.CustomRule;
import io.reloop.core.validation.rule.FileExistenceRule;
import io.reloop.core.validation.rule.ValidationRule;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/// Checks an {@link IterationConfig} against the configuration limits.
///
/// ### Limits
/// | Field                     | Constraint                                     |
/// |---------------------------|------------------------------------------------|
/// | `maxIterations`           | 1..{@value #MAX_ITERATIONS_LIMIT}              |
/// | `circuitBreakerThreshold` | 1..{@value #MAX_CIRCUIT_BREAKER_THRESHOLD}     |
/// | `completionPatterns`      | at least one; non-blank, valid regex, unique   |
/// | `blockedPatterns`         | non-blank, valid regex, unique                 |
/// | `regressionWindow`        | at least 3                                     |
/// | `regressionDropThreshold` | not negative                                   |
/// | `thrashingThreshold`      | at least 1                                     |
/// | rule names                | non-blank, unique                              |
/// | `stopHooks`               | well-formed ids, unique                        |
///
/// Rule-specific checks cover command text and timeout, pattern syntax and flags,
/// coverage bounds, non-empty path lists and validator id format.
///
/// Every violation is collected; the exception lists all of them.
public final class IterationConfigValidator {

    static final int MAX_ITERATIONS_LIMIT = 100;
    static final int MAX_CIRCUIT_BREAKER_THRESHOLD = 20;

    private static final Pattern VALIDATOR_ID = Pattern.compile("[A-Za-z0-9_.-]+");

    /// Validates a config, throwing if it has violations.
    ///
    /// @param taskId the task the config is for, not null
    /// @param config the config, not null
    /// @throws InvalidIterationConfigException if any limit is violated
    public void validate(String taskId, IterationConfig config) {
        List<String> violations = violations(config);
        if (!violations.isEmpty()) {
            throw new InvalidIterationConfigException(taskId, violations);
        }
    }

    /// Collects every violation of a config.
    ///
    /// @param config the config, not null
    /// @return violation messages, empty if valid, never null
    public List<String> violations(IterationConfig config) {
        List<String> violations = new ArrayList<>();

        if (config.getMaxIterations() < 1 || config.getMaxIterations() > MAX_ITERATIONS_LIMIT) {
            violations.add(
                    "maxIterations must be between 1 and "
                            + MAX_ITERATIONS_LIMIT
                            + ", got "
                            + config.getMaxIterations());
        }
        if (config.getCircuitBreakerThreshold() < 1
                || config.getCircuitBreakerThreshold() > MAX_CIRCUIT_BREAKER_THRESHOLD) {
            violations.add(
                    "circuitBreakerThreshold must be between 1 and "
                            + MAX_CIRCUIT_BREAKER_THRESHOLD
                            + ", got "
                            + config.getCircuitBreakerThreshold());
        }
        if (config.getCompletionPatterns().isEmpty()) {
            violations.add("completionPatterns must contain at least one pattern");
        }
        checkPatterns("completionPatterns", config.getCompletionPatterns(), violations);
        checkPatterns("blockedPatterns", config.getBlockedPatterns(), violations);

        if (config.getRegressionWindow() < 3) {
            violations.add("regressionWindow must be at least 3");
        }
        if (config.getRegressionDropThreshold() < 0) {
            violations.add("regressionDropThreshold must not be negative");
        }
        if (config.getThrashingThreshold() < 1) {
            violations.add("thrashingThreshold must be at least 1");
        }

        Set<String> names = new HashSet<>();
        for (ValidationRule rule : config.getValidationRules()) {
            if (rule.name().isBlank()) {
                violations.add("validation rule names must not be blank");
            } else if (!names.add(rule.name())) {
                violations.add("validation rule names must be unique: " + rule.name());
            }
            checkRule(rule, violations);
        }

        Set<String> hookIds = new HashSet<>();
        for (String hookId : config.getStopHooks()) {
            if (hookId == null || !VALIDATOR_ID.matcher(hookId).matches()) {
                violations.add("stopHooks contains a malformed id: " + hookId);
            } else if (!hookIds.add(hookId)) {
                violations.add("stopHooks must be unique: " + hookId);
            }
        }
        return violations;
    }

    private static void checkPatterns(String field, List<String> patterns, List<String> out) {
        Set<String> seen = new HashSet<>();
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                out.add(field + " must not contain blank patterns");
                continue;
            }
            if (!seen.add(pattern)) {
                out.add(field + " must be unique: " + pattern);
            }
            try {
                PatternCompiler.compile(pattern, null);
            } catch (EvaluatorException e) {
                out.add(field + " contains an invalid pattern '" + pattern + "': " + e.getMessage());
            }
        }
    }

    private static void checkRule(ValidationRule rule, List<String> out) {
        String prefix = "rule '" + rule.name() + "': ";
        if (rule instanceof CommandRule command) {
            if (command.command().isBlank()) {
                out.add(prefix + "command must not be blank");
            }
            if (command.timeout() != null
                    && (command.timeout().isNegative() || command.timeout().isZero())) {
                out.add(prefix + "timeout must be positive");
            }
        } else if (rule instanceof ContentPatternRule content) {
            try {
                PatternCompiler.compile(content.pattern(), content.flags());
            } catch (EvaluatorException e) {
                out.add(prefix + e.getMessage());
            }
        } else if (rule instanceof CoverageRule coverage) {
            if (coverage.reportPath().isBlank()) {
                out.add(prefix + "reportPath must not be blank");
            }
            if (coverage.minCoverage() < 0 || coverage.minCoverage() > 100) {
                out.add(prefix + "minCoverage must be between 0 and 100");
            }
        } else if (rule instanceof FileExistenceRule files) {
            if (files.paths().isEmpty()) {
                out.add(prefix + "paths must not be empty");
            } else if (files.paths().stream().anyMatch(p -> p == null || p.isBlank())) {
                out.add(prefix + "paths must not contain blank entries");
            }
        } else if (rule instanceof CustomRule custom) {
            if (!VALIDATOR_ID.matcher(custom.validatorId()).matches()) {
                out.add(prefix + "validatorId is malformed: " + custom.validatorId());
            }
        }
    }
}
