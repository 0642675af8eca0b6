package io.reloop.core.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Pass/fail verdict produced by a single rule evaluator.
///
/// The {@link ValidationEngine} adds timing and the rule name to turn an outcome
/// into a {@link ValidationResult}.
///
/// @param passed whether the checked condition holds
/// @param message human-readable explanation, not null
/// @param details structured evidence, never null
public record RuleOutcome(boolean passed, String message, Map<String, Object> details) {

    public RuleOutcome {
        Objects.requireNonNull(message, "message must not be null");
        details =
                details != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                        : Map.of();
    }

    public static RuleOutcome pass(String message, Map<String, Object> details) {
        return new RuleOutcome(true, message, details);
    }

    public static RuleOutcome fail(String message, Map<String, Object> details) {
        return new RuleOutcome(false, message, details);
    }
}
