package io.reloop.core.signal;

import io.reloop.core.validation.ValidationContext;
import io.reloop.core.validation.ValidationEngine;
import io.reloop.core.validation.ValidationResult;
import io.reloop.core.validation.rule.ContentPatternRule;
import io.reloop.core.validation.rule.ContentTarget;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Detects completion and blocked markers in the caller's agent output.
///
/// Each configured pattern becomes an implicit {@link ContentPatternRule} with
/// `mustMatch = true` against {@link ContentTarget#AGENT_OUTPUT}, evaluated through
/// the {@link ValidationEngine}. The implicit rules are named `completion[i]` and
/// `blocked[i]` and are kept out of the validation score.
///
/// ### Precedence
/// `BLOCKED > COMPLETE > CONTINUE`. A blocking marker always overrides a completion
/// claim made in the same output. Within one category the first configured pattern
/// that matched is reported.
///
/// @implNote Thread-safe. Stateless apart from the shared engine.
public final class CompletionSignalDetector {

    private final ValidationEngine engine;

    public CompletionSignalDetector(ValidationEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /// Scans the agent output of a context.
    ///
    /// @param completionPatterns patterns signalling completion, not null
    /// @param blockedPatterns patterns signalling a blocker, not null
    /// @param context validation context carrying the agent output, not null
    /// @return the detection, never null
    public SignalDetection detect(
            List<String> completionPatterns, List<String> blockedPatterns, ValidationContext context) {
        Objects.requireNonNull(completionPatterns, "completionPatterns must not be null");
        Objects.requireNonNull(blockedPatterns, "blockedPatterns must not be null");
        Objects.requireNonNull(context, "context must not be null");

        if (context.agentOutput() == null) {
            return SignalDetection.none();
        }

        List<ValidationResult> results = new ArrayList<>();
        String blockedMatch = firstMatch("blocked", blockedPatterns, context, results);
        String completionMatch = firstMatch("completion", completionPatterns, context, results);

        if (blockedMatch != null) {
            return new SignalDetection(CompletionSignal.BLOCKED, blockedMatch, results);
        }
        if (completionMatch != null) {
            return new SignalDetection(CompletionSignal.COMPLETE, completionMatch, results);
        }
        return new SignalDetection(CompletionSignal.CONTINUE, null, results);
    }

    private String firstMatch(
            String prefix,
            List<String> patterns,
            ValidationContext context,
            List<ValidationResult> results) {
        String match = null;
        for (int i = 0; i < patterns.size(); i++) {
            String pattern = patterns.get(i);
            ContentPatternRule rule =
                    ContentPatternRule.builder()
                            .name(prefix + "[" + i + "]")
                            .pattern(pattern)
                            .target(ContentTarget.AGENT_OUTPUT)
                            .mustMatch(true)
                            .build();
            ValidationResult result = engine.evaluate(rule, context);
            results.add(result);
            if (match == null && result.countsAsPassed()) {
                match = pattern;
            }
        }
        return match;
    }
}
