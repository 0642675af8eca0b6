package io.reloop.core.validation.evaluator;

import io.reloop.core.validation.RuleOutcome;
import io.reloop.core.validation.ValidationContext;
import io.reloop.core.validation.rule.ContentPatternRule;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Evaluates {@link ContentPatternRule}s against the targeted text field.
///
/// A missing target text is an evaluator error rather than a non-match; a rule
/// forbidding content must not pass just because nothing was supplied.
///
/// Details carry `matchCount` and up to {@value #MAX_REPORTED_MATCHES} matched strings.
public final class ContentPatternRuleEvaluator implements RuleEvaluator<ContentPatternRule> {

    static final int MAX_REPORTED_MATCHES = 5;

    @Override
    public RuleOutcome evaluate(ContentPatternRule rule, ValidationContext context)
            throws EvaluatorException {
        Pattern pattern = PatternCompiler.compile(rule.pattern(), rule.flags());
        String text =
                context.text(rule.target())
                        .orElseThrow(
                                () ->
                                        new EvaluatorException(
                                                "Target content not available: "
                                                        + rule.target().wireName()));

        List<String> matches = new ArrayList<>();
        int count = 0;
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            if (count < MAX_REPORTED_MATCHES) {
                matches.add(matcher.group());
            }
            count++;
        }
        boolean found = count > 0;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("target", rule.target().wireName());
        details.put("matchCount", count);
        details.put("matches", matches);

        boolean passed = found == rule.mustMatch();
        String message;
        if (rule.mustMatch()) {
            message =
                    found
                            ? "Pattern found in " + rule.target().wireName()
                            : "Required pattern not found in " + rule.target().wireName();
        } else {
            message =
                    found
                            ? "Forbidden pattern found in " + rule.target().wireName()
                            : "Pattern absent from " + rule.target().wireName();
        }
        return new RuleOutcome(passed, message, details);
    }
}
