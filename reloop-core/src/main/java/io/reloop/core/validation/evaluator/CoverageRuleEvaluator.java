package io.reloop.core.validation.evaluator;

import io.reloop.core.validation.RuleOutcome;
import io.reloop.core.validation.ValidationContext;
import io.reloop.core.validation.coverage.CoverageReportParser;
import io.reloop.core.validation.rule.CoverageFormat;
import io.reloop.core.validation.rule.CoverageRule;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Evaluates {@link CoverageRule}s by parsing the report with the parser registered
/// for its format.
///
/// Passes iff the extracted percentage is at least `minCoverage`. A missing or
/// unreadable report, an unparseable one, or a format without a registered parser
/// is an evaluator error.
public final class CoverageRuleEvaluator implements RuleEvaluator<CoverageRule> {

    private final Map<CoverageFormat, CoverageReportParser> parsers;

    /// Creates an evaluator.
    ///
    /// @param parsers parser per supported format, not null
    public CoverageRuleEvaluator(Map<CoverageFormat, CoverageReportParser> parsers) {
        Objects.requireNonNull(parsers, "parsers must not be null");
        this.parsers =
                parsers.isEmpty() ? new EnumMap<>(CoverageFormat.class) : new EnumMap<>(parsers);
    }

    @Override
    public RuleOutcome evaluate(CoverageRule rule, ValidationContext context)
            throws EvaluatorException {
        CoverageReportParser parser = parsers.get(rule.reportFormat());
        if (parser == null) {
            throw new EvaluatorException(
                    "No parser registered for coverage format: " + rule.reportFormat().wireName());
        }

        Path report = context.workingDirectory().resolve(rule.reportPath());
        if (!Files.isRegularFile(report)) {
            throw new EvaluatorException("Coverage report not found: " + rule.reportPath());
        }

        String content;
        try {
            content = new String(Files.readAllBytes(report), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new EvaluatorException("Failed to read coverage report: " + e.getMessage(), e);
        }

        double percentage = parser.percentage(content, rule.scope());
        double rounded = Math.round(percentage * 100.0) / 100.0;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("percentage", rounded);
        details.put("minCoverage", rule.minCoverage());
        details.put("scope", rule.scope().wireName());
        details.put("format", rule.reportFormat().wireName());

        String summary =
                String.format(
                        "%s coverage %.2f%% (minimum %.2f%%)",
                        rule.scope().wireName(), percentage, rule.minCoverage());
        return percentage >= rule.minCoverage()
                ? RuleOutcome.pass(summary, details)
                : RuleOutcome.fail(summary, details);
    }
}
