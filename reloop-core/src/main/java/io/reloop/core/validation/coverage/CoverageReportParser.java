package io.reloop.core.validation.coverage;

import io.reloop.core.validation.evaluator.EvaluatorException;
import io.reloop.core.validation.rule.CoverageScope;

/// Extracts a coverage percentage from the text of a coverage report.
///
/// One parser exists per {@link io.reloop.core.validation.rule.CoverageFormat}. The
/// core module ships LCOV and Cobertura parsers; formats that need a JSON library
/// are contributed by other modules and registered through
/// {@link io.reloop.core.ReloopFactory.Builder#coverageParser}.
///
/// @see io.reloop.core.validation.evaluator.CoverageRuleEvaluator
@FunctionalInterface
public interface CoverageReportParser {

    /// Parses the report and returns the percentage for a scope.
    ///
    /// @param content full report text, not null
    /// @param scope metric to extract, not null
    /// @return coverage percentage in `[0, 100]`
    /// @throws EvaluatorException if the report is malformed or lacks the metric
    double percentage(String content, CoverageScope scope) throws EvaluatorException;
}
