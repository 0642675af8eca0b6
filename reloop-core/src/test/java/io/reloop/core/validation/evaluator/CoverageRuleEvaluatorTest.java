package io.reloop.core.validation.evaluator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.reloop.core.validation.RuleOutcome;
import io.reloop.core.validation.ValidationContext;
import io.reloop.core.validation.coverage.LcovReportParser;
import io.reloop.core.validation.rule.CoverageFormat;
import io.reloop.core.validation.rule.CoverageRule;
import io.reloop.core.validation.rule.CoverageScope;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CoverageRuleEvaluatorTest {

    @TempDir Path workDir;

    private CoverageRuleEvaluator evaluator;
    private ValidationContext context;

    @BeforeEach
    void setUp() throws Exception {
        evaluator = new CoverageRuleEvaluator(Map.of(CoverageFormat.LCOV, new LcovReportParser()));
        context = new ValidationContext(workDir, null, null, null);
        Files.createDirectories(workDir.resolve("coverage"));
        Files.writeString(workDir.resolve("coverage/lcov.info"), "LF:3\nLH:2\nBRF:4\nBRH:4\n");
    }

    private static CoverageRule rule(double min, CoverageScope scope) {
        return CoverageRule.builder()
                .name("coverage")
                .reportPath("coverage/lcov.info")
                .reportFormat(CoverageFormat.LCOV)
                .minCoverage(min)
                .scope(scope)
                .build();
    }

    @Test
    void shouldFailBelowMinimumWithRoundedPercentage() throws Exception {
        RuleOutcome outcome = evaluator.evaluate(rule(80, CoverageScope.LINES), context);

        assertThat(outcome.passed()).isFalse();
        assertThat(outcome.details())
                .containsEntry("percentage", 66.67)
                .containsEntry("minCoverage", 80.0)
                .containsEntry("scope", "lines")
                .containsEntry("format", "lcov");
    }

    @Test
    void shouldPassAtOrAboveMinimum() throws Exception {
        assertThat(evaluator.evaluate(rule(100, CoverageScope.BRANCHES), context).passed()).isTrue();
    }

    @Test
    void shouldErrorWhenReportMissing() {
        CoverageRule missing =
                CoverageRule.builder().name("coverage").reportPath("nope.info").minCoverage(1).build();

        assertThatThrownBy(() -> evaluator.evaluate(missing, context))
                .isInstanceOf(EvaluatorException.class)
                .hasMessage("Coverage report not found: nope.info");
    }

    @Test
    void shouldErrorWhenFormatHasNoParser() {
        CoverageRule json =
                CoverageRule.builder()
                        .name("coverage")
                        .reportPath("coverage/lcov.info")
                        .reportFormat(CoverageFormat.JSON)
                        .minCoverage(1)
                        .build();

        assertThatThrownBy(() -> evaluator.evaluate(json, context))
                .isInstanceOf(EvaluatorException.class)
                .hasMessage("No parser registered for coverage format: json");
    }
}
