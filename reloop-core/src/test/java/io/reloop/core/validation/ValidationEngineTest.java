package io.reloop.core.validation;

import static org.assertj.core.api.Assertions.assertThat;

import io.reloop.core.validation.coverage.LcovReportParser;
import io.reloop.core.validation.evaluator.CommandRuleEvaluator;
import io.reloop.core.validation.evaluator.ContentPatternRuleEvaluator;
import io.reloop.core.validation.evaluator.CoverageRuleEvaluator;
import io.reloop.core.validation.evaluator.CustomRuleEvaluator;
import io.reloop.core.validation.evaluator.CustomValidator;
import io.reloop.core.validation.evaluator.CustomValidatorRegistry;
import io.reloop.core.validation.evaluator.FileExistenceRuleEvaluator;
import io.reloop.core.validation.rule.CommandRule;
import io.reloop.core.validation.rule.ContentPatternRule;
import io.reloop.core.validation.rule.CoverageFormat;
import io.reloop.core.validation.rule.CoverageRule;
import io.reloop.core.validation.rule.CustomRule;
import io.reloop.core.validation.rule.FileExistenceRule;
import io.reloop.core.validation.rule.ValidationRule;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ValidationEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir Path workDir;

    private CustomValidatorRegistry registry;
    private ValidationEngine engine;

    @BeforeEach
    void setUp() {
        registry = new CustomValidatorRegistry();
        engine =
                new ValidationEngine(
                        new CommandRuleEvaluator(Duration.ofSeconds(10)),
                        new ContentPatternRuleEvaluator(),
                        new CoverageRuleEvaluator(Map.of(CoverageFormat.LCOV, new LcovReportParser())),
                        new FileExistenceRuleEvaluator(),
                        new CustomRuleEvaluator(registry),
                        Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ValidationContext context(String agentOutput) {
        return new ValidationContext(workDir, agentOutput, null, null);
    }

    private static ContentPatternRule pattern(String name, String regex) {
        return ContentPatternRule.builder().name(name).pattern(regex).build();
    }

    @Nested
    class Scoring {

        @Test
        void shouldScoreHundredWhenAllRulesPass() {
            List<ValidationRule> rules = List.of(pattern("a", "alpha"), pattern("b", "beta"));

            ValidationReport report = engine.validate(rules, context("alpha beta"), "task-1", 1);

            assertThat(report.overallPassed()).isTrue();
            assertThat(report.validationScore()).isEqualTo(100);
            assertThat(report.totalRules()).isEqualTo(2);
            assertThat(report.passedRules()).isEqualTo(2);
            assertThat(report.validatedAt()).isEqualTo(NOW);
        }

        @Test
        void shouldFloorPartialScore() {
            List<ValidationRule> rules =
                    List.of(pattern("a", "alpha"), pattern("b", "beta"), pattern("c", "gamma"));

            ValidationReport report = engine.validate(rules, context("alpha beta"), "task-1", 2);

            assertThat(report.validationScore()).isEqualTo(66);
            assertThat(report.failedRules()).isEqualTo(1);
            assertThat(report.overallPassed()).isFalse();
            assertThat(report.iterationNumber()).isEqualTo(2);
        }

        @Test
        void shouldPassEmptyRuleSetWithFullScore() {
            ValidationReport report = engine.validate(List.of(), context("anything"), "task-1", 1);

            assertThat(report.overallPassed()).isTrue();
            assertThat(report.validationScore()).isEqualTo(100);
            assertThat(report.results()).isEmpty();
        }

        @Test
        void shouldExcludeDisabledRulesFromCounts() {
            ContentPatternRule disabled =
                    ContentPatternRule.builder().name("off").pattern("never").enabled(false).build();

            ValidationReport report =
                    engine.validate(
                            List.of(pattern("on", "alpha"), disabled), context("alpha"), "task-1", 1);

            assertThat(report.totalRules()).isEqualTo(1);
            assertThat(report.results()).extracting(ValidationResult::getRuleName).containsExactly("on");
        }

        @Test
        void shouldSortResultsByRuleName() {
            List<ValidationRule> rules =
                    List.of(pattern("zeta", "x"), pattern("alpha", "x"), pattern("mid", "x"));

            ValidationReport report = engine.validate(rules, context("x"), "task-1", 1);

            assertThat(report.results())
                    .extracting(ValidationResult::getRuleName)
                    .containsExactly("alpha", "mid", "zeta");
        }
    }

    @Nested
    class ErrorIsolation {

        @Test
        void shouldCountErroredRuleAsFailureWithoutAbortingReport() {
            CoverageRule missingReport =
                    CoverageRule.builder()
                            .name("coverage")
                            .reportPath("coverage/lcov.info")
                            .reportFormat(CoverageFormat.LCOV)
                            .minCoverage(80)
                            .build();

            ValidationReport report =
                    engine.validate(
                            List.of(missingReport, pattern("marker", "ok")),
                            context("ok"),
                            "task-1",
                            1);

            assertThat(report.erroredRules()).isEqualTo(1);
            assertThat(report.passedRules()).isEqualTo(1);
            assertThat(report.validationScore()).isEqualTo(50);
            assertThat(report.overallPassed()).isFalse();
            ValidationResult errored = report.results().get(0);
            assertThat(errored.hasError()).isTrue();
            assertThat(errored.isPassed()).isFalse();
            assertThat(errored.getError()).contains("Coverage report not found");
            assertThat(report.failures()).containsExactly(errored);
        }

        @Test
        void shouldCaptureUnexpectedValidatorExceptions() {
            registry.register(
                    new CustomValidator() {
                        @Override
                        public String getValidatorId() {
                            return "explodes";
                        }

                        @Override
                        public RuleOutcome validate(
                                Map<String, Object> config, ValidationContext context) {
                            throw new IllegalStateException("boom");
                        }
                    });

            ValidationReport report =
                    engine.validate(
                            List.of(CustomRule.of("custom", "explodes", Map.of())),
                            context("x"),
                            "task-1",
                            1);

            assertThat(report.erroredRules()).isEqualTo(1);
            assertThat(report.results().get(0).getError()).contains("boom");
        }

        @Test
        void shouldErrorWhenCustomValidatorIsUnknown() {
            ValidationResult result =
                    engine.evaluate(CustomRule.of("custom", "missing", Map.of()), context("x"));

            assertThat(result.hasError()).isTrue();
            assertThat(result.countsAsPassed()).isFalse();
        }
    }

    @Nested
    class Dispatch {

        @Test
        void shouldEvaluateEveryRuleType() throws Exception {
            Files.writeString(workDir.resolve("README.md"), "# readme");
            Files.writeString(workDir.resolve("lcov.info"), "SF:a.js\nLF:10\nLH:9\nend_of_record\n");
            registry.register(
                    new CustomValidator() {
                        @Override
                        public String getValidatorId() {
                            return "always";
                        }

                        @Override
                        public RuleOutcome validate(
                                Map<String, Object> config, ValidationContext context) {
                            return RuleOutcome.pass("fine", Map.of());
                        }
                    });

            List<ValidationRule> rules =
                    List.of(
                            CommandRule.builder().name("cmd").command("true").build(),
                            pattern("content", "done"),
                            CoverageRule.builder()
                                    .name("coverage")
                                    .reportPath("lcov.info")
                                    .minCoverage(80)
                                    .build(),
                            FileExistenceRule.allOf("files", List.of("README.md")),
                            CustomRule.of("custom", "always", Map.of()));

            ValidationReport report = engine.validate(rules, context("done"), "task-1", 1);

            assertThat(report.overallPassed())
                    .as("results: %s", report.results())
                    .isTrue();
            assertThat(report.totalRules()).isEqualTo(5);
        }
    }
}
