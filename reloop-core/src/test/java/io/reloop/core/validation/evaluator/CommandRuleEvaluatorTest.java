package io.reloop.core.validation.evaluator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.reloop.core.validation.RuleOutcome;
import io.reloop.core.validation.ValidationContext;
import io.reloop.core.validation.rule.CommandRule;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
class CommandRuleEvaluatorTest {

    @TempDir Path workDir;

    private CommandRuleEvaluator evaluator;
    private ValidationContext context;

    @BeforeEach
    void setUp() {
        evaluator = new CommandRuleEvaluator(Duration.ofSeconds(10));
        context = new ValidationContext(workDir, null, null, null);
    }

    @Test
    void shouldPassWhenExitCodeMatches() throws Exception {
        CommandRule rule = CommandRule.builder().name("echo").command("echo hello").build();

        RuleOutcome outcome = evaluator.evaluate(rule, context);

        assertThat(outcome.passed()).isTrue();
        assertThat(outcome.details()).containsEntry("exitCode", 0);
        assertThat((String) outcome.details().get("stdout")).isEqualTo("hello\n");
    }

    @Test
    void shouldFailOnUnexpectedExitCode() throws Exception {
        CommandRule rule =
                CommandRule.builder().name("fails").command("echo oops >&2; exit 3").build();

        RuleOutcome outcome = evaluator.evaluate(rule, context);

        assertThat(outcome.passed()).isFalse();
        assertThat(outcome.message()).isEqualTo("Command exited with code 3, expected 0");
        assertThat((String) outcome.details().get("stderr")).contains("oops");
    }

    @Test
    void shouldHonorExpectedNonZeroExitCode() throws Exception {
        CommandRule rule =
                CommandRule.builder().name("grep-none").command("exit 1").expectedExitCode(1).build();

        assertThat(evaluator.evaluate(rule, context).passed()).isTrue();
    }

    @Test
    void shouldRunInWorkingDirectoryWithEnvironment() throws Exception {
        Files.createDirectories(workDir.resolve("sub"));
        CommandRule rule =
                CommandRule.builder()
                        .name("env")
                        .command("test \"$(basename \"$PWD\")\" = sub && test \"$MODE\" = strict")
                        .workingDirectory("sub")
                        .env(Map.of("MODE", "strict"))
                        .build();

        assertThat(evaluator.evaluate(rule, context).passed()).isTrue();
    }

    @Test
    void shouldTruncateLongOutput() throws Exception {
        CommandRule rule =
                CommandRule.builder()
                        .name("flood")
                        .command("i=0; while [ $i -lt 3000 ]; do printf x; i=$((i+1)); done")
                        .build();

        RuleOutcome outcome = evaluator.evaluate(rule, context);

        assertThat((String) outcome.details().get("stdout"))
                .hasSize(CommandRuleEvaluator.MAX_OUTPUT_CHARS);
    }

    @Test
    void shouldKillCommandOnTimeout() {
        CommandRule rule =
                CommandRule.builder()
                        .name("slow")
                        .command("sleep 30")
                        .timeout(Duration.ofMillis(300))
                        .build();

        long start = System.nanoTime();
        assertThatThrownBy(() -> evaluator.evaluate(rule, context))
                .isInstanceOf(EvaluatorException.class)
                .hasMessageContaining("timed out after 300 ms");
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(elapsedMs).isLessThan(5_000);
    }

    @Test
    void shouldErrorWhenWorkingDirectoryIsMissing() {
        CommandRule rule =
                CommandRule.builder().name("nowhere").command("true").workingDirectory("absent").build();

        assertThatThrownBy(() -> evaluator.evaluate(rule, context))
                .isInstanceOf(EvaluatorException.class)
                .hasMessageContaining("Working directory does not exist");
    }
}
