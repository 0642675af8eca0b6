package io.reloop.core.hook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.reloop.core.validation.ValidationReport;
import io.reloop.core.validation.ValidationResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StopHookRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final StopHookRegistry registry = new StopHookRegistry();

    private static ValidationResult result(String rule, boolean passed) {
        return ValidationResult.builder()
                .ruleName(rule)
                .passed(passed)
                .message(passed ? "ok" : "missing " + rule)
                .timestamp(NOW)
                .build();
    }

    private static StopHookContext context(String output, ValidationResult... results) {
        return StopHookContext.of(
                "task-1", 2, output, ValidationReport.of("task-1", 2, List.of(results), NOW));
    }

    private static StopHook fixed(String id, StopHookDecision decision, List<String> calls) {
        return new StopHook() {
            @Override
            public String getHookId() {
                return id;
            }

            @Override
            public StopHookDecision evaluate(StopHookContext context) {
                calls.add(id);
                return decision;
            }
        };
    }

    @Test
    void shouldAlwaysHoldBuiltInHooks() {
        assertThat(registry.ids()).containsExactlyInAnyOrder("validation", "promise", "default");
    }

    @Test
    void shouldReturnEmptyForEmptyChain() {
        assertThat(registry.evaluate(List.of(), context("anything"))).isEmpty();
    }

    @Test
    void shouldRejectUnknownHookId() {
        assertThatThrownBy(() -> registry.evaluate(List.of("code-review"), context("x")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("code-review");
    }

    @Nested
    class Chain {

        @Test
        void shouldStopAtFirstDecisiveHook() {
            List<String> calls = new ArrayList<>();
            StopHookRegistry chain =
                    new StopHookRegistry(
                            List.of(
                                    fixed("a", StopHookDecision.keepGoing("a", "prompt a"), calls),
                                    fixed("b", StopHookDecision.complete("b done"), calls),
                                    fixed("c", StopHookDecision.escalate("c"), calls)));

            Optional<StopHookResult> result = chain.evaluate(List.of("a", "b", "c"), context("x"));

            assertThat(result).contains(new StopHookResult("b", StopAction.COMPLETE, "b done", null));
            assertThat(calls).containsExactly("a", "b");
        }

        @Test
        void shouldReturnLastContinueWhenNoHookDecides() {
            List<String> calls = new ArrayList<>();
            StopHookRegistry chain =
                    new StopHookRegistry(
                            List.of(
                                    fixed("a", StopHookDecision.keepGoing("a", "prompt a"), calls),
                                    fixed("b", StopHookDecision.keepGoing("b", "prompt b"), calls)));

            StopHookResult result = chain.evaluate(List.of("a", "b"), context("x")).orElseThrow();

            assertThat(result.hookId()).isEqualTo("b");
            assertThat(result.nextPrompt()).isEqualTo("prompt b");
        }

        @Test
        void shouldEscalateWhenHookThrows() {
            StopHook broken =
                    new StopHook() {
                        @Override
                        public String getHookId() {
                            return "broken";
                        }

                        @Override
                        public StopHookDecision evaluate(StopHookContext context) {
                            throw new IllegalStateException("no verdict");
                        }
                    };
            registry.register(broken);

            StopHookResult result =
                    registry.evaluate(List.of("broken", "default"), context("x")).orElseThrow();

            assertThat(result.hookId()).isEqualTo("broken");
            assertThat(result.action()).isEqualTo(StopAction.ESCALATE);
            assertThat(result.reason()).isEqualTo("Hook evaluation failed: no verdict");
        }

        @Test
        void shouldReplaceBuiltInWithSameId() {
            List<String> calls = new ArrayList<>();
            registry.register(fixed("default", StopHookDecision.complete("custom"), calls));

            StopHookResult result = registry.evaluate(List.of("default"), context("x")).orElseThrow();

            assertThat(result.reason()).isEqualTo("custom");
            assertThat(calls).containsExactly("default");
        }
    }

    @Nested
    class BuiltIns {

        @Test
        void shouldCompleteValidationHookWhenEveryRulePasses() {
            StopHookResult result =
                    registry.evaluate(List.of("validation"), context("x", result("a", true)))
                            .orElseThrow();

            assertThat(result.action()).isEqualTo(StopAction.COMPLETE);
            assertThat(result.nextPrompt()).isNull();
        }

        @Test
        void shouldListFailuresInValidationPrompt() {
            StopHookResult result =
                    registry.evaluate(
                                    List.of("validation"),
                                    context("x", result("a", true), result("b", false)))
                            .orElseThrow();

            assertThat(result.action()).isEqualTo(StopAction.CONTINUE);
            assertThat(result.reason()).isEqualTo("1 validation rule(s) failed");
            assertThat(result.nextPrompt())
                    .isEqualTo(
                            "Continue iteration. Fix the following validation failures:\n"
                                    + "- b: missing b");
        }

        @Test
        void shouldNotCompleteValidationHookWithoutRules() {
            StopHookResult result =
                    registry.evaluate(List.of("validation"), context("x")).orElseThrow();

            assertThat(result.action()).isEqualTo(StopAction.CONTINUE);
            assertThat(result.nextPrompt()).isNull();
        }

        @Test
        void shouldPreferCompletionPromiseOverEscalation() {
            StopHookResult result =
                    registry.evaluate(
                                    List.of("promise"),
                                    context(
                                            "<promise>ESCALATE</promise>"
                                                    + " <promise>COMPLETE</promise>"))
                            .orElseThrow();

            assertThat(result.action()).isEqualTo(StopAction.COMPLETE);
        }

        @Test
        void shouldEscalateOnBlockedPromise() {
            StopHookResult result =
                    registry.evaluate(List.of("promise"), context("<promise>blocked</promise>"))
                            .orElseThrow();

            assertThat(result.action()).isEqualTo(StopAction.ESCALATE);
            assertThat(result.reason())
                    .isEqualTo("Agent signaled blocked state via <promise>BLOCKED</promise>");
        }

        @Test
        void shouldLetDefaultHookHonourPromiseBeforeFailures() {
            StopHookResult result =
                    registry.evaluate(
                                    List.of("default"),
                                    context("<promise>COMPLETE</promise>", result("a", false)))
                            .orElseThrow();

            assertThat(result.action()).isEqualTo(StopAction.COMPLETE);
        }

        @Test
        void shouldKeepDefaultHookGoingWithoutRulesOrPromise() {
            StopHookResult result = registry.evaluate(List.of("default"), context("x")).orElseThrow();

            assertThat(result.action()).isEqualTo(StopAction.CONTINUE);
            assertThat(result.reason()).isEqualTo("Iteration in progress");
        }
    }

    @Nested
    class Promises {

        @Test
        void shouldFindEveryTagIgnoringCase() {
            assertThat(PromiseTag.scan("<PROMISE>complete</promise> then <promise>Blocked</promise>"))
                    .containsExactlyInAnyOrder(PromiseTag.COMPLETE, PromiseTag.BLOCKED);
        }

        @Test
        void shouldIgnoreUnknownOrMalformedTags() {
            assertThat(PromiseTag.scan("<promise>DONE</promise> <promise>COMPLETE")).isEmpty();
            assertThat(PromiseTag.scan(null)).isEmpty();
        }
    }
}
