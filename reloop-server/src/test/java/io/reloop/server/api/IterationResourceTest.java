package io.reloop.server.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.reloop.core.ReloopEnvironment;
import io.reloop.core.ReloopFactory;
import io.reloop.core.checkpoint.Checkpoint;
import io.reloop.core.exception.ChainClosedException;
import io.reloop.core.exception.DuplicateActiveSessionException;
import io.reloop.core.exception.IllegalIterationStateException;
import io.reloop.core.exception.InvalidIterationConfigException;
import io.reloop.core.validation.rule.ContentPatternRule;
import io.reloop.core.validation.rule.ValidationRule;
import io.reloop.server.api.IterationResource.CompleteRequest;
import io.reloop.server.api.IterationResource.IterationStartRequest;
import io.reloop.server.api.IterationResource.NextRequest;
import io.reloop.server.api.IterationResource.ValidateRequest;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@SuppressWarnings("unchecked")
class IterationResourceTest {

    private static final String TASK = "task-1";

    private ReloopEnvironment env;
    private IterationResource resource;

    @BeforeEach
    void setUp() {
        env = ReloopFactory.createEnvironment();
        resource = new IterationResource(env.getIterationController(), env.getCheckpointStore());
    }

    private static IterationStartRequest startRequest(String taskId, int maxIterations) {
        return startRequest(taskId, maxIterations, null, null);
    }

    private static IterationStartRequest startRequest(
            String taskId, int maxIterations, String agentId, List<String> stopHooks) {
        List<ValidationRule> rules =
                List.of(ContentPatternRule.builder().name("greeting").pattern("hello").build());
        return new IterationStartRequest(
                taskId,
                maxIterations,
                null,
                List.of("ALL DONE"),
                List.of("NEED HELP"),
                rules,
                null,
                null,
                null,
                null,
                Map.of("attempt", 1),
                agentId,
                stopHooks);
    }

    private static Map<String, Object> body(Response response) {
        try (response) {
            return (Map<String, Object>) response.getEntity();
        }
    }

    @Nested
    class Start {

        @Test
        void shouldStartSessionAndReturn201() {
            Response response = resource.start(startRequest(TASK, 5));

            assertThat(response.getStatus()).isEqualTo(201);
            Map<String, Object> body = body(response);
            assertThat(body.get("iterationNumber")).isEqualTo(1);
            assertThat((String) body.get("checkpointId")).isNotBlank();
        }

        @Test
        void shouldRejectSecondActiveSession() {
            body(resource.start(startRequest(TASK, 5)));

            assertThatThrownBy(() -> resource.start(startRequest(TASK, 5)))
                    .isInstanceOf(DuplicateActiveSessionException.class);
        }

        @Test
        void shouldRejectInvalidConfig() {
            assertThatThrownBy(() -> resource.start(startRequest(TASK, 0)))
                    .isInstanceOf(InvalidIterationConfigException.class);
        }

        @Test
        void shouldApplyOptionalGuardSettings() {
            IterationStartRequest request =
                    new IterationStartRequest(
                            TASK,
                            5,
                            7,
                            null,
                            null,
                            null,
                            "work",
                            4,
                            15.0,
                            9,
                            null,
                            null,
                            List.of("promise", "validation"));

            var config = request.toConfig();

            assertThat(config.getCircuitBreakerThreshold()).isEqualTo(7);
            assertThat(config.getRegressionWindow()).isEqualTo(4);
            assertThat(config.getRegressionDropThreshold()).isEqualTo(15.0);
            assertThat(config.getThrashingThreshold()).isEqualTo(9);
            assertThat(config.getWorkingDirectory()).isEqualTo("work");
            assertThat(config.getValidationRules()).isEmpty();
            assertThat(config.getStopHooks()).containsExactly("promise", "validation");
        }

        @Test
        void shouldMergeAgentPresetRulesUnderRequestRules() {
            Map<String, Object> started = body(resource.start(startRequest(TASK, 5, "ta", null)));
            String checkpointId = (String) started.get("checkpointId");

            Checkpoint first = env.getCheckpointStore().findById(checkpointId).orElseThrow();
            assertThat(first.iterationConfig().getValidationRules())
                    .extracting(ValidationRule::name)
                    .containsExactly("has_architecture_diagram", "has_decision_records", "greeting");
        }

        @Test
        void shouldRejectUnknownAgentPreset() {
            assertThatThrownBy(() -> resource.start(startRequest(TASK, 5, "intern", null)))
                    .isInstanceOfSatisfying(
                            InvalidIterationConfigException.class,
                            e ->
                                    assertThat(e.getViolations())
                                            .singleElement()
                                            .asString()
                                            .contains("intern"));
        }

        @Test
        void shouldRejectUnregisteredStopHook() {
            assertThatThrownBy(
                            () -> resource.start(startRequest(TASK, 5, null, List.of("code-review"))))
                    .isInstanceOf(InvalidIterationConfigException.class)
                    .hasMessageContaining("code-review");
        }
    }

    @Nested
    class Validate {

        @Test
        void shouldReturnVerdictWithFeedback() {
            body(resource.start(startRequest(TASK, 5)));

            Map<String, Object> body =
                    body(resource.validate(TASK, new ValidateRequest("nothing useful yet")));

            assertThat(body)
                    .containsEntry("overallPassed", false)
                    .containsEntry("validationScore", 0)
                    .containsEntry("signal", "CONTINUE")
                    .doesNotContainKeys("detectedPattern", "escalation", "stopHook", "nextPrompt");
            assertThat((List<String>) body.get("feedback"))
                    .singleElement()
                    .asString()
                    .startsWith("greeting: ");
        }

        @Test
        void shouldReportDetectedCompletionPattern() {
            body(resource.start(startRequest(TASK, 5)));

            Map<String, Object> body =
                    body(resource.validate(TASK, new ValidateRequest("hello world. ALL DONE")));

            assertThat(body)
                    .containsEntry("overallPassed", true)
                    .containsEntry("validationScore", 100)
                    .containsEntry("signal", "COMPLETE")
                    .containsEntry("detectedPattern", "ALL DONE");
        }
    }

    @Nested
    class StopHooks {

        @Test
        void shouldReturnNextPromptFromDefaultHook() {
            body(resource.start(startRequest(TASK, 5, null, List.of("default"))));

            Map<String, Object> body =
                    body(resource.validate(TASK, new ValidateRequest("nothing useful yet")));

            assertThat(body).containsEntry("signal", "CONTINUE");
            assertThat((Map<String, Object>) body.get("stopHook"))
                    .containsEntry("hookId", "default")
                    .containsEntry("action", "CONTINUE");
            assertThat((String) body.get("nextPrompt"))
                    .startsWith("Continue iteration. Fix the following validation failures:")
                    .contains("- greeting: ");
        }

        @Test
        void shouldEscalateOnPromiseTagAndCarryItIntoSummary() {
            body(resource.start(startRequest(TASK, 5, null, List.of("promise"))));

            Map<String, Object> verdict =
                    body(
                            resource.validate(
                                    TASK, new ValidateRequest("stuck <promise>ESCALATE</promise>")));

            assertThat(verdict).containsEntry("signal", "ESCALATE");
            assertThat((Map<String, Object>) verdict.get("escalation"))
                    .containsEntry("guard", "stop_hook:promise");

            body(resource.complete(TASK, new CompleteRequest("escalated", "handing over")));
            assertThat((String) body(resource.status(TASK)).get("summary"))
                    .startsWith("[stop_hook:promise]")
                    .endsWith("handing over");
        }
    }

    @Nested
    class Next {

        @Test
        void shouldAdvanceAfterContinueVerdict() {
            body(resource.start(startRequest(TASK, 5)));
            body(resource.validate(TASK, new ValidateRequest("not yet")));

            Map<String, Object> body =
                    body(resource.next(TASK, new NextRequest("tried again", null)));

            assertThat(body.get("iterationNumber")).isEqualTo(2);
        }

        @Test
        void shouldAcceptMissingBody() {
            body(resource.start(startRequest(TASK, 5)));
            body(resource.validate(TASK, new ValidateRequest("not yet")));

            assertThat(body(resource.next(TASK, null)).get("iterationNumber")).isEqualTo(2);
        }

        @Test
        void shouldRejectAdvanceWithoutValidation() {
            body(resource.start(startRequest(TASK, 5)));

            assertThatThrownBy(() -> resource.next(TASK, null))
                    .isInstanceOf(IllegalIterationStateException.class);
        }
    }

    @Nested
    class Complete {

        @Test
        void shouldCloseSessionWithCaseInsensitiveOutcome() {
            body(resource.start(startRequest(TASK, 5)));
            body(resource.validate(TASK, new ValidateRequest("hello. ALL DONE")));

            Map<String, Object> body =
                    body(resource.complete(TASK, new CompleteRequest("Success", "done")));

            assertThat(body)
                    .containsEntry("totalIterations", 1)
                    .containsEntry("finalScore", 100)
                    .containsKey("closedAt");
            assertThat(body(resource.status(TASK))).containsEntry("state", "COMPLETED");
        }

        @Test
        void shouldRejectUnknownOutcome() {
            body(resource.start(startRequest(TASK, 5)));

            assertThatThrownBy(() -> resource.complete(TASK, new CompleteRequest("abandoned", null)))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessageContaining("success, blocked, escalated");
        }

        @Test
        void shouldRejectAdvanceAfterClose() {
            body(resource.start(startRequest(TASK, 5)));
            body(resource.validate(TASK, new ValidateRequest("not yet")));
            body(resource.complete(TASK, new CompleteRequest("blocked", "waiting on API keys")));

            assertThatThrownBy(() -> resource.next(TASK, null))
                    .isInstanceOf(ChainClosedException.class);
        }
    }

    @Nested
    class Queries {

        @Test
        void shouldReportUninitializedTask() {
            Map<String, Object> body = body(resource.status("unknown-task"));

            assertThat(body)
                    .containsEntry("taskId", "unknown-task")
                    .containsEntry("state", "UNINITIALIZED")
                    .doesNotContainKey("summary");
        }

        @Test
        void shouldReturnCheckpointById() {
            String checkpointId =
                    (String) body(resource.start(startRequest(TASK, 5))).get("checkpointId");

            try (Response response = resource.checkpoint(checkpointId)) {
                Checkpoint checkpoint = (Checkpoint) response.getEntity();
                assertThat(checkpoint.taskId()).isEqualTo(TASK);
                assertThat(checkpoint.agentContext()).containsEntry("attempt", 1);
            }
        }

        @Test
        void shouldReturn404ForUnknownCheckpoint() {
            assertThatThrownBy(() -> resource.checkpoint("missing"))
                    .isInstanceOf(NotFoundException.class)
                    .hasMessageContaining("missing");
        }
    }
}
