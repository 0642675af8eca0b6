package io.reloop.server.api;

import io.reloop.core.checkpoint.Checkpoint;
import io.reloop.core.checkpoint.CheckpointStore;
import io.reloop.core.guard.Escalation;
import io.reloop.core.hook.StopHookResult;
import io.reloop.core.iteration.CompletionResult;
import io.reloop.core.iteration.IterationConfig;
import io.reloop.core.iteration.IterationController;
import io.reloop.core.iteration.IterationOutcome;
import io.reloop.core.iteration.IterationStatus;
import io.reloop.core.iteration.IterationVerdict;
import io.reloop.core.iteration.NextResult;
import io.reloop.core.iteration.StartResult;
import io.reloop.core.validation.rule.ValidationRule;
import io.reloop.server.validation.LogSanitizer;
import io.reloop.server.validation.ValidId;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST API for the iteration loop.
///
/// A caller drives one task through `start`, then repeats `validate` and `next`
/// until the verdict's signal is no longer CONTINUE, then calls `complete`.
///
/// Contract violations raised by the {@link IterationController} propagate to
/// {@link IterationExceptionMapper}; this resource only translates payloads.
///
/// @see IterationController for the state machine
@Path("/api/v1/iterations")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class IterationResource {

    private static final Logger LOG = Logger.getLogger(IterationResource.class);

    private final IterationController controller;
    private final CheckpointStore checkpointStore;

    @Inject
    public IterationResource(IterationController controller, CheckpointStore checkpointStore) {
        this.controller = controller;
        this.checkpointStore = checkpointStore;
    }

    /// Starts an iteration session for a task.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/iterations
    ///
    /// {"taskId": "task-42", "agentId": "qa", "maxIterations": 10,
    ///  "completionPatterns": ["ALL DONE"], "stopHooks": ["default"],
    ///  "validationRules": [{"type": "command", "name": "tests", "command": "mvn -q test"}]}
    /// ```
    ///
    /// `agentId` selects a rule preset whose rules are merged under the request's own.
    ///
    /// ### Response (201 Created)
    /// ```json
    /// {"checkpointId": "0b6f...", "iterationNumber": 1}
    /// ```
    @POST
    public Response start(@Valid @NotNull IterationStartRequest request) {
        LOG.infov(
                "Start iteration request: task={0}, agent={1}, maxIterations={2}, rules={3}",
                LogSanitizer.sanitize(request.taskId()),
                LogSanitizer.sanitize(request.agentId()),
                request.maxIterations(),
                request.validationRules() != null ? request.validationRules().size() : 0);

        StartResult result =
                controller.start(
                        request.taskId(),
                        request.agentId(),
                        request.toConfig(),
                        request.agentContext());

        return Response.status(Response.Status.CREATED)
                .entity(
                        Map.of(
                                "checkpointId", result.checkpointId(),
                                "iterationNumber", result.iterationNumber()))
                .build();
    }

    /// Validates the current iteration against the session's rules.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"overallPassed": false, "validationScore": 50, "signal": "CONTINUE",
    ///  "feedback": ["tests: Command exited with code 1, expected 0"],
    ///  "stopHook": {"hookId": "default", "action": "CONTINUE",
    ///               "reason": "1 validation rule(s) failed"},
    ///  "nextPrompt": "Continue iteration. Fix the following validation failures:\n- tests: ..."}
    /// ```
    @POST
    @Path("/{taskId}/validate")
    public Response validate(
            @PathParam("taskId") @ValidId String taskId,
            @Valid @NotNull ValidateRequest request) {
        IterationVerdict verdict = controller.validate(taskId, request.agentOutput());

        LOG.infov(
                "Validated task {0}: score={1}, signal={2}",
                LogSanitizer.sanitize(taskId), verdict.validationScore(), verdict.signal());

        return Response.ok().entity(toBody(verdict)).build();
    }

    /// Advances to the next iteration after a CONTINUE verdict.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"iterationNumber": 2, "checkpointId": "7c1d..."}
    /// ```
    @POST
    @Path("/{taskId}/next")
    public Response next(@PathParam("taskId") @ValidId String taskId, NextRequest request) {
        String notes = request != null ? request.notes() : null;
        Map<String, Object> agentContext = request != null ? request.agentContext() : null;

        NextResult result = controller.next(taskId, notes, agentContext);

        return Response.ok()
                .entity(
                        Map.of(
                                "iterationNumber", result.iterationNumber(),
                                "checkpointId", result.checkpointId()))
                .build();
    }

    /// Closes the session with a terminal outcome.
    ///
    /// ### Request
    /// ```json
    /// {"outcome": "escalated", "summary": "Tests keep failing on CI only"}
    /// ```
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"totalIterations": 4, "finalScore": 75, "closedAt": "2026-03-01T10:15:00Z"}
    /// ```
    @POST
    @Path("/{taskId}/complete")
    public Response complete(
            @PathParam("taskId") @ValidId String taskId,
            @Valid @NotNull CompleteRequest request) {
        IterationOutcome outcome = parseOutcome(request.outcome());

        CompletionResult result = controller.complete(taskId, outcome, request.summary());

        LOG.infov(
                "Completed task {0} as {1} after {2} iteration(s)",
                LogSanitizer.sanitize(taskId), outcome, result.totalIterations());

        return Response.ok()
                .entity(
                        Map.of(
                                "totalIterations", result.totalIterations(),
                                "finalScore", result.finalScore(),
                                "closedAt", result.closedAt().toString()))
                .build();
    }

    /// Reports where a task stands in the loop.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"taskId": "task-42", "state": "ACTIVE", "iterationNumber": 3, "checkpointId": "..."}
    /// ```
    @GET
    @Path("/{taskId}")
    public Response status(@PathParam("taskId") @ValidId String taskId) {
        IterationStatus status = controller.status(taskId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("taskId", status.taskId());
        body.put("state", status.state().name());
        body.put("iterationNumber", status.iterationNumber());
        body.put("checkpointId", status.checkpointId());
        if (status.summary() != null) {
            body.put("summary", status.summary());
        }
        return Response.ok().entity(body).build();
    }

    /// Returns a stored checkpoint by id, including checkpoints of closed sessions.
    @GET
    @Path("/checkpoints/{checkpointId}")
    public Response checkpoint(@PathParam("checkpointId") @ValidId String checkpointId) {
        Checkpoint checkpoint =
                checkpointStore
                        .findById(checkpointId)
                        .orElseThrow(
                                () -> {
                                    LOG.warnv(
                                            "Checkpoint not found: {0}",
                                            LogSanitizer.sanitize(checkpointId));
                                    return new NotFoundException(
                                            "Checkpoint not found: " + checkpointId);
                                });
        return Response.ok().entity(checkpoint).build();
    }

    // --- Mapping ---

    private static Map<String, Object> toBody(IterationVerdict verdict) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("overallPassed", verdict.overallPassed());
        body.put("validationScore", verdict.validationScore());
        body.put("signal", verdict.signal().name());
        if (verdict.detectedPattern() != null) {
            body.put("detectedPattern", verdict.detectedPattern());
        }
        body.put("feedback", verdict.feedback());
        Escalation escalation = verdict.escalation();
        if (escalation != null) {
            body.put(
                    "escalation",
                    Map.of(
                            "guard", escalation.guard(),
                            "reason", escalation.reason(),
                            "evidence", escalation.evidence()));
        }
        StopHookResult stopHook = verdict.stopHook();
        if (stopHook != null) {
            body.put(
                    "stopHook",
                    Map.of(
                            "hookId", stopHook.hookId(),
                            "action", stopHook.action().name(),
                            "reason", stopHook.reason()));
        }
        if (verdict.nextPrompt() != null) {
            body.put("nextPrompt", verdict.nextPrompt());
        }
        return body;
    }

    private static IterationOutcome parseOutcome(String value) {
        try {
            return IterationOutcome.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(
                    "outcome must be one of success, blocked, escalated but was: " + value);
        }
    }

    // --- Request DTOs ---

    /// Request body for starting a session.
    ///
    /// Optional guard settings fall back to the {@link IterationConfig} defaults.
    ///
    /// @param taskId the task to iterate on, not blank
    /// @param maxIterations iteration ceiling
    /// @param circuitBreakerThreshold consecutive failures before escalating, may be null
    /// @param completionPatterns patterns signalling completion, may be null
    /// @param blockedPatterns patterns signalling a blocked task, may be null
    /// @param validationRules rules checked each iteration, may be null
    /// @param workingDirectory directory commands and file checks run in, may be null
    /// @param regressionWindow scores compared by the regression guard, may be null
    /// @param regressionDropThreshold score drop that counts as regression, may be null
    /// @param thrashingThreshold repeated identical failures before escalating, may be null
    /// @param agentContext opaque caller data carried across iterations, may be null
    /// @param agentId agent role whose rule preset applies, may be null
    /// @param stopHooks ids of the stop hooks run after every validation, may be null
    public record IterationStartRequest(
            @NotBlank(message = "taskId is required") @ValidId String taskId,
            int maxIterations,
            Integer circuitBreakerThreshold,
            List<String> completionPatterns,
            List<String> blockedPatterns,
            List<ValidationRule> validationRules,
            String workingDirectory,
            Integer regressionWindow,
            Double regressionDropThreshold,
            Integer thrashingThreshold,
            Map<String, Object> agentContext,
            String agentId,
            List<String> stopHooks) {

        IterationConfig toConfig() {
            IterationConfig.Builder builder =
                    IterationConfig.builder()
                            .maxIterations(maxIterations)
                            .completionPatterns(completionPatterns)
                            .blockedPatterns(blockedPatterns)
                            .validationRules(validationRules)
                            .workingDirectory(workingDirectory)
                            .stopHooks(stopHooks);
            if (circuitBreakerThreshold != null) {
                builder.circuitBreakerThreshold(circuitBreakerThreshold);
            }
            if (regressionWindow != null) {
                builder.regressionWindow(regressionWindow);
            }
            if (regressionDropThreshold != null) {
                builder.regressionDropThreshold(regressionDropThreshold);
            }
            if (thrashingThreshold != null) {
                builder.thrashingThreshold(thrashingThreshold);
            }
            return builder.build();
        }
    }

    /// Request body for validating an iteration.
    ///
    /// @param agentOutput the caller's latest free-text output, not null
    public record ValidateRequest(
            @NotNull(message = "agentOutput is required") String agentOutput) {}

    /// Request body for advancing to the next iteration.
    ///
    /// @param notes notes recorded in the history entry, may be null
    /// @param agentContext replacement caller context, may be null to keep the current one
    public record NextRequest(String notes, Map<String, Object> agentContext) {}

    /// Request body for closing a session.
    ///
    /// @param outcome `success`, `blocked` or `escalated`, case-insensitive
    /// @param summary closing summary, may be null
    public record CompleteRequest(
            @NotBlank(message = "outcome is required") String outcome, String summary) {}
}
