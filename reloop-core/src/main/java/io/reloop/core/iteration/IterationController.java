package io.reloop.core.iteration;

import io.reloop.core.checkpoint.Checkpoint;
import io.reloop.core.checkpoint.CheckpointChain;
import io.reloop.core.checkpoint.CheckpointStore;
import io.reloop.core.checkpoint.CheckpointUpdate;
import io.reloop.core.checkpoint.HistoryEntry;
import io.reloop.core.exception.ChainClosedException;
import io.reloop.core.exception.IllegalIterationStateException;
import io.reloop.core.exception.InvalidIterationConfigException;
import io.reloop.core.exception.MaxIterationsExceededException;
import io.reloop.core.exception.SessionNotFoundException;
import io.reloop.core.exception.UnregisteredCustomValidatorException;
import io.reloop.core.guard.Escalation;
import io.reloop.core.guard.GuardContext;
import io.reloop.core.guard.SafetyGuardStack;
import io.reloop.core.hook.StopAction;
import io.reloop.core.hook.StopHookContext;
import io.reloop.core.hook.StopHookRegistry;
import io.reloop.core.hook.StopHookResult;
import io.reloop.core.signal.CompletionSignal;
import io.reloop.core.signal.CompletionSignalDetector;
import io.reloop.core.signal.SignalDetection;
import io.reloop.core.validation.ValidationContext;
import io.reloop.core.validation.ValidationEngine;
import io.reloop.core.validation.ValidationReport;
import io.reloop.core.validation.ValidationResult;
import io.reloop.core.validation.evaluator.CustomValidatorRegistry;
import io.reloop.core.validation.preset.RulePresetCatalog;
import io.reloop.core.validation.rule.CustomRule;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// State machine driving one iteration session per task.
///
/// ### Lifecycle
/// ```
/// start ──> ACTIVE ──validate*──> next ──> ACTIVE ... ──complete──> COMPLETED | BLOCKED | ESCALATED
/// ```
///
/// - {@link #start} merges preset rules, validates the config, checks custom
///   validator and stop hook ids and creates the first checkpoint
/// - {@link #validate} runs the rules, the completion detector, the guard stack and
///   the session's stop hooks against the newest checkpoint, then records the
///   verdict on that checkpoint; it may be repeated within an iteration
/// - {@link #next} appends the following iteration's checkpoint, extending history
///   with the recorded verdict; allowed only after a CONTINUE verdict
/// - {@link #complete} closes the chain; a recorded escalation is prefixed to the
///   summary whatever the outcome
///
/// ### Signal Resolution
/// 1. a guard escalation yields ESCALATE; stop hooks are skipped
/// 2. a stop hook ESCALATE yields ESCALATE
/// 3. a detected blocked pattern yields BLOCKED
/// 4. a detected completion pattern or a stop hook COMPLETE yields COMPLETE
/// 5. otherwise CONTINUE
///
/// @implNote Thread-safe and stateless. Verdicts live in the {@link CheckpointStore},
/// so any controller sharing the store can advance or close a session.
public final class IterationController {

    private static final Logger logger = Logger.getLogger(IterationController.class.getName());

    private final CheckpointStore store;
    private final ValidationEngine validationEngine;
    private final CompletionSignalDetector signalDetector;
    private final SafetyGuardStack guardStack;
    private final IterationConfigValidator configValidator;
    private final CustomValidatorRegistry customValidators;
    private final StopHookRegistry stopHooks;
    private final RulePresetCatalog rulePresets;
    private final TaskTextSource textSource;
    private final List<IterationListener> listeners;
    private final Path defaultWorkingDirectory;
    private final Clock clock;

    public IterationController(
            CheckpointStore store,
            ValidationEngine validationEngine,
            CompletionSignalDetector signalDetector,
            SafetyGuardStack guardStack,
            IterationConfigValidator configValidator,
            CustomValidatorRegistry customValidators,
            StopHookRegistry stopHooks,
            RulePresetCatalog rulePresets,
            TaskTextSource textSource,
            List<IterationListener> listeners,
            Path defaultWorkingDirectory,
            Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.validationEngine =
                Objects.requireNonNull(validationEngine, "validationEngine must not be null");
        this.signalDetector =
                Objects.requireNonNull(signalDetector, "signalDetector must not be null");
        this.guardStack = Objects.requireNonNull(guardStack, "guardStack must not be null");
        this.configValidator =
                Objects.requireNonNull(configValidator, "configValidator must not be null");
        this.customValidators =
                Objects.requireNonNull(customValidators, "customValidators must not be null");
        this.stopHooks = Objects.requireNonNull(stopHooks, "stopHooks must not be null");
        this.rulePresets = Objects.requireNonNull(rulePresets, "rulePresets must not be null");
        this.textSource = Objects.requireNonNull(textSource, "textSource must not be null");
        this.listeners = List.copyOf(Objects.requireNonNull(listeners, "listeners"));
        this.defaultWorkingDirectory =
                Objects.requireNonNull(defaultWorkingDirectory, "defaultWorkingDirectory");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Starts a session at iteration 1 with the global rules only.
    ///
    /// @see #start(String, String, IterationConfig, Map)
    public StartResult start(String taskId, IterationConfig config, Map<String, Object> agentContext) {
        return start(taskId, null, config, agentContext);
    }

    /// Starts a session at iteration 1.
    ///
    /// The stored config carries the global rules and the agent's preset rules,
    /// overridden by same-named rules of `config`.
    ///
    /// @param taskId the task, not null
    /// @param agentId agent role whose rule preset applies, may be null
    /// @param config the session config, not null
    /// @param agentContext initial caller context, may be null
    /// @return the first checkpoint's id and iteration number, never null
    /// @throws InvalidIterationConfigException if the config violates its limits, the
    ///     agent has no preset or a stop hook id is unknown
    /// @throws UnregisteredCustomValidatorException if a custom rule names an unknown id
    /// @throws io.reloop.core.exception.DuplicateActiveSessionException if the task
    ///     already has a live session
    public StartResult start(
            String taskId, String agentId, IterationConfig config, Map<String, Object> agentContext) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(config, "config must not be null");

        IterationConfig merged = rulePresets.apply(taskId, agentId, config);
        configValidator.validate(taskId, merged);
        requireRegisteredValidators(taskId, merged);
        requireRegisteredStopHooks(taskId, merged);

        Checkpoint first = store.create(taskId, merged, agentContext);
        IterationConfig stored = first.iterationConfig();
        logger.info(
                "Started iteration session for task "
                        + taskId
                        + " (maxIterations="
                        + stored.getMaxIterations()
                        + ", rules="
                        + stored.getValidationRules().size()
                        + (agentId != null ? ", agent=" + agentId : "")
                        + ")");
        notifyListeners(listener -> listener.onStart(first));
        return new StartResult(first.id(), first.iterationNumber());
    }

    /// Validates the current iteration and records the verdict on its checkpoint.
    ///
    /// @param taskId the task, not null
    /// @param agentOutput the caller's latest free-text output, may be null
    /// @return the verdict, never null
    /// @throws SessionNotFoundException if the task has no live session
    /// @throws ChainClosedException if the task's session is closed
    /// @throws io.reloop.core.exception.StaleChainException if another caller advanced
    ///     the session during validation
    public IterationVerdict validate(String taskId, String agentOutput) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Checkpoint checkpoint = requireLatest(taskId);
        IterationConfig config = checkpoint.iterationConfig();

        ValidationContext context =
                new ValidationContext(
                        workingDirectory(config),
                        agentOutput,
                        textSource.taskNotes(taskId).orElse(null),
                        textSource.latestWorkProduct(taskId).orElse(null));

        ValidationReport report =
                validationEngine.validate(
                        config.getValidationRules(),
                        context,
                        taskId,
                        checkpoint.iterationNumber());
        SignalDetection detection =
                signalDetector.detect(
                        config.getCompletionPatterns(), config.getBlockedPatterns(), context);

        List<HistoryEntry> history = new ArrayList<>(checkpoint.iterationHistory());
        history.add(HistoryEntry.from(report, checkpoint.id(), null));
        Optional<Escalation> escalation =
                guardStack.evaluate(new GuardContext(config, history, report, detection.signal()));

        StopHookResult hookResult = null;
        if (escalation.isEmpty() && !config.getStopHooks().isEmpty()) {
            hookResult =
                    stopHooks
                            .evaluate(
                                    config.getStopHooks(),
                                    StopHookContext.of(
                                            taskId,
                                            checkpoint.iterationNumber(),
                                            agentOutput,
                                            report))
                            .orElse(null);
            if (hookResult != null && hookResult.action() == StopAction.ESCALATE) {
                escalation = Optional.of(hookEscalation(hookResult, report));
            }
        }

        CompletionSignal signal = resolveSignal(detection.signal(), escalation, hookResult);
        IterationVerdict verdict =
                new IterationVerdict(
                        report.overallPassed(),
                        report.validationScore(),
                        signal,
                        detection.detectedPattern(),
                        feedback(report, escalation.orElse(null)),
                        escalation.orElse(null),
                        hookResult,
                        report);

        store.recordVerdict(taskId, checkpoint.sequence(), verdict);
        logger.info(
                "Task "
                        + taskId
                        + " iteration "
                        + checkpoint.iterationNumber()
                        + ": signal="
                        + signal
                        + ", score="
                        + report.validationScore());
        notifyListeners(listener -> listener.onValidated(taskId, verdict));
        return verdict;
    }

    /// Advances to the next iteration.
    ///
    /// @param taskId the task, not null
    /// @param notes notes recorded with the finished iteration, may be null
    /// @return the new iteration number and checkpoint id, never null
    /// @see #next(String, String, Map)
    public NextResult next(String taskId, String notes) {
        return next(taskId, notes, null);
    }

    /// Advances to the next iteration, replacing the caller context.
    ///
    /// @param taskId the task, not null
    /// @param notes notes recorded with the finished iteration, may be null
    /// @param agentContext context for the new iteration, or null to carry the current one
    /// @return the new iteration number and checkpoint id, never null
    /// @throws MaxIterationsExceededException if the current iteration is the last allowed
    /// @throws IllegalIterationStateException if the iteration was not validated or the
    ///     last signal was not CONTINUE
    /// @throws ChainClosedException if the session is closed
    /// @throws io.reloop.core.exception.StaleChainException if another caller advanced first
    public NextResult next(String taskId, String notes, Map<String, Object> agentContext) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Checkpoint checkpoint = requireLatest(taskId);
        IterationConfig config = checkpoint.iterationConfig();

        if (checkpoint.iterationNumber() >= config.getMaxIterations()) {
            throw new MaxIterationsExceededException(taskId, config.getMaxIterations());
        }

        IterationVerdict verdict =
                store.findVerdict(taskId, checkpoint.sequence())
                        .orElseThrow(
                                () ->
                                        new IllegalIterationStateException(
                                                taskId,
                                                "Iteration "
                                                        + checkpoint.iterationNumber()
                                                        + " of task "
                                                        + taskId
                                                        + " must be validated before advancing"));
        if (verdict.signal() != CompletionSignal.CONTINUE) {
            throw new IllegalIterationStateException(
                    taskId,
                    "Cannot advance task "
                            + taskId
                            + " after signal "
                            + verdict.signal()
                            + "; complete the session instead");
        }

        List<HistoryEntry> history = new ArrayList<>(checkpoint.iterationHistory());
        history.add(HistoryEntry.from(verdict.report(), checkpoint.id(), notes));

        List<String> promises = new ArrayList<>(checkpoint.completionPromisesSeen());
        if (verdict.detectedPattern() != null && !promises.contains(verdict.detectedPattern())) {
            promises.add(verdict.detectedPattern());
        }

        Checkpoint appended =
                store.append(
                        taskId,
                        checkpoint.sequence(),
                        new CheckpointUpdate(
                                checkpoint.iterationNumber() + 1,
                                history,
                                verdict.report(),
                                agentContext != null ? agentContext : checkpoint.agentContext(),
                                promises));

        logger.info("Task " + taskId + " advanced to iteration " + appended.iterationNumber());
        notifyListeners(listener -> listener.onAdvance(appended));
        return new NextResult(appended.iterationNumber(), appended.id());
    }

    /// Closes the session with a terminal outcome.
    ///
    /// When the current iteration's recorded verdict carries an escalation, the stored
    /// summary is prefixed with the guard or hook that fired and its evidence, for any
    /// outcome.
    ///
    /// @param taskId the task, not null
    /// @param outcome the terminal outcome, not null
    /// @param summary the caller's summary, may be null
    /// @return totals and close time, never null
    /// @throws ChainClosedException if the session is already closed
    /// @throws SessionNotFoundException if the task has no live session
    public CompletionResult complete(String taskId, IterationOutcome outcome, String summary) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Checkpoint checkpoint = requireLatest(taskId);

        IterationVerdict verdict = store.findVerdict(taskId, checkpoint.sequence()).orElse(null);

        int finalScore;
        if (verdict != null) {
            finalScore = verdict.validationScore();
        } else if (checkpoint.lastValidationReport() != null) {
            finalScore = checkpoint.lastValidationReport().validationScore();
        } else {
            finalScore = 0;
        }

        String storedSummary = summary;
        if (verdict != null && verdict.escalation() != null) {
            String reason = verdict.escalation().describe();
            storedSummary = summary == null || summary.isBlank() ? reason : reason + "\n" + summary;
        }

        CheckpointChain closed = store.close(taskId, outcome.chainStatus(), storedSummary);

        logger.info(
                "Task "
                        + taskId
                        + " completed as "
                        + outcome
                        + " after "
                        + checkpoint.iterationNumber()
                        + " iteration(s)");
        notifyListeners(listener -> listener.onComplete(closed));
        return new CompletionResult(
                checkpoint.iterationNumber(), finalScore, closed.closedAt(), storedSummary);
    }

    /// Returns the task's session state.
    ///
    /// @param taskId the task, not null
    /// @return the status, UNINITIALIZED if the task has no session, never null
    public IterationStatus status(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Optional<CheckpointChain> chain = store.findChain(taskId);
        if (chain.isEmpty()
                || (!chain.get().status().isTerminal()
                        && chain.get().isExpiredAt(clock.instant()))) {
            return new IterationStatus(taskId, IterationState.UNINITIALIZED, 0, null, null);
        }
        CheckpointChain header = chain.get();
        int iteration =
                store.findById(header.latestCheckpointId())
                        .map(Checkpoint::iterationNumber)
                        .orElse((int) header.latestSequence());
        return new IterationStatus(
                taskId,
                IterationState.of(header.status()),
                iteration,
                header.latestCheckpointId(),
                header.summary());
    }

    private Checkpoint requireLatest(String taskId) {
        return store.resumeLatest(taskId)
                .orElseThrow(
                        () -> {
                            boolean closed =
                                    store.findChain(taskId)
                                            .map(chain -> chain.status().isTerminal())
                                            .orElse(false);
                            return closed
                                    ? new ChainClosedException(taskId)
                                    : new SessionNotFoundException(taskId);
                        });
    }

    private void requireRegisteredValidators(String taskId, IterationConfig config) {
        List<String> missing =
                config.getValidationRules().stream()
                        .filter(CustomRule.class::isInstance)
                        .map(rule -> ((CustomRule) rule).validatorId())
                        .filter(id -> !customValidators.contains(id))
                        .distinct()
                        .toList();
        if (!missing.isEmpty()) {
            throw new UnregisteredCustomValidatorException(taskId, missing);
        }
    }

    private void requireRegisteredStopHooks(String taskId, IterationConfig config) {
        List<String> unknown =
                config.getStopHooks().stream()
                        .filter(id -> !stopHooks.contains(id))
                        .map(id -> "stopHooks references an unregistered hook: " + id)
                        .toList();
        if (!unknown.isEmpty()) {
            throw new InvalidIterationConfigException(taskId, unknown);
        }
    }

    private static CompletionSignal resolveSignal(
            CompletionSignal detected, Optional<Escalation> escalation, StopHookResult hookResult) {
        if (escalation.isPresent()) {
            return CompletionSignal.ESCALATE;
        }
        if (detected == CompletionSignal.CONTINUE
                && hookResult != null
                && hookResult.action() == StopAction.COMPLETE) {
            return CompletionSignal.COMPLETE;
        }
        return detected;
    }

    private static Escalation hookEscalation(StopHookResult hookResult, ValidationReport report) {
        List<String> evidence = new ArrayList<>();
        for (ValidationResult result : report.failures()) {
            evidence.add(result.getRuleName() + " failed");
        }
        return new Escalation("stop_hook:" + hookResult.hookId(), hookResult.reason(), evidence);
    }

    private Path workingDirectory(IterationConfig config) {
        return config.getWorkingDirectory() != null
                ? defaultWorkingDirectory.resolve(config.getWorkingDirectory())
                : defaultWorkingDirectory;
    }

    private static List<String> feedback(ValidationReport report, Escalation escalation) {
        List<String> feedback = new ArrayList<>();
        for (ValidationResult result : report.failures()) {
            feedback.add(result.getRuleName() + ": " + result.getMessage());
        }
        if (escalation != null) {
            feedback.add("Escalated: " + escalation.describe());
        }
        return feedback;
    }

    private void notifyListeners(Consumer<IterationListener> event) {
        for (IterationListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Iteration listener failed", e);
            }
        }
    }
}
