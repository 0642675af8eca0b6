package io.reloop.core;

import io.reloop.core.checkpoint.CheckpointStore;
import io.reloop.core.hook.StopHookRegistry;
import io.reloop.core.iteration.IterationController;
import io.reloop.core.validation.ValidationEngine;
import io.reloop.core.validation.evaluator.CustomValidatorRegistry;
import io.reloop.core.validation.preset.RulePresetCatalog;

/// Container holding the wired Reloop components.
///
/// ### Contracts
/// - **Precondition**: All constructor parameters must be non-null
/// - **Invariant**: Component references are immutable after construction
///
/// @apiNote Create instances via {@link ReloopFactory#createEnvironment()} or
/// {@link ReloopFactory.Builder} rather than direct construction.
///
/// @see ReloopFactory
public final class ReloopEnvironment {

    private final IterationController iterationController;
    private final ValidationEngine validationEngine;
    private final CustomValidatorRegistry customValidatorRegistry;
    private final StopHookRegistry stopHookRegistry;
    private final RulePresetCatalog rulePresets;
    private final CheckpointStore checkpointStore;

    /// Creates a new environment with the specified components.
    ///
    /// @param iterationController session state machine, not null
    /// @param validationEngine rule engine used by the controller, not null
    /// @param customValidatorRegistry registry consulted by custom rules, not null
    /// @param stopHookRegistry hooks sessions can list by id, not null
    /// @param rulePresets global and per-agent rules merged at session start, not null
    /// @param checkpointStore storage for checkpoint chains, not null
    public ReloopEnvironment(
            IterationController iterationController,
            ValidationEngine validationEngine,
            CustomValidatorRegistry customValidatorRegistry,
            StopHookRegistry stopHookRegistry,
            RulePresetCatalog rulePresets,
            CheckpointStore checkpointStore) {
        this.iterationController = iterationController;
        this.validationEngine = validationEngine;
        this.customValidatorRegistry = customValidatorRegistry;
        this.stopHookRegistry = stopHookRegistry;
        this.rulePresets = rulePresets;
        this.checkpointStore = checkpointStore;
    }

    /// Returns the controller that drives iteration sessions.
    ///
    /// @return the controller, never null
    public IterationController getIterationController() {
        return iterationController;
    }

    public ValidationEngine getValidationEngine() {
        return validationEngine;
    }

    /// Returns the registry of custom validators.
    ///
    /// Validators registered after creation are visible to sessions started afterwards.
    ///
    /// @return the registry, never null
    public CustomValidatorRegistry getCustomValidatorRegistry() {
        return customValidatorRegistry;
    }

    public StopHookRegistry getStopHookRegistry() {
        return stopHookRegistry;
    }

    public RulePresetCatalog getRulePresets() {
        return rulePresets;
    }

    /// Returns the checkpoint store.
    ///
    /// Defaults to {@link io.reloop.core.checkpoint.InMemoryCheckpointStore} when no
    /// store is registered via {@link ReloopFactory.Builder}.
    ///
    /// @return the store, never null
    public CheckpointStore getCheckpointStore() {
        return checkpointStore;
    }
}
