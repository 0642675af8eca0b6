package io.reloop.core;

import io.reloop.core.checkpoint.CheckpointStore;
import io.reloop.core.checkpoint.InMemoryCheckpointStore;
import io.reloop.core.guard.SafetyGuardStack;
import io.reloop.core.hook.StopHook;
import io.reloop.core.hook.StopHookRegistry;
import io.reloop.core.iteration.IterationConfigValidator;
import io.reloop.core.iteration.IterationController;
import io.reloop.core.iteration.IterationListener;
import io.reloop.core.iteration.TaskTextSource;
import io.reloop.core.signal.CompletionSignalDetector;
import io.reloop.core.validation.ValidationEngine;
import io.reloop.core.validation.coverage.CoberturaReportParser;
import io.reloop.core.validation.coverage.CoverageReportParser;
import io.reloop.core.validation.coverage.LcovReportParser;
import io.reloop.core.validation.evaluator.CommandRuleEvaluator;
import io.reloop.core.validation.evaluator.ContentPatternRuleEvaluator;
import io.reloop.core.validation.evaluator.CoverageRuleEvaluator;
import io.reloop.core.validation.evaluator.CustomRuleEvaluator;
import io.reloop.core.validation.evaluator.CustomValidator;
import io.reloop.core.validation.evaluator.CustomValidatorRegistry;
import io.reloop.core.validation.evaluator.FileExistenceRuleEvaluator;
import io.reloop.core.validation.preset.RulePresetCatalog;
import io.reloop.core.validation.rule.CoverageFormat;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Factory for creating and wiring Reloop environments.
///
/// ### Usage Patterns
///
/// **Builder with a durable store** (server):
/// {@snippet :
/// var env = ReloopFactory.builder()
///     .config(ReloopConfig.builder().checkpointTtl(Duration.ofHours(24)).build())
///     .checkpointStore(jdbcStore)
///     .coverageParser(CoverageFormat.JSON, new JacksonCoverageSummaryParser())
///     .build();
/// }
///
/// **Quick start** (tests, embedded use):
/// {@snippet :
/// var env = ReloopFactory.createEnvironment();
/// }
///
/// The core registers LCOV and Cobertura parsers. JSON coverage summaries need a
/// parser from the serialization module. The built-in stop hooks and
/// {@link RulePresetCatalog#defaults()} are always available.
///
/// @see ReloopEnvironment
/// @see ReloopConfig
public final class ReloopFactory {

    private ReloopFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment with default configuration and an in-memory store.
    ///
    /// @return a fully-configured environment, never null
    public static ReloopEnvironment createEnvironment() {
        return createEnvironment(new ReloopConfig());
    }

    /// Creates an environment with custom configuration and an in-memory store.
    ///
    /// @param config configuration options, not null
    /// @return a fully-configured environment, never null
    public static ReloopEnvironment createEnvironment(ReloopConfig config) {
        return builder().config(config).build();
    }

    /// Creates a new builder for fluent environment configuration.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ReloopEnvironment}.
    public static class Builder {
        private ReloopConfig config = new ReloopConfig();
        private CheckpointStore checkpointStore;
        private final List<CustomValidator> customValidators = new ArrayList<>();
        private final List<StopHook> stopHooks = new ArrayList<>();
        private RulePresetCatalog rulePresets = RulePresetCatalog.defaults();
        private final Map<CoverageFormat, CoverageReportParser> coverageParsers =
                new EnumMap<>(CoverageFormat.class);
        private TaskTextSource taskTextSource = TaskTextSource.empty();
        private final List<IterationListener> listeners = new ArrayList<>();
        private SafetyGuardStack guardStack;
        private Clock clock = Clock.systemUTC();

        private Builder() {
            coverageParsers.put(CoverageFormat.LCOV, new LcovReportParser());
            coverageParsers.put(CoverageFormat.COBERTURA, new CoberturaReportParser());
        }

        public Builder config(ReloopConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /// Sets the checkpoint store. Defaults to an in-memory store honoring the
        /// configured TTL.
        ///
        /// @param checkpointStore the store, not null
        /// @return this builder for chaining, never null
        public Builder checkpointStore(CheckpointStore checkpointStore) {
            this.checkpointStore = checkpointStore;
            return this;
        }

        public Builder customValidator(CustomValidator validator) {
            customValidators.add(Objects.requireNonNull(validator, "validator must not be null"));
            return this;
        }

        public Builder customValidators(List<CustomValidator> validators) {
            validators.forEach(this::customValidator);
            return this;
        }

        /// Registers a stop hook sessions can list by id. A hook with a built-in id
        /// replaces the built-in.
        ///
        /// @param hook the hook, not null
        /// @return this builder for chaining, never null
        public Builder stopHook(StopHook hook) {
            stopHooks.add(Objects.requireNonNull(hook, "hook must not be null"));
            return this;
        }

        public Builder rulePresets(RulePresetCatalog rulePresets) {
            this.rulePresets = Objects.requireNonNull(rulePresets, "rulePresets must not be null");
            return this;
        }

        /// Registers or replaces the parser for a coverage report format.
        ///
        /// @param format the report format, not null
        /// @param parser the parser, not null
        /// @return this builder for chaining, never null
        public Builder coverageParser(CoverageFormat format, CoverageReportParser parser) {
            coverageParsers.put(
                    Objects.requireNonNull(format, "format must not be null"),
                    Objects.requireNonNull(parser, "parser must not be null"));
            return this;
        }

        public Builder taskTextSource(TaskTextSource taskTextSource) {
            this.taskTextSource = Objects.requireNonNull(taskTextSource, "taskTextSource");
            return this;
        }

        public Builder listener(IterationListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
            return this;
        }

        /// Replaces the default guard stack.
        ///
        /// @param guardStack the guards, not null
        /// @return this builder for chaining, never null
        public Builder guardStack(SafetyGuardStack guardStack) {
            this.guardStack = guardStack;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /// Builds the environment.
        ///
        /// @return the configured environment, never null
        public ReloopEnvironment build() {
            CustomValidatorRegistry registry = new CustomValidatorRegistry(customValidators);
            ValidationEngine engine =
                    new ValidationEngine(
                            new CommandRuleEvaluator(config.getDefaultCommandTimeout()),
                            new ContentPatternRuleEvaluator(),
                            new CoverageRuleEvaluator(coverageParsers),
                            new FileExistenceRuleEvaluator(),
                            new CustomRuleEvaluator(registry),
                            clock);

            StopHookRegistry hookRegistry = new StopHookRegistry(stopHooks);

            CheckpointStore store =
                    checkpointStore != null
                            ? checkpointStore
                            : new InMemoryCheckpointStore(clock, config.getCheckpointTtl());

            IterationController controller =
                    new IterationController(
                            store,
                            engine,
                            new CompletionSignalDetector(engine),
                            guardStack != null ? guardStack : SafetyGuardStack.defaults(),
                            new IterationConfigValidator(),
                            registry,
                            hookRegistry,
                            rulePresets,
                            taskTextSource,
                            listeners,
                            config.getWorkingDirectory(),
                            clock);

            return new ReloopEnvironment(
                    controller, engine, registry, hookRegistry, rulePresets, store);
        }
    }
}
