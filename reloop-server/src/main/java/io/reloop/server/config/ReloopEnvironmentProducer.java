package io.reloop.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.reloop.core.ReloopConfig;
import io.reloop.core.ReloopEnvironment;
import io.reloop.core.ReloopFactory;
import io.reloop.core.hook.StopHook;
import io.reloop.core.iteration.IterationListener;
import io.reloop.core.iteration.TaskTextSource;
import io.reloop.core.validation.evaluator.CustomValidator;
import io.reloop.core.validation.rule.CoverageFormat;
import io.reloop.serialization.coverage.JacksonCoverageSummaryParser;
import io.reloop.server.persistence.JdbcCheckpointStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import javax.sql.DataSource;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/// CDI producer for the Reloop runtime environment.
///
/// Wires the validation engine, guard stack, checkpoint store and iteration
/// controller via {@link ReloopFactory}, adding the beans the container discovers:
/// - every {@link CustomValidator} bean, registered under its validator id
/// - every {@link StopHook} bean, listed by sessions under its hook id
/// - every {@link IterationListener} bean
/// - a {@link TaskTextSource} bean if one is resolvable, otherwise a source with no text
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `reloop.command.default-timeout` | Duration | `60s` | Timeout for command rules without their own |
/// | `reloop.checkpoint.ttl` | Duration | none | Lifetime of a checkpoint; unset means no expiry |
/// | `reloop.working-directory` | String | process cwd | Base for relative rule working directories |
/// | `quarkus.datasource.active` | Boolean | `true` | JDBC store when active, in-memory otherwise |
///
/// @implNote Application-scoped singleton. Thread-safe after initialization.
///
/// @see ReloopEnvironment
/// @see ServerConfiguration
@ApplicationScoped
public class ReloopEnvironmentProducer {

    private static final Logger LOG = Logger.getLogger(ReloopEnvironmentProducer.class);

    @Inject Config config;

    @Inject Instance<CustomValidator> customValidators;

    @Inject Instance<StopHook> stopHooks;

    @Inject Instance<IterationListener> iterationListeners;

    @Inject Instance<TaskTextSource> taskTextSourceInstance;

    @Inject Instance<DataSource> dataSourceInstance;

    @Inject ObjectMapper objectMapper;

    /// Produces the Reloop runtime environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    @Produces
    @ApplicationScoped
    public ReloopEnvironment reloopEnvironment() {
        ReloopConfig reloopConfig = readConfig();
        Clock clock = Clock.systemUTC();

        ReloopFactory.Builder factoryBuilder =
                ReloopFactory.builder()
                        .config(reloopConfig)
                        .clock(clock)
                        .coverageParser(
                                CoverageFormat.JSON, new JacksonCoverageSummaryParser(objectMapper))
                        .customValidators(customValidators.stream().toList());

        stopHooks.stream().forEach(factoryBuilder::stopHook);
        iterationListeners.forEach(factoryBuilder::listener);

        if (taskTextSourceInstance.isResolvable()) {
            factoryBuilder.taskTextSource(taskTextSourceInstance.get());
            LOG.info("Using CDI-provided TaskTextSource");
        }

        boolean dsActive =
                config.getOptionalValue("quarkus.datasource.active", Boolean.class).orElse(true);

        if (dsActive && dataSourceInstance.isResolvable()) {
            factoryBuilder.checkpointStore(
                    new JdbcCheckpointStore(
                            dataSourceInstance.get(),
                            objectMapper,
                            clock,
                            reloopConfig.getCheckpointTtl()));
            LOG.info("Using JDBC checkpoint store (PostgreSQL)");
        } else {
            LOG.info("Using in-memory checkpoint store");
        }

        ReloopEnvironment environment = factoryBuilder.build();

        LOG.infov(
                "Configured ReloopEnvironment: {0} custom validator(s), stop hooks {1},"
                        + " command timeout {2}",
                environment.getCustomValidatorRegistry().ids().size(),
                environment.getStopHookRegistry().ids(),
                reloopConfig.getDefaultCommandTimeout());
        return environment;
    }

    /// Reads `reloop.*` properties into a core config.
    ReloopConfig readConfig() {
        ReloopConfig.Builder builder =
                ReloopConfig.builder()
                        .defaultCommandTimeout(
                                config.getOptionalValue(
                                                "reloop.command.default-timeout", Duration.class)
                                        .orElse(ReloopConfig.DEFAULT_COMMAND_TIMEOUT));

        config.getOptionalValue("reloop.checkpoint.ttl", Duration.class)
                .ifPresent(builder::checkpointTtl);
        config.getOptionalValue("reloop.working-directory", String.class)
                .map(Path::of)
                .ifPresent(builder::workingDirectory);

        return builder.build();
    }
}
