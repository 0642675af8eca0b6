package io.reloop.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.reloop.core.ReloopEnvironment;
import io.reloop.core.checkpoint.CheckpointStore;
import io.reloop.core.iteration.IterationController;
import io.reloop.core.validation.ValidationEngine;
import io.reloop.core.validation.evaluator.CustomValidatorRegistry;
import io.reloop.serialization.CheckpointSerializer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/// CDI configuration for server-specific beans.
///
/// The core components are built by {@link ReloopEnvironmentProducer} through
/// {@link io.reloop.core.ReloopFactory}. This class produces:
/// - the shared `ObjectMapper`, which Quarkus REST also uses for request and
///   response bodies, so validation rules bind through the Reloop Jackson module
/// - delegating producers that expose environment components for direct injection
@ApplicationScoped
public class ServerConfiguration {

    // ========== Utility Beans ==========

    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return CheckpointSerializer.createMapper();
    }

    // ========== ReloopEnvironment Component Delegates ==========

    /// Produces the iteration controller driving the REST API.
    ///
    /// @param env the initialized environment, not null
    /// @return the controller, never null
    @Produces
    @Singleton
    public IterationController iterationController(ReloopEnvironment env) {
        return env.getIterationController();
    }

    /// Produces the checkpoint store, JDBC-backed when a datasource is active.
    ///
    /// @param env the initialized environment, not null
    /// @return the checkpoint store, never null
    @Produces
    @Singleton
    public CheckpointStore checkpointStore(ReloopEnvironment env) {
        return env.getCheckpointStore();
    }

    @Produces
    @Singleton
    public ValidationEngine validationEngine(ReloopEnvironment env) {
        return env.getValidationEngine();
    }

    @Produces
    @Singleton
    public CustomValidatorRegistry customValidatorRegistry(ReloopEnvironment env) {
        return env.getCustomValidatorRegistry();
    }
}
