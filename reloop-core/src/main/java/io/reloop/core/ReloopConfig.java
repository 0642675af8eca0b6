package io.reloop.core;

import java.nio.file.Path;
import java.time.Duration;

/// Configuration options for the Reloop validation environment.
///
/// ### Default Values
/// - `defaultCommandTimeout`: 60 seconds, applied to command rules without a timeout
/// - `checkpointTtl`: none, checkpoints never expire
/// - `workingDirectory`: the process working directory
///
/// @implNote **Not thread-safe**. Configure before passing to {@link ReloopFactory}
/// and do not modify after environment creation.
///
/// @see ReloopFactory#createEnvironment(ReloopConfig)
/// @see Builder
public class ReloopConfig {

    public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(60);

    private Duration defaultCommandTimeout = DEFAULT_COMMAND_TIMEOUT;
    private Duration checkpointTtl;
    private Path workingDirectory = Path.of("").toAbsolutePath();

    /// Creates a configuration with default values.
    public ReloopConfig() {}

    /// Returns the timeout for command rules that do not set their own.
    ///
    /// @return the timeout, never null
    public Duration getDefaultCommandTimeout() {
        return defaultCommandTimeout;
    }

    public void setDefaultCommandTimeout(Duration defaultCommandTimeout) {
        this.defaultCommandTimeout = defaultCommandTimeout;
    }

    /// Returns how long a checkpoint stays resumable after it is written.
    ///
    /// @return the lifetime, or null if checkpoints never expire
    public Duration getCheckpointTtl() {
        return checkpointTtl;
    }

    public void setCheckpointTtl(Duration checkpointTtl) {
        this.checkpointTtl = checkpointTtl;
    }

    /// Returns the directory that rule paths and commands are resolved against.
    ///
    /// A session's own working directory, when set, is resolved relative to this one.
    ///
    /// @return the base directory, never null
    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    public void setWorkingDirectory(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ReloopConfig}.
    public static class Builder {
        private final ReloopConfig config = new ReloopConfig();

        /// @param timeout timeout for command rules without their own, not null
        /// @return this builder for chaining, never null
        public Builder defaultCommandTimeout(Duration timeout) {
            config.defaultCommandTimeout = timeout;
            return this;
        }

        /// @param ttl checkpoint lifetime, or null for no expiry
        /// @return this builder for chaining, never null
        public Builder checkpointTtl(Duration ttl) {
            config.checkpointTtl = ttl;
            return this;
        }

        /// @param workingDirectory base directory for rule evaluation, not null
        /// @return this builder for chaining, never null
        public Builder workingDirectory(Path workingDirectory) {
            config.workingDirectory = workingDirectory;
            return this;
        }

        public ReloopConfig build() {
            return config;
        }
    }
}
