package io.reloop.core.validation.rule;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/// Runs a shell command in the working directory and checks its exit code.
///
/// The command passes iff the process exits with {@link #expectedExitCode()} before
/// its timeout elapses. A timed-out or unspawnable command is reported as an
/// evaluator error, never as a silent pass or fail.
///
/// @param name rule name, unique within a configuration, not null
/// @param description optional description, may be null
/// @param enabled whether the rule is evaluated
/// @param command shell command text passed to `/bin/sh -c`, not null
/// @param expectedExitCode exit code that counts as success
/// @param timeout hard timeout, or null to use the engine default
/// @param workingDirectory directory relative to the session working directory, may be null
/// @param env environment overrides for the spawned process, never null
public record CommandRule(
        String name,
        String description,
        boolean enabled,
        String command,
        int expectedExitCode,
        Duration timeout,
        String workingDirectory,
        Map<String, String> env)
        implements ValidationRule {

    public CommandRule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(command, "command must not be null");
        env = env != null ? Map.copyOf(env) : Map.of();
    }

    @Override
    public RuleType type() {
        return RuleType.COMMAND;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String description;
        private boolean enabled = true;
        private String command;
        private int expectedExitCode = 0;
        private Duration timeout;
        private String workingDirectory;
        private Map<String, String> env = Map.of();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder expectedExitCode(int expectedExitCode) {
            this.expectedExitCode = expectedExitCode;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder workingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public CommandRule build() {
            return new CommandRule(
                    name,
                    description,
                    enabled,
                    command,
                    expectedExitCode,
                    timeout,
                    workingDirectory,
                    env);
        }
    }
}
