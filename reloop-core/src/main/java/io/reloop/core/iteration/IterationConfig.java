package io.reloop.core.iteration;

import io.reloop.core.validation.rule.ValidationRule;
import java.util.List;
import java.util.Objects;

/// Immutable configuration of one iteration session.
///
/// Stored once per checkpoint chain and copied into every checkpoint of it. A
/// session's config is never edited; a different ceiling or rule set means
/// starting a new chain.
///
/// ### Default Values
/// | Field                     | Default |
/// |---------------------------|---------|
/// | `circuitBreakerThreshold` | `3`     |
/// | `regressionWindow`        | `3`     |
/// | `regressionDropThreshold` | `10.0`  |
/// | `thrashingThreshold`      | `5`     |
///
/// Limits are checked by {@link IterationConfigValidator} when a session starts,
/// not by the builder, so invalid configs can still be built, serialized and
/// reported on.
///
/// @see IterationController#start
public final class IterationConfig {

    public static final int DEFAULT_CIRCUIT_BREAKER_THRESHOLD = 3;
    public static final int DEFAULT_REGRESSION_WINDOW = 3;
    public static final double DEFAULT_REGRESSION_DROP_THRESHOLD = 10.0;
    public static final int DEFAULT_THRASHING_THRESHOLD = 5;

    private final int maxIterations;
    private final int circuitBreakerThreshold;
    private final List<String> completionPatterns;
    private final List<String> blockedPatterns;
    private final List<ValidationRule> validationRules;
    private final int regressionWindow;
    private final double regressionDropThreshold;
    private final int thrashingThreshold;
    private final String workingDirectory;
    private final List<String> stopHooks;

    private IterationConfig(Builder builder) {
        this.maxIterations = builder.maxIterations;
        this.circuitBreakerThreshold = builder.circuitBreakerThreshold;
        this.completionPatterns = List.copyOf(builder.completionPatterns);
        this.blockedPatterns = List.copyOf(builder.blockedPatterns);
        this.validationRules = List.copyOf(builder.validationRules);
        this.regressionWindow = builder.regressionWindow;
        this.regressionDropThreshold = builder.regressionDropThreshold;
        this.thrashingThreshold = builder.thrashingThreshold;
        this.workingDirectory = builder.workingDirectory;
        this.stopHooks = List.copyOf(builder.stopHooks);
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public int getCircuitBreakerThreshold() {
        return circuitBreakerThreshold;
    }

    public List<String> getCompletionPatterns() {
        return completionPatterns;
    }

    public List<String> getBlockedPatterns() {
        return blockedPatterns;
    }

    public List<ValidationRule> getValidationRules() {
        return validationRules;
    }

    public int getRegressionWindow() {
        return regressionWindow;
    }

    public double getRegressionDropThreshold() {
        return regressionDropThreshold;
    }

    public int getThrashingThreshold() {
        return thrashingThreshold;
    }

    /// Returns the session working directory.
    ///
    /// @return the directory, or null to use the engine default
    public String getWorkingDirectory() {
        return workingDirectory;
    }

    /// Returns the ids of the stop hooks run after every validation, in order.
    ///
    /// @return hook ids, empty when the session uses the completion detector alone
    public List<String> getStopHooks() {
        return stopHooks;
    }

    /// Returns a builder prefilled with this config's values.
    ///
    /// @return a new builder, never null
    public Builder toBuilder() {
        return builder()
                .maxIterations(maxIterations)
                .circuitBreakerThreshold(circuitBreakerThreshold)
                .completionPatterns(completionPatterns)
                .blockedPatterns(blockedPatterns)
                .validationRules(validationRules)
                .regressionWindow(regressionWindow)
                .regressionDropThreshold(regressionDropThreshold)
                .thrashingThreshold(thrashingThreshold)
                .workingDirectory(workingDirectory)
                .stopHooks(stopHooks);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IterationConfig that)) return false;
        return maxIterations == that.maxIterations
                && circuitBreakerThreshold == that.circuitBreakerThreshold
                && regressionWindow == that.regressionWindow
                && Double.compare(regressionDropThreshold, that.regressionDropThreshold) == 0
                && thrashingThreshold == that.thrashingThreshold
                && completionPatterns.equals(that.completionPatterns)
                && blockedPatterns.equals(that.blockedPatterns)
                && validationRules.equals(that.validationRules)
                && Objects.equals(workingDirectory, that.workingDirectory)
                && stopHooks.equals(that.stopHooks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                maxIterations,
                circuitBreakerThreshold,
                completionPatterns,
                blockedPatterns,
                validationRules,
                regressionWindow,
                regressionDropThreshold,
                thrashingThreshold,
                workingDirectory,
                stopHooks);
    }

    @Override
    public String toString() {
        return "IterationConfig{maxIterations="
                + maxIterations
                + ", circuitBreakerThreshold="
                + circuitBreakerThreshold
                + ", rules="
                + validationRules.size()
                + "}";
    }

    public static final class Builder {
        private int maxIterations;
        private int circuitBreakerThreshold = DEFAULT_CIRCUIT_BREAKER_THRESHOLD;
        private List<String> completionPatterns = List.of();
        private List<String> blockedPatterns = List.of();
        private List<ValidationRule> validationRules = List.of();
        private int regressionWindow = DEFAULT_REGRESSION_WINDOW;
        private double regressionDropThreshold = DEFAULT_REGRESSION_DROP_THRESHOLD;
        private int thrashingThreshold = DEFAULT_THRASHING_THRESHOLD;
        private String workingDirectory;
        private List<String> stopHooks = List.of();

        private Builder() {}

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder circuitBreakerThreshold(int circuitBreakerThreshold) {
            this.circuitBreakerThreshold = circuitBreakerThreshold;
            return this;
        }

        public Builder completionPatterns(List<String> completionPatterns) {
            this.completionPatterns = completionPatterns != null ? completionPatterns : List.of();
            return this;
        }

        public Builder blockedPatterns(List<String> blockedPatterns) {
            this.blockedPatterns = blockedPatterns != null ? blockedPatterns : List.of();
            return this;
        }

        public Builder validationRules(List<ValidationRule> validationRules) {
            this.validationRules = validationRules != null ? validationRules : List.of();
            return this;
        }

        public Builder regressionWindow(int regressionWindow) {
            this.regressionWindow = regressionWindow;
            return this;
        }

        public Builder regressionDropThreshold(double regressionDropThreshold) {
            this.regressionDropThreshold = regressionDropThreshold;
            return this;
        }

        public Builder thrashingThreshold(int thrashingThreshold) {
            this.thrashingThreshold = thrashingThreshold;
            return this;
        }

        public Builder workingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder stopHooks(List<String> stopHooks) {
            this.stopHooks = stopHooks != null ? stopHooks : List.of();
            return this;
        }

        public IterationConfig build() {
            return new IterationConfig(this);
        }
    }
}
