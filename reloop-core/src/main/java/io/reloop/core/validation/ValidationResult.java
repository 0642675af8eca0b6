package io.reloop.core.validation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Immutable result of evaluating one validation rule.
///
/// A result with a non-null {@link #getError()} means the evaluator itself could not
/// run (timeout, spawn failure, unreadable report, invalid regex). Such results are
/// never counted as passed, regardless of {@link #isPassed()}.
public final class ValidationResult {

    private final String ruleName;
    private final boolean passed;
    private final String message;
    private final long durationMs;
    private final Instant timestamp;
    private final String error;
    private final Map<String, Object> details;

    private ValidationResult(Builder builder) {
        this.ruleName = Objects.requireNonNull(builder.ruleName, "ruleName must not be null");
        this.passed = builder.passed;
        this.message = builder.message != null ? builder.message : "";
        this.durationMs = builder.durationMs;
        this.timestamp = builder.timestamp;
        this.error = builder.error;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
    }

    public String getRuleName() {
        return ruleName;
    }

    public boolean isPassed() {
        return passed;
    }

    public String getMessage() {
        return message;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /// Returns the evaluator-level failure, distinct from a failed check.
    ///
    /// @return the error message, or null if the evaluator ran
    public String getError() {
        return error;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public boolean hasError() {
        return error != null;
    }

    /// Returns whether this result counts toward the passed total.
    ///
    /// @return `true` only for a passed check without an evaluator error
    public boolean countsAsPassed() {
        return passed && error == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationResult that)) return false;
        return passed == that.passed
                && durationMs == that.durationMs
                && ruleName.equals(that.ruleName)
                && message.equals(that.message)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(error, that.error)
                && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleName, passed, message, durationMs, timestamp, error, details);
    }

    @Override
    public String toString() {
        return "ValidationResult{ruleName='"
                + ruleName
                + "', passed="
                + passed
                + ", error="
                + error
                + ", message='"
                + message
                + "'}";
    }

    public static final class Builder {
        private String ruleName;
        private boolean passed;
        private String message;
        private long durationMs;
        private Instant timestamp = Instant.now();
        private String error;
        private Map<String, Object> details = Map.of();

        private Builder() {}

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder passed(boolean passed) {
            this.passed = passed;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details != null ? details : Map.of();
            return this;
        }

        public ValidationResult build() {
            return new ValidationResult(this);
        }
    }
}
