package io.reloop.core.validation.rule;

import java.util.Objects;

/// Checks a coverage report against a minimum percentage.
///
/// @param name rule name, unique within a configuration, not null
/// @param description optional description, may be null
/// @param enabled whether the rule is evaluated
/// @param reportPath report location relative to the working directory, not null
/// @param reportFormat report format, not null
/// @param minCoverage required percentage in `[0, 100]`
/// @param scope metric to compare, defaults to {@link CoverageScope#LINES}
public record CoverageRule(
        String name,
        String description,
        boolean enabled,
        String reportPath,
        CoverageFormat reportFormat,
        double minCoverage,
        CoverageScope scope)
        implements ValidationRule {

    public CoverageRule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(reportPath, "reportPath must not be null");
        Objects.requireNonNull(reportFormat, "reportFormat must not be null");
        scope = scope != null ? scope : CoverageScope.LINES;
    }

    @Override
    public RuleType type() {
        return RuleType.COVERAGE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String description;
        private boolean enabled = true;
        private String reportPath;
        private CoverageFormat reportFormat = CoverageFormat.LCOV;
        private double minCoverage;
        private CoverageScope scope = CoverageScope.LINES;

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

        public Builder reportPath(String reportPath) {
            this.reportPath = reportPath;
            return this;
        }

        public Builder reportFormat(CoverageFormat reportFormat) {
            this.reportFormat = reportFormat;
            return this;
        }

        public Builder minCoverage(double minCoverage) {
            this.minCoverage = minCoverage;
            return this;
        }

        public Builder scope(CoverageScope scope) {
            this.scope = scope;
            return this;
        }

        public CoverageRule build() {
            return new CoverageRule(
                    name, description, enabled, reportPath, reportFormat, minCoverage, scope);
        }
    }
}
