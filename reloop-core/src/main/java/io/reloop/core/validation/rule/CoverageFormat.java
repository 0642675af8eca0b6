package io.reloop.core.validation.rule;

import java.util.Arrays;

/// Coverage report formats understood by the coverage evaluator.
public enum CoverageFormat {
    LCOV("lcov"),
    /// Istanbul `coverage-summary.json`.
    JSON("json"),
    COBERTURA("cobertura");

    private final String wireName;

    CoverageFormat(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static CoverageFormat fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(format -> format.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(
                        () -> new IllegalArgumentException("Unknown coverage format: " + wireName));
    }
}
