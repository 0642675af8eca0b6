package io.reloop.core.validation.rule;

import java.util.Arrays;

/// Coverage metric checked by a {@link CoverageRule}.
public enum CoverageScope {
    LINES("lines"),
    BRANCHES("branches"),
    FUNCTIONS("functions"),
    STATEMENTS("statements");

    private final String wireName;

    CoverageScope(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static CoverageScope fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(scope -> scope.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(
                        () -> new IllegalArgumentException("Unknown coverage scope: " + wireName));
    }
}
