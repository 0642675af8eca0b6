package io.reloop.core.validation.rule;

import java.util.Arrays;

/// Text field searched by a {@link ContentPatternRule}.
public enum ContentTarget {
    /// The caller's latest free-text output.
    AGENT_OUTPUT("agent_output"),
    /// The caller's task notes.
    TASK_NOTES("task_notes"),
    /// The latest work product stored for the task.
    WORK_PRODUCT_LATEST("work_product_latest");

    private final String wireName;

    ContentTarget(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ContentTarget fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(target -> target.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(
                        () -> new IllegalArgumentException("Unknown content target: " + wireName));
    }
}
