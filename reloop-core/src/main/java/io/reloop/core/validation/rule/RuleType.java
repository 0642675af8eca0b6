package io.reloop.core.validation.rule;

import java.util.Arrays;

/// Discriminator for {@link ValidationRule} implementations.
///
/// The wire name is used in the JSON representation of rules.
public enum RuleType {
    COMMAND("command"),
    CONTENT_PATTERN("content_pattern"),
    COVERAGE("coverage"),
    FILE_EXISTENCE("file_existence"),
    CUSTOM("custom");

    private final String wireName;

    RuleType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /// Resolves a rule type from its wire name.
    ///
    /// @param wireName the wire name, e.g. `content_pattern`, not null
    /// @return the matching type, never null
    /// @throws IllegalArgumentException if no type uses the given name
    public static RuleType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(
                        () -> new IllegalArgumentException("Unknown rule type: " + wireName));
    }
}
