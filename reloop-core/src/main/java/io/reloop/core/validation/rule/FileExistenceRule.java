package io.reloop.core.validation.rule;

import java.util.List;
import java.util.Objects;

/// Checks that files exist relative to the working directory.
///
/// @param name rule name, unique within a configuration, not null
/// @param description optional description, may be null
/// @param enabled whether the rule is evaluated
/// @param paths relative paths to check, never null
/// @param allMustExist `true` if every path must exist, `false` if any one suffices
public record FileExistenceRule(
        String name, String description, boolean enabled, List<String> paths, boolean allMustExist)
        implements ValidationRule {

    public FileExistenceRule {
        Objects.requireNonNull(name, "name must not be null");
        paths = paths != null ? List.copyOf(paths) : List.of();
    }

    @Override
    public RuleType type() {
        return RuleType.FILE_EXISTENCE;
    }

    /// Creates an enabled rule requiring every path to exist.
    ///
    /// @param name rule name, not null
    /// @param paths relative paths, not null
    /// @return the rule, never null
    public static FileExistenceRule allOf(String name, List<String> paths) {
        return new FileExistenceRule(name, null, true, paths, true);
    }

    /// Creates an enabled rule requiring at least one path to exist.
    ///
    /// @param name rule name, not null
    /// @param paths relative paths, not null
    /// @return the rule, never null
    public static FileExistenceRule anyOf(String name, List<String> paths) {
        return new FileExistenceRule(name, null, true, paths, false);
    }
}
