package io.reloop.core.validation.rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Delegates to a caller-registered {@link io.reloop.core.validation.evaluator.CustomValidator}.
///
/// @param name rule name, unique within a configuration, not null
/// @param description optional description, may be null
/// @param enabled whether the rule is evaluated
/// @param validatorId id the validator was registered under, not null
/// @param config opaque configuration handed to the validator, never null
public record CustomRule(
        String name,
        String description,
        boolean enabled,
        String validatorId,
        Map<String, Object> config)
        implements ValidationRule {

    public CustomRule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(validatorId, "validatorId must not be null");
        config =
                config != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(config))
                        : Map.of();
    }

    @Override
    public RuleType type() {
        return RuleType.CUSTOM;
    }

    /// Creates an enabled custom rule.
    ///
    /// @param name rule name, not null
    /// @param validatorId registered validator id, not null
    /// @param config validator configuration, may be null
    /// @return the rule, never null
    public static CustomRule of(String name, String validatorId, Map<String, Object> config) {
        return new CustomRule(name, null, true, validatorId, config);
    }
}
