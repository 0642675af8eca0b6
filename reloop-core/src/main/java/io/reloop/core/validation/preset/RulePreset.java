package io.reloop.core.validation.preset;

import io.reloop.core.validation.rule.ValidationRule;
import java.util.List;
import java.util.Objects;

/// Named set of rules an agent role starts its sessions with.
///
/// @param agentId the agent role, e.g. `qa`, not null
/// @param rules the role's rules, never null
public record RulePreset(String agentId, List<ValidationRule> rules) {

    public RulePreset {
        Objects.requireNonNull(agentId, "agentId must not be null");
        rules = rules != null ? List.copyOf(rules) : List.of();
    }
}
