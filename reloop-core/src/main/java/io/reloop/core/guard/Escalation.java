package io.reloop.core.guard;

import java.util.List;
import java.util.Objects;

/// A safety guard's decision to halt the iteration loop.
///
/// @param guard name of the guard that fired, e.g. `circuit_breaker`, not null
/// @param reason short human-readable reason, not null
/// @param evidence facts supporting the decision, never null
public record Escalation(String guard, String reason, List<String> evidence) {

    public Escalation {
        Objects.requireNonNull(guard, "guard must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }

    /// Renders the escalation for a closing summary.
    ///
    /// @return `[guard] reason` followed by the evidence, never null
    public String describe() {
        StringBuilder sb = new StringBuilder("[").append(guard).append("] ").append(reason);
        if (!evidence.isEmpty()) {
            sb.append(" (evidence: ").append(String.join("; ", evidence)).append(')');
        }
        return sb.toString();
    }
}
