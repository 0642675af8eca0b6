package io.reloop.core.guard;

import java.util.Optional;

/// A check that can force the loop to escalate.
///
/// Guards are pure functions of their context. They never touch stored state;
/// the iteration controller persists whatever they decide.
///
/// @see SafetyGuardStack for evaluation order
@FunctionalInterface
public interface SafetyGuard {

    /// Decides whether the loop must stop.
    ///
    /// @param context config, history and latest report, not null
    /// @return an escalation, or empty to let the loop continue
    Optional<Escalation> check(GuardContext context);
}
