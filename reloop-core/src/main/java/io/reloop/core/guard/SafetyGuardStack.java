package io.reloop.core.guard;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Ordered list of {@link SafetyGuard}s evaluated after every validation.
///
/// Guards run in list order and evaluation stops at the first escalation. The
/// default order is:
/// 1. {@link IterationCeilingGuard}
/// 2. {@link CircuitBreakerGuard}
/// 3. {@link QualityRegressionGuard}
/// 4. {@link ThrashingGuard}
///
/// Adding a guard means adding it to the list; guards never call each other.
///
/// @implNote Thread-safe. Holds an immutable list of stateless guards.
public final class SafetyGuardStack {

    private static final Logger logger = Logger.getLogger(SafetyGuardStack.class.getName());

    private final List<SafetyGuard> guards;

    public SafetyGuardStack(List<SafetyGuard> guards) {
        this.guards = List.copyOf(Objects.requireNonNull(guards, "guards must not be null"));
    }

    /// Creates the stack with the default guards in their fixed order.
    ///
    /// @return the default stack, never null
    public static SafetyGuardStack defaults() {
        return new SafetyGuardStack(
                List.of(
                        new IterationCeilingGuard(),
                        new CircuitBreakerGuard(),
                        new QualityRegressionGuard(),
                        new ThrashingGuard()));
    }

    /// Runs the guards until one escalates.
    ///
    /// @param context guard inputs, not null
    /// @return the first escalation, or empty if every guard passed
    public Optional<Escalation> evaluate(GuardContext context) {
        Objects.requireNonNull(context, "context must not be null");
        for (SafetyGuard guard : guards) {
            Optional<Escalation> escalation = guard.check(context);
            if (escalation.isPresent()) {
                logger.info(
                        "Guard escalated task "
                                + context.report().taskId()
                                + ": "
                                + escalation.get().describe());
                return escalation;
            }
        }
        return Optional.empty();
    }

    public List<SafetyGuard> getGuards() {
        return guards;
    }
}
