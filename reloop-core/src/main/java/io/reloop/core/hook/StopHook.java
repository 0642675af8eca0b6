package io.reloop.core.hook;

/// Extension point deciding whether the loop should stop after a validation pass.
///
/// Hooks are looked up by {@link #getHookId()} in the {@link StopHookRegistry} and
/// run in the order a session's config lists them. Guards always run first; hooks
/// only see passes no guard escalated.
///
/// Implementations should be stateless. A hook that throws is treated as an
/// escalation.
///
/// @see StopHookRegistry#evaluate
public interface StopHook {

    /// Returns the id sessions reference this hook by.
    ///
    /// @return the hook id, not null
    String getHookId();

    /// Decides what the loop should do.
    ///
    /// @param context validation pass inputs, not null
    /// @return the decision, not null
    StopHookDecision evaluate(StopHookContext context);
}
