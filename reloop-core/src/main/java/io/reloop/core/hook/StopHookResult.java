package io.reloop.core.hook;

import java.util.Objects;

/// The decision that ended a hook chain, tagged with the hook that made it.
///
/// @param hookId id of the deciding hook, not null
/// @param action the decided action, not null
/// @param reason the hook's reason, not null
/// @param nextPrompt follow-up prompt for the agent, may be null
public record StopHookResult(String hookId, StopAction action, String reason, String nextPrompt) {

    public StopHookResult {
        Objects.requireNonNull(hookId, "hookId must not be null");
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    static StopHookResult of(String hookId, StopHookDecision decision) {
        return new StopHookResult(
                hookId, decision.action(), decision.reason(), decision.nextPrompt());
    }
}
