package io.reloop.core.hook;

import java.util.Objects;

/// A single hook's answer.
///
/// @param action what the loop should do, not null
/// @param reason why, not null
/// @param nextPrompt instruction for the agent's next iteration, may be null
public record StopHookDecision(StopAction action, String reason, String nextPrompt) {

    public StopHookDecision {
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    public static StopHookDecision complete(String reason) {
        return new StopHookDecision(StopAction.COMPLETE, reason, null);
    }

    public static StopHookDecision escalate(String reason) {
        return new StopHookDecision(StopAction.ESCALATE, reason, null);
    }

    public static StopHookDecision keepGoing(String reason, String nextPrompt) {
        return new StopHookDecision(StopAction.CONTINUE, reason, nextPrompt);
    }
}
