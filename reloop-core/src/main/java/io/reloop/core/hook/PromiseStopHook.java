package io.reloop.core.hook;

import java.util.Optional;

/// Acts on the agent's explicit promise tags.
///
/// COMPLETE completes; ESCALATE and BLOCKED escalate. Without a tag the loop
/// continues.
public final class PromiseStopHook implements StopHook {

    public static final String ID = "promise";

    @Override
    public String getHookId() {
        return ID;
    }

    @Override
    public StopHookDecision evaluate(StopHookContext context) {
        return judge(context)
                .orElseGet(() -> StopHookDecision.keepGoing("No completion promise detected", null));
    }

    static Optional<StopHookDecision> judge(StopHookContext context) {
        if (context.promised(PromiseTag.COMPLETE)) {
            return Optional.of(
                    StopHookDecision.complete(
                            "Agent signaled completion via " + PromiseTag.COMPLETE.tag()));
        }
        if (context.promised(PromiseTag.ESCALATE)) {
            return Optional.of(
                    StopHookDecision.escalate(
                            "Agent signaled escalation via " + PromiseTag.ESCALATE.tag()));
        }
        if (context.promised(PromiseTag.BLOCKED)) {
            return Optional.of(
                    StopHookDecision.escalate(
                            "Agent signaled blocked state via " + PromiseTag.BLOCKED.tag()));
        }
        return Optional.empty();
    }
}
