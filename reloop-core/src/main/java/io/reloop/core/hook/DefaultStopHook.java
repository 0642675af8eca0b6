package io.reloop.core.hook;

/// Promise tags first, then validation results.
///
/// Equivalent to {@link PromiseStopHook} followed by {@link ValidationStopHook},
/// except that a pass with no rules and no tag continues with "Iteration in
/// progress".
public final class DefaultStopHook implements StopHook {

    public static final String ID = "default";

    @Override
    public String getHookId() {
        return ID;
    }

    @Override
    public StopHookDecision evaluate(StopHookContext context) {
        return PromiseStopHook.judge(context)
                .orElseGet(
                        () ->
                                context.report().totalRules() > 0
                                        ? ValidationStopHook.judge(context.report())
                                        : StopHookDecision.keepGoing("Iteration in progress", null));
    }
}
