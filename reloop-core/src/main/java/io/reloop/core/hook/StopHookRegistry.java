package io.reloop.core.hook;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Registry of {@link StopHook}s by id, and the evaluator of a session's hook chain.
///
/// The built-in hooks `validation`, `promise` and `default` are always present;
/// registering a hook with one of their ids replaces it.
///
/// ### Chain Evaluation
/// Hooks run in the order the session lists them:
/// - the first COMPLETE or ESCALATE ends the chain and is returned
/// - a CONTINUE moves on to the next hook; the last hook's CONTINUE is returned
/// - a hook that throws ends the chain with ESCALATE
///
/// @implNote Thread-safe. Backed by a ConcurrentHashMap.
public final class StopHookRegistry {

    private static final Logger logger = Logger.getLogger(StopHookRegistry.class.getName());

    private final Map<String, StopHook> hooks = new ConcurrentHashMap<>();

    /// Creates a registry holding only the built-in hooks.
    public StopHookRegistry() {
        this(List.of());
    }

    /// Creates a registry with the built-in hooks plus `extra`.
    ///
    /// @param extra additional hooks, not null
    public StopHookRegistry(List<StopHook> extra) {
        Objects.requireNonNull(extra, "extra must not be null");
        register(new ValidationStopHook());
        register(new PromiseStopHook());
        register(new DefaultStopHook());
        extra.forEach(this::register);
    }

    /// Registers a hook, replacing any previous one with the same id.
    ///
    /// @param hook the hook, not null
    public void register(StopHook hook) {
        Objects.requireNonNull(hook, "hook must not be null");
        String id = Objects.requireNonNull(hook.getHookId(), "hookId");
        StopHook previous = hooks.put(id, hook);
        if (previous != null && previous != hook) {
            logger.info("Replaced stop hook: " + id);
        }
    }

    public boolean contains(String hookId) {
        Objects.requireNonNull(hookId, "hookId must not be null");
        return hooks.containsKey(hookId);
    }

    public Set<String> ids() {
        return Set.copyOf(hooks.keySet());
    }

    /// Runs the listed hooks against one validation pass.
    ///
    /// @param hookIds hook ids in evaluation order, not null; every id must be registered
    /// @param context pass inputs, not null
    /// @return the deciding result, or empty when `hookIds` is empty
    /// @throws IllegalArgumentException if an id is not registered
    public Optional<StopHookResult> evaluate(List<String> hookIds, StopHookContext context) {
        Objects.requireNonNull(hookIds, "hookIds must not be null");
        Objects.requireNonNull(context, "context must not be null");

        StopHookResult last = null;
        for (String hookId : hookIds) {
            StopHook hook = hooks.get(hookId);
            if (hook == null) {
                throw new IllegalArgumentException("Unknown stop hook: " + hookId);
            }

            StopHookDecision decision;
            try {
                decision = Objects.requireNonNull(hook.evaluate(context), "decision");
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Stop hook " + hookId + " failed for task " + context.taskId(),
                        e);
                return Optional.of(
                        new StopHookResult(
                                hookId,
                                StopAction.ESCALATE,
                                "Hook evaluation failed: " + e.getMessage(),
                                null));
            }

            last = StopHookResult.of(hookId, decision);
            if (decision.action() != StopAction.CONTINUE) {
                logger.fine(
                        "Stop hook "
                                + hookId
                                + " decided "
                                + decision.action()
                                + " for task "
                                + context.taskId());
                return Optional.of(last);
            }
        }
        return Optional.ofNullable(last);
    }
}
