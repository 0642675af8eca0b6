package io.reloop.core.hook;

/// What a {@link StopHook} asks the loop to do after a validation pass.
public enum StopAction {
    /// The task is done; the caller should complete the session.
    COMPLETE,

    /// Keep iterating, optionally with a follow-up prompt for the agent.
    CONTINUE,

    /// Stop and hand the task to a human.
    ESCALATE
}
