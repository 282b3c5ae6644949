package io.httpr.client;

/**
 * Outcome of a post-response hook.
 */
public enum HookDecision {
    /** Keep evaluating the remaining hooks. */
    CONTINUE,
    /** Skip the remaining hooks and mark the result as asking its sequence to stop. */
    STOP
}
