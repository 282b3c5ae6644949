package io.httpr.client;

import io.httpr.http.spi.HttpClientRequest;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Callback invoked around the execution of a {@link Request}.
 *
 * <p>Hooks are registered on a {@link Service} (shared scope) or on a single
 * {@link Request}. Shared hooks always run before request hooks. Hooks run on the
 * executing thread and must not block on I/O.
 */
public interface RequestHook {

    /**
     * Called once per execution after materialization and before the first send attempt.
     * The wire request may be mutated in place; there is no way to cancel the send.
     *
     * @param request the wire request about to be sent
     */
    default void beforeSend(HttpClientRequest request) {
    }

    /**
     * Called once per execution after the last attempt, whether it succeeded or failed.
     *
     * @param result the outcome of the execution
     * @return {@link HookDecision#STOP} to skip the remaining hooks and ask a sequential
     *         group to stop, {@link HookDecision#CONTINUE} otherwise
     */
    default HookDecision afterResponse(ResultEnvelope result) {
        return HookDecision.CONTINUE;
    }

    static RequestHook beforeSend(Consumer<HttpClientRequest> action) {
        Objects.requireNonNull(action, "action");
        return new RequestHook() {
            @Override
            public void beforeSend(HttpClientRequest request) {
                action.accept(request);
            }
        };
    }

    static RequestHook afterResponse(Function<ResultEnvelope, HookDecision> action) {
        Objects.requireNonNull(action, "action");
        return new RequestHook() {
            @Override
            public HookDecision afterResponse(ResultEnvelope result) {
                return action.apply(result);
            }
        };
    }
}
