package io.httpr.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings shared by every request created from a {@link Service}.
 *
 * @param timeout per-request timeout applied to the wire request, never null
 * @param debug when true the executor logs a full request/response dump after each execution
 */
public record ServiceConfig(Duration timeout, boolean debug) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(20);

    public ServiceConfig {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
    }

    public static ServiceConfig defaults() {
        return new ServiceConfig(DEFAULT_TIMEOUT, false);
    }

    public ServiceConfig withTimeout(Duration timeout) {
        return new ServiceConfig(timeout, debug);
    }

    public ServiceConfig withDebug(boolean debug) {
        return new ServiceConfig(timeout, debug);
    }
}
