package io.httpr.client;

import io.httpr.http.spi.HttpClientAdapter;
import io.httpr.http.spi.HttpClientException;
import io.httpr.http.spi.HttpClientRequest;
import io.httpr.http.spi.HttpClientResponse;
import io.httpr.http.spi.JdkHttpClientAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Executes a single {@link Request}: materialization, pre-send hooks, the network call
 * with fixed-delay retries, and post-response hooks.
 *
 * <p>Request errors never escape {@link #execute(Request)}; they are returned inside the
 * {@link ResultEnvelope}. An executor holds no per-request state and may be shared by
 * any number of threads, as long as each {@link Request} is executed by one thread at a time.
 */
public final class RequestExecutor {

    private final HttpClientAdapter fallbackAdapter;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Logger log;

    /**
     * Creates an executor using the system clock and real sleeps.
     *
     * @param fallbackAdapter transport for requests that do not belong to a {@link Service};
     *                        service requests always use their service's adapter
     */
    public RequestExecutor(HttpClientAdapter fallbackAdapter) {
        this(fallbackAdapter, Clock.systemUTC(), Sleeper.system(), LoggerFactory.getLogger(RequestExecutor.class));
    }

    public RequestExecutor(HttpClientAdapter fallbackAdapter, Clock clock, Sleeper sleeper, Logger log) {
        this.fallbackAdapter = Objects.requireNonNull(fallbackAdapter, "fallbackAdapter");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * Process-wide executor used by {@link Request#execute()} for requests without a service.
     * Created on first use with a JDK HttpClient and never replaced.
     */
    public static RequestExecutor defaultExecutor() {
        return DefaultHolder.INSTANCE;
    }

    public ResultEnvelope execute(Request request) {
        Objects.requireNonNull(request, "request");

        HttpClientRequest wire;
        try {
            wire = request.wire();
        } catch (HttprException.Materialization e) {
            log.warn("Cannot build {}: {}", request, e.getMessage());
            return ResultEnvelope.failure(request, e);
        }

        List<RequestHook> hooks = hookChain(request);
        for (RequestHook hook : hooks) {
            hook.beforeSend(wire);
        }

        request.markStarted(clock.instant());
        ResultEnvelope result;
        try {
            HttpClientResponse response = sendWithRetries(adapterFor(request), request, wire);
            result = ResultEnvelope.success(request, new Response(request, response));
        } catch (HttpClientException e) {
            result = ResultEnvelope.failure(request, e);
        }
        request.markEnded(clock.instant());

        try {
            for (RequestHook hook : hooks) {
                if (hook.afterResponse(result) == HookDecision.STOP) {
                    result = result.withStopRequested();
                    break;
                }
            }
        } catch (RuntimeException e) {
            // the caller never sees this response, so nobody else can release its connection
            if (result.response() != null) {
                result.response().discard();
            }
            throw e;
        }

        if (request.service() != null && request.service().config().debug() && log.isDebugEnabled()) {
            log.debug("{}", ResponseDump.dumpString(result));
        }
        return result;
    }

    private HttpClientResponse sendWithRetries(HttpClientAdapter adapter, Request request, HttpClientRequest wire)
            throws HttpClientException {
        HttpClientException last;
        try {
            return adapter.send(wire);
        } catch (HttpClientException e) {
            last = e;
        }

        int attempts = 1;
        for (Duration delay : request.retryDelays()) {
            log.debug("{} failed on attempt {} ({}), retrying in {}", request, attempts, last.getMessage(), delay);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                last.addSuppressed(e);
                break;
            }
            attempts++;
            try {
                return adapter.send(wire);
            } catch (HttpClientException e) {
                last = e;
            }
        }

        log.warn("{} failed after {} attempt(s): {}", request, attempts, last.toString());
        throw last;
    }

    private HttpClientAdapter adapterFor(Request request) {
        return request.service() != null ? request.service().adapter() : fallbackAdapter;
    }

    private static List<RequestHook> hookChain(Request request) {
        List<RequestHook> shared = request.sharedHooks();
        List<RequestHook> own = request.hooks();
        List<RequestHook> chain = new ArrayList<>(shared.size() + own.size());
        chain.addAll(shared);
        chain.addAll(own);
        return chain;
    }

    private static final class DefaultHolder {
        static final RequestExecutor INSTANCE =
                new RequestExecutor(JdkHttpClientAdapter.create(ServiceConfig.DEFAULT_TIMEOUT));
    }
}
