package io.httpr.client;

import io.httpr.http.spi.HttpClientRequest;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Declarative description of one HTTP call.
 *
 * <p>A request is configured through chained mutation and then executed, either directly
 * or as part of a {@link Group}. The first execution materializes it into an
 * {@link HttpClientRequest}; that wire request is cached and reused by every later
 * execution, so configuration changes made afterwards have no effect.
 *
 * <p>Instances are not thread-safe. A request must not be executed by two threads at once.
 */
public final class Request {

    private static final String TOKEN_CHARS = "!#$%&'*+-.^_`|~";

    private final Service service;
    private final String method;
    private final String uri;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final Map<String, List<String>> params = new LinkedHashMap<>();
    private final List<RequestHook> hooks = new ArrayList<>();
    private List<Duration> retryDelays = List.of();
    private byte[] body;
    private Duration timeout;

    private HttpClientRequest wire;
    private Instant startedAt;
    private Instant endedAt;

    Request(Service service, String method, String uri, Map<String, List<String>> defaultHeaders) {
        this.service = service;
        this.method = method == null || method.isEmpty() ? "GET" : method;
        this.uri = Objects.requireNonNull(uri, "uri");
        defaultHeaders.forEach((name, values) -> headers.put(name, new ArrayList<>(values)));
    }

    /**
     * Creates a request that does not belong to any {@link Service}. It runs with
     * {@link ServiceConfig#defaults()} and no shared hooks.
     *
     * @param method the HTTP method; empty or null means GET
     * @param uri the absolute target URI
     */
    public static Request of(String method, String uri) {
        return new Request(null, method, uri, Map.of());
    }

    /**
     * Sets the delays to wait before each retry. A request that fails on the transport is
     * retried once per delay, in order, until an attempt succeeds. No delays means no retry.
     */
    public Request retryDelays(Duration... delays) {
        return retryDelays(Arrays.asList(delays));
    }

    public Request retryDelays(List<Duration> delays) {
        Objects.requireNonNull(delays, "delays");
        for (Duration d : delays) {
            if (d == null || d.isNegative()) {
                throw new IllegalArgumentException("retry delay must be non-negative: " + d);
            }
        }
        this.retryDelays = List.copyOf(delays);
        return this;
    }

    /**
     * Adds query parameters given as name/value pairs, e.g. {@code params("page", "2", "size", "50")}.
     *
     * @throws IllegalArgumentException if an odd number of arguments is given
     */
    public Request params(String... pairs) {
        Pairs.forEach(pairs, "params", (name, value) ->
                params.computeIfAbsent(name, k -> new ArrayList<>()).add(value));
        return this;
    }

    /**
     * Appends a header value, keeping values inherited from the service.
     */
    public Request header(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }

    /**
     * Replaces every value of a header, including values inherited from the service.
     */
    public Request rawHeader(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        List<String> values = new ArrayList<>(1);
        values.add(value);
        headers.put(name, values);
        return this;
    }

    public Request body(byte[] body, String contentType) {
        this.body = body;
        if (contentType != null) {
            rawHeader("Content-Type", contentType);
        }
        return this;
    }

    public Request timeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public Request hook(RequestHook... hooks) {
        for (RequestHook hook : hooks) {
            this.hooks.add(Objects.requireNonNull(hook, "hook"));
        }
        return this;
    }

    public Request beforeSend(Consumer<HttpClientRequest> action) {
        return hook(RequestHook.beforeSend(action));
    }

    public Request afterResponse(Function<ResultEnvelope, HookDecision> action) {
        return hook(RequestHook.afterResponse(action));
    }

    /**
     * Returns the wire request, materializing it on first call.
     *
     * @throws HttprException.Materialization if the method or URI is malformed
     */
    public HttpClientRequest wire() {
        if (wire != null) {
            return wire;
        }
        if (!isToken(method)) {
            throw new HttprException.Materialization("invalid method: " + method);
        }
        URI target;
        try {
            target = new URI(uri);
        } catch (URISyntaxException e) {
            throw new HttprException.Materialization("invalid uri: " + uri, e);
        }
        String scheme = target.getScheme() == null ? null : target.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new HttprException.Materialization("uri must be absolute http(s): " + uri);
        }
        if (target.getHost() == null) {
            throw new HttprException.Materialization("uri has no host: " + uri);
        }
        wire = HttpClientRequest.builder(Urls.withQuery(target, params), method)
                .headers(headers)
                .body(body)
                .timeout(effectiveTimeout())
                .build();
        return wire;
    }

    /**
     * Returns true once {@link #wire()} has succeeded.
     */
    public boolean isMaterialized() {
        return wire != null;
    }

    /**
     * Executes this request with its service's executor, or with
     * {@link RequestExecutor#defaultExecutor()} when it has no service.
     */
    public ResultEnvelope execute() {
        RequestExecutor executor = service != null ? service.executor() : RequestExecutor.defaultExecutor();
        return executor.execute(this);
    }

    public Service service() { return service; }
    public String method() { return method; }
    public String uri() { return uri; }
    public List<Duration> retryDelays() { return retryDelays; }

    public Map<String, List<String>> headers() {
        return Collections.unmodifiableMap(headers);
    }

    /**
     * Request-scope hooks only; shared hooks live on the {@link Service}.
     */
    public List<RequestHook> hooks() {
        return Collections.unmodifiableList(hooks);
    }

    /** Start of the most recent execution, or null if never executed. */
    public Instant startedAt() { return startedAt; }

    /** End of the most recent execution, or null if it has not finished. */
    public Instant endedAt() { return endedAt; }

    /**
     * Time between start and end of the most recent execution, or {@link Duration#ZERO}
     * if it has not completed.
     */
    public Duration elapsed() {
        if (startedAt == null || endedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, endedAt);
    }

    void markStarted(Instant at) {
        this.startedAt = at;
        this.endedAt = null;
    }

    void markEnded(Instant at) {
        this.endedAt = at;
    }

    List<RequestHook> sharedHooks() {
        return service == null ? List.of() : service.hooks();
    }

    private Duration effectiveTimeout() {
        if (timeout != null) {
            return timeout;
        }
        return service == null ? ServiceConfig.DEFAULT_TIMEOUT : service.config().timeout();
    }

    private static boolean isToken(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean ok = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || TOKEN_CHARS.indexOf(c) >= 0;
            if (!ok) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }
}
