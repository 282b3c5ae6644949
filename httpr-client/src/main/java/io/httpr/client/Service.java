package io.httpr.client;

import io.httpr.http.spi.HttpClientAdapter;
import io.httpr.http.spi.HttpClientRequest;
import io.httpr.http.spi.JdkHttpClientAdapter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Shared configuration for a family of requests against one remote host.
 *
 * <p>A service owns the transport (and so the connection pool) used by all of its
 * requests, a set of default headers, named paths, and the shared-scope hooks that
 * run before any request-scope hook.
 *
 * <pre>{@code
 * Service users = Service.create(ServiceConfig.defaults())
 *         .host("https://api.example.com")
 *         .paths("list", "/users", "one", "/users/{id}")
 *         .header("Accept", "application/json");
 *
 * ResultEnvelope result = users.method("GET", "list").params("page", "2").execute();
 * }</pre>
 *
 * <p>Configure a service before issuing requests from it. Mutating headers or hooks
 * while its requests are executing is not supported.
 */
public final class Service {

    private final ServiceConfig config;
    private final HttpClientAdapter adapter;
    private final RequestExecutor executor;
    private final Map<String, String> paths = new LinkedHashMap<>();
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final List<RequestHook> hooks = new ArrayList<>();
    private String host = "";

    private Service(ServiceConfig config, HttpClientAdapter adapter) {
        this.config = Objects.requireNonNull(config, "config");
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.executor = new RequestExecutor(adapter);
    }

    public static Service create() {
        return create(ServiceConfig.defaults());
    }

    /**
     * Creates a service backed by a JDK HttpClient whose connect timeout is the configured timeout.
     */
    public static Service create(ServiceConfig config) {
        Objects.requireNonNull(config, "config");
        return new Service(config, JdkHttpClientAdapter.create(config.timeout()));
    }

    public static Service create(ServiceConfig config, HttpClientAdapter adapter) {
        return new Service(config, adapter);
    }

    /**
     * Sets the prefix prepended to every request URI, e.g. {@code https://api.example.com}.
     */
    public Service host(String host) {
        this.host = host == null ? "" : host;
        return this;
    }

    /**
     * Registers named paths given as key/path pairs.
     *
     * @throws IllegalArgumentException if an odd number of arguments is given
     */
    public Service paths(String... keyAndPath) {
        Pairs.forEach(keyAndPath, "paths", paths::put);
        return this;
    }

    public Service header(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }

    public Service rawHeader(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        List<String> values = new ArrayList<>(1);
        values.add(value);
        headers.put(name, values);
        return this;
    }

    public Service hook(RequestHook... hooks) {
        for (RequestHook hook : hooks) {
            this.hooks.add(Objects.requireNonNull(hook, "hook"));
        }
        return this;
    }

    public Service beforeSend(Consumer<HttpClientRequest> action) {
        return hook(RequestHook.beforeSend(action));
    }

    public Service afterResponse(Function<ResultEnvelope, HookDecision> action) {
        return hook(RequestHook.afterResponse(action));
    }

    /**
     * Creates a request for {@code host + uri}. The service's current default headers are
     * copied into the request.
     */
    public Request request(String method, String uri) {
        return new Request(this, method, host + uri, headers);
    }

    /**
     * Creates a request for a path registered with {@link #paths(String...)}.
     *
     * @throws IllegalArgumentException if no path is registered under {@code pathKey}
     */
    public Request method(String method, String pathKey) {
        String path = paths.get(pathKey);
        if (path == null) {
            throw new IllegalArgumentException("no path registered for key: " + pathKey);
        }
        return request(method, path);
    }

    public Request get(String uri) {
        return request("GET", uri);
    }

    public Request post(String uri) {
        return request("POST", uri);
    }

    public Request put(String uri) {
        return request("PUT", uri);
    }

    public Request delete(String uri) {
        return request("DELETE", uri);
    }

    /**
     * Creates a request whose URI is the segments joined with {@code /}.
     */
    public Request rest(String method, String... segments) {
        return request(method, String.join("/", segments));
    }

    public ServiceConfig config() { return config; }
    public HttpClientAdapter adapter() { return adapter; }
    public String host() { return host; }

    public Map<String, List<String>> headers() {
        return Collections.unmodifiableMap(headers);
    }

    RequestExecutor executor() {
        return executor;
    }

    List<RequestHook> hooks() {
        return Collections.unmodifiableList(hooks);
    }
}
