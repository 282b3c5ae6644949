package io.httpr.http.spi;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Wire-level HTTP request sent by an {@link HttpClientAdapter}.
 *
 * <p>The target URI and method are fixed at construction. Headers, body and timeout
 * stay mutable so that pre-send hooks can adjust the request in place. Instances
 * are not thread-safe.
 */
public final class HttpClientRequest {

    private final URI uri;
    private final String method;
    private final Map<String, List<String>> headers;
    private byte[] body;
    private Duration timeout;

    private HttpClientRequest(URI uri, String method, Map<String, List<String>> headers, byte[] body, Duration timeout) {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.method = Objects.requireNonNull(method, "method");
        this.headers = headers;
        this.body = body;
        this.timeout = timeout;
    }

    public URI uri() { return uri; }
    public String method() { return method; }
    public byte[] body() { return body; }
    public Duration timeout() { return timeout; }

    /**
     * Returns a read-only view of the headers in insertion order.
     */
    public Map<String, List<String>> headers() {
        return Collections.unmodifiableMap(headers);
    }

    /**
     * Returns the first value of the named header.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    public Optional<String> header(String name) {
        String key = findKey(name);
        if (key == null) return Optional.empty();
        List<String> values = headers.get(key);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    /**
     * Replaces all values of the named header.
     */
    public HttpClientRequest setHeader(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        removeHeader(name);
        List<String> values = new ArrayList<>(1);
        values.add(value);
        headers.put(name, values);
        return this;
    }

    /**
     * Appends a value to the named header, keeping existing values.
     */
    public HttpClientRequest addHeader(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        String key = findKey(name);
        if (key == null) {
            headers.put(name, new ArrayList<>(List.of(value)));
        } else {
            headers.get(key).add(value);
        }
        return this;
    }

    public HttpClientRequest removeHeader(String name) {
        String key = findKey(name);
        if (key != null) headers.remove(key);
        return this;
    }

    public HttpClientRequest body(byte[] body) {
        this.body = body;
        return this;
    }

    public HttpClientRequest timeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    private String findKey(String name) {
        if (name == null) return null;
        String target = name.toLowerCase(Locale.ROOT);
        for (String key : headers.keySet()) {
            if (key.toLowerCase(Locale.ROOT).equals(target)) return key;
        }
        return null;
    }

    public static Builder builder(URI uri, String method) {
        return new Builder(uri, method);
    }

    public static Builder get(URI uri) { return new Builder(uri, "GET"); }
    public static Builder post(URI uri) { return new Builder(uri, "POST"); }
    public static Builder put(URI uri) { return new Builder(uri, "PUT"); }
    public static Builder delete(URI uri) { return new Builder(uri, "DELETE"); }
    public static Builder head(URI uri) { return new Builder(uri, "HEAD"); }

    public static final class Builder {
        private final URI uri;
        private final String method;
        private final Map<String, List<String>> headers = new LinkedHashMap<>();
        private byte[] body;
        private Duration timeout;

        private Builder(URI uri, String method) {
            this.uri = uri;
            this.method = method;
        }

        public Builder header(String name, String value) {
            headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder headers(Map<String, ? extends Iterable<String>> headers) {
            if (headers != null) {
                headers.forEach((name, values) -> {
                    if (name == null || values == null) return;
                    for (String value : values) {
                        if (value != null) header(name, value);
                    }
                });
            }
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            HttpClientRequest request = new HttpClientRequest(uri, method, new LinkedHashMap<>(), body, timeout);
            headers.forEach((name, values) -> values.forEach(value -> request.addHeader(name, value)));
            return request;
        }
    }
}
