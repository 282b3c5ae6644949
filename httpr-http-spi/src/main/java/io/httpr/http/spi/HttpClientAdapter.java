package io.httpr.http.spi;

/**
 * Abstraction for HTTP client implementations.
 *
 * <p>This interface allows httpr to work with different HTTP client libraries
 * (JDK HttpClient, Apache HttpClient, OkHttp, etc.) without direct dependency
 * on any specific implementation.
 *
 * <p>Implementations should be thread-safe and reusable. One adapter instance
 * is shared by every request issued through a service, so its connection pool
 * is shared as well.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * HttpClientRequest request = HttpClientRequest.get(URI.create("http://example.com")).build();
 * try (HttpClientResponse response = adapter.send(request)) {
 *     byte[] body = response.body().readAllBytes();
 * }
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Sends an HTTP request and returns once the response headers are available.
     *
     * <p>The body is exposed as a stream and is not read by the adapter. The caller
     * is responsible for closing the returned response.
     *
     * @param request the HTTP request to send
     * @return the HTTP response with an unread body stream
     * @throws HttpClientException if the request fails
     * @throws HttpTimeoutException if the request times out
     */
    HttpClientResponse send(HttpClientRequest request) throws HttpClientException;
}
