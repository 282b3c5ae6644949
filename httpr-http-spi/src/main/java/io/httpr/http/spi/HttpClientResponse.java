package io.httpr.http.spi;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Represents an HTTP response from an {@link HttpClientAdapter}.
 *
 * <p>The body is exposed as an unread stream. Closing the response releases the
 * underlying connection back to the adapter's pool.
 */
public interface HttpClientResponse extends Closeable {

    /**
     * Returns the HTTP status code.
     * @return the status code (e.g., 200, 404, 500)
     */
    int statusCode();

    /**
     * Returns the protocol version the response was received with, e.g. {@code HTTP/1.1}.
     */
    String protocol();

    /**
     * Returns all response headers in the order the transport reported them.
     */
    Map<String, List<String>> headers();

    /**
     * Returns the first value for the specified header name.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    default Optional<String> header(String name) {
        if (name == null) return Optional.empty();
        for (Map.Entry<String, List<String>> e : headers().entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                return Optional.ofNullable(e.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the response body as an input stream. Never null; an empty
     * stream is returned when the response has no body.
     */
    InputStream body();

    @Override
    default void close() throws IOException {
        body().close();
    }
}
