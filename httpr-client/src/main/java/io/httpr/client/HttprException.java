package io.httpr.client;

/**
 * Base class for httpr runtime errors.
 *
 * <p>Transport failures are reported as {@link io.httpr.http.spi.HttpClientException}
 * and decoding failures as {@link BodyDecodingException}; this hierarchy covers
 * errors raised by the client itself.
 */
public abstract class HttprException extends RuntimeException {

    protected HttprException(String message) {
        super(message);
    }

    protected HttprException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a request cannot be turned into a wire request (malformed method or URI).
     * Never retried.
     */
    public static class Materialization extends HttprException {
        public Materialization(String message) {
            super(message);
        }

        public Materialization(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when an envelope is published on a stream that has already been closed.
     */
    public static class StreamClosed extends HttprException {
        public StreamClosed(String message) {
            super(message);
        }
    }
}
