package io.httpr.http.spi;

/**
 * Transport-level failure: the request could not be sent or no response
 * headers were received (connect refused, reset, I/O error).
 *
 * <p>Adapters wrap their library-specific exceptions in this type so that
 * callers can retry on it without knowing which client is underneath.
 */
public class HttpClientException extends Exception {

    public HttpClientException(String message) {
        super(message);
    }

    public HttpClientException(String message, Throwable cause) {
        super(message, cause);
    }

    public HttpClientException(Throwable cause) {
        super(cause);
    }
}
