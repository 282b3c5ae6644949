package io.httpr.client;

/**
 * Raised when a response body cannot be read or parsed into the requested type.
 */
public class BodyDecodingException extends Exception {
    public BodyDecodingException(String message) {
        super(message);
    }

    public BodyDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
