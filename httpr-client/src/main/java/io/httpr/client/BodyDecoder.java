package io.httpr.client;

/**
 * Turns a response body into a typed value.
 *
 * <p>Implementations wrap a specific parsing library and must be thread-safe.
 */
public interface BodyDecoder {

    /**
     * The media type this decoder handles, e.g. {@code application/json}.
     */
    String mediaType();

    /**
     * Decodes the body.
     *
     * @param body the raw body bytes
     * @param type the target class
     * @return the decoded value
     * @throws BodyDecodingException if the body does not match {@code type}
     */
    <T> T decode(byte[] body, Class<T> type) throws BodyDecodingException;
}
