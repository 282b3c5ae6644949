package io.httpr.client;

import io.httpr.http.spi.HttpClientResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Response received for a {@link Request}.
 *
 * <p>The body is read from the network on the first call to {@link #bytes()} and cached,
 * together with any read error. Later calls, and the decoding helpers, only see the
 * cached outcome. The underlying stream is closed after that single read.
 */
public final class Response {

    private static final Logger log = LoggerFactory.getLogger(Response.class);

    private final Request request;
    private final HttpClientResponse wire;

    private boolean read;
    private byte[] body;
    private IOException readError;

    Response(Request request, HttpClientResponse wire) {
        this.request = Objects.requireNonNull(request, "request");
        this.wire = Objects.requireNonNull(wire, "wire");
    }

    public Request request() { return request; }
    public int statusCode() { return wire.statusCode(); }
    public String protocol() { return wire.protocol(); }
    public Map<String, List<String>> headers() { return wire.headers(); }

    public Optional<String> header(String name) {
        return wire.header(name);
    }

    public boolean isSuccessful() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    /**
     * Returns the body, reading it from the network on first call.
     *
     * @throws IOException the error of the first read, repeated on every call
     */
    public synchronized byte[] bytes() throws IOException {
        if (!read) {
            read = true;
            try {
                InputStream in = wire.body();
                body = in.readAllBytes();
            } catch (IOException e) {
                readError = e;
            } catch (RuntimeException e) {
                readError = new IOException("Response body of " + request + " is not readable", e);
            } finally {
                closeQuietly();
            }
        }
        if (readError != null) {
            throw readError;
        }
        return body.clone();
    }

    public String text() throws IOException {
        return new String(bytes(), StandardCharsets.UTF_8);
    }

    /**
     * True once the body has been read (successfully or not).
     */
    public synchronized boolean isBodyRead() {
        return read;
    }

    /**
     * Decodes the body into {@code type} with the given decoder.
     *
     * @throws BodyDecodingException if the body cannot be read or parsed
     */
    public <T> T decode(BodyDecoder decoder, Class<T> type) throws BodyDecodingException {
        Objects.requireNonNull(decoder, "decoder");
        byte[] data;
        try {
            data = bytes();
        } catch (IOException e) {
            throw new BodyDecodingException("Failed to read response body of " + request, e);
        }
        return decoder.decode(data, type);
    }

    /**
     * Decodes a JSON body using the decoder registered for {@code application/json}.
     */
    public <T> T toJson(Class<T> type) throws BodyDecodingException {
        return decode(BodyDecoders.forMediaType(BodyDecoders.JSON), type);
    }

    /**
     * Decodes an XML body using the decoder registered for {@code application/xml}.
     */
    public <T> T toXml(Class<T> type) throws BodyDecodingException {
        return decode(BodyDecoders.forMediaType(BodyDecoders.XML), type);
    }

    /**
     * Releases the connection without reading the body. Later reads fail with a cached error.
     */
    synchronized void discard() {
        if (!read) {
            read = true;
            readError = new IOException("Response body of " + request + " was discarded");
            closeQuietly();
        }
    }

    private void closeQuietly() {
        try {
            wire.close();
        } catch (IOException e) {
            log.debug("Closing response of {} failed", request, e);
        }
    }

    @Override
    public String toString() {
        return protocol() + " " + statusCode() + " for " + request;
    }
}
