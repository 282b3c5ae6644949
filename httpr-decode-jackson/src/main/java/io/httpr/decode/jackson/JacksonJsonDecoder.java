package io.httpr.decode.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.httpr.client.BodyDecoder;
import io.httpr.client.BodyDecoders;
import io.httpr.client.BodyDecodingException;

import java.util.Objects;

/**
 * JSON {@link BodyDecoder} backed by Jackson.
 */
public final class JacksonJsonDecoder implements BodyDecoder {
    private final ObjectMapper mapper;

    /**
     * Creates a decoder that ignores properties the target type does not declare.
     */
    public JacksonJsonDecoder() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public JacksonJsonDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public String mediaType() {
        return BodyDecoders.JSON;
    }

    @Override
    public <T> T decode(byte[] body, Class<T> type) throws BodyDecodingException {
        try {
            return mapper.readValue(body, type);
        } catch (Exception e) {
            throw new BodyDecodingException("Failed to decode JSON body to " + type.getName(), e);
        }
    }
}
