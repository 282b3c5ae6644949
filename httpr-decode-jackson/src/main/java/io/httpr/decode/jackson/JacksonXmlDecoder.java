package io.httpr.decode.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import io.httpr.client.BodyDecoder;
import io.httpr.client.BodyDecoders;
import io.httpr.client.BodyDecodingException;

import java.util.Objects;

/**
 * XML {@link BodyDecoder} backed by Jackson's XML dataformat.
 */
public final class JacksonXmlDecoder implements BodyDecoder {
    private final XmlMapper mapper;

    public JacksonXmlDecoder() {
        this(XmlMapper.builder()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .build());
    }

    public JacksonXmlDecoder(XmlMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public String mediaType() {
        return BodyDecoders.XML;
    }

    @Override
    public <T> T decode(byte[] body, Class<T> type) throws BodyDecodingException {
        try {
            return mapper.readValue(body, type);
        } catch (Exception e) {
            throw new BodyDecodingException("Failed to decode XML body to " + type.getName(), e);
        }
    }
}
