package io.httpr.decode.jackson;

import io.httpr.client.BodyDecoder;
import io.httpr.client.BodyDecoderProvider;

import java.util.List;

/**
 * ServiceLoader provider for {@link JacksonJsonDecoder} and {@link JacksonXmlDecoder}.
 */
public final class JacksonBodyDecoderProvider implements BodyDecoderProvider {
    @Override
    public List<BodyDecoder> decoders() {
        return List.of(new JacksonJsonDecoder(), new JacksonXmlDecoder());
    }
}
