package io.httpr.client;

import java.util.List;

/**
 * ServiceLoader entry point for {@link BodyDecoder} implementations.
 */
public interface BodyDecoderProvider {
    List<BodyDecoder> decoders();
}
