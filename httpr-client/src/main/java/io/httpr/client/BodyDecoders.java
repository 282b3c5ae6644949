package io.httpr.client;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Looks up {@link BodyDecoder}s registered through {@link BodyDecoderProvider}.
 */
public final class BodyDecoders {

    public static final String JSON = "application/json";
    public static final String XML = "application/xml";

    private static volatile Map<String, BodyDecoder> registered;

    private BodyDecoders() {}

    /**
     * Returns the first registered decoder for the media type.
     *
     * @throws BodyDecodingException if no provider registers one
     */
    public static BodyDecoder forMediaType(String mediaType) throws BodyDecodingException {
        BodyDecoder decoder = registered().get(mediaType.toLowerCase(Locale.ROOT));
        if (decoder == null) {
            throw new BodyDecodingException("No BodyDecoder registered for " + mediaType
                    + "; add a module such as httpr-decode-jackson to the classpath");
        }
        return decoder;
    }

    private static Map<String, BodyDecoder> registered() {
        Map<String, BodyDecoder> local = registered;
        if (local == null) {
            synchronized (BodyDecoders.class) {
                local = registered;
                if (local == null) {
                    local = new LinkedHashMap<>();
                    for (BodyDecoderProvider provider : ServiceLoader.load(BodyDecoderProvider.class)) {
                        for (BodyDecoder decoder : provider.decoders()) {
                            local.putIfAbsent(decoder.mediaType().toLowerCase(Locale.ROOT), decoder);
                        }
                    }
                    registered = local;
                }
            }
        }
        return local;
    }
}
