package io.httpr.client;

import io.httpr.http.spi.HttpClientRequest;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Renders an executed request and its response as HTTP/1.1-style text for debugging.
 *
 * <p>The response body is taken from the {@link Response}'s cache (reading it first if
 * nobody has yet). Dumping never sends anything.
 */
public final class ResponseDump {
    private ResponseDump() {}

    public static byte[] dump(Response response) {
        return dumpString(ResultEnvelope.success(response.request(), response)).getBytes(StandardCharsets.UTF_8);
    }

    public static String dumpString(ResultEnvelope result) {
        Request request = result.request();
        StringBuilder sb = new StringBuilder();
        if (request.isMaterialized()) {
            appendRequest(sb, request.wire());
        } else {
            sb.append(request).append(" (not built)\n\n");
        }

        Response response = result.response();
        if (response != null) {
            sb.append(response.protocol()).append(' ').append(response.statusCode()).append('\n');
            appendHeaders(sb, response.headers());
            sb.append('\n');
            try {
                sb.append(new String(response.bytes(), StandardCharsets.UTF_8));
            } catch (IOException e) {
                sb.append("<body unavailable: ").append(e.getMessage()).append('>');
            }
            sb.append('\n');
        } else {
            sb.append("Error: ").append(result.error()).append('\n');
        }

        sb.append("\nSummary: start at ").append(request.startedAt())
                .append(", end at ").append(request.endedAt())
                .append(", cost ").append(request.elapsed())
                .append('\n');
        return sb.toString();
    }

    private static void appendRequest(StringBuilder sb, HttpClientRequest wire) {
        URI uri = wire.uri();
        String target = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            target += "?" + uri.getRawQuery();
        }
        sb.append(wire.method()).append(' ').append(target).append(" HTTP/1.1\n");
        if (wire.header("Host").isEmpty()) {
            sb.append("Host: ").append(uri.getRawAuthority()).append('\n');
        }
        appendHeaders(sb, wire.headers());
        sb.append('\n');
        if (wire.body() != null) {
            sb.append(new String(wire.body(), StandardCharsets.UTF_8)).append('\n');
        }
    }

    private static void appendHeaders(StringBuilder sb, Map<String, List<String>> headers) {
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            for (String value : e.getValue()) {
                sb.append(e.getKey()).append(": ").append(value).append('\n');
            }
        }
    }
}
