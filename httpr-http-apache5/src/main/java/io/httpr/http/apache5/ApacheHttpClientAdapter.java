package io.httpr.http.apache5;

import io.httpr.http.spi.HttpClientAdapter;
import io.httpr.http.spi.HttpClientException;
import io.httpr.http.spi.HttpClientRequest;
import io.httpr.http.spi.HttpClientResponse;
import io.httpr.http.spi.HttpTimeoutException;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ProtocolVersion;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using Apache HttpClient 5.
 */
public final class ApacheHttpClientAdapter implements HttpClientAdapter {

    public static final int DEFAULT_MAX_PER_ROUTE = 64;
    static final int DEFAULT_MAX_TOTAL = 256;

    private final CloseableHttpClient httpClient;

    public ApacheHttpClientAdapter(CloseableHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates a new adapter whose pool allows {@value #DEFAULT_MAX_PER_ROUTE} connections per host.
     *
     * <p>Every response returned by {@link #send} keeps its pooled connection until its body
     * is read to the end or it is closed, so this bounds how many unread responses from one
     * host can exist at once.
     * @return a new ApacheHttpClientAdapter
     */
    public static ApacheHttpClientAdapter create() {
        return create(DEFAULT_MAX_PER_ROUTE);
    }

    /**
     * Creates a new adapter whose pool allows {@code maxPerRoute} connections per host.
     * @param maxPerRoute the maximum number of open connections to one host
     * @return a new ApacheHttpClientAdapter
     */
    public static ApacheHttpClientAdapter create(int maxPerRoute) {
        if (maxPerRoute < 1) {
            throw new IllegalArgumentException("maxPerRoute must be positive: " + maxPerRoute);
        }
        PoolingHttpClientConnectionManager connections = new PoolingHttpClientConnectionManager();
        connections.setMaxTotal(Math.max(maxPerRoute, DEFAULT_MAX_TOTAL));
        connections.setDefaultMaxPerRoute(maxPerRoute);
        return new ApacheHttpClientAdapter(HttpClients.custom()
                .setConnectionManager(connections)
                .build());
    }

    /**
     * Creates a new adapter with the specified HttpClient.
     * @param httpClient the Apache HttpClient to use
     * @return a new ApacheHttpClientAdapter
     */
    public static ApacheHttpClientAdapter create(CloseableHttpClient httpClient) {
        return new ApacheHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        try {
            HttpUriRequestBase apacheRequest = toApacheRequest(request);
            ClassicHttpResponse response = httpClient.executeOpen(null, apacheRequest, null);
            return new StreamingResponse(response);
        } catch (SocketTimeoutException e) {
            throw new HttpTimeoutException(e);
        } catch (IOException | IllegalArgumentException e) {
            throw new HttpClientException(e);
        }
    }

    private static HttpUriRequestBase toApacheRequest(HttpClientRequest request) {
        HttpUriRequestBase apacheRequest = new HttpUriRequestBase(request.method(), request.uri());

        if (request.body() != null) {
            ContentType contentType = request.header("Content-Type")
                    .map(ContentType::parse)
                    .orElse(ContentType.APPLICATION_OCTET_STREAM);
            apacheRequest.setEntity(new ByteArrayEntity(request.body(), contentType));
        }

        request.headers().forEach((name, values) -> values.forEach(value -> apacheRequest.addHeader(name, value)));

        if (request.timeout() != null) {
            long millis = request.timeout().toMillis();
            RequestConfig config = RequestConfig.custom()
                    .setResponseTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .setConnectionRequestTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .build();
            apacheRequest.setConfig(config);
        }

        return apacheRequest;
    }

    private static final class StreamingResponse implements HttpClientResponse {
        private final ClassicHttpResponse response;
        private final Map<String, List<String>> headers;

        StreamingResponse(ClassicHttpResponse response) {
            this.response = response;
            Map<String, List<String>> collected = new LinkedHashMap<>();
            for (Header h : response.getHeaders()) {
                collected.computeIfAbsent(h.getName(), k -> new ArrayList<>()).add(h.getValue());
            }
            this.headers = Collections.unmodifiableMap(collected);
        }

        @Override
        public int statusCode() {
            return response.getCode();
        }

        @Override
        public String protocol() {
            ProtocolVersion version = response.getVersion();
            return version == null ? "HTTP/1.1" : version.format();
        }

        @Override
        public Map<String, List<String>> headers() {
            return headers;
        }

        @Override
        public InputStream body() {
            HttpEntity entity = response.getEntity();
            if (entity == null) {
                return InputStream.nullInputStream();
            }
            try {
                return entity.getContent();
            } catch (IOException e) {
                return new FailingInputStream(e);
            }
        }

        @Override
        public void close() throws IOException {
            response.close();
        }
    }

    /**
     * Reports the error that prevented the entity stream from being opened on first read.
     */
    private static final class FailingInputStream extends InputStream {
        private final IOException error;

        FailingInputStream(IOException error) {
            this.error = error;
        }

        @Override
        public int read() throws IOException {
            throw new IOException("Response entity is not readable", error);
        }
    }
}
