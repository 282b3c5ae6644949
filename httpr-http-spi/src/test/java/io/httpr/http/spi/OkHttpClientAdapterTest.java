package io.httpr.http.spi;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OkHttpClientAdapterTest extends AbstractHttpClientAdapterTest {

    @Override
    protected HttpClientAdapter createAdapter() {
        return OkHttpClientAdapter.create(new OkHttpClient.Builder()
                .connectTimeout(2, TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build());
    }

    @Test
    void putWithoutBodySendsEmptyPayload() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));

        try (HttpClientResponse response = createAdapter().send(HttpClientRequest.put(server.url("/items/1").uri()).build())) {
            assertThat(response.statusCode()).isEqualTo(200);
        }

        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getBodySize()).isZero();
    }
}
