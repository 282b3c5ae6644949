package io.httpr.client;

import io.httpr.http.spi.HttpClientException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceIntegrationTest {

    private MockWebServer server;
    private Service service;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        String base = server.url("/").toString();
        service = Service.create(ServiceConfig.defaults().withTimeout(Duration.ofSeconds(5)).withDebug(true))
                .host(base.substring(0, base.length() - 1))
                .header("Accept", "application/json");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void sendsHeadersParamsAndHookMutations() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"ok\":true}"));
        service.beforeSend(wire -> wire.setHeader("Authorization", "Bearer t0k3n"));

        ResultEnvelope result = service.get("/users").params("page", "2").execute();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.response().statusCode()).isEqualTo(200);
        assertThat(result.response().text()).isEqualTo("{\"ok\":true}");

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getPath()).isEqualTo("/users?page=2");
        assertThat(recorded.getHeader("Accept")).isEqualTo("application/json");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer t0k3n");
    }

    @Test
    void postsBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201));

        ResultEnvelope result = service.post("/users")
                .body("{\"name\":\"ada\"}".getBytes(), "application/json")
                .execute();

        assertThat(result.response().statusCode()).isEqualTo(201);
        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"name\":\"ada\"}");
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");
    }

    @Test
    void retriesAfterDisconnect() throws Exception {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("second"));

        ResultEnvelope result = service.get("/flaky").retryDelays(Duration.ofMillis(10)).execute();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.response().text()).isEqualTo("second");
    }

    @Test
    void timeoutIsReportedAsTransportFailure() {
        server.enqueue(new MockResponse().setHeadersDelay(2, TimeUnit.SECONDS));

        ResultEnvelope result = service.get("/slow").timeout(Duration.ofMillis(200)).execute();

        assertThat(result.error()).isInstanceOf(HttpClientException.class);
    }

    @Test
    void nonSuccessStatusIsAResponseNotAnError() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));

        ResultEnvelope result = service.get("/busy").execute();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.response().isSuccessful()).isFalse();
        assertThat(result.response().text()).isEqualTo("busy");
    }

    @Test
    void sequentialGroupAgainstServer() throws Exception {
        server.enqueue(new MockResponse().setBody("a"));
        server.enqueue(new MockResponse().setBody("b"));
        server.enqueue(new MockResponse().setBody("c"));
        Group group = Group.of(service.get("/a"), service.get("/b"), service.get("/c"));

        ResultStream stream = group.sequential();
        assertThat(stream.poll(Duration.ofSeconds(5)).orElseThrow().response().text()).isEqualTo("a");
        group.continueSequence();
        assertThat(stream.poll(Duration.ofSeconds(5)).orElseThrow().response().text()).isEqualTo("b");
        group.stop();

        assertThat(stream.next()).isEmpty();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void parallelGroupAgainstServer() throws Exception {
        for (int i = 0; i < 5; i++) {
            server.enqueue(new MockResponse().setBody("ok").setBodyDelay(i * 20L, TimeUnit.MILLISECONDS));
        }
        Group group = Group.of(service.get("/1"), service.get("/2"), service.get("/3"), service.get("/4"), service.get("/5"));

        List<ResultEnvelope> results = group.parallel().drain();

        assertThat(results).hasSize(5);
        Set<Request> distinct = new HashSet<>();
        for (ResultEnvelope r : results) {
            assertThat(r.isSuccess()).isTrue();
            distinct.add(r.request());
        }
        assertThat(distinct).hasSize(5);
    }
}
