package io.httpr.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceTest {

    private final Service service = Service.create(ServiceConfig.defaults(), ScriptedAdapter.alwaysOk("ok"))
            .host("https://api.example.com");

    @Test
    void namedPathsResolveAgainstHost() {
        service.paths("list", "/users", "one", "/users/42");

        Request request = service.method("GET", "one");

        assertThat(request.uri()).isEqualTo("https://api.example.com/users/42");
        assertThat(request.method()).isEqualTo("GET");
    }

    @Test
    void unknownPathKeyIsRejected() {
        assertThatThrownBy(() -> service.method("GET", "missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void oddPathsAreRejected() {
        assertThatThrownBy(() -> service.paths("list"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void restJoinsSegments() {
        assertThat(service.rest("DELETE", "", "users", "42", "roles").uri())
                .isEqualTo("https://api.example.com/users/42/roles");
    }

    @Test
    void shortcutsSetMethod() {
        assertThat(service.get("/a").method()).isEqualTo("GET");
        assertThat(service.post("/a").method()).isEqualTo("POST");
        assertThat(service.put("/a").method()).isEqualTo("PUT");
        assertThat(service.delete("/a").method()).isEqualTo("DELETE");
    }

    @Test
    void requestHeadersAreCopiedFromService() {
        service.header("Accept", "application/json");

        Request request = service.get("/a").rawHeader("Accept", "text/plain");

        assertThat(request.headers().get("Accept")).containsExactly("text/plain");
        assertThat(service.headers().get("Accept")).containsExactly("application/json");
        assertThat(service.get("/b").headers().get("Accept")).containsExactly("application/json");
    }

    @Test
    void serviceRequestsExecuteThroughServiceAdapter() throws Exception {
        ScriptedAdapter adapter = ScriptedAdapter.alwaysOk("from service");
        Service own = Service.create(ServiceConfig.defaults(), adapter).host("http://localhost");

        ResultEnvelope result = own.get("/x").execute();

        assertThat(result.response().text()).isEqualTo("from service");
        assertThat(adapter.sent()).hasSize(1);
    }

    @Test
    void configRejectsNonPositiveTimeout() {
        assertThatThrownBy(() -> new ServiceConfig(Duration.ZERO, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void registryStoresLoadsAndRemoves() {
        for (ServiceRegistry registry : List.of(ServiceRegistry.create(), ServiceRegistry.concurrent())) {
            registry.store("users", service);

            assertThat(registry.load("users")).containsSame(service);
            assertThat(registry.load("orders")).isEmpty();
            assertThat(registry.remove("users")).isTrue();
            assertThat(registry.remove("users")).isFalse();
            assertThat(registry.load("users")).isEmpty();
        }
    }
}
