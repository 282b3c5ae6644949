package io.httpr.client;

import io.httpr.http.spi.HttpClientException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class GroupSequentialTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final Duration SHORT = Duration.ofMillis(150);

    private final ScriptedAdapter adapter = ScriptedAdapter.alwaysOk("ok");
    private final Service service = Service.create(ServiceConfig.defaults(), adapter).host("http://localhost");

    @Test
    void deliversInOrderAndWaitsForContinue() throws Exception {
        Request r1 = service.get("/1");
        Request r2 = service.get("/2");
        Request r3 = service.get("/3");
        Group group = Group.of(r1, r2, r3);

        ResultStream stream = group.sequential();

        assertThat(stream.poll(WAIT).orElseThrow().request()).isSameAs(r1);
        assertThat(stream.poll(SHORT)).isEmpty();
        assertThat(adapter.attempts()).isEqualTo(1);

        group.continueSequence();
        assertThat(stream.poll(WAIT).orElseThrow().request()).isSameAs(r2);

        group.continueSequence();
        assertThat(stream.poll(WAIT).orElseThrow().request()).isSameAs(r3);

        group.continueSequence();
        assertThat(stream.next()).isEmpty();
        assertThat(stream.isDone()).isTrue();
        assertThat(adapter.attempts()).isEqualTo(3);
    }

    @Test
    void stopEndsTheSequenceWithoutRunningTheRest() throws Exception {
        Request r1 = service.get("/1");
        Group group = Group.of(r1, service.get("/2"), service.get("/3"));

        ResultStream stream = group.sequential();
        assertThat(stream.poll(WAIT).orElseThrow().request()).isSameAs(r1);

        group.stop();

        assertThat(stream.poll(WAIT)).isEmpty();
        assertThat(stream.isDone()).isTrue();
        assertThat(adapter.attempts()).isEqualTo(1);
    }

    @Test
    void failedRequestDoesNotEndTheSequence() throws Exception {
        ScriptedAdapter flaky = new ScriptedAdapter().thenFail(1).thenRespond("second");
        Service flakyService = Service.create(ServiceConfig.defaults(), flaky).host("http://localhost");
        Group group = Group.of(flakyService.get("/1"), flakyService.get("/2"));

        ResultStream stream = group.sequential();

        ResultEnvelope first = stream.poll(WAIT).orElseThrow();
        assertThat(first.error()).isInstanceOf(HttpClientException.class);

        group.continueSequence();
        ResultEnvelope second = stream.poll(WAIT).orElseThrow();
        assertThat(second.isSuccess()).isTrue();
        assertThat(second.response().text()).isEqualTo("second");

        group.continueSequence();
        assertThat(stream.next()).isEmpty();
    }

    @Test
    void materializationFailureIsDeliveredLikeAnyOtherResult() throws Exception {
        Group group = Group.of(service.request("GET", "/bad path"), service.get("/ok"));

        ResultStream stream = group.sequential();

        assertThat(stream.poll(WAIT).orElseThrow().error()).isInstanceOf(HttprException.Materialization.class);
        group.continueSequence();
        assertThat(stream.poll(WAIT).orElseThrow().isSuccess()).isTrue();
        group.continueSequence();
        assertThat(stream.next()).isEmpty();
    }

    @Test
    void repeatedCallsReturnTheActiveStream() throws Exception {
        Group group = Group.of(service.get("/1"), service.get("/2"));

        ResultStream first = group.sequential();
        ResultStream second = group.sequential();

        assertThat(second).isSameAs(first);

        first.poll(WAIT).orElseThrow();
        group.stop();
        assertThat(first.next()).isEmpty();

        ResultStream restarted = group.sequential();
        assertThat(restarted).isNotSameAs(first);
        assertThat(restarted.poll(WAIT)).isPresent();
        group.stop();
    }

    @Test
    void continueWithoutPendingDeliveryIsIgnored() throws Exception {
        Request r1 = service.get("/1");
        Group group = Group.of(r1, service.get("/2"));

        group.continueSequence();
        group.stop();

        ResultStream stream = group.sequential();
        assertThat(stream.poll(WAIT).orElseThrow().request()).isSameAs(r1);
        assertThat(stream.poll(SHORT)).isEmpty();
        assertThat(stream.isDone()).isFalse();

        group.stop();
        assertThat(stream.next()).isEmpty();
    }

    @Test
    void hookStopIsSurfacedButDoesNotEndTheSequence() throws Exception {
        Request r1 = service.get("/1").afterResponse(r -> HookDecision.STOP);
        Request r2 = service.get("/2");
        Group group = Group.of(r1, r2);

        ResultStream stream = group.sequential();

        ResultEnvelope first = stream.poll(WAIT).orElseThrow();
        assertThat(first.stopRequested()).isTrue();
        assertThat(stream.poll(SHORT)).isEmpty();

        group.continueSequence();
        assertThat(stream.poll(WAIT).orElseThrow().request()).isSameAs(r2);
        group.continueSequence();
        assertThat(stream.next()).isEmpty();
    }

    @Test
    void consumerCanStopOnHookSignal() throws Exception {
        Group group = Group.of(
                service.get("/1"),
                service.get("/2").afterResponse(r -> HookDecision.STOP),
                service.get("/3"));

        ResultStream stream = group.sequential();
        List<ResultEnvelope> received = new ArrayList<>();
        Optional<ResultEnvelope> next;
        while ((next = stream.next()).isPresent()) {
            received.add(next.get());
            if (next.get().stopRequested()) {
                group.stop();
            } else {
                group.continueSequence();
            }
        }

        assertThat(received).hasSize(2);
        assertThat(adapter.attempts()).isEqualTo(2);
    }

    @Test
    void hookExceptionBecomesAFailedResult() throws Exception {
        Request r1 = service.get("/1").beforeSend(wire -> {
            throw new IllegalStateException("hook bug");
        });
        Group group = Group.of(r1);

        ResultStream stream = group.sequential();

        assertThat(stream.poll(WAIT).orElseThrow().error()).isInstanceOf(IllegalStateException.class);
        group.continueSequence();
        assertThat(stream.next()).isEmpty();
    }

    @Test
    void failingPostResponseHookReleasesTheDroppedResponse() throws Exception {
        Group group = Group.of(service.get("/1").afterResponse(r -> {
            throw new IllegalStateException("hook bug");
        }));

        ResultStream stream = group.sequential();

        assertThat(stream.poll(WAIT).orElseThrow().error()).isInstanceOf(IllegalStateException.class);
        assertThat(adapter.responses()).singleElement()
                .satisfies(response -> assertThat(response.closed()).isTrue());
        group.continueSequence();
        assertThat(stream.next()).isEmpty();
    }

    @Test
    void emptyGroupClosesImmediately() throws Exception {
        ResultStream stream = new Group(List.of()).sequential();

        assertThat(stream.next()).isEmpty();
        assertThat(stream.isDone()).isTrue();
    }
}
