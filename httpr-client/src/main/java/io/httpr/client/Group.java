package io.httpr.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An ordered batch of {@link Request}s consumed either one at a time or all at once.
 *
 * <p><b>Sequential mode</b> ({@link #sequential()}): a background thread executes the
 * requests in list order. After each execution it publishes the envelope and waits until
 * the reader calls {@link #continueSequence()} or {@link #stop()}. At most one envelope is
 * ever in flight. A failed request does not end the sequence; only {@link #stop()} does.
 *
 * <p><b>Parallel mode</b> ({@link #parallel()}): every request is started at once on the
 * worker executor and envelopes are delivered in completion order. Every request runs to
 * completion; there is no cancellation.
 *
 * <p>Each mode has at most one active stream. Asking for a mode while its stream is
 * still running returns that same stream; once it finishes, the next call starts over.
 *
 * <pre>{@code
 * Group group = Group.of(first, second, third);
 * ResultStream stream = group.sequential();
 * Optional<ResultEnvelope> next;
 * while ((next = stream.next()).isPresent()) {
 *     if (!next.get().isSuccess() || next.get().stopRequested()) {
 *         group.stop();
 *     } else {
 *         group.continueSequence();
 *     }
 * }
 * }</pre>
 *
 * <p>Requests placed in a group must not be executed elsewhere while a stream is running.
 */
public final class Group {

    private static final Logger log = LoggerFactory.getLogger(Group.class);
    private static final AtomicInteger THREAD_IDS = new AtomicInteger();

    private final List<Request> requests;
    private final RequestExecutor executor;
    private final Executor workers;

    private final Object lock = new Object();
    private EnvelopeChannel sequential;
    private EnvelopeChannel parallel;
    private volatile StepGate gate;

    /**
     * Creates a group that runs each request with its own service's executor and starts
     * one daemon thread per request in parallel mode.
     */
    public static Group of(Request... requests) {
        return new Group(Arrays.asList(requests));
    }

    public Group(List<Request> requests) {
        this(requests, null, Group::startDaemon);
    }

    /**
     * @param executor executor for every request, or null to use {@link Request#execute()}
     * @param workers runs the per-request tasks of parallel mode
     */
    public Group(List<Request> requests, RequestExecutor executor, Executor workers) {
        Objects.requireNonNull(requests, "requests");
        for (Request r : requests) {
            Objects.requireNonNull(r, "request");
        }
        this.requests = List.copyOf(requests);
        this.executor = executor;
        this.workers = Objects.requireNonNull(workers, "workers");
    }

    public List<Request> requests() {
        return requests;
    }

    /**
     * Returns the sequential stream, starting it if it is not running.
     */
    public ResultStream sequential() {
        synchronized (lock) {
            if (sequential != null) {
                return sequential;
            }
            EnvelopeChannel channel = EnvelopeChannel.rendezvous();
            sequential = channel;
            Thread t = new Thread(() -> runSequence(channel), "httpr-sequence-" + THREAD_IDS.incrementAndGet());
            t.setDaemon(true);
            t.start();
            return channel;
        }
    }

    /**
     * Lets the sequential stream move on to the next request. Does nothing if no
     * delivered envelope is waiting for a decision.
     */
    public void continueSequence() {
        StepGate g = gate;
        if (g != null) {
            g.open(StepGate.Decision.CONTINUE);
        }
    }

    /**
     * Ends the sequential stream after the current envelope. Requests not yet started are
     * skipped and the stream is closed. A request already executing is not interrupted.
     */
    public void stop() {
        StepGate g = gate;
        if (g != null) {
            g.open(StepGate.Decision.STOP);
        }
    }

    /**
     * Returns the parallel stream, starting every request if it is not running.
     */
    public ResultStream parallel() {
        synchronized (lock) {
            if (parallel != null) {
                return parallel;
            }
            EnvelopeChannel channel = EnvelopeChannel.buffered(requests.size());
            parallel = channel;
            CompletableFuture<?>[] tasks = new CompletableFuture<?>[requests.size()];
            for (int i = 0; i < tasks.length; i++) {
                Request request = requests.get(i);
                try {
                    tasks[i] = CompletableFuture.runAsync(() -> publish(channel, executeSafely(request)), workers);
                } catch (RejectedExecutionException e) {
                    log.warn("Worker rejected {}", request, e);
                    publish(channel, ResultEnvelope.failure(request, e));
                    tasks[i] = CompletableFuture.completedFuture(null);
                }
            }
            CompletableFuture.allOf(tasks).whenComplete((ignored, error) -> {
                synchronized (lock) {
                    if (parallel == channel) {
                        parallel = null;
                    }
                }
                channel.close();
            });
            return channel;
        }
    }

    private void runSequence(EnvelopeChannel channel) {
        try {
            for (Request request : requests) {
                ResultEnvelope result = executeSafely(request);
                StepGate g = new StepGate();
                gate = g;
                channel.send(result);
                if (g.await() == StepGate.Decision.STOP) {
                    log.debug("Sequence stopped after {}", request);
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Sequence thread interrupted, closing stream");
        } finally {
            gate = null;
            synchronized (lock) {
                if (sequential == channel) {
                    sequential = null;
                }
            }
            channel.close();
        }
    }

    private ResultEnvelope executeSafely(Request request) {
        try {
            return executor != null ? executor.execute(request) : request.execute();
        } catch (RuntimeException e) {
            log.warn("Hook failed while executing {}", request, e);
            return ResultEnvelope.failure(request, e);
        }
    }

    private static void publish(EnvelopeChannel channel, ResultEnvelope result) {
        try {
            channel.send(result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing result of {}", result.request());
        }
    }

    private static void startDaemon(Runnable task) {
        Thread t = new Thread(task, "httpr-parallel-" + THREAD_IDS.incrementAndGet());
        t.setDaemon(true);
        t.start();
    }
}
