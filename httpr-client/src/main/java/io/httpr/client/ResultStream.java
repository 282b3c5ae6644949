package io.httpr.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read side of a one-way stream of {@link ResultEnvelope}s produced by a {@link Group}.
 *
 * <p>The producer closes the stream when it has nothing more to deliver. Readers see
 * every envelope published before the close, then end-of-stream.
 */
public interface ResultStream {

    /**
     * Waits for the next envelope.
     *
     * @return the next envelope, or empty once the stream is closed and drained
     */
    Optional<ResultEnvelope> next() throws InterruptedException;

    /**
     * Waits at most {@code timeout} for the next envelope.
     *
     * @return the next envelope, or empty on timeout or end-of-stream; use {@link #isDone()}
     *         to tell the two apart
     */
    Optional<ResultEnvelope> poll(Duration timeout) throws InterruptedException;

    /**
     * True once the stream is closed and every envelope has been taken.
     */
    boolean isDone();

    /**
     * Reads until end-of-stream. Only useful for streams that advance on their own,
     * such as {@link Group#parallel()}.
     */
    default List<ResultEnvelope> drain() throws InterruptedException {
        List<ResultEnvelope> out = new ArrayList<>();
        Optional<ResultEnvelope> next;
        while ((next = next()).isPresent()) {
            out.add(next.get());
        }
        return out;
    }
}
