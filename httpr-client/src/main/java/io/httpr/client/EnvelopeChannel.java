package io.httpr.client;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Closable hand-off queue behind {@link ResultStream}.
 *
 * <p>With capacity zero, {@link #send} returns only after a reader has taken the envelope.
 * With a positive capacity it blocks only while the buffer is full. {@link #close} never
 * blocks, so a producer can always finish even if nobody reads the remaining envelopes.
 */
final class EnvelopeChannel implements ResultStream {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final Condition taken = lock.newCondition();
    private final ArrayDeque<ResultEnvelope> buffer = new ArrayDeque<>();
    private final int capacity;

    private long sent;
    private long received;
    private boolean closed;

    EnvelopeChannel(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0: " + capacity);
        }
        this.capacity = capacity;
    }

    static EnvelopeChannel rendezvous() {
        return new EnvelopeChannel(0);
    }

    static EnvelopeChannel buffered(int capacity) {
        return new EnvelopeChannel(capacity);
    }

    /**
     * Publishes an envelope, waiting for buffer space (or, unbuffered, for a reader to take it).
     *
     * @throws HttprException.StreamClosed if the channel was closed
     */
    void send(ResultEnvelope envelope) throws InterruptedException {
        lock.lock();
        try {
            while (!closed && buffer.size() >= Math.max(capacity, 1)) {
                notFull.await();
            }
            if (closed) {
                throw new HttprException.StreamClosed("stream already closed");
            }
            buffer.addLast(envelope);
            long ticket = ++sent;
            notEmpty.signal();
            if (capacity == 0) {
                while (received < ticket) {
                    taken.await();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ResultEnvelope> next() throws InterruptedException {
        lock.lock();
        try {
            while (buffer.isEmpty() && !closed) {
                notEmpty.await();
            }
            return take();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ResultEnvelope> poll(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (buffer.isEmpty() && !closed) {
                if (nanos <= 0) {
                    return Optional.empty();
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return take();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isDone() {
        lock.lock();
        try {
            return closed && buffer.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    private Optional<ResultEnvelope> take() {
        ResultEnvelope envelope = buffer.pollFirst();
        if (envelope == null) {
            return Optional.empty();
        }
        received++;
        notFull.signal();
        taken.signalAll();
        return Optional.of(envelope);
    }
}
