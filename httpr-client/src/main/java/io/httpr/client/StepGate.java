package io.httpr.client;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One-shot rendezvous between a sequential producer and its controller.
 *
 * <p>A fresh gate is created for every delivered envelope. The first call to
 * {@link #open} decides the outcome; later calls are ignored.
 */
final class StepGate {

    enum Decision { CONTINUE, STOP }

    private final CountDownLatch opened = new CountDownLatch(1);
    private final AtomicReference<Decision> decision = new AtomicReference<>();

    /**
     * @return true if this call decided the gate
     */
    boolean open(Decision d) {
        if (decision.compareAndSet(null, d)) {
            opened.countDown();
            return true;
        }
        return false;
    }

    Decision await() throws InterruptedException {
        opened.await();
        return decision.get();
    }
}
