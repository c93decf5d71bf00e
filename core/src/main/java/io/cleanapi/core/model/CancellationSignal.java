package io.cleanapi.core.model;

import io.cleanapi.core.error.CallAbortedException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation token threaded from the caller through to the transport.
 *
 * <p>
 * {@link #cancel()} flips the signal once and runs every registered listener; transports use a
 * listener to abort the in-flight request. A listener registered after cancellation runs
 * immediately on the registering thread.
 *
 * <p>
 * Thread-safe.
 */
public final class CancellationSignal {

    private static final Logger LOG = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /** Cancels the signal. Only the first invocation has an effect. */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            runQuietly(listener);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a listener to run on cancellation.
     *
     * @return handle that removes the listener again
     */
    public Subscription onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            runQuietly(listener);
        }
        return () -> listeners.remove(listener);
    }

    /** Throws {@link CallAbortedException} if the signal has been cancelled. */
    public void throwIfCancelled(String endpoint) {
        if (cancelled.get()) {
            throw new CallAbortedException(endpoint);
        }
    }

    private static void runQuietly(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            LOG.warn("Cancellation listener failed", e);
        }
    }
}
