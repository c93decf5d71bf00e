package io.cleanapi.core.engine;

import io.cleanapi.core.model.Subscription;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-endpoint subscriber lists for one kind of call event.
 *
 * <p>
 * Registration and removal are atomic per endpoint key; {@link #emit} iterates a copy-on-write
 * snapshot, so callbacks may subscribe or unsubscribe while an event is being delivered.
 * A callback that throws is logged at WARN and the remaining callbacks still run.
 *
 * @param <E> the event type
 */
final class CallHookBus<E> {

    private static final Logger LOG = LoggerFactory.getLogger(CallHookBus.class);

    private final String hook;
    private final Map<String, CopyOnWriteArrayList<Registration<E>>> subscribers = new ConcurrentHashMap<>();

    /** @param hook hook name used in log messages, e.g. {@code onCall} */
    CallHookBus(String hook) {
        this.hook = hook;
    }

    Subscription subscribe(String endpoint, Consumer<? super E> callback) {
        Registration<E> registration = new Registration<>(callback);
        subscribers.compute(endpoint, (key, list) -> {
            CopyOnWriteArrayList<Registration<E>> target = list == null ? new CopyOnWriteArrayList<>() : list;
            target.add(registration);
            return target;
        });
        return () -> subscribers.computeIfPresent(endpoint, (key, list) -> {
            list.remove(registration);
            return list.isEmpty() ? null : list;
        });
    }

    void emit(String endpoint, E event) {
        List<Registration<E>> list = subscribers.get(endpoint);
        if (list == null) {
            return;
        }
        for (Registration<E> registration : list) {
            try {
                registration.callback.accept(event);
            } catch (RuntimeException e) {
                LOG.warn("{} callback failed: endpoint={}", hook, endpoint, e);
            }
        }
    }

    int subscriberCount(String endpoint) {
        List<Registration<E>> list = subscribers.get(endpoint);
        return list == null ? 0 : list.size();
    }

    /** Identity wrapper so the same callback can be registered twice and removed once. */
    private static final class Registration<E> {
        private final Consumer<? super E> callback;

        Registration(Consumer<? super E> callback) {
            this.callback = callback;
        }
    }
}
