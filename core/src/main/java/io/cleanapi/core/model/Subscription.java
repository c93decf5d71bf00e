package io.cleanapi.core.model;

/** Handle returned by hook and listener registrations. Unsubscribing twice is a no-op. */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
