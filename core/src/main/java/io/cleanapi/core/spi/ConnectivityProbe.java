package io.cleanapi.core.spi;

/**
 * Reports whether the host currently has network connectivity. Consulted by the error normalizer
 * to tell {@code no_internet} apart from {@code no_server_response}.
 */
@FunctionalInterface
public interface ConnectivityProbe {

    /** Probe that always reports the host as online. */
    ConnectivityProbe ALWAYS_ONLINE = () -> true;

    boolean isOnline();
}
