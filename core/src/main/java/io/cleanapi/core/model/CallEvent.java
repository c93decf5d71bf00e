package io.cleanapi.core.model;

import io.cleanapi.core.config.ClientConfig;

/**
 * Payload delivered to {@code onCall} hooks, before the request executes.
 *
 * @param endpoint the endpoint name
 * @param input    the exact input the caller supplied
 * @param config   the client's ambient configuration, or {@code null} for a client built
 *                 without one
 */
public record CallEvent(String endpoint, CallInput input, ClientConfig config) {

    public boolean hasConfig() {
        return config != null;
    }
}
