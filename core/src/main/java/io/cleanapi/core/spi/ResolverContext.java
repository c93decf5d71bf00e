package io.cleanapi.core.spi;

import io.cleanapi.core.config.ClientConfig;
import io.cleanapi.core.model.CallInput;
import io.cleanapi.core.model.CancellationSignal;
import java.util.Map;

/**
 * Arguments handed to a {@link Resolver}.
 *
 * @param endpoint the endpoint name
 * @param input    the input after validation (validator outputs replace the supplied values)
 * @param config   client configuration, or {@code null} for a client built without one
 */
public record ResolverContext(String endpoint, CallInput input, ClientConfig config) {

    public Map<String, Object> pathParams() {
        return input.pathParams();
    }

    public Map<String, Object> searchParams() {
        return input.searchParams();
    }

    public Object payload() {
        return input.payload();
    }

    public Object extra() {
        return input.extra();
    }

    /** The call's cancellation signal, or {@code null}. */
    public CancellationSignal signal() {
        return input.signal();
    }
}
