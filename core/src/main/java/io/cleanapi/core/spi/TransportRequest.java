package io.cleanapi.core.spi;

import io.cleanapi.core.config.ClientConfig;
import io.cleanapi.core.model.CancellationSignal;
import io.cleanapi.core.model.HttpMethod;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A request ready for the wire: path already interpolated, inputs already validated.
 *
 * @param endpoint     endpoint name, for logging and error attribution
 * @param method       HTTP method
 * @param path         interpolated and percent-encoded path, starting with {@code /}
 * @param searchParams query parameters, unencoded (empty when none)
 * @param body         payload to serialize, or {@code null} for no body
 * @param hasBody      whether a payload was supplied (distinguishes an explicit {@code null})
 * @param config       client configuration, or {@code null}
 * @param signal       cancellation signal, or {@code null}
 */
public record TransportRequest(
        String endpoint,
        HttpMethod method,
        String path,
        Map<String, Object> searchParams,
        Object body,
        boolean hasBody,
        ClientConfig config,
        CancellationSignal signal) {

    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        searchParams = Collections.unmodifiableMap(new LinkedHashMap<>(searchParams == null ? Map.of() : searchParams));
    }
}
