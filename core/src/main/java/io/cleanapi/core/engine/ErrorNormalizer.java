package io.cleanapi.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.cleanapi.core.error.CallAbortedException;
import io.cleanapi.core.error.HttpResponseException;
import io.cleanapi.core.error.NoResponseException;
import io.cleanapi.core.error.RequestSetupException;
import io.cleanapi.core.error.ResolverException;
import io.cleanapi.core.error.TransportException;
import io.cleanapi.core.error.ValidationException;
import io.cleanapi.core.model.ApiError;
import io.cleanapi.core.spi.ConnectivityProbe;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps any failure to exactly one {@link ApiError} variant.
 *
 * <p>
 * Wrappers ({@link CompletionException}, {@link ExecutionException}, {@link ResolverException})
 * are unwrapped first; the unwrapped throwable is what gets classified and kept as
 * {@code rawError}. Precedence:
 * <ol>
 * <li>cancellation: {@code aborted}</li>
 * <li>{@link HttpResponseException}: server error envelope, or {@code unsupported_server_response}</li>
 * <li>{@link NoResponseException}: {@code no_internet} or {@code no_server_response}</li>
 * <li>{@link RequestSetupException}: {@code configuration_issue}</li>
 * <li>{@link ValidationException}: {@code validation_error}</li>
 * <li>anything else: {@code client_exception}</li>
 * </ol>
 *
 * <p>
 * Never throws. Thread-safe if the probe is.
 */
public final class ErrorNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorNormalizer.class);

    private final ConnectivityProbe probe;

    public ErrorNormalizer(ConnectivityProbe probe) {
        this.probe = Objects.requireNonNull(probe, "probe");
    }

    public ApiError normalize(Throwable failure) {
        Throwable error = unwrap(failure);

        if (error instanceof CallAbortedException
                || error instanceof CancellationException
                || error instanceof InterruptedException) {
            return new ApiError.Aborted(error);
        }
        if (error instanceof TransportException transport) {
            return normalizeTransport(transport);
        }
        if (error instanceof ValidationException validation) {
            return new ApiError.ValidationFailed(validation.issues(), validation);
        }
        return new ApiError.ClientException(error);
    }

    private ApiError normalizeTransport(TransportException error) {
        if (error instanceof HttpResponseException response) {
            return fromResponse(response);
        }
        if (error instanceof NoResponseException) {
            return isOnline() ? new ApiError.NoServerResponse(error) : new ApiError.NoInternet(error);
        }
        if (error instanceof RequestSetupException) {
            return new ApiError.ConfigurationIssue(error);
        }
        // an unknown TransportException subtype is still a client-side failure
        return new ApiError.ClientException(error);
    }

    private static ApiError fromResponse(HttpResponseException error) {
        JsonNode body = error.body();
        JsonNode message = body.get("message");
        if (!body.isObject() || message == null || !message.isTextual()) {
            return new ApiError.UnsupportedServerResponse(error.status(), body, error);
        }
        JsonNode type = body.get("type");
        String resolvedType = type != null && type.isTextual() ? type.asText() : error.reasonPhrase();
        if (resolvedType == null || resolvedType.isEmpty()) {
            resolvedType = String.valueOf(error.status());
        }
        JsonNode meta = body.get("meta");
        return new ApiError.ContractError(
                resolvedType,
                error.status(),
                message.asText(),
                meta == null || meta.isNull() ? null : meta,
                error);
    }

    private boolean isOnline() {
        try {
            return probe.isOnline();
        } catch (RuntimeException e) {
            LOG.warn("Connectivity probe failed, assuming online", e);
            return true;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException
                        || current instanceof ExecutionException
                        || current instanceof ResolverException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
