package io.cleanapi.core.error;

/**
 * Base exception for failures of the underlying network call.
 *
 * <p>
 * Subtypes represent the failure modes the error normalizer distinguishes:
 * <ul>
 * <li>{@link HttpResponseException}: the server answered with a non-2xx status
 * <li>{@link NoResponseException}: the request was sent but nothing came back
 * <li>{@link RequestSetupException}: the request could not be built or sent at all
 * </ul>
 */
public abstract class TransportException extends CleanApiException {

    private static final long serialVersionUID = 1L;

    protected TransportException(String message, Throwable cause, String endpoint) {
        super(message, cause, endpoint, Stage.TRANSPORT);
    }
}
