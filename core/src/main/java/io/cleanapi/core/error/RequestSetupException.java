package io.cleanapi.core.error;

/**
 * Thrown when the request could not be built before anything went on the wire: a malformed base
 * URL, an unserializable payload, a missing transport.
 */
public class RequestSetupException extends TransportException {

    private static final long serialVersionUID = 1L;

    public RequestSetupException(String message, Throwable cause, String endpoint) {
        super(message, cause, endpoint);
    }
}
