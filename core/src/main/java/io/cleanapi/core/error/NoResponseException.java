package io.cleanapi.core.error;

/**
 * Thrown when the request was sent but no response was received: connection refused, host
 * unreachable, read timeout, or the connection dropped mid-exchange.
 */
public class NoResponseException extends TransportException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message  human-readable error description
     * @param cause    the underlying network exception
     * @param endpoint the endpoint being called, may be null
     */
    public NoResponseException(String message, Throwable cause, String endpoint) {
        super(message, cause, endpoint);
    }
}
