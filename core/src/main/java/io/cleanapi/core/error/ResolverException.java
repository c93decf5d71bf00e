package io.cleanapi.core.error;

/**
 * Wraps a checked exception thrown by a resolver so that {@code call} can rethrow it without
 * declaring {@code throws Exception}. Unchecked resolver failures are never wrapped.
 */
public final class ResolverException extends CleanApiException {

    private static final long serialVersionUID = 1L;

    public ResolverException(String endpoint, Throwable cause) {
        super("Resolver for endpoint '" + endpoint + "' failed: " + cause.getMessage(), cause, endpoint, Stage.TRANSPORT);
    }
}
