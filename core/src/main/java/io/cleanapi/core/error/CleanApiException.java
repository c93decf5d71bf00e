package io.cleanapi.core.error;

/**
 * Abstract base for all clean-api exceptions. Never thrown directly; use one of the concrete
 * subclasses: {@link ContractDefinitionException} at registration time, {@link ValidationException}
 * at call time, {@link TransportException} and {@link CallAbortedException} around the network call.
 */
public abstract class CleanApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Stage of the call lifecycle in which the error occurred. */
    public enum Stage {
        DEFINITION,
        VALIDATION,
        TRANSPORT
    }

    private final String endpoint;
    private final Stage stage;

    protected CleanApiException(String message, String endpoint, Stage stage) {
        super(message);
        this.endpoint = endpoint;
        this.stage = stage;
    }

    protected CleanApiException(String message, Throwable cause, String endpoint, Stage stage) {
        super(message, cause);
        this.endpoint = endpoint;
        this.stage = stage;
    }

    /** The endpoint that triggered the error, or {@code null} if not yet identified. */
    public String endpoint() {
        return endpoint;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The stage in which the error occurred. */
    public Stage stage() {
        return stage;
    }
}
