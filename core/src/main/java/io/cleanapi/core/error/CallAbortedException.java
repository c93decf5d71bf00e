package io.cleanapi.core.error;

/** Thrown when a call is cancelled through its {@code CancellationSignal}. */
public final class CallAbortedException extends CleanApiException {

    private static final long serialVersionUID = 1L;

    public CallAbortedException(String endpoint) {
        super("Call aborted", endpoint, Stage.TRANSPORT);
    }

    public CallAbortedException(String endpoint, Throwable cause) {
        super("Call aborted", cause, endpoint, Stage.TRANSPORT);
    }
}
