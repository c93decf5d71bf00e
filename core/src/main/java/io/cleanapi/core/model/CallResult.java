package io.cleanapi.core.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of {@code safeCall}: an ordered pair whose first element is the success flag and whose
 * second element is either the dto or the normalized {@link ApiError}.
 *
 * @param <D> dto type
 */
public final class CallResult<D> {

    private final boolean ok;
    private final D dto;
    private final ApiError error;

    private CallResult(boolean ok, D dto, ApiError error) {
        this.ok = ok;
        this.dto = dto;
        this.error = error;
    }

    /** Creates a successful result; the dto may be {@code null} for empty responses. */
    public static <D> CallResult<D> ok(D dto) {
        return new CallResult<>(true, dto, null);
    }

    /** Creates a failed result. */
    public static <D> CallResult<D> failed(ApiError error) {
        Objects.requireNonNull(error, "error must not be null for a failed result");
        return new CallResult<>(false, null, error);
    }

    /** Element 0 of the pair. */
    public boolean ok() {
        return ok;
    }

    /** The dto. Only meaningful when {@link #ok()} is true. */
    public D dto() {
        return dto;
    }

    /** The normalized error. Only meaningful when {@link #ok()} is false. */
    public ApiError error() {
        return error;
    }

    /** Element 1 of the pair: the dto on success, the error otherwise. */
    public Object value() {
        return ok ? dto : error;
    }

    /** Folds both branches into one value. */
    public <R> R fold(Function<? super D, ? extends R> onOk, Function<? super ApiError, ? extends R> onError) {
        return ok ? onOk.apply(dto) : onError.apply(error);
    }

    @Override
    public String toString() {
        return ok
                ? "CallResult[ok, dto=" + dto + "]"
                : "CallResult[failed, type=" + error.type() + ", status=" + error.status() + "]";
    }
}
