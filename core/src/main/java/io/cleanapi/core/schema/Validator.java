package io.cleanapi.core.schema;

import io.cleanapi.core.error.ValidationException;
import java.util.Optional;

/**
 * Uniform validation function used by every endpoint slot: returns the validated (possibly
 * converted) value or throws {@link ValidationException} listing every issue found.
 *
 * <p>
 * Implementations must be idempotent on already-valid data: validating the output of a
 * successful {@code validate} call yields an equal value. Implementations must be thread-safe.
 *
 * @param <T> the validated value's type
 */
@FunctionalInterface
public interface Validator<T> {

    /**
     * Validates {@code data}.
     *
     * @param data the value to validate, may be {@code null}
     * @return the validated value
     * @throws ValidationException if {@code data} does not have the expected shape
     */
    T validate(Object data);

    /**
     * The declarative schema object this validator was built from, for reuse by external
     * tooling (form generators, documentation). Empty for hand-written validators.
     */
    default Optional<Object> rawSchema() {
        return Optional.empty();
    }
}
