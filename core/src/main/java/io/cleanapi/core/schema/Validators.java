package io.cleanapi.core.schema;

import io.cleanapi.core.error.ValidationException;
import io.cleanapi.core.error.ValidationIssue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/** Factories for {@link Validator}s built from hand-written checks. */
public final class Validators {

    private Validators() {
        // utility class
    }

    /**
     * Wraps a checking function. The function returns the validated value or throws
     * {@link ValidationException}.
     */
    public static <T> Validator<T> check(Function<Object, T> validator) {
        Objects.requireNonNull(validator, "validator");
        return validator::apply;
    }

    /**
     * Wraps a checking function and attaches the raw schema object it implements, so that
     * {@code getRawSchema} can expose it.
     */
    public static <T> Validator<T> check(Function<Object, T> validator, Object rawSchema) {
        Objects.requireNonNull(validator, "validator");
        Objects.requireNonNull(rawSchema, "rawSchema");
        return new Validator<>() {
            @Override
            public T validate(Object data) {
                return validator.apply(data);
            }

            @Override
            public Optional<Object> rawSchema() {
                return Optional.of(rawSchema);
            }
        };
    }

    /** Accepts instances of {@code type} and returns them cast; rejects everything else. */
    public static <T> Validator<T> instanceOf(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return data -> {
            if (!type.isInstance(data)) {
                throw ValidationException.of(
                        "Expected " + type.getSimpleName() + ", got "
                                + (data == null ? "null" : data.getClass().getSimpleName()));
            }
            return type.cast(data);
        };
    }

    /**
     * Accepts maps containing every one of {@code keys} with a non-null value. Reports each missing
     * key as its own issue.
     */
    public static Validator<Map<String, Object>> requiredKeys(String... keys) {
        List<String> required = List.of(keys);
        return data -> {
            if (!(data instanceof Map<?, ?> map)) {
                throw ValidationException.of("Expected an object");
            }
            List<ValidationIssue> issues = new ArrayList<>();
            for (String key : required) {
                if (map.get(key) == null) {
                    issues.add(ValidationIssue.at("Required", key));
                }
            }
            if (!issues.isEmpty()) {
                throw new ValidationException(issues);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> typed = (Map<String, Object>) map;
            return typed;
        };
    }
}
