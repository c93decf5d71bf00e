package io.cleanapi.core.error;

import java.util.List;
import java.util.Objects;

/**
 * One structural problem found by a validator.
 *
 * @param path    location of the problem inside the validated value; each segment is either a
 *                {@link String} property name or an {@link Integer} array index
 * @param message human-readable description
 */
public record ValidationIssue(List<Object> path, String message) {

    public ValidationIssue {
        path = List.copyOf(Objects.requireNonNull(path, "path"));
        Objects.requireNonNull(message, "message");
    }

    /** Issue at the root of the validated value. */
    public static ValidationIssue root(String message) {
        return new ValidationIssue(List.of(), message);
    }

    /** Issue at the given path segments. */
    public static ValidationIssue at(String message, Object... path) {
        return new ValidationIssue(List.of(path), message);
    }

    /** Dotted rendering of the path, e.g. {@code items.0.name}; empty for the root. */
    public String pathString() {
        StringBuilder sb = new StringBuilder();
        for (Object segment : path) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(segment);
        }
        return sb.toString();
    }
}
