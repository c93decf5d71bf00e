package io.cleanapi.core.error;

import io.cleanapi.core.model.Slot;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by a validator when the value does not have the expected shape. Carries every issue the
 * validator found, not just the first one.
 *
 * <p>
 * Raised before the network call for input slots and after it for the dto. {@code call} lets it
 * propagate; {@code safeCall} turns it into a {@code validation_error} value.
 */
public final class ValidationException extends CleanApiException {

    private static final long serialVersionUID = 1L;

    private final transient List<ValidationIssue> issues;
    private final Slot slot;

    public ValidationException(List<ValidationIssue> issues) {
        this(issues, null, null);
    }

    public ValidationException(List<ValidationIssue> issues, String endpoint, Slot slot) {
        super(describe(issues, endpoint, slot), endpoint, Stage.VALIDATION);
        this.issues = List.copyOf(issues);
        this.slot = slot;
    }

    /** Single-issue convenience constructor. */
    public static ValidationException of(String message, Object... path) {
        return new ValidationException(List.of(ValidationIssue.at(message, path)));
    }

    /** The issues, in the order the validator reported them. */
    public List<ValidationIssue> issues() {
        return issues;
    }

    /** The slot that failed, or {@code null} when raised outside the call pipeline. */
    public Slot slot() {
        return slot;
    }

    /**
     * Returns a copy attributed to the given endpoint and slot. Validators don't know where they
     * are used, so the pipeline re-labels what they throw.
     */
    public ValidationException attributedTo(String endpoint, Slot slot) {
        ValidationException copy = new ValidationException(issues, endpoint, slot);
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    private static String describe(List<ValidationIssue> issues, String endpoint, Slot slot) {
        String where = endpoint == null ? "" : " for endpoint '" + endpoint + "'";
        String which = slot == null ? "" : " (" + slot.key() + ")";
        String detail = issues.stream()
                .map(i -> i.path().isEmpty() ? i.message() : i.pathString() + ": " + i.message())
                .collect(Collectors.joining("; "));
        return "Validation failed" + where + which + ": " + detail;
    }
}
