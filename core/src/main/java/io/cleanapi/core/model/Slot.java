package io.cleanapi.core.model;

/**
 * The validator slots of an endpoint. The first four are call inputs; {@link #DTO} is the
 * successful result and {@link #ERROR} the server-declared error shape.
 */
public enum Slot {
    PATH_PARAMS("pathParams", true),
    SEARCH_PARAMS("searchParams", true),
    PAYLOAD("payload", true),
    EXTRA("extra", true),
    DTO("dto", false),
    ERROR("error", false);

    private final String key;
    private final boolean input;

    Slot(String key, boolean input) {
        this.key = key;
        this.input = input;
    }

    /** The slot's name in the wire and hook vocabulary, e.g. {@code pathParams}. */
    public String key() {
        return key;
    }

    /** True for the slots a caller supplies in a {@link CallInput}. */
    public boolean isInput() {
        return input;
    }
}
