package io.cleanapi.core.model;

/** HTTP methods an endpoint may declare. */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE;

    /** Whether a supplied payload is sent as the request body. GET requests never carry one. */
    public boolean allowsBody() {
        return this != GET;
    }
}
