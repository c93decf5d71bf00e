package io.cleanapi.core.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Thrown when the server responded with a status outside the 2xx range. Carries the response so
 * the error normalizer can read the server's error envelope.
 */
public class HttpResponseException extends TransportException {

    private static final long serialVersionUID = 1L;

    private final int status;
    private final String reasonPhrase;
    private final transient JsonNode body;

    /**
     * @param status       the HTTP status code
     * @param reasonPhrase the status text, e.g. {@code Not Found}
     * @param body         the response body; textual node if it was not JSON, null node if empty
     * @param endpoint     the endpoint being called, may be null
     */
    public HttpResponseException(int status, String reasonPhrase, JsonNode body, String endpoint) {
        super("Server responded with " + status + " " + reasonPhrase, null, endpoint);
        this.status = status;
        this.reasonPhrase = reasonPhrase;
        this.body = body != null ? body : NullNode.getInstance();
    }

    public int status() {
        return status;
    }

    public String reasonPhrase() {
        return reasonPhrase;
    }

    public JsonNode body() {
        return body;
    }
}
