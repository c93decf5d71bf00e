package io.cleanapi.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Map;

/**
 * Successful response returned by a {@link Transport}.
 *
 * @param status       the HTTP status code (2xx)
 * @param reasonPhrase the status text
 * @param headers      single-value header map (lowercase keys, first value wins)
 * @param body         the body parsed as JSON; a textual node when it was not JSON, a null
 *                     node when empty
 */
public record TransportResponse(int status, String reasonPhrase, Map<String, String> headers, JsonNode body) {

    public TransportResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? NullNode.getInstance() : body;
    }
}
