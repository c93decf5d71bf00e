package io.cleanapi.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cleanapi.core.error.ValidationIssue;
import java.util.List;
import java.util.Objects;

/**
 * Normalized error returned by {@code safeCall}. Every failure, whatever its origin, becomes
 * exactly one of the variants below, and callers can branch on {@link #type()} alone.
 *
 * <p>
 * Status codes of zero and below are reserved for client-side and transport failures; positive
 * codes are HTTP statuses reported by the server:
 *
 * <table>
 * <caption>Variants</caption>
 * <tr><th>type</th><th>status</th><th>meta</th></tr>
 * <tr><td>server-declared, e.g. {@code user_not_found}</td><td>HTTP status</td><td>server {@code meta}, if any</td></tr>
 * <tr><td>{@code aborted}</td><td>0</td><td></td></tr>
 * <tr><td>{@code client_exception}</td><td>-1</td><td></td></tr>
 * <tr><td>{@code no_internet}</td><td>-2</td><td></td></tr>
 * <tr><td>{@code no_server_response}</td><td>-3</td><td></td></tr>
 * <tr><td>{@code configuration_issue}</td><td>-4</td><td></td></tr>
 * <tr><td>{@code unsupported_server_response}</td><td>-5</td><td>{@code originalStatus, originalResponse}</td></tr>
 * <tr><td>{@code validation_error}</td><td>-6</td><td>{@code issues}</td></tr>
 * </table>
 *
 * <p>
 * {@link #rawError()} always holds the throwable that was classified.
 */
public sealed interface ApiError {

    String ABORTED = "aborted";
    String CLIENT_EXCEPTION = "client_exception";
    String NO_INTERNET = "no_internet";
    String NO_SERVER_RESPONSE = "no_server_response";
    String CONFIGURATION_ISSUE = "configuration_issue";
    String UNSUPPORTED_SERVER_RESPONSE = "unsupported_server_response";
    String VALIDATION_ERROR = "validation_error";

    /** Discriminating tag. */
    String type();

    int status();

    String message();

    /** Variant-specific details, or {@code null} for variants without meta. */
    JsonNode meta();

    /** The original failure. */
    Throwable rawError();

    /** True for errors that came from the server's own error envelope. */
    default boolean isContractError() {
        return this instanceof ContractError;
    }

    /** Error declared by the server through its {@code {message, type?, meta?}} envelope. */
    record ContractError(String type, int status, String message, JsonNode meta, Throwable rawError)
            implements ApiError {
        public ContractError {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(message, "message");
        }
    }

    /** The call was cancelled through its signal. */
    record Aborted(Throwable rawError) implements ApiError {
        public String type() {
            return ABORTED;
        }

        public int status() {
            return 0;
        }

        public String message() {
            return "Request aborted";
        }

        public JsonNode meta() {
            return null;
        }
    }

    /** Any failure that is not a transport, validation or cancellation failure. */
    record ClientException(Throwable rawError) implements ApiError {
        public String type() {
            return CLIENT_EXCEPTION;
        }

        public int status() {
            return -1;
        }

        public String message() {
            return "Client exception";
        }

        public JsonNode meta() {
            return null;
        }
    }

    /** No response arrived and the host reports no network connectivity. */
    record NoInternet(Throwable rawError) implements ApiError {
        public String type() {
            return NO_INTERNET;
        }

        public int status() {
            return -2;
        }

        public String message() {
            return "No internet connection";
        }

        public JsonNode meta() {
            return null;
        }
    }

    /** The request went out but no response arrived. */
    record NoServerResponse(Throwable rawError) implements ApiError {
        public String type() {
            return NO_SERVER_RESPONSE;
        }

        public int status() {
            return -3;
        }

        public String message() {
            return "No server response";
        }

        public JsonNode meta() {
            return null;
        }
    }

    /** The request could not be set up. */
    record ConfigurationIssue(Throwable rawError) implements ApiError {
        public String type() {
            return CONFIGURATION_ISSUE;
        }

        public int status() {
            return -4;
        }

        public String message() {
            return "Error setting up the request";
        }

        public JsonNode meta() {
            return null;
        }
    }

    /** The server answered with an error whose body is not a recognized error envelope. */
    record UnsupportedServerResponse(int originalStatus, JsonNode originalResponse, Throwable rawError)
            implements ApiError {
        public String type() {
            return UNSUPPORTED_SERVER_RESPONSE;
        }

        public int status() {
            return -5;
        }

        public String message() {
            return "The server's error response format is unsupported.";
        }

        public JsonNode meta() {
            ObjectNode meta = JsonNodeFactory.instance.objectNode();
            meta.put("originalStatus", originalStatus);
            meta.set("originalResponse", originalResponse);
            return meta;
        }
    }

    /** An input or the dto failed validation. */
    record ValidationFailed(List<ValidationIssue> issues, Throwable rawError) implements ApiError {
        public ValidationFailed {
            issues = List.copyOf(issues);
        }

        public String type() {
            return VALIDATION_ERROR;
        }

        public int status() {
            return -6;
        }

        public String message() {
            return "Validation failed";
        }

        public JsonNode meta() {
            ObjectNode meta = JsonNodeFactory.instance.objectNode();
            ArrayNode array = meta.putArray("issues");
            for (ValidationIssue issue : issues) {
                ObjectNode node = array.addObject();
                ArrayNode path = node.putArray("path");
                for (Object segment : issue.path()) {
                    if (segment instanceof Integer index) {
                        path.add(index);
                    } else {
                        path.add(String.valueOf(segment));
                    }
                }
                node.put("message", issue.message());
            }
            return meta;
        }
    }
}
