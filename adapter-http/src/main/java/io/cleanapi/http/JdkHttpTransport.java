package io.cleanapi.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.cleanapi.core.config.ClientConfig;
import io.cleanapi.core.contract.UrlEncoding;
import io.cleanapi.core.error.CallAbortedException;
import io.cleanapi.core.error.HttpResponseException;
import io.cleanapi.core.error.NoResponseException;
import io.cleanapi.core.error.RequestSetupException;
import io.cleanapi.core.model.Subscription;
import io.cleanapi.core.spi.Transport;
import io.cleanapi.core.spi.TransportRequest;
import io.cleanapi.core.spi.TransportResponse;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Transport} on the JDK {@link HttpClient}.
 *
 * <p>
 * The request URL is the base URL, the interpolated path and the encoded query string. A
 * supplied payload is serialized with Jackson and sent as {@code application/json}. Response
 * bodies are parsed to {@link JsonNode}: an empty body becomes {@code null}, a body that is not
 * JSON becomes a text node.
 *
 * <p>
 * Requests go out with {@code sendAsync} so the call's cancellation signal can cancel the
 * in-flight exchange. Failures map to the transport exception family:
 * <ul>
 * <li>non-2xx status: {@link HttpResponseException}</li>
 * <li>connect refused, timeouts, I/O: {@link NoResponseException}</li>
 * <li>no base URL, bad URI, unserializable payload: {@link RequestSetupException}</li>
 * <li>cancelled signal or interrupted thread: {@link CallAbortedException}</li>
 * </ul>
 *
 * <p>
 * Thread-safe; the underlying {@link HttpClient} is shared by all calls.
 */
public final class JdkHttpTransport implements Transport {

    private static final Logger LOG = LoggerFactory.getLogger(JdkHttpTransport.class);

    /** Headers the JDK client manages itself or refuses to set. */
    private static final Set<String> RESTRICTED_HEADERS =
            Set.of("host", "content-length", "connection", "expect", "upgrade", "transfer-encoding");

    private static final String JSON = "application/json";

    private final HttpClient httpClient;
    private final ClientConfig config;
    private final ObjectMapper mapper;

    public JdkHttpTransport(ClientConfig config) {
        this(config, new ObjectMapper());
    }

    /**
     * @param config connection settings; the base URL and default headers can be overridden
     *               per request through {@link TransportRequest#config()}
     * @param mapper mapper for request and response bodies
     */
    public JdkHttpTransport(ClientConfig config, ObjectMapper mapper) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(config.connectTimeoutMs()))
                .followRedirects(config.followRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .build();

        LOG.debug("JdkHttpTransport initialized: base_url={}", config.baseUrl());
    }

    @Override
    public TransportResponse execute(TransportRequest request) {
        String endpoint = request.endpoint();
        ClientConfig effective = request.config() != null ? request.config() : config;
        HttpRequest httpRequest = buildRequest(request, effective);

        if (request.signal() != null) {
            request.signal().throwIfCancelled(endpoint);
        }
        LOG.debug("Sending request: endpoint={}, method={}, uri={}", endpoint, request.method(), httpRequest.uri());

        CompletableFuture<HttpResponse<String>> future =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
        Subscription cancelHook = request.signal() == null
                ? () -> {}
                : request.signal().onCancel(() -> future.cancel(true));

        HttpResponse<String> response;
        try {
            response = future.get();
        } catch (CancellationException e) {
            throw new CallAbortedException(endpoint, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CallAbortedException(endpoint, e);
        } catch (ExecutionException e) {
            throw mapFailure(endpoint, httpRequest.uri(), e.getCause() == null ? e : e.getCause());
        } finally {
            cancelHook.unsubscribe();
        }

        int status = response.statusCode();
        JsonNode body = parseBody(response.body());
        LOG.debug("Response received: endpoint={}, status={}", endpoint, status);

        if (status < 200 || status >= 300) {
            throw new HttpResponseException(status, ReasonPhrases.of(status), body, endpoint);
        }
        return new TransportResponse(status, ReasonPhrases.of(status), responseHeaders(response), body);
    }

    /** Package-private for tests. */
    HttpClient httpClient() {
        return httpClient;
    }

    private HttpRequest buildRequest(TransportRequest request, ClientConfig effective) {
        String endpoint = request.endpoint();
        if (effective.baseUrl().isEmpty()) {
            throw new RequestSetupException("No base URL configured", null, endpoint);
        }
        String query = UrlEncoding.buildQueryString(request.searchParams());
        String target = effective.baseUrl() + request.path() + (query.isEmpty() ? "" : "?" + query);

        URI uri;
        try {
            uri = URI.create(target);
        } catch (IllegalArgumentException e) {
            throw new RequestSetupException("Invalid request URI: " + target, e, endpoint);
        }

        HttpRequest.BodyPublisher publisher = HttpRequest.BodyPublishers.noBody();
        if (request.hasBody()) {
            try {
                publisher = HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(request.body()));
            } catch (JsonProcessingException e) {
                throw new RequestSetupException("Payload is not serializable: " + e.getOriginalMessage(), e, endpoint);
            }
        }

        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(Duration.ofMillis(effective.readTimeoutMs()))
                    .method(request.method().name(), publisher)
                    .header("accept", JSON);
            if (request.hasBody()) {
                builder.header("content-type", JSON);
            }
            for (Map.Entry<String, String> header : effective.defaultHeaders().entrySet()) {
                if (!RESTRICTED_HEADERS.contains(header.getKey().toLowerCase())) {
                    builder.setHeader(header.getKey(), header.getValue());
                }
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            // unsupported scheme, missing host or an illegal header value
            throw new RequestSetupException("Invalid request: " + e.getMessage(), e, endpoint);
        }
    }

    private static RuntimeException mapFailure(String endpoint, URI uri, Throwable cause) {
        if (cause instanceof HttpConnectTimeoutException) {
            return new NoResponseException("Connect timeout to " + uri, cause, endpoint);
        }
        if (cause instanceof HttpTimeoutException) {
            return new NoResponseException("Read timeout from " + uri, cause, endpoint);
        }
        if (cause instanceof ConnectException) {
            return new NoResponseException("Connection refused by " + uri, cause, endpoint);
        }
        if (cause instanceof IOException) {
            return new NoResponseException("Failed to reach " + uri, cause, endpoint);
        }
        if (cause instanceof IllegalArgumentException) {
            return new RequestSetupException("Request rejected by the HTTP client: " + cause.getMessage(), cause, endpoint);
        }
        return new NoResponseException("Request to " + uri + " failed: " + cause, cause, endpoint);
    }

    private JsonNode parseBody(String raw) {
        if (raw == null || raw.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            LOG.debug("Response body is not JSON, keeping it as text: {}", e.getOriginalMessage());
            return TextNode.valueOf(raw);
        }
    }

    private static Map<String, String> responseHeaders(HttpResponse<?> response) {
        Map<String, String> headers = new LinkedHashMap<>();
        response.headers().map().forEach((name, values) -> {
            if (!values.isEmpty()) {
                headers.put(name.toLowerCase(), firstOf(values));
            }
        });
        return headers;
    }

    private static String firstOf(List<String> values) {
        return values.get(0);
    }
}
