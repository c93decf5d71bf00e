package io.cleanapi.core.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Ambient per-client configuration. Transports read the connection settings; the whole record
 * is handed to {@code onCall} hooks and resolvers.
 *
 * <p>
 * Use {@link #builder()} to construct instances with defaults applied.
 *
 * @param baseUrl          scheme, host and optional port and prefix prepended to every path,
 *                         e.g. {@code https://api.example.com/v1}; may be empty for resolver-only
 *                         clients
 * @param defaultHeaders   headers sent with every request (lowercase keys)
 * @param connectTimeoutMs TCP connect timeout in ms
 * @param readTimeoutMs    response timeout in ms
 * @param followRedirects  whether 3xx responses are followed
 * @param attributes       free-form application values (tenant, locale, ...) made visible to
 *                         hooks and resolvers
 */
public record ClientConfig(
        String baseUrl,
        Map<String, String> defaultHeaders,
        int connectTimeoutMs,
        int readTimeoutMs,
        boolean followRedirects,
        Map<String, Object> attributes) {

    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_READ_TIMEOUT_MS = 30_000;

    public ClientConfig {
        baseUrl = baseUrl == null ? "" : stripTrailingSlash(baseUrl.trim());
        defaultHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(defaultHeaders == null ? Map.of() : defaultHeaders));
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes == null ? Map.of() : attributes));
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("connectTimeoutMs must be positive, got " + connectTimeoutMs);
        }
        if (readTimeoutMs <= 0) {
            throw new IllegalArgumentException("readTimeoutMs must be positive, got " + readTimeoutMs);
        }
    }

    /** Creates a new builder with sensible defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this configuration. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.baseUrl = baseUrl;
        b.defaultHeaders.putAll(defaultHeaders);
        b.connectTimeoutMs = connectTimeoutMs;
        b.readTimeoutMs = readTimeoutMs;
        b.followRedirects = followRedirects;
        b.attributes.putAll(attributes);
        return b;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /** Builder for {@link ClientConfig}. */
    public static final class Builder {

        private String baseUrl = "";
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
        private int connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
        private int readTimeoutMs = DEFAULT_READ_TIMEOUT_MS;
        private boolean followRedirects;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        Builder() {}

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        /** Adds a default header; the name is lower-cased. */
        public Builder defaultHeader(String name, String value) {
            this.defaultHeaders.put(name.toLowerCase(Locale.ROOT), value);
            return this;
        }

        public Builder connectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder readTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
            return this;
        }

        public Builder followRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        public Builder attribute(String name, Object value) {
            this.attributes.put(name, value);
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(
                    baseUrl, defaultHeaders, connectTimeoutMs, readTimeoutMs, followRedirects, attributes);
        }
    }
}
