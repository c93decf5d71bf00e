package io.cleanapi.core.contract;

import java.lang.reflect.Array;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * RFC 3986 percent-encoding for path segments and query components. Unreserved characters
 * ({@code A-Z a-z 0-9 - . _ ~}) are left as-is; everything else, including {@code /}, is
 * encoded from its UTF-8 bytes.
 */
public final class UrlEncoding {

    private UrlEncoding() {
        // utility class
    }

    /** Encodes a single path segment; {@code "a/b c"} becomes {@code "a%2Fb%20c"}. */
    public static String encodePathSegment(String segment) {
        return encode(segment);
    }

    /** Encodes a query parameter name or value. */
    public static String encodeQueryComponent(String component) {
        return encode(component);
    }

    /**
     * Builds a query string (without the leading {@code ?}) from the given parameters, in map
     * order. {@code null} values are skipped; arrays and {@link Iterable}s produce one
     * {@code key=value} pair per element. Returns an empty string when nothing remains.
     */
    public static String buildQueryString(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            if (value instanceof Iterable<?> iterable) {
                for (Object element : iterable) {
                    appendPair(sb, entry.getKey(), element);
                }
            } else if (value.getClass().isArray()) {
                for (int i = 0; i < Array.getLength(value); i++) {
                    appendPair(sb, entry.getKey(), Array.get(value, i));
                }
            } else {
                appendPair(sb, entry.getKey(), value);
            }
        }
        return sb.toString();
    }

    private static void appendPair(StringBuilder sb, String key, Object value) {
        if (value == null) {
            return;
        }
        if (sb.length() > 0) {
            sb.append('&');
        }
        sb.append(encode(key)).append('=').append(encode(String.valueOf(value)));
    }

    private static String encode(String raw) {
        if (raw == null || raw.isEmpty()) {
            return raw;
        }
        // URLEncoder targets form data: fix up space, '*' and '~' for RFC 3986
        return URLEncoder.encode(raw, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }
}
