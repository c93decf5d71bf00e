package io.cleanapi.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ClientConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Expected layout (every key optional):
 *
 * <pre>
 * client:
 *   base-url: https://api.example.com
 *   connect-timeout-ms: 2000
 *   read-timeout-ms: 10000
 *   follow-redirects: false
 *   default-headers:
 *     accept: application/json
 * attributes:
 *   tenant: acme
 * </pre>
 *
 * <p>
 * Environment variables take precedence over YAML values: {@code CLEANAPI_BASE_URL},
 * {@code CLEANAPI_CONNECT_TIMEOUT_MS}, {@code CLEANAPI_READ_TIMEOUT_MS},
 * {@code CLEANAPI_FOLLOW_REDIRECTS}. An env var is "set" if and only if it is defined AND its
 * trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_BASE_URL = "CLEANAPI_BASE_URL";
    static final String ENV_CONNECT_TIMEOUT_MS = "CLEANAPI_CONNECT_TIMEOUT_MS";
    static final String ENV_READ_TIMEOUT_MS = "CLEANAPI_READ_TIMEOUT_MS";
    static final String ENV_FOLLOW_REDIRECTS = "CLEANAPI_FOLLOW_REDIRECTS";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link ClientConfig} from the given YAML file, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ClientConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ClientConfig} from the given YAML file, applying overrides from the supplied
     * lookup function. Returning {@code null} from {@code envLookup} means "not defined".
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ClientConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    private static ClientConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ClientConfig.Builder builder = ClientConfig.builder();

        JsonNode client = root.path("client");
        if (client.has("base-url")) builder.baseUrl(client.get("base-url").asText());
        if (client.has("connect-timeout-ms"))
            builder.connectTimeoutMs(requireInt(client, "connect-timeout-ms"));
        if (client.has("read-timeout-ms")) builder.readTimeoutMs(requireInt(client, "read-timeout-ms"));
        if (client.has("follow-redirects"))
            builder.followRedirects(client.get("follow-redirects").asBoolean());

        JsonNode headers = client.path("default-headers");
        for (Iterator<Map.Entry<String, JsonNode>> it = headers.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> header = it.next();
            builder.defaultHeader(header.getKey(), header.getValue().asText());
        }

        JsonNode attributes = root.path("attributes");
        for (Iterator<Map.Entry<String, JsonNode>> it = attributes.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> attribute = it.next();
            builder.attribute(attribute.getKey(), YAML_MAPPER.convertValue(attribute.getValue(), Object.class));
        }

        envString(envLookup, ENV_BASE_URL, builder::baseUrl);
        envInt(envLookup, ENV_CONNECT_TIMEOUT_MS, builder::connectTimeoutMs);
        envInt(envLookup, ENV_READ_TIMEOUT_MS, builder::readTimeoutMs);
        envBool(envLookup, ENV_FOLLOW_REDIRECTS, builder::followRedirects);

        return builder.build();
    }

    private static int requireInt(JsonNode parent, String key) {
        JsonNode value = parent.get(key);
        if (!value.canConvertToInt()) {
            throw new ConfigLoadException("client." + key + " must be an integer, got: " + value);
        }
        return value.asInt();
    }

    /** Returns {@code true} if the env var is defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: " + raw, e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
