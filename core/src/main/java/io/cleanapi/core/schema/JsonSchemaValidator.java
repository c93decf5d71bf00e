package io.cleanapi.core.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.cleanapi.core.error.ContractDefinitionException;
import io.cleanapi.core.error.ValidationException;
import io.cleanapi.core.error.ValidationIssue;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link Validator} backed by a JSON Schema (2020-12) document.
 *
 * <p>
 * The input is converted to a Jackson tree, validated against the schema, and then either
 * returned as a {@link JsonNode} or bound to a target type. Every {@link ValidationMessage} is
 * flattened into a {@link ValidationIssue} whose path is derived from the instance location
 * ({@code $.items[0].name} becomes {@code ["items", 0, "name"]}).
 *
 * <p>
 * The schema document is exposed through {@link #rawSchema()}.
 *
 * <p>
 * Thread-safe: the compiled {@link JsonSchema} and the {@link ObjectMapper} are both safe for
 * concurrent use.
 *
 * @param <T> the validated value's type
 */
public final class JsonSchemaValidator<T> implements Validator<T> {

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final JsonNode schemaNode;
    private final JsonSchema schema;
    private final Class<T> targetType;
    private final ObjectMapper mapper;

    private JsonSchemaValidator(JsonNode schemaNode, Class<T> targetType, ObjectMapper mapper) {
        this.schemaNode = Objects.requireNonNull(schemaNode, "schemaNode");
        this.targetType = targetType;
        this.mapper = mapper;
        try {
            this.schema = SCHEMA_FACTORY.getSchema(schemaNode);
        } catch (RuntimeException e) {
            throw new ContractDefinitionException("Invalid JSON Schema: " + e.getMessage(), e, null, null);
        }
    }

    /** Validator returning the validated value as a {@link JsonNode}. */
    public static JsonSchemaValidator<JsonNode> of(JsonNode schema) {
        return new JsonSchemaValidator<>(schema, null, DEFAULT_MAPPER);
    }

    /** Validator binding the validated value to {@code type}. */
    public static <T> JsonSchemaValidator<T> of(JsonNode schema, Class<T> type) {
        return new JsonSchemaValidator<>(schema, Objects.requireNonNull(type, "type"), DEFAULT_MAPPER);
    }

    /** Validator binding to {@code type} with a caller-configured mapper (modules, naming strategy). */
    public static <T> JsonSchemaValidator<T> of(JsonNode schema, Class<T> type, ObjectMapper mapper) {
        return new JsonSchemaValidator<>(
                schema, Objects.requireNonNull(type, "type"), Objects.requireNonNull(mapper, "mapper"));
    }

    /** Parses the schema from YAML (or JSON, which is valid YAML). */
    public static JsonSchemaValidator<JsonNode> fromYaml(String schemaYaml) {
        return of(parse(schemaYaml));
    }

    /** Parses the schema from YAML (or JSON) and binds validated values to {@code type}. */
    public static <T> JsonSchemaValidator<T> fromYaml(String schemaYaml, Class<T> type) {
        return of(parse(schemaYaml), type);
    }

    /** Loads the schema from a classpath resource (YAML or JSON) and binds to {@code type}. */
    public static <T> JsonSchemaValidator<T> fromResource(String resource, Class<T> type) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = JsonSchemaValidator.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ContractDefinitionException("Schema resource not found: " + resource, null, null);
            }
            return of(YAML_MAPPER.readTree(in), type);
        } catch (IOException e) {
            throw new ContractDefinitionException(
                    "Failed to read schema resource " + resource + ": " + e.getMessage(), e, null, null);
        }
    }

    @Override
    public T validate(Object data) {
        JsonNode instance = toTree(data);
        Set<ValidationMessage> messages = schema.validate(instance);
        if (!messages.isEmpty()) {
            List<ValidationIssue> issues = new ArrayList<>(messages.size());
            for (ValidationMessage message : messages) {
                issues.add(toIssue(message));
            }
            throw new ValidationException(issues);
        }
        return bind(instance);
    }

    @Override
    public Optional<Object> rawSchema() {
        return Optional.of(schemaNode);
    }

    /** The schema document. */
    public JsonNode schemaNode() {
        return schemaNode;
    }

    private JsonNode toTree(Object data) {
        if (data instanceof JsonNode node) {
            return node;
        }
        try {
            return mapper.valueToTree(data);
        } catch (IllegalArgumentException e) {
            throw ValidationException.of("Value cannot be represented as JSON: " + e.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private T bind(JsonNode instance) {
        if (targetType == null || targetType == JsonNode.class) {
            return (T) instance;
        }
        try {
            return mapper.treeToValue(instance, targetType);
        } catch (JsonProcessingException e) {
            throw ValidationException.of(
                    "Value cannot be mapped to " + targetType.getSimpleName() + ": " + e.getOriginalMessage());
        }
    }

    static ValidationIssue toIssue(ValidationMessage message) {
        String location = message.getInstanceLocation() == null
                ? "$"
                : message.getInstanceLocation().toString();
        String text = message.getMessage();
        String prefix = location + ": ";
        if (text != null && text.startsWith(prefix)) {
            text = text.substring(prefix.length());
        }
        return new ValidationIssue(parseLocation(location), text == null ? "Invalid value" : text);
    }

    /**
     * Parses a JSONPath-style instance location ({@code $.a.b[0]['c d']}) into segments. Array
     * indices become {@link Integer}s, everything else {@link String}s.
     */
    static List<Object> parseLocation(String location) {
        List<Object> segments = new ArrayList<>();
        int i = location.startsWith("$") ? 1 : 0;
        int n = location.length();
        while (i < n) {
            char c = location.charAt(i);
            if (c == '.') {
                int end = i + 1;
                while (end < n && location.charAt(end) != '.' && location.charAt(end) != '[') {
                    end++;
                }
                segments.add(location.substring(i + 1, end));
                i = end;
            } else if (c == '[') {
                int close = location.indexOf(']', i);
                if (close < 0) {
                    segments.add(location.substring(i + 1));
                    break;
                }
                String inner = location.substring(i + 1, close);
                if (inner.length() >= 2 && inner.startsWith("'") && inner.endsWith("'")) {
                    segments.add(inner.substring(1, inner.length() - 1));
                } else {
                    try {
                        segments.add(Integer.parseInt(inner));
                    } catch (NumberFormatException e) {
                        segments.add(inner);
                    }
                }
                i = close + 1;
            } else if (c == '/') {
                // JSON Pointer rendering
                int end = location.indexOf('/', i + 1);
                String token = location.substring(i + 1, end < 0 ? n : end)
                        .replace("~1", "/")
                        .replace("~0", "~");
                segments.add(token.chars().allMatch(Character::isDigit) && !token.isEmpty()
                        ? (Object) Integer.parseInt(token)
                        : token);
                i = end < 0 ? n : end;
            } else {
                i++;
            }
        }
        return segments;
    }

    private static JsonNode parse(String schemaText) {
        try {
            return YAML_MAPPER.readTree(schemaText);
        } catch (JsonProcessingException e) {
            throw new ContractDefinitionException(
                    "Schema is not valid YAML/JSON: " + e.getOriginalMessage(), e, null, null);
        }
    }
}
