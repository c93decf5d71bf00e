package io.cleanapi.core.contract;

import io.cleanapi.core.error.ContractDefinitionException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parsed endpoint path such as {@code /users/:id/posts/:postId}.
 *
 * <p>
 * A placeholder is a whole path segment starting with {@code :}; its name must be a valid
 * identifier and may appear only once. A {@code :} elsewhere in a segment is literal text.
 *
 * <p>
 * {@link #interpolate(Map)} substitutes {@code String.valueOf(value)} for each placeholder and
 * percent-encodes it as a single segment, so a value containing {@code /} cannot change the
 * path's shape.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class PathTemplate {

    private static final Pattern PLACEHOLDER_NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private final String template;
    /** Literal text between placeholders; always one more entry than {@link #names}. */
    private final List<String> literals;
    private final List<String> names;
    private final Set<String> placeholders;

    private PathTemplate(String template, List<String> literals, List<String> names) {
        this.template = template;
        this.literals = List.copyOf(literals);
        this.names = List.copyOf(names);
        this.placeholders = Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    /**
     * Parses a template.
     *
     * @param template the path template
     * @param endpoint endpoint name used in error messages, may be null
     * @throws ContractDefinitionException if the template does not start with {@code /} or has a
     *                                     malformed or duplicated placeholder
     */
    public static PathTemplate parse(String template, String endpoint) {
        if (template == null || !template.startsWith("/")) {
            throw new ContractDefinitionException(
                    "Path \"" + template + "\" must start with a '/'.", endpoint, template);
        }
        List<String> literals = new ArrayList<>();
        List<String> names = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        StringBuilder literal = new StringBuilder();
        String[] segments = template.split("/", -1);
        for (int i = 1; i < segments.length; i++) {
            String segment = segments[i];
            literal.append('/');
            if (!segment.startsWith(":")) {
                literal.append(segment);
                continue;
            }
            String name = segment.substring(1);
            if (!PLACEHOLDER_NAME.matcher(name).matches()) {
                throw new ContractDefinitionException(
                        "Path \"" + template + "\" has a malformed placeholder '" + segment + "'.", endpoint, template);
            }
            if (!seen.add(name)) {
                throw new ContractDefinitionException(
                        "Path \"" + template + "\" declares placeholder ':" + name + "' more than once.",
                        endpoint,
                        template);
            }
            literals.add(literal.toString());
            literal.setLength(0);
            names.add(name);
        }
        literals.add(literal.toString());
        return new PathTemplate(template, literals, names);
    }

    /** The template as written. */
    public String template() {
        return template;
    }

    /** Placeholder names in order of appearance. */
    public Set<String> placeholders() {
        return placeholders;
    }

    public boolean hasPlaceholders() {
        return !names.isEmpty();
    }

    /**
     * Substitutes every placeholder.
     *
     * @param pathParams values keyed by placeholder name; may be null when the template has no
     *                   placeholders
     * @return the concrete path
     * @throws IllegalArgumentException if a placeholder has no value; callers validate the key
     *                                  set beforehand
     */
    public String interpolate(Map<String, ?> pathParams) {
        StringBuilder sb = new StringBuilder(literals.get(0));
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            if (pathParams == null || !pathParams.containsKey(name)) {
                throw new IllegalArgumentException("No value for path parameter '" + name + "' in " + template);
            }
            sb.append(UrlEncoding.encodePathSegment(String.valueOf(pathParams.get(name))));
            sb.append(literals.get(i + 1));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PathTemplate other && template.equals(other.template);
    }

    @Override
    public int hashCode() {
        return template.hashCode();
    }

    @Override
    public String toString() {
        return template;
    }
}
