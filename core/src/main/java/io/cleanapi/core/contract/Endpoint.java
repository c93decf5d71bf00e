package io.cleanapi.core.contract;

import com.fasterxml.jackson.databind.JsonNode;
import io.cleanapi.core.error.ContractDefinitionException;
import io.cleanapi.core.model.HttpMethod;
import io.cleanapi.core.model.Slot;
import io.cleanapi.core.schema.Validator;
import io.cleanapi.core.spi.Resolver;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One named operation of a {@link Contract}: either declarative (HTTP method plus path template)
 * or resolver-based, with an optional validator per {@link Slot}.
 *
 * <p>
 * Built through {@link #get}, {@link #post}, {@link #put}, {@link #patch}, {@link #delete} or
 * {@link #resolved}. {@link Builder#build()} checks the definition and throws
 * {@link ContractDefinitionException} when the path template and declared path parameters
 * disagree.
 *
 * <p>
 * Immutable and thread-safe once built. Identity matters: a client only accepts the endpoint
 * instances registered in its contract.
 *
 * @param <D> the type of the validated result; {@link JsonNode} for declarative endpoints
 *            without a dto validator
 */
public final class Endpoint<D> {

    private final String name;
    private final HttpMethod method;
    private final PathTemplate path;
    private final Resolver resolver;
    private final Map<Slot, Validator<?>> validators;
    private final Set<Slot> declaredInputs;
    private final Set<String> pathParamNames;

    private Endpoint(Builder<D> b, PathTemplate path, Set<String> pathParamNames) {
        this.name = b.name;
        this.method = b.method;
        this.path = path;
        this.resolver = b.resolver;
        this.validators = Collections.unmodifiableMap(new EnumMap<>(b.validators));
        this.pathParamNames = Collections.unmodifiableSet(pathParamNames);

        Set<Slot> inputs = EnumSet.noneOf(Slot.class);
        inputs.addAll(b.accepted);
        for (Slot slot : b.validators.keySet()) {
            if (slot.isInput()) {
                inputs.add(slot);
            }
        }
        if (!pathParamNames.isEmpty()) {
            inputs.add(Slot.PATH_PARAMS);
        }
        this.declaredInputs = Collections.unmodifiableSet(inputs);
    }

    public static Builder<JsonNode> get(String name, String path) {
        return of(HttpMethod.GET, name, path);
    }

    public static Builder<JsonNode> post(String name, String path) {
        return of(HttpMethod.POST, name, path);
    }

    public static Builder<JsonNode> put(String name, String path) {
        return of(HttpMethod.PUT, name, path);
    }

    public static Builder<JsonNode> patch(String name, String path) {
        return of(HttpMethod.PATCH, name, path);
    }

    public static Builder<JsonNode> delete(String name, String path) {
        return of(HttpMethod.DELETE, name, path);
    }

    /** Declarative endpoint with an explicit method. */
    public static Builder<JsonNode> of(HttpMethod method, String name, String path) {
        Builder<JsonNode> b = new Builder<>(name);
        b.method = Objects.requireNonNull(method, "method");
        b.path = path;
        return b;
    }

    /**
     * Resolver-based endpoint. Without a dto validator the result is whatever the resolver
     * returns.
     */
    public static Builder<Object> resolved(String name, Resolver resolver) {
        Builder<Object> b = new Builder<>(name);
        b.resolver = Objects.requireNonNull(resolver, "resolver");
        return b;
    }

    public String name() {
        return name;
    }

    /** HTTP method, or {@code null} for a resolver-based endpoint. */
    public HttpMethod method() {
        return method;
    }

    /** Parsed path, or {@code null} for a resolver-based endpoint declared without one. */
    public PathTemplate path() {
        return path;
    }

    /** The resolver, or {@code null} for a declarative endpoint. */
    public Resolver resolver() {
        return resolver;
    }

    public boolean isResolverBased() {
        return resolver != null;
    }

    /** The validator for a slot, or {@code null} when the slot has none. */
    public Validator<?> validator(Slot slot) {
        return validators.get(slot);
    }

    /** The dto validator, or {@code null}. */
    @SuppressWarnings("unchecked")
    public Validator<D> dtoValidator() {
        return (Validator<D>) validators.get(Slot.DTO);
    }

    /** Every slot that has a validator, in {@link Slot} order. */
    public Map<Slot, Validator<?>> validators() {
        return validators;
    }

    /** Input slots a caller may supply. Supplying any other slot is a validation error. */
    public Set<Slot> declaredInputs() {
        return declaredInputs;
    }

    /**
     * Path parameter names the endpoint expects. For declarative endpoints these are exactly the
     * path template's placeholders.
     */
    public Set<String> pathParamNames() {
        return pathParamNames;
    }

    @Override
    public String toString() {
        if (isResolverBased()) {
            return "Endpoint[" + name + " resolver" + (path == null ? "" : " " + path) + "]";
        }
        return "Endpoint[" + name + " " + method + " " + path + "]";
    }

    /**
     * Builder for {@link Endpoint}. Not thread-safe.
     *
     * @param <D> the result type, changed by {@link #dto(Validator)}
     */
    public static final class Builder<D> {

        private final String name;
        private HttpMethod method;
        private String path;
        private Resolver resolver;
        private final Map<Slot, Validator<?>> validators = new EnumMap<>(Slot.class);
        private final Set<Slot> accepted = EnumSet.noneOf(Slot.class);
        private Set<String> declaredPathParams;

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Sets the path of a resolver-based endpoint. Declarative endpoints get theirs from the
         * factory method.
         */
        public Builder<D> path(String path) {
            this.path = path;
            return this;
        }

        /**
         * Declares the expected path parameter names. Optional for declarative endpoints, whose
         * template placeholders already name them; when given, the two sets must match.
         */
        public Builder<D> pathParamNames(String... names) {
            this.declaredPathParams = new LinkedHashSet<>(List.of(names));
            return this;
        }

        public Builder<D> pathParams(Validator<?> validator) {
            return slot(Slot.PATH_PARAMS, validator);
        }

        public Builder<D> searchParams(Validator<?> validator) {
            return slot(Slot.SEARCH_PARAMS, validator);
        }

        public Builder<D> payload(Validator<?> validator) {
            return slot(Slot.PAYLOAD, validator);
        }

        public Builder<D> extra(Validator<?> validator) {
            return slot(Slot.EXTRA, validator);
        }

        /** Validator for the server's declared error body. Used by the error helper only. */
        public Builder<D> error(Validator<?> validator) {
            return slot(Slot.ERROR, validator);
        }

        /** Sets the dto validator, which also fixes the endpoint's result type. */
        @SuppressWarnings("unchecked")
        public <N> Builder<N> dto(Validator<N> validator) {
            validators.put(Slot.DTO, Objects.requireNonNull(validator, "validator"));
            return (Builder<N>) this;
        }

        /** Declares input slots the endpoint accepts without validating them. */
        public Builder<D> accepts(Slot... slots) {
            for (Slot slot : slots) {
                if (!slot.isInput()) {
                    throw new IllegalArgumentException(slot + " is not an input slot");
                }
                accepted.add(slot);
            }
            return this;
        }

        private Builder<D> slot(Slot slot, Validator<?> validator) {
            validators.put(slot, Objects.requireNonNull(validator, "validator"));
            return this;
        }

        /**
         * @throws ContractDefinitionException if the name is blank, a declarative endpoint has no
         *                                     path, the template is malformed, or its
         *                                     placeholders disagree with the declared names or
     *                                     the properties of a {@code pathParams} JSON Schema
         */
        public Endpoint<D> build() {
            if (name == null || name.isBlank()) {
                throw new ContractDefinitionException("Endpoint name must not be blank", name, path);
            }
            if (resolver == null && path == null) {
                throw new ContractDefinitionException(
                        "Endpoint '" + name + "' needs a path or a resolver", name, null);
            }
            PathTemplate template = path == null ? null : PathTemplate.parse(path, name);
            Set<String> names;
            if (template == null) {
                names = declaredPathParams == null ? new LinkedHashSet<>() : declaredPathParams;
            } else {
                names = new LinkedHashSet<>(template.placeholders());
                if (declaredPathParams != null) {
                    checkPlaceholders(template, declaredPathParams);
                }
                checkSchemaProperties(template);
            }
            return new Endpoint<>(this, template, names);
        }

        // A pathParams JSON Schema may not name keys the template cannot carry.
        private void checkSchemaProperties(PathTemplate template) {
            Validator<?> validator = validators.get(Slot.PATH_PARAMS);
            if (validator == null) {
                return;
            }
            Object raw = validator.rawSchema().orElse(null);
            if (!(raw instanceof JsonNode schema) || !schema.path("properties").isObject()) {
                return;
            }
            Set<String> unknown = new LinkedHashSet<>();
            schema.path("properties").fieldNames().forEachRemaining(unknown::add);
            unknown.removeAll(template.placeholders());
            if (!unknown.isEmpty()) {
                throw new ContractDefinitionException(
                        "Path \"" + template + "\" is missing parameters from contract: " + unknown,
                        name,
                        template.template());
            }
        }

        private void checkPlaceholders(PathTemplate template, Set<String> declared) {
            Set<String> undeclared = new LinkedHashSet<>(template.placeholders());
            undeclared.removeAll(declared);
            if (!undeclared.isEmpty()) {
                throw new ContractDefinitionException(
                        "Path \"" + template + "\" has parameters not defined in contract: " + undeclared,
                        name,
                        template.template());
            }
            Set<String> missing = new LinkedHashSet<>(declared);
            missing.removeAll(template.placeholders());
            if (!missing.isEmpty()) {
                throw new ContractDefinitionException(
                        "Path \"" + template + "\" is missing parameters from contract: " + missing,
                        name,
                        template.template());
            }
        }
    }
}
