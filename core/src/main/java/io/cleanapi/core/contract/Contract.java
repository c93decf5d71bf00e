package io.cleanapi.core.contract;

import io.cleanapi.core.error.ContractDefinitionException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered registry of named {@link Endpoint}s. Endpoint definitions are checked when
 * they are built; the contract adds the name uniqueness check.
 *
 * <p>
 * Thread-safe: built once, then read concurrently by any number of clients.
 */
public final class Contract {

    private final Map<String, Endpoint<?>> endpoints;

    private Contract(Map<String, Endpoint<?>> endpoints) {
        this.endpoints = Collections.unmodifiableMap(new LinkedHashMap<>(endpoints));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Contract of the given endpoints, in order. */
    public static Contract of(Endpoint<?>... endpoints) {
        Builder b = builder();
        for (Endpoint<?> endpoint : endpoints) {
            b.add(endpoint);
        }
        return b.build();
    }

    /**
     * Looks up an endpoint by name.
     *
     * @throws IllegalArgumentException if no endpoint has that name
     */
    public Endpoint<?> endpoint(String name) {
        Endpoint<?> endpoint = endpoints.get(name);
        if (endpoint == null) {
            throw new IllegalArgumentException("Unknown endpoint '" + name + "'; known: " + endpoints.keySet());
        }
        return endpoint;
    }

    public Optional<Endpoint<?>> find(String name) {
        return Optional.ofNullable(endpoints.get(name));
    }

    /** True if this exact endpoint instance is registered. */
    public boolean contains(Endpoint<?> endpoint) {
        return endpoint != null && endpoints.get(endpoint.name()) == endpoint;
    }

    /** All endpoints keyed by name, in registration order. */
    public Map<String, Endpoint<?>> endpoints() {
        return endpoints;
    }

    public Collection<String> names() {
        return endpoints.keySet();
    }

    public int size() {
        return endpoints.size();
    }

    @Override
    public String toString() {
        return "Contract" + endpoints.keySet();
    }

    /** Builder for {@link Contract}. Not thread-safe. */
    public static final class Builder {

        private final Map<String, Endpoint<?>> endpoints = new LinkedHashMap<>();

        private Builder() {}

        /** Adds a built endpoint. */
        public Builder add(Endpoint<?> endpoint) {
            if (endpoints.containsKey(endpoint.name())) {
                throw new ContractDefinitionException(
                        "Duplicate endpoint name '" + endpoint.name() + "'",
                        endpoint.name(),
                        endpoint.path() == null ? null : endpoint.path().template());
            }
            endpoints.put(endpoint.name(), endpoint);
            return this;
        }

        /** Builds and adds an endpoint. */
        public Builder add(Endpoint.Builder<?> endpoint) {
            return add(endpoint.build());
        }

        public Contract build() {
            return new Contract(endpoints);
        }
    }
}
