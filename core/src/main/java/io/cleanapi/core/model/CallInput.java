package io.cleanapi.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Arguments of a single call. Every slot is optional; an absent slot is different from a slot
 * supplied with an empty map, and {@link #suppliedSlots()} reports exactly what the caller set.
 *
 * <p>
 * Immutable. Maps are copied defensively and keep insertion order; {@code null} values inside
 * them are allowed and stringify to {@code "null"} during interpolation.
 */
public final class CallInput {

    private static final CallInput EMPTY = new Builder().build();

    private final Map<String, Object> pathParams;
    private final Map<String, Object> searchParams;
    private final Object payload;
    private final Object extra;
    private final boolean payloadSet;
    private final boolean extraSet;
    private final CancellationSignal signal;

    private CallInput(Builder b) {
        this.pathParams = b.pathParams == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(b.pathParams));
        this.searchParams =
                b.searchParams == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(b.searchParams));
        this.payload = b.payload;
        this.extra = b.extra;
        this.payloadSet = b.payloadSet;
        this.extraSet = b.extraSet;
        this.signal = b.signal;
    }

    /** Input with no slots and no cancellation signal. */
    public static CallInput empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Path parameters, or {@code null} when not supplied. */
    public Map<String, Object> pathParams() {
        return pathParams;
    }

    /** Query parameters, or {@code null} when not supplied. */
    public Map<String, Object> searchParams() {
        return searchParams;
    }

    /** Request payload, or {@code null} when not supplied. */
    public Object payload() {
        return payload;
    }

    /** Caller-defined extra data for resolvers, or {@code null} when not supplied. */
    public Object extra() {
        return extra;
    }

    /** Cancellation signal for this call, or {@code null} if the call can't be cancelled. */
    public CancellationSignal signal() {
        return signal;
    }

    /** The input slots the caller supplied. */
    public Set<Slot> suppliedSlots() {
        Set<Slot> slots = EnumSet.noneOf(Slot.class);
        if (pathParams != null) slots.add(Slot.PATH_PARAMS);
        if (searchParams != null) slots.add(Slot.SEARCH_PARAMS);
        if (payloadSet) slots.add(Slot.PAYLOAD);
        if (extraSet) slots.add(Slot.EXTRA);
        return slots;
    }

    /** Value of an input slot, or {@code null} when absent. */
    public Object get(Slot slot) {
        return switch (slot) {
            case PATH_PARAMS -> pathParams;
            case SEARCH_PARAMS -> searchParams;
            case PAYLOAD -> payload;
            case EXTRA -> extra;
            default -> throw new IllegalArgumentException(slot + " is not an input slot");
        };
    }

    /** Returns a builder pre-populated with this input. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.pathParams = pathParams;
        b.searchParams = searchParams;
        b.payload = payload;
        b.extra = extra;
        b.payloadSet = payloadSet;
        b.extraSet = extraSet;
        b.signal = signal;
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallInput other)) return false;
        return payloadSet == other.payloadSet
                && extraSet == other.extraSet
                && Objects.equals(pathParams, other.pathParams)
                && Objects.equals(searchParams, other.searchParams)
                && Objects.equals(payload, other.payload)
                && Objects.equals(extra, other.extra)
                && signal == other.signal;
    }

    @Override
    public int hashCode() {
        return Objects.hash(pathParams, searchParams, payload, extra, payloadSet, extraSet);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CallInput[");
        String sep = "";
        if (pathParams != null) {
            sb.append("pathParams=").append(pathParams);
            sep = ", ";
        }
        if (searchParams != null) {
            sb.append(sep).append("searchParams=").append(searchParams);
            sep = ", ";
        }
        if (payloadSet) {
            sb.append(sep).append("payload=").append(payload);
            sep = ", ";
        }
        if (extraSet) {
            sb.append(sep).append("extra=").append(extra);
        }
        return sb.append(']').toString();
    }

    /** Builder for {@link CallInput}. */
    public static final class Builder {

        private Map<String, Object> pathParams;
        private Map<String, Object> searchParams;
        private Object payload;
        private Object extra;
        private boolean payloadSet;
        private boolean extraSet;
        private CancellationSignal signal;

        Builder() {}

        public Builder pathParams(Map<String, ?> pathParams) {
            this.pathParams = pathParams == null ? null : new LinkedHashMap<>(pathParams);
            return this;
        }

        /** Adds a single path parameter, creating the slot if needed. */
        public Builder pathParam(String name, Object value) {
            if (pathParams == null) pathParams = new LinkedHashMap<>();
            pathParams.put(name, value);
            return this;
        }

        public Builder searchParams(Map<String, ?> searchParams) {
            this.searchParams = searchParams == null ? null : new LinkedHashMap<>(searchParams);
            return this;
        }

        /** Adds a single query parameter, creating the slot if needed. */
        public Builder searchParam(String name, Object value) {
            if (searchParams == null) searchParams = new LinkedHashMap<>();
            searchParams.put(name, value);
            return this;
        }

        public Builder payload(Object payload) {
            this.payload = payload;
            this.payloadSet = true;
            return this;
        }

        public Builder extra(Object extra) {
            this.extra = extra;
            this.extraSet = true;
            return this;
        }

        public Builder signal(CancellationSignal signal) {
            this.signal = signal;
            return this;
        }

        public CallInput build() {
            return new CallInput(this);
        }
    }
}
