package io.cleanapi.core.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cleanapi.core.contract.Endpoint;
import io.cleanapi.core.error.ValidationException;
import io.cleanapi.core.error.ValidationIssue;
import io.cleanapi.core.model.CallInput;
import io.cleanapi.core.model.Slot;
import io.cleanapi.core.schema.Validator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs an endpoint's validators over call input and results.
 *
 * <p>
 * Input validation runs a structural check first (undeclared slots, path parameter key set),
 * then the slot validators in the fixed order {@code pathParams, searchParams, payload, extra}.
 * The first failing slot stops the pipeline. Slots without a validator pass through unchanged.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class ValidationPipeline {

    private static final List<Slot> INPUT_ORDER =
            List.of(Slot.PATH_PARAMS, Slot.SEARCH_PARAMS, Slot.PAYLOAD, Slot.EXTRA);

    private static final TypeReference<LinkedHashMap<String, Object>> PARAM_MAP = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public ValidationPipeline(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Validates every supplied input slot.
     *
     * @return the input with validator outputs in place of the supplied values; the signal is
     *         carried over
     * @throws ValidationException attributed to the endpoint and the failing slot
     */
    public CallInput validateInputs(Endpoint<?> endpoint, CallInput input) {
        checkStructure(endpoint, input);

        Set<Slot> supplied = input.suppliedSlots();
        CallInput.Builder validated = input.toBuilder();
        for (Slot slot : INPUT_ORDER) {
            if (!supplied.contains(slot) || endpoint.validator(slot) == null) {
                continue;
            }
            Object value = validateSlot(endpoint, slot, input.get(slot));
            switch (slot) {
                case PATH_PARAMS -> validated.pathParams(asParamMap(endpoint, slot, value));
                case SEARCH_PARAMS -> validated.searchParams(asParamMap(endpoint, slot, value));
                case PAYLOAD -> validated.payload(value);
                case EXTRA -> validated.extra(value);
                default -> throw new IllegalStateException("Not an input slot: " + slot);
            }
        }
        return validated.build();
    }

    /**
     * Validates a raw result with the endpoint's dto validator, or returns it unchanged when there
     * is none.
     */
    @SuppressWarnings("unchecked")
    public <D> D validateDto(Endpoint<D> endpoint, Object raw) {
        Validator<D> validator = endpoint.dtoValidator();
        if (validator == null) {
            return (D) raw;
        }
        try {
            return validator.validate(raw);
        } catch (ValidationException e) {
            throw e.attributedTo(endpoint.name(), Slot.DTO);
        }
    }

    /** Runs a single slot's validator; pass-through when the slot has none. */
    public Object validateSlot(Endpoint<?> endpoint, Slot slot, Object value) {
        Validator<?> validator = endpoint.validator(slot);
        if (validator == null) {
            return value;
        }
        try {
            return validator.validate(value);
        } catch (ValidationException e) {
            throw e.attributedTo(endpoint.name(), slot);
        }
    }

    private void checkStructure(Endpoint<?> endpoint, CallInput input) {
        List<ValidationIssue> undeclared = new ArrayList<>();
        for (Slot slot : input.suppliedSlots()) {
            if (!endpoint.declaredInputs().contains(slot)) {
                undeclared.add(ValidationIssue.at("Not accepted by this endpoint", slot.key()));
            }
        }
        if (!undeclared.isEmpty()) {
            throw new ValidationException(undeclared, endpoint.name(), null);
        }

        Set<String> expected = endpoint.pathParamNames();
        if (expected.isEmpty()) {
            return;
        }
        Map<String, Object> given = input.pathParams() == null ? Map.of() : input.pathParams();
        List<ValidationIssue> issues = new ArrayList<>();
        for (String name : expected) {
            if (!given.containsKey(name)) {
                issues.add(ValidationIssue.at("Missing path parameter", Slot.PATH_PARAMS.key(), name));
            }
        }
        Set<String> unknown = new LinkedHashSet<>(given.keySet());
        unknown.removeAll(expected);
        for (String name : unknown) {
            issues.add(ValidationIssue.at("Unknown path parameter", Slot.PATH_PARAMS.key(), name));
        }
        if (!issues.isEmpty()) {
            throw new ValidationException(issues, endpoint.name(), Slot.PATH_PARAMS);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asParamMap(Endpoint<?> endpoint, Slot slot, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        try {
            return mapper.convertValue(value, PARAM_MAP);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(
                    List.of(ValidationIssue.root("Validated value is not an object: " + e.getMessage())),
                    endpoint.name(),
                    slot);
        }
    }
}
