package io.cleanapi.core.model;

/**
 * Payload delivered to {@code onOk} hooks after the dto passed validation.
 *
 * @param call the call's event
 * @param dto  the validated dto
 * @param <D>  dto type
 */
public record OkEvent<D>(CallEvent call, D dto) {}
