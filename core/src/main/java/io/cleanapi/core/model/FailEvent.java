package io.cleanapi.core.model;

/**
 * Payload delivered to {@code onFail} hooks for any failure during a call, including failures
 * before the request executed.
 *
 * @param call  the call's event
 * @param error the raw failure, as {@code call} rethrows it
 */
public record FailEvent(CallEvent call, Throwable error) {}
