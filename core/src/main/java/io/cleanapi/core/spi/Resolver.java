package io.cleanapi.core.spi;

/**
 * Caller-supplied function that performs the remote operation of a resolver-based endpoint,
 * instead of the declarative method and path.
 *
 * <p>
 * Whatever the resolver returns becomes the candidate dto and goes through the dto validator.
 * Anything it throws is treated like a transport failure: {@code call} rethrows it and
 * {@code safeCall} normalizes it.
 */
@FunctionalInterface
public interface Resolver {

    /**
     * @param context validated input, client configuration and cancellation signal
     * @return the raw result
     * @throws Exception any failure; {@code call} rethrows unchecked exceptions unchanged and
     *                   wraps checked ones in {@link io.cleanapi.core.error.ResolverException}
     */
    Object resolve(ResolverContext context) throws Exception;
}
