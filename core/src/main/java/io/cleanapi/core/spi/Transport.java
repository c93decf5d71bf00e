package io.cleanapi.core.spi;

import io.cleanapi.core.error.CallAbortedException;
import io.cleanapi.core.error.HttpResponseException;
import io.cleanapi.core.error.NoResponseException;
import io.cleanapi.core.error.RequestSetupException;

/**
 * SPI for the network layer that executes declarative endpoints.
 *
 * <p>
 * The core engine has no HTTP dependency; adapters implement this interface on top of a concrete
 * client. Implementations MUST be thread-safe and MUST report failures through the exception
 * types below so the error normalizer can classify them:
 * <ul>
 * <li>{@link HttpResponseException}: a response arrived with a non-2xx status</li>
 * <li>{@link NoResponseException}: the request was sent but no response came back</li>
 * <li>{@link RequestSetupException}: the request could not be built</li>
 * <li>{@link CallAbortedException}: the request's cancellation signal fired</li>
 * </ul>
 */
public interface Transport {

    /**
     * Executes the request and returns the 2xx response.
     *
     * @param request the fully interpolated request
     * @return the successful response
     */
    TransportResponse execute(TransportRequest request);
}
