package io.cleanapi.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cleanapi.core.config.ClientConfig;
import io.cleanapi.core.contract.Contract;
import io.cleanapi.core.contract.Endpoint;
import io.cleanapi.core.error.CallAbortedException;
import io.cleanapi.core.error.RequestSetupException;
import io.cleanapi.core.error.ResolverException;
import io.cleanapi.core.model.ApiError;
import io.cleanapi.core.model.CallEvent;
import io.cleanapi.core.model.CallInput;
import io.cleanapi.core.model.CallResult;
import io.cleanapi.core.model.CancellationSignal;
import io.cleanapi.core.model.FailEvent;
import io.cleanapi.core.model.OkEvent;
import io.cleanapi.core.model.Slot;
import io.cleanapi.core.model.Subscription;
import io.cleanapi.core.schema.Validator;
import io.cleanapi.core.spi.ConnectivityProbe;
import io.cleanapi.core.spi.ResolverContext;
import io.cleanapi.core.spi.Transport;
import io.cleanapi.core.spi.TransportRequest;
import io.cleanapi.core.spi.TransportResponse;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Executes the endpoints of a {@link Contract}.
 *
 * <p>
 * One call runs these stages in order: input validation, {@code onCall} hooks, the remote
 * operation (transport or resolver), dto validation, then {@code onOk} or {@code onFail} hooks.
 * A failing input validator stops the call before anything goes on the wire.
 *
 * <p>
 * {@link #call} throws the raw failure; {@link #safeCall} returns a {@link CallResult} holding
 * the validated dto or a normalized {@link ApiError}. Passing an endpoint that is not part of this
 * client's contract is a programming error and throws {@link IllegalArgumentException} from
 * every method, {@code safeCall} included.
 *
 * <p>
 * Thread-safe. Hook subscriptions belong to this client instance.
 */
public final class ContractClient {

    private static final Logger LOG = LoggerFactory.getLogger(ContractClient.class);

    /** MDC key holding the endpoint name while a call runs. */
    static final String MDC_ENDPOINT = "endpoint";

    private final Contract contract;
    private final Transport transport;
    private final ClientConfig config;
    private final ErrorNormalizer normalizer;
    private final ValidationPipeline pipeline;
    private final Executor executor;

    private final CallHookBus<CallEvent> callHooks = new CallHookBus<>("onCall");
    private final CallHookBus<OkEvent<?>> okHooks = new CallHookBus<>("onOk");
    private final CallHookBus<FailEvent> failHooks = new CallHookBus<>("onFail");

    private ContractClient(Builder b) {
        this.contract = b.contract;
        this.transport = b.transport;
        this.config = b.config;
        this.normalizer = new ErrorNormalizer(b.probe);
        this.pipeline = new ValidationPipeline(b.mapper);
        this.executor = b.executor;
    }

    public static Builder builder(Contract contract) {
        return new Builder(contract);
    }

    public Contract contract() {
        return contract;
    }

    /** The client configuration, or {@code null} when built without one. */
    public ClientConfig config() {
        return config;
    }

    public ErrorNormalizer errorNormalizer() {
        return normalizer;
    }

    // --- calls ---

    public <D> D call(Endpoint<D> endpoint) {
        return call(endpoint, CallInput.empty());
    }

    /**
     * Calls an endpoint and returns the validated dto.
     *
     * @throws io.cleanapi.core.error.ValidationException if an input or the result is invalid
     * @throws io.cleanapi.core.error.TransportException  if the transport fails
     * @throws CallAbortedException                        if the call's signal was cancelled
     * @throws RuntimeException                            anything an unchecked resolver failure
     *                                                     throws, unchanged
     * @throws Error                                       an error thrown by a resolver, transport or
     *                                                     validator, after the {@code onFail} hooks ran
     */
    public <D> D call(Endpoint<D> endpoint, CallInput input) {
        requireRegistered(endpoint);
        Objects.requireNonNull(input, "input must not be null");

        String name = endpoint.name();
        CallEvent event = new CallEvent(name, input, config);
        long start = System.nanoTime();
        MDC.put(MDC_ENDPOINT, name);
        try {
            CallInput validated = pipeline.validateInputs(endpoint, input);
            throwIfCancelled(input, name);
            callHooks.emit(name, event);
            throwIfCancelled(input, name);

            Object raw = execute(endpoint, validated);
            D dto = pipeline.validateDto(endpoint, raw);

            LOG.info("Call completed: endpoint={}, duration_ms={}", name, elapsedMillis(start));
            okHooks.emit(name, new OkEvent<>(event, dto));
            return dto;
        } catch (RuntimeException | Error e) {
            LOG.warn(
                    "Call failed: endpoint={}, error={}, duration_ms={}",
                    name,
                    e.getClass().getSimpleName(),
                    elapsedMillis(start));
            LOG.debug("Call failure detail: endpoint={}", name, e);
            failHooks.emit(name, new FailEvent(event, e));
            throw e;
        } finally {
            MDC.remove(MDC_ENDPOINT);
        }
    }

    public <D> CallResult<D> safeCall(Endpoint<D> endpoint) {
        return safeCall(endpoint, CallInput.empty());
    }

    /**
     * Like {@link #call} but returns failures as a normalized {@link ApiError}. Errors thrown by a
     * resolver, transport or validator become {@code client_exception}. Only an unregistered
     * endpoint throws.
     */
    public <D> CallResult<D> safeCall(Endpoint<D> endpoint, CallInput input) {
        requireRegistered(endpoint);
        try {
            return CallResult.ok(call(endpoint, input));
        } catch (RuntimeException | Error e) {
            return CallResult.failed(normalizer.normalize(e));
        }
    }

    /**
     * Runs {@link #call} on the client's executor. Cancelling the returned future cancels the
     * call's signal; a signal is created when the input has none. An executor that rejects the
     * task completes the future exceptionally.
     */
    public <D> CompletableFuture<D> callAsync(Endpoint<D> endpoint, CallInput input) {
        requireRegistered(endpoint);
        Objects.requireNonNull(input, "input must not be null");
        CallInput withSignal = input.signal() != null
                ? input
                : input.toBuilder().signal(new CancellationSignal()).build();
        CancellationSignal signal = withSignal.signal();

        CompletableFuture<D> future = new CompletableFuture<>() {
            @Override
            public boolean cancel(boolean mayInterruptIfRunning) {
                signal.cancel();
                return super.cancel(mayInterruptIfRunning);
            }
        };
        try {
            executor.execute(() -> {
                try {
                    future.complete(call(endpoint, withSignal));
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Call rejected by executor: endpoint={}", endpoint.name());
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Asynchronous {@link #safeCall}. The returned future always completes normally; cancel the
     * call through the input's signal. Only an unregistered endpoint throws.
     */
    public <D> CompletableFuture<CallResult<D>> safeCallAsync(Endpoint<D> endpoint, CallInput input) {
        requireRegistered(endpoint);
        CompletableFuture<D> future;
        try {
            future = callAsync(endpoint, input);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(CallResult.failed(normalizer.normalize(e)));
        }
        return future.<CallResult<D>>handle(
                (dto, error) -> error == null ? CallResult.ok(dto) : CallResult.failed(normalizer.normalize(error)));
    }

    private Object execute(Endpoint<?> endpoint, CallInput input) {
        if (endpoint.isResolverBased()) {
            return resolve(endpoint, input);
        }
        if (transport == null) {
            throw new RequestSetupException("No transport configured for declarative endpoints", null, endpoint.name());
        }
        String path = endpoint.path().interpolate(input.pathParams());
        boolean hasBody = input.suppliedSlots().contains(Slot.PAYLOAD) && endpoint.method().allowsBody();
        TransportRequest request = new TransportRequest(
                endpoint.name(),
                endpoint.method(),
                path,
                input.searchParams(),
                hasBody ? input.payload() : null,
                hasBody,
                config,
                input.signal());
        LOG.debug("Dispatching request: endpoint={}, method={}, path={}", endpoint.name(), endpoint.method(), path);
        TransportResponse response = transport.execute(request);
        LOG.debug("Response received: endpoint={}, status={}", endpoint.name(), response.status());
        return response.body();
    }

    private Object resolve(Endpoint<?> endpoint, CallInput input) {
        LOG.debug("Invoking resolver: endpoint={}", endpoint.name());
        try {
            return endpoint.resolver().resolve(new ResolverContext(endpoint.name(), input, config));
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallAbortedException(endpoint.name(), e);
        } catch (Exception e) {
            throw new ResolverException(endpoint.name(), e);
        }
    }

    // --- hooks ---

    /** Registers a callback that runs before every network call of the endpoint. */
    public Subscription onCall(Endpoint<?> endpoint, Consumer<? super CallEvent> callback) {
        requireRegistered(endpoint);
        return callHooks.subscribe(endpoint.name(), Objects.requireNonNull(callback, "callback"));
    }

    /** Registers a callback that receives the validated dto after a successful call. */
    @SuppressWarnings("unchecked")
    public <D> Subscription onOk(Endpoint<D> endpoint, Consumer<? super OkEvent<D>> callback) {
        requireRegistered(endpoint);
        Objects.requireNonNull(callback, "callback");
        return okHooks.subscribe(endpoint.name(), event -> callback.accept((OkEvent<D>) event));
    }

    /** Registers a callback that receives the raw failure of a failed call. */
    public Subscription onFail(Endpoint<?> endpoint, Consumer<? super FailEvent> callback) {
        requireRegistered(endpoint);
        return failHooks.subscribe(endpoint.name(), Objects.requireNonNull(callback, "callback"));
    }

    // --- schema introspection ---

    /** The endpoint's validators by slot; empty when it has none. */
    public Optional<Map<Slot, Validator<?>>> getSchema(Endpoint<?> endpoint) {
        requireRegistered(endpoint);
        Map<Slot, Validator<?>> validators = endpoint.validators();
        return validators.isEmpty() ? Optional.empty() : Optional.of(validators);
    }

    /** Raw schemas of the slots whose validator exposes one; empty when none do. */
    public Optional<Map<Slot, Object>> getRawSchema(Endpoint<?> endpoint) {
        requireRegistered(endpoint);
        Map<Slot, Object> raw = new EnumMap<>(Slot.class);
        endpoint.validators().forEach((slot, validator) -> validator.rawSchema().ifPresent(s -> raw.put(slot, s)));
        return raw.isEmpty() ? Optional.empty() : Optional.of(Collections.unmodifiableMap(raw));
    }

    // --- slot helpers ---

    /** Validates a value against the endpoint's dto validator. */
    public <D> D dto(Endpoint<D> endpoint, Object value) {
        requireRegistered(endpoint);
        return pipeline.validateDto(endpoint, value);
    }

    public Object payload(Endpoint<?> endpoint, Object value) {
        return validate(endpoint, Slot.PAYLOAD, value);
    }

    public Object pathParams(Endpoint<?> endpoint, Object value) {
        return validate(endpoint, Slot.PATH_PARAMS, value);
    }

    public Object searchParams(Endpoint<?> endpoint, Object value) {
        return validate(endpoint, Slot.SEARCH_PARAMS, value);
    }

    public Object extra(Endpoint<?> endpoint, Object value) {
        return validate(endpoint, Slot.EXTRA, value);
    }

    /** Validates a server error body against the endpoint's error validator. */
    public Object error(Endpoint<?> endpoint, Object value) {
        return validate(endpoint, Slot.ERROR, value);
    }

    /** Runs one slot's validator; returns the value unchanged when the slot has none. */
    public Object validate(Endpoint<?> endpoint, Slot slot, Object value) {
        requireRegistered(endpoint);
        return pipeline.validateSlot(endpoint, slot, value);
    }

    /** Normalizes any failure, for callers that use {@link #call} and catch themselves. */
    public ApiError normalize(Throwable error) {
        return normalizer.normalize(error);
    }

    int hookCount(Endpoint<?> endpoint) {
        String name = endpoint.name();
        return callHooks.subscriberCount(name) + okHooks.subscriberCount(name) + failHooks.subscriberCount(name);
    }

    private void requireRegistered(Endpoint<?> endpoint) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        if (!contract.contains(endpoint)) {
            throw new IllegalArgumentException("Endpoint '" + endpoint.name() + "' is not part of this client's contract");
        }
    }

    private static void throwIfCancelled(CallInput input, String endpoint) {
        if (input.signal() != null) {
            input.signal().throwIfCancelled(endpoint);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    /** Builder for {@link ContractClient}. */
    public static final class Builder {

        private final Contract contract;
        private Transport transport;
        private ClientConfig config;
        private ConnectivityProbe probe = ConnectivityProbe.ALWAYS_ONLINE;
        private Executor executor = ForkJoinPool.commonPool();
        private ObjectMapper mapper = new ObjectMapper();

        private Builder(Contract contract) {
            this.contract = Objects.requireNonNull(contract, "contract must not be null");
        }

        /** Transport for declarative endpoints. Optional when every endpoint has a resolver. */
        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder config(ClientConfig config) {
            this.config = config;
            return this;
        }

        public Builder connectivityProbe(ConnectivityProbe probe) {
            this.probe = Objects.requireNonNull(probe, "probe");
            return this;
        }

        /** Executor for {@code callAsync}; defaults to the common pool. */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        /** Mapper used to turn validated path and query parameters into maps. */
        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public ContractClient build() {
            if (transport == null
                    && contract.endpoints().values().stream().anyMatch(e -> !e.isResolverBased())) {
                LOG.warn("Client built without a transport: declarative endpoints will fail, contract={}", contract);
            }
            return new ContractClient(this);
        }
    }
}
