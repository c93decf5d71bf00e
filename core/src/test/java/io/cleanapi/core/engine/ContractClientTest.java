package io.cleanapi.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.cleanapi.core.config.ClientConfig;
import io.cleanapi.core.contract.Contract;
import io.cleanapi.core.contract.Endpoint;
import io.cleanapi.core.error.CallAbortedException;
import io.cleanapi.core.error.HttpResponseException;
import io.cleanapi.core.error.NoResponseException;
import io.cleanapi.core.error.ResolverException;
import io.cleanapi.core.error.ValidationException;
import io.cleanapi.core.model.ApiError;
import io.cleanapi.core.model.CallEvent;
import io.cleanapi.core.model.CallInput;
import io.cleanapi.core.model.CallResult;
import io.cleanapi.core.model.CancellationSignal;
import io.cleanapi.core.model.FailEvent;
import io.cleanapi.core.model.HttpMethod;
import io.cleanapi.core.model.OkEvent;
import io.cleanapi.core.model.Slot;
import io.cleanapi.core.model.Subscription;
import io.cleanapi.core.schema.JsonSchemaValidator;
import io.cleanapi.core.schema.Validator;
import io.cleanapi.core.schema.Validators;
import io.cleanapi.core.spi.TransportRequest;
import io.cleanapi.core.testkit.RecordingTransport;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ContractClient} against the in-memory {@link RecordingTransport}.
 */
@DisplayName("ContractClient")
class ContractClientTest {

    record User(int id, String name) {}

    record NewUser(String name) {}

    private static final String USER_SCHEMA = """
            type: object
            required: [id, name]
            properties:
              id: {type: integer}
              name: {type: string}
            """;

    private static final Validator<Map<String, Object>> POSITIVE_ID = Validators.check(data -> {
        @SuppressWarnings("unchecked")
        Map<String, Object> params = (Map<String, Object>) data;
        Object id = params.get("id");
        if (!(id instanceof Integer value) || value <= 0) {
            throw ValidationException.of("Must be a positive integer", "id");
        }
        return params;
    });

    private final Endpoint<User> getUser = Endpoint.get("getUser", "/users/:id")
            .pathParams(POSITIVE_ID)
            .dto(JsonSchemaValidator.fromYaml(USER_SCHEMA, User.class))
            .build();

    private final Endpoint<User> createUser = Endpoint.post("createUser", "/users")
            .payload(JsonSchemaValidator.fromYaml("{type: object, required: [name]}", NewUser.class))
            .dto(JsonSchemaValidator.fromYaml(USER_SCHEMA, User.class))
            .build();

    private final Endpoint<JsonNode> search = Endpoint.get("search", "/search")
            .accepts(Slot.SEARCH_PARAMS)
            .build();

    private final Endpoint<Object> localTime = Endpoint.resolved("localTime", ctx -> ctx.extra())
            .accepts(Slot.EXTRA)
            .build();

    private final Contract contract = Contract.of(getUser, createUser, search, localTime);

    private RecordingTransport transport;
    private ContractClient client;

    @BeforeEach
    void setUp() {
        transport = RecordingTransport.returning("{\"id\":7,\"name\":\"Ada\"}");
        client = ContractClient.builder(contract).transport(transport).build();
    }

    private static CallInput userId(Object id) {
        return CallInput.builder().pathParam("id", id).build();
    }

    @Nested
    @DisplayName("call")
    class Call {

        @Test
        @DisplayName("interpolates the path and returns the validated dto")
        void happyPath() {
            User user = client.call(getUser, userId(7));

            assertThat(user).isEqualTo(new User(7, "Ada"));
            TransportRequest request = transport.lastRequest();
            assertThat(request.method()).isEqualTo(HttpMethod.GET);
            assertThat(request.path()).isEqualTo("/users/7");
            assertThat(request.hasBody()).isFalse();
            assertThat(request.endpoint()).isEqualTo("getUser");
        }

        @Test
        @DisplayName("invalid input fails before the network")
        void invalidInputSkipsNetwork() {
            assertThatThrownBy(() -> client.call(getUser, userId(-1)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("id: Must be a positive integer");

            assertThat(transport.callCount()).isZero();
        }

        @Test
        @DisplayName("the request is built from validator outputs")
        void validatedPayloadIsSent() {
            client.call(createUser, CallInput.builder().payload(Map.of("name", "Ada")).build());

            TransportRequest request = transport.lastRequest();
            assertThat(request.hasBody()).isTrue();
            assertThat(request.body()).isEqualTo(new NewUser("Ada"));
        }

        @Test
        @DisplayName("accepted search params are forwarded unchanged")
        void searchParamsForwarded() {
            JsonNode body = client.call(search, CallInput.builder().searchParam("q", "a b").build());

            assertThat(body.get("name").asText()).isEqualTo("Ada");
            assertThat(transport.lastRequest().searchParams()).containsEntry("q", "a b");
        }

        @Test
        @DisplayName("an invalid dto throws after the network call")
        void invalidDto() {
            transport.respondJson(200, "{\"id\":\"seven\"}");

            assertThatThrownBy(() -> client.call(getUser, userId(7)))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).slot()).isEqualTo(Slot.DTO));
            assertThat(transport.callCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("transport failures propagate raw")
        void transportFailure() {
            transport.respondJson(404, "{\"message\":\"User not found\"}");

            assertThatThrownBy(() -> client.call(getUser, userId(7)))
                    .isInstanceOf(HttpResponseException.class)
                    .satisfies(e -> assertThat(((HttpResponseException) e).status()).isEqualTo(404));
        }

        @Test
        @DisplayName("resolver endpoints return what the resolver returns")
        void resolver() {
            Object result = client.call(localTime, CallInput.builder().extra("12:00").build());

            assertThat(result).isEqualTo("12:00");
            assertThat(transport.callCount()).isZero();
        }

        @Test
        @DisplayName("checked resolver exceptions are wrapped, unchecked ones are not")
        void resolverExceptions() {
            Endpoint<Object> checked = Endpoint.resolved("checked", ctx -> {
                throw new IOException("disk");
            }).build();
            Endpoint<Object> unchecked = Endpoint.resolved("unchecked", ctx -> {
                throw new IllegalStateException("bug");
            }).build();
            ContractClient resolverClient = ContractClient.builder(Contract.of(checked, unchecked)).build();

            assertThatThrownBy(() -> resolverClient.call(checked))
                    .isInstanceOf(ResolverException.class)
                    .hasCauseInstanceOf(IOException.class);
            assertThatThrownBy(() -> resolverClient.call(unchecked)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("endpoints outside the contract are programming errors")
        void unregisteredEndpoint() {
            Endpoint<JsonNode> stranger = Endpoint.get("getUser", "/users/:id").build();

            assertThatThrownBy(() -> client.call(stranger, userId(1))).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> client.safeCall(stranger, userId(1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("a declarative call without a transport is a setup failure")
        void noTransport() {
            ContractClient bare = ContractClient.builder(contract).build();

            CallResult<User> result = bare.safeCall(getUser, userId(1));

            assertThat(result.error().type()).isEqualTo(ApiError.CONFIGURATION_ISSUE);
        }

        @Test
        @DisplayName("the client config reaches the transport")
        void configReachesTransport() {
            ClientConfig config = ClientConfig.builder().baseUrl("https://api.example.com").build();
            ContractClient configured =
                    ContractClient.builder(contract).transport(transport).config(config).build();

            configured.call(getUser, userId(1));

            assertThat(transport.lastRequest().config()).isSameAs(config);
        }
    }

    @Nested
    @DisplayName("safeCall")
    class SafeCall {

        @Test
        @DisplayName("success carries the dto")
        void success() {
            CallResult<User> result = client.safeCall(getUser, userId(7));

            assertThat(result.ok()).isTrue();
            assertThat(result.dto()).isEqualTo(new User(7, "Ada"));
        }

        @Test
        @DisplayName("server error envelopes become contract errors")
        void contractError() {
            transport.respondJson(404, "{\"message\":\"User not found\",\"type\":\"user_not_found\"}");

            CallResult<User> result = client.safeCall(getUser, userId(7));

            assertThat(result.ok()).isFalse();
            assertThat(result.error().type()).isEqualTo("user_not_found");
            assertThat(result.error().status()).isEqualTo(404);
            assertThat(result.error().message()).isEqualTo("User not found");
        }

        @Test
        @DisplayName("invalid input is a validation error")
        void validationError() {
            CallResult<User> result = client.safeCall(getUser, userId(0));

            assertThat(result.error()).isInstanceOf(ApiError.ValidationFailed.class);
            assertThat(result.error().meta().at("/issues/0/path/0").asText()).isEqualTo("id");
            assertThat(transport.callCount()).isZero();
        }

        @Test
        @DisplayName("no response while offline is no_internet")
        void offline() {
            transport.failWith(new NoResponseException("refused", null, "getUser"));
            ContractClient offline = ContractClient.builder(contract)
                    .transport(transport)
                    .connectivityProbe(() -> false)
                    .build();

            assertThat(offline.safeCall(getUser, userId(7)).error().type()).isEqualTo(ApiError.NO_INTERNET);
        }

        @Test
        @DisplayName("a cancelled signal aborts before the network")
        void cancelledBeforeCall() {
            CancellationSignal signal = new CancellationSignal();
            signal.cancel();

            CallResult<User> result = client.safeCall(
                    getUser, CallInput.builder().pathParam("id", 1).signal(signal).build());

            assertThat(result.error().type()).isEqualTo(ApiError.ABORTED);
            assertThat(transport.callCount()).isZero();
        }

        @Test
        @DisplayName("resolver failures are normalized")
        void resolverFailure() {
            Endpoint<Object> failing = Endpoint.resolved("failing", ctx -> {
                throw new IOException("disk");
            }).build();
            Endpoint<Object> interrupted = Endpoint.resolved("interrupted", ctx -> {
                throw new InterruptedException();
            }).build();
            ContractClient resolverClient = ContractClient.builder(Contract.of(failing, interrupted)).build();

            ApiError failure = resolverClient.safeCall(failing).error();
            assertThat(failure.type()).isEqualTo(ApiError.CLIENT_EXCEPTION);
            assertThat(failure.rawError()).isInstanceOf(IOException.class);

            assertThat(resolverClient.safeCall(interrupted).error().type()).isEqualTo(ApiError.ABORTED);
            assertThat(Thread.interrupted()).isTrue();
        }

        @Test
        @DisplayName("errors thrown by a resolver are normalized and reach onFail")
        void resolverError() throws Exception {
            Endpoint<Object> broken = Endpoint.resolved("broken", ctx -> {
                throw new AssertionError("resolver bug");
            }).build();
            ContractClient resolverClient = ContractClient.builder(Contract.of(broken))
                    .executor(Runnable::run)
                    .build();
            List<FailEvent> failures = new ArrayList<>();
            resolverClient.onFail(broken, failures::add);

            ApiError sync = resolverClient.safeCall(broken).error();
            ApiError async = resolverClient.safeCallAsync(broken, CallInput.empty()).get(5, TimeUnit.SECONDS).error();

            assertThat(sync.type()).isEqualTo(ApiError.CLIENT_EXCEPTION);
            assertThat(sync.rawError()).isInstanceOf(AssertionError.class).hasMessage("resolver bug");
            assertThat(async.type()).isEqualTo(ApiError.CLIENT_EXCEPTION);
            assertThat(failures).hasSize(2)
                    .allSatisfy(event -> assertThat(event.error()).isInstanceOf(AssertionError.class));
            assertThatThrownBy(() -> resolverClient.call(broken)).isInstanceOf(AssertionError.class);
        }

        @Test
        @DisplayName("a null input is a client exception")
        void nullInput() {
            assertThat(client.safeCall(getUser, null).error().type()).isEqualTo(ApiError.CLIENT_EXCEPTION);
        }
    }

    @Nested
    @DisplayName("Async calls")
    class Async {

        private ExecutorService executor;

        @BeforeEach
        void startExecutor() {
            executor = Executors.newSingleThreadExecutor();
        }

        @AfterEach
        void stopExecutor() {
            executor.shutdownNow();
        }

        private ContractClient asyncClient() {
            return ContractClient.builder(contract).transport(transport).executor(executor).build();
        }

        /** Makes the transport block until the request's signal is cancelled. */
        private CountDownLatch blockUntilCancelled() {
            CountDownLatch started = new CountDownLatch(1);
            transport.respond(request -> {
                CountDownLatch cancelled = new CountDownLatch(1);
                request.signal().onCancel(cancelled::countDown);
                started.countDown();
                try {
                    cancelled.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new CallAbortedException(request.endpoint());
            });
            return started;
        }

        @Test
        @DisplayName("callAsync completes with the dto")
        void callAsync() throws Exception {
            User user = asyncClient().callAsync(getUser, userId(7)).get(5, TimeUnit.SECONDS);

            assertThat(user).isEqualTo(new User(7, "Ada"));
        }

        @Test
        @DisplayName("cancelling the future cancels the call's signal")
        void cancelFuture() throws Exception {
            CountDownLatch started = blockUntilCancelled();
            CancellationSignal signal = new CancellationSignal();
            ContractClient async = asyncClient();
            List<Throwable> failures = new ArrayList<>();
            CountDownLatch failed = new CountDownLatch(1);
            async.onFail(getUser, event -> {
                failures.add(event.error());
                failed.countDown();
            });

            CompletableFuture<User> future =
                    async.callAsync(getUser, CallInput.builder().pathParam("id", 1).signal(signal).build());
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            future.cancel(true);

            assertThat(signal.isCancelled()).isTrue();
            assertThat(future).isCancelled();
            assertThat(failed.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(failures).singleElement().isInstanceOf(CallAbortedException.class);
        }

        @Test
        @DisplayName("safeCallAsync resolves to aborted when the signal fires mid-call")
        void safeCallAsyncAborted() throws Exception {
            CountDownLatch started = blockUntilCancelled();
            CancellationSignal signal = new CancellationSignal();

            CompletableFuture<CallResult<User>> future = asyncClient()
                    .safeCallAsync(getUser, CallInput.builder().pathParam("id", 1).signal(signal).build());
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            signal.cancel();

            CallResult<User> result = future.get(5, TimeUnit.SECONDS);
            assertThat(result.ok()).isFalse();
            assertThat(result.error().type()).isEqualTo(ApiError.ABORTED);
        }

        @Test
        @DisplayName("safeCallAsync normalizes failures")
        void safeCallAsyncFailure() throws Exception {
            transport.respondJson(500, "oops");

            CallResult<User> result = asyncClient().safeCallAsync(getUser, userId(7)).get(5, TimeUnit.SECONDS);

            assertThat(result.error().type()).isEqualTo(ApiError.UNSUPPORTED_SERVER_RESPONSE);
        }

        @Test
        @DisplayName("safeCallAsync with a null input resolves to client_exception")
        void safeCallAsyncNullInput() throws Exception {
            CallResult<User> result = asyncClient().safeCallAsync(getUser, null).get(5, TimeUnit.SECONDS);

            assertThat(result.error().type()).isEqualTo(ApiError.CLIENT_EXCEPTION);
            assertThat(result.error().rawError()).isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> asyncClient().callAsync(getUser, null))
                    .isInstanceOf(NullPointerException.class);
        }

        @Test
        @DisplayName("a rejecting executor fails the future instead of throwing")
        void rejectedByExecutor() throws Exception {
            ContractClient rejecting = ContractClient.builder(contract)
                    .transport(transport)
                    .executor(command -> {
                        throw new RejectedExecutionException("queue full");
                    })
                    .build();

            CompletableFuture<User> future = rejecting.callAsync(getUser, userId(7));
            CallResult<User> result = rejecting.safeCallAsync(getUser, userId(7)).get(5, TimeUnit.SECONDS);

            assertThat(future).isCompletedExceptionally();
            assertThat(result.error().type()).isEqualTo(ApiError.CLIENT_EXCEPTION);
            assertThat(result.error().rawError()).isInstanceOf(RejectedExecutionException.class);
            assertThat(transport.callCount()).isZero();
        }

        @Test
        @DisplayName("a future cancelled before it runs skips onCall and the network")
        void cancelledBeforeExecution() {
            List<Runnable> queued = new ArrayList<>();
            ContractClient deferred = ContractClient.builder(contract)
                    .transport(transport)
                    .executor(queued::add)
                    .build();
            List<CallEvent> calls = new ArrayList<>();
            deferred.onCall(getUser, calls::add);

            CompletableFuture<User> future = deferred.callAsync(getUser, userId(7));
            future.cancel(true);
            queued.forEach(Runnable::run);

            assertThat(future).isCancelled();
            assertThat(calls).isEmpty();
            assertThat(transport.callCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Hooks")
    class Hooks {

        @Test
        @DisplayName("onCall receives the exact input before the network call")
        void onCallBeforeNetwork() {
            List<CallEvent> events = new ArrayList<>();
            List<Integer> callsSeen = new ArrayList<>();
            client.onCall(getUser, event -> {
                events.add(event);
                callsSeen.add(transport.callCount());
            });
            CallInput input = userId(7);

            client.call(getUser, input);

            assertThat(events).singleElement().satisfies(event -> {
                assertThat(event.endpoint()).isEqualTo("getUser");
                assertThat(event.input()).isSameAs(input);
                assertThat(event.hasConfig()).isFalse();
            });
            assertThat(callsSeen).containsExactly(0);
        }

        @Test
        @DisplayName("onCall sees the config when the client has one")
        void onCallWithConfig() {
            ClientConfig config = ClientConfig.builder().attribute("tenant", "acme").build();
            ContractClient configured =
                    ContractClient.builder(contract).transport(transport).config(config).build();
            List<CallEvent> events = new ArrayList<>();
            configured.onCall(getUser, events::add);

            configured.call(getUser, userId(7));

            assertThat(events).singleElement().satisfies(event -> {
                assertThat(event.hasConfig()).isTrue();
                assertThat(event.config().attributes()).containsEntry("tenant", "acme");
            });
        }

        @Test
        @DisplayName("onCall does not fire when input validation fails")
        void onCallSkippedOnInvalidInput() {
            List<CallEvent> events = new ArrayList<>();
            client.onCall(getUser, events::add);

            client.safeCall(getUser, userId(-5));

            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("hooks are scoped to their endpoint and client")
        void scoping() {
            List<String> seen = new ArrayList<>();
            client.onCall(createUser, event -> seen.add("createUser"));
            ContractClient other = ContractClient.builder(contract).transport(transport).build();
            other.onCall(getUser, event -> seen.add("other client"));

            client.call(getUser, userId(7));

            assertThat(seen).isEmpty();
        }

        @Test
        @DisplayName("unsubscribed callbacks stop firing")
        void unsubscribe() {
            List<CallEvent> events = new ArrayList<>();
            Subscription subscription = client.onCall(getUser, events::add);
            client.call(getUser, userId(7));

            subscription.unsubscribe();
            client.call(getUser, userId(7));

            assertThat(events).hasSize(1);
            assertThat(client.hookCount(getUser)).isZero();
        }

        @Test
        @DisplayName("a throwing callback does not fail the call or skip later callbacks")
        void throwingCallback() {
            List<String> seen = new ArrayList<>();
            client.onCall(getUser, event -> {
                throw new IllegalStateException("hook bug");
            });
            client.onCall(getUser, event -> seen.add("second"));

            CallResult<User> result = client.safeCall(getUser, userId(7));

            assertThat(result.ok()).isTrue();
            assertThat(seen).containsExactly("second");
        }

        @Test
        @DisplayName("onOk fires once with the validated dto")
        void onOk() {
            List<OkEvent<User>> events = new ArrayList<>();
            client.onOk(getUser, events::add);

            client.call(getUser, userId(7));

            assertThat(events).singleElement().satisfies(event -> {
                assertThat(event.dto()).isEqualTo(new User(7, "Ada"));
                assertThat(event.call().endpoint()).isEqualTo("getUser");
            });
        }

        @Test
        @DisplayName("onFail fires once with the raw failure")
        void onFail() {
            transport.respondJson(404, "{\"message\":\"User not found\"}");
            List<FailEvent> failures = new ArrayList<>();
            List<OkEvent<User>> successes = new ArrayList<>();
            client.onFail(getUser, failures::add);
            client.onOk(getUser, successes::add);

            client.safeCall(getUser, userId(7));

            assertThat(successes).isEmpty();
            assertThat(failures).singleElement()
                    .satisfies(event -> assertThat(event.error()).isInstanceOf(HttpResponseException.class));
        }
    }

    @Nested
    @DisplayName("Schema introspection and slot helpers")
    class Introspection {

        @Test
        @DisplayName("getSchema lists only supplied validators")
        void getSchema() {
            assertThat(client.getSchema(getUser)).hasValueSatisfying(
                    schema -> assertThat(schema).containsOnlyKeys(Slot.PATH_PARAMS, Slot.DTO));
            assertThat(client.getSchema(search)).isEmpty();
        }

        @Test
        @DisplayName("getRawSchema lists only validators with a raw schema")
        void getRawSchema() {
            assertThat(client.getRawSchema(getUser)).hasValueSatisfying(raw -> {
                assertThat(raw).containsOnlyKeys(Slot.DTO);
                assertThat(((JsonNode) raw.get(Slot.DTO)).get("required")).hasSize(2);
            });
            assertThat(client.getRawSchema(search)).isEmpty();
        }

        @Test
        @DisplayName("getRawSchema is empty when no validator exposes one")
        void noRawSchema() {
            Endpoint<JsonNode> handWritten = Endpoint.post("x", "/x").payload(data -> data).build();
            ContractClient local = ContractClient.builder(Contract.of(handWritten)).build();

            assertThat(local.getSchema(handWritten)).isPresent();
            assertThat(local.getRawSchema(handWritten)).isEmpty();
        }

        @Test
        @DisplayName("slot helpers run a single validator")
        void slotHelpers() {
            assertThat(client.dto(getUser, Map.of("id", 1, "name", "x"))).isEqualTo(new User(1, "x"));
            assertThat(client.payload(createUser, Map.of("name", "Bo"))).isEqualTo(new NewUser("Bo"));
            assertThatThrownBy(() -> client.pathParams(getUser, Map.of("id", 0)))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).slot()).isEqualTo(Slot.PATH_PARAMS));
            assertThat(client.searchParams(search, Map.of("q", 1))).isEqualTo(Map.of("q", 1));
        }

        @Test
        @DisplayName("the error helper validates server error bodies on demand")
        void errorHelper() {
            Endpoint<JsonNode> withError = Endpoint.get("withError", "/w")
                    .error(JsonSchemaValidator.fromYaml("{type: object, required: [code]}"))
                    .build();
            ContractClient local = ContractClient.builder(Contract.of(withError)).build();

            assertThat(((JsonNode) local.error(withError, Map.of("code", 3))).get("code").asInt())
                    .isEqualTo(3);
            assertThatThrownBy(() -> local.error(withError, Map.of()))
                    .isInstanceOf(ValidationException.class);
        }
    }
}
