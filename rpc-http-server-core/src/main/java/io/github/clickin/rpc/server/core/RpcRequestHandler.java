package io.github.clickin.rpc.server.core;

import io.github.clickin.rpc.core.ErrorCode;
import io.github.clickin.rpc.core.Protocol;
import io.github.clickin.rpc.core.ProcedureType;
import io.github.clickin.rpc.core.RpcException;
import io.github.clickin.rpc.json.spi.JsonCodec;
import io.github.clickin.rpc.json.spi.JsonCodecs;
import io.github.clickin.rpc.server.spi.DataTransformer;
import io.github.clickin.rpc.server.spi.ErrorShapeRequest;
import io.github.clickin.rpc.server.spi.ErrorShaper;
import io.github.clickin.rpc.server.spi.ProcedureCall;
import io.github.clickin.rpc.server.spi.ProcedureInput;
import io.github.clickin.rpc.server.spi.ProcedureRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Framework-neutral HTTP handler that maps a request to one or more procedure calls.
 *
 * <p>{@code GET} runs queries with the input taken from the {@code input} query parameter; {@code POST}
 * runs mutations with the input taken from the body. With {@code ?batch=1} the procedure path is a
 * comma-separated list and the input an object keyed by call index; all calls share one context, run
 * concurrently and fail independently. {@code HEAD} always answers {@code 204}.
 *
 * <p>Use {@link #builder(ProcedureRouter)} to create instances with custom configuration:
 * <pre>{@code
 * RpcRequestHandler<Session> handler = RpcRequestHandler.builder(router)
 *     .contextFactory(req -> sessions.resolve(req))
 *     .batchingEnabled(true)
 *     .maxBodySize(RpcRequestHandler.DEFAULT_MAX_BODY_SIZE)
 *     .errorListener(details -> metrics.record(details.error()))
 *     .build();
 * }</pre>
 *
 * @param <C> context type
 */
public final class RpcRequestHandler<C> {
    private static final Logger log = LoggerFactory.getLogger(RpcRequestHandler.class);

    /**
     * Convenience constant: 10 MB.
     *
     * <p>Not used by default.
     */
    public static final long DEFAULT_MAX_BODY_SIZE = 10 * 1024 * 1024;

    /**
     * Disable body size limiting (unlimited).
     *
     * <p>This is the default; let the hosting framework enforce limits.
     */
    public static final long NO_BODY_SIZE_LIMIT = RequestBodies.NO_LIMIT;

    // Written without the codec so it survives codec failures.
    private static final byte[] FALLBACK_BODY = ("{\"id\":null,\"error\":{\"message\":\"Internal server error\",\"code\":"
            + ErrorCode.INTERNAL_SERVER_ERROR.jsonRpcCode() + ",\"data\":{\"code\":\"INTERNAL_SERVER_ERROR\",\"httpStatus\":500}}}")
            .getBytes(StandardCharsets.UTF_8);

    private final ProcedureRouter<C> router;
    private final ContextFactory<C> contextFactory;
    private final ErrorShaper<C> errorShaper;
    private final ErrorListener<C> errorListener;
    private final DataTransformer transformer;
    private final boolean batchingEnabled;
    private final InputExtractor inputExtractor;
    private final ResponseBuilder<C> responseBuilder;

    /**
     * Creates a new builder for configuring a handler.
     *
     * @param router the procedure registry (required)
     * @return a new builder instance
     */
    public static <C> Builder<C> builder(ProcedureRouter<C> router) {
        return new Builder<>(router);
    }

    private RpcRequestHandler(Builder<C> builder) {
        this.router = Objects.requireNonNull(builder.router, "router");
        this.contextFactory = builder.contextFactory != null ? builder.contextFactory : ContextFactory.none();
        this.errorShaper = builder.errorShaper != null ? builder.errorShaper : new DefaultErrorShaper<>();
        this.errorListener = builder.errorListener != null ? builder.errorListener : ErrorListener.noop();
        this.transformer = builder.transformer != null ? builder.transformer : DataTransformer.identity();
        this.batchingEnabled = builder.batchingEnabled;
        JsonCodec codec = builder.codec != null ? builder.codec : JsonCodecs.load();
        long maxBodySize = builder.maxBodySize > 0 ? builder.maxBodySize : NO_BODY_SIZE_LIMIT;
        this.inputExtractor = new InputExtractor(codec, maxBodySize);
        this.responseBuilder = new ResponseBuilder<>(codec, transformer,
                builder.responseMeta != null ? builder.responseMeta : ResponseMetaProvider.none());
    }

    /**
     * Builder for {@link RpcRequestHandler}.
     */
    public static final class Builder<C> {
        private final ProcedureRouter<C> router;
        private ContextFactory<C> contextFactory;
        private ErrorShaper<C> errorShaper;
        private ErrorListener<C> errorListener;
        private ResponseMetaProvider<C> responseMeta;
        private DataTransformer transformer;
        private JsonCodec codec;
        private boolean batchingEnabled = true;
        private long maxBodySize;

        private Builder(ProcedureRouter<C> router) {
            this.router = Objects.requireNonNull(router, "router");
        }

        /** Sets the per-request context factory. Default: null context. */
        public Builder<C> contextFactory(ContextFactory<C> contextFactory) {
            this.contextFactory = contextFactory;
            return this;
        }

        /** Sets the error shaper. Default: {@link DefaultErrorShaper} without stack traces. */
        public Builder<C> errorShaper(ErrorShaper<C> errorShaper) {
            this.errorShaper = errorShaper;
            return this;
        }

        /** Sets the failure observer. Default: none. */
        public Builder<C> errorListener(ErrorListener<C> errorListener) {
            this.errorListener = errorListener;
            return this;
        }

        /** Sets the response meta hook. Default: none. */
        public Builder<C> responseMeta(ResponseMetaProvider<C> responseMeta) {
            this.responseMeta = responseMeta;
            return this;
        }

        /** Sets the payload transformer. Default: {@link DataTransformer#identity()}. */
        public Builder<C> transformer(DataTransformer transformer) {
            this.transformer = transformer;
            return this;
        }

        /** Sets the JSON codec. Default: the first {@code JsonCodecProvider} found by ServiceLoader. */
        public Builder<C> codec(JsonCodec codec) {
            this.codec = codec;
            return this;
        }

        /** Enables or disables {@code ?batch=1} requests. Default: enabled. */
        public Builder<C> batchingEnabled(boolean batchingEnabled) {
            this.batchingEnabled = batchingEnabled;
            return this;
        }

        /**
         * Sets the maximum request body size in bytes. Default: unlimited.
         *
         * <p>Use {@link RpcRequestHandler#DEFAULT_MAX_BODY_SIZE} as a conservative default, or
         * {@link RpcRequestHandler#NO_BODY_SIZE_LIMIT} to disable limiting.
         */
        public Builder<C> maxBodySize(long maxBodySize) {
            this.maxBodySize = maxBodySize;
            return this;
        }

        /** Builds the handler with the configured settings. */
        public RpcRequestHandler<C> build() {
            return new RpcRequestHandler<>(this);
        }
    }

    /**
     * Handles a request and waits for its response.
     *
     * @param req the incoming request
     * @param path the procedure path taken from the route; comma-separated for batch calls
     * @return the response, never an exception
     */
    public ServerResponse handle(ServerRequest req, String path) {
        return handleAsync(req, path).join();
    }

    /**
     * Handles a request.
     *
     * <p>The returned future always completes normally: every failure is turned into an error envelope.
     *
     * @param req the incoming request
     * @param path the procedure path taken from the route; comma-separated for batch calls
     */
    public CompletableFuture<ServerResponse> handleAsync(ServerRequest req, String path) {
        Objects.requireNonNull(req, "req");
        if ("HEAD".equalsIgnoreCase(req.method())) {
            return CompletableFuture.completedFuture(new ServerResponse(HttpStatusCodes.NO_CONTENT, new ResponseBody.Empty()));
        }

        Exchange<C> exchange = new Exchange<>(req, ProcedureType.fromHttpMethod(req.method()),
                Protocol.BATCH_ENABLED.equals(req.query().get(Protocol.Q_BATCH)));

        CompletableFuture<List<CallOutcome>> outcomes;
        try {
            outcomes = dispatch(exchange, path);
        } catch (Throwable e) {
            outcomes = CompletableFuture.failedFuture(e);
        }
        return outcomes
                .handle((results, error) -> error != null ? requestFailed(exchange, error) : respond(exchange, results))
                .exceptionally(error -> fallback(exchange, error));
    }

    private CompletableFuture<List<CallOutcome>> dispatch(Exchange<C> exchange, String path) {
        if (exchange.batch && !batchingEnabled) {
            throw new RpcException(ErrorCode.INTERNAL_SERVER_ERROR, "Batching is not enabled on the server");
        }
        if (!exchange.type.isServableOverHttp()) {
            throw new RpcException(ErrorCode.METHOD_NOT_SUPPORTED, "Unexpected request method " + exchange.request.method());
        }
        ProcedureInput rawInput = inputExtractor.extract(exchange.request, exchange.type);

        Objects.requireNonNull(path, "path");
        List<String> paths = exchange.batch ? Arrays.asList(path.split(Protocol.PATH_SEPARATOR, -1)) : List.of(path);
        exchange.paths = paths;

        return invoke(() -> contextFactory.createContext(exchange.request)).thenCompose(context -> {
            exchange.context = context;
            BatchInputs inputs = exchange.batch
                    ? BatchInputs.batch(rawInput, transformer)
                    : BatchInputs.single(rawInput, transformer);

            List<CompletableFuture<CallOutcome>> calls = new ArrayList<>(paths.size());
            for (int i = 0; i < paths.size(); i++) {
                calls.add(call(exchange, paths.get(i), inputs.get(i)));
            }
            return CompletableFuture.allOf(calls.toArray(CompletableFuture[]::new))
                    .thenApply(done -> calls.stream().map(CompletableFuture::join).toList());
        });
    }

    // Never completes exceptionally: failures are folded into the outcome.
    private CompletableFuture<CallOutcome> call(Exchange<C> exchange, String path, ProcedureInput input) {
        ProcedureCall<C> call = new ProcedureCall<>(exchange.context, path, input, exchange.type);
        return invoke(() -> router.call(call)).handle((data, failure) -> {
            if (failure == null) {
                return CallOutcome.success(path, input, data);
            }
            RpcException error = RpcException.from(failure);
            log.debug("Procedure {} failed with {}", path, error.code(), error);
            notifyListener(new ErrorDetails<>(error, path, input, exchange.context, exchange.type, exchange.request));
            return CallOutcome.failure(path, input, error);
        });
    }

    private ServerResponse respond(Exchange<C> exchange, List<CallOutcome> outcomes) {
        List<RpcException> errors = new ArrayList<>();
        List<ResponseEnvelope> envelopes = new ArrayList<>(outcomes.size());
        for (CallOutcome outcome : outcomes) {
            if (outcome.failed()) {
                errors.add(outcome.error());
                Object shape = errorShaper.shape(new ErrorShapeRequest<>(
                        outcome.error(), exchange.type, outcome.path(), outcome.input(), exchange.context));
                envelopes.add(new ResponseEnvelope.Error(outcome.error(), shape));
            } else {
                envelopes.add(new ResponseEnvelope.Result(outcome.data()));
            }
        }
        return responseBuilder.build(exchange.context, exchange.paths, exchange.type, envelopes, exchange.batch, errors);
    }

    // Gates, input extraction, context creation and input decoding abort the whole request.
    private ServerResponse requestFailed(Exchange<C> exchange, Throwable failure) {
        RpcException error = RpcException.from(failure);
        log.debug("Rejected {} request with {}: {}", exchange.request.method(), error.code(), error.getMessage());

        Object shape = errorShaper.shape(new ErrorShapeRequest<>(
                error, exchange.type, null, ProcedureInput.absent(), exchange.context));
        notifyListener(new ErrorDetails<>(error, null, ProcedureInput.absent(), exchange.context, exchange.type, exchange.request));
        return responseBuilder.build(exchange.context, exchange.paths, exchange.type,
                List.of(new ResponseEnvelope.Error(error, shape)), false, List.of(error));
    }

    private ServerResponse fallback(Exchange<C> exchange, Throwable failure) {
        log.error("Failed to build response for {} {}", exchange.request.method(), exchange.request.uri(), failure);
        return new ServerResponse(HttpStatusCodes.INTERNAL_SERVER_ERROR, new ResponseBody.Bytes(FALLBACK_BODY.clone()))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON);
    }

    private void notifyListener(ErrorDetails<C> details) {
        try {
            errorListener.onError(details);
        } catch (Throwable e) {
            log.warn("Error listener failed for path {}", details.path(), e);
        }
    }

    // Turns synchronous throws, errors included, into failed stages.
    private static <T> CompletableFuture<T> invoke(Supplier<? extends CompletionStage<T>> action) {
        try {
            CompletionStage<T> stage = action.get();
            if (stage == null) {
                return CompletableFuture.completedFuture(null);
            }
            return stage.toCompletableFuture();
        } catch (Throwable e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /** Per-request state filled in as the request advances through the pipeline. */
    private static final class Exchange<C> {
        final ServerRequest request;
        final ProcedureType type;
        final boolean batch;
        volatile List<String> paths;
        volatile C context;

        Exchange(ServerRequest request, ProcedureType type, boolean batch) {
            this.request = request;
            this.type = type;
            this.batch = batch;
        }
    }
}
