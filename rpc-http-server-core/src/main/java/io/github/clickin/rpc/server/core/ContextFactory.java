package io.github.clickin.rpc.server.core;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Creates the per-request context shared by every call of a request.
 *
 * <p>Invoked exactly once per request, after the request passed validation and before any procedure
 * runs. A failure aborts the whole request.
 *
 * @param <C> context type
 */
@FunctionalInterface
public interface ContextFactory<C> {
    CompletionStage<C> createContext(ServerRequest request);

    /** Context factory producing a null context. */
    static <C> ContextFactory<C> none() {
        return request -> CompletableFuture.completedFuture(null);
    }

    /** Adapts a synchronous factory. */
    static <C> ContextFactory<C> of(Function<ServerRequest, C> factory) {
        Objects.requireNonNull(factory, "factory");
        return request -> CompletableFuture.completedFuture(factory.apply(request));
    }
}
