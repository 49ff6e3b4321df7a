package io.github.clickin.rpc.server.spi;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Registry that executes named procedures.
 *
 * <p>Implementations look up {@link ProcedureCall#path()} and run the procedure with the given context
 * and input. Failures may be thrown directly or reported through the returned stage; throw
 * {@link io.github.clickin.rpc.core.RpcException} to choose the error code sent to the client.
 * An unknown path should fail with {@link io.github.clickin.rpc.core.ErrorCode#NOT_FOUND}.
 *
 * <p>Calls of one batch are started together, so implementations must tolerate concurrent invocations
 * sharing one context.
 *
 * @param <C> context type
 */
@FunctionalInterface
public interface ProcedureRouter<C> {

    /**
     * Executes a procedure.
     *
     * @param call the call to execute
     * @return a stage completing with the procedure output (may complete with null)
     */
    CompletionStage<Object> call(ProcedureCall<C> call);

    /**
     * Blocking procedure execution, see {@link #blocking(Blocking, Executor)}.
     */
    @FunctionalInterface
    interface Blocking<C> {
        Object call(ProcedureCall<C> call) throws Exception;
    }

    /**
     * Adapts a blocking registry by running each call on {@code executor}.
     *
     * <p>Batch calls then run in parallel up to the executor's capacity.
     */
    static <C> ProcedureRouter<C> blocking(Blocking<C> delegate, Executor executor) {
        Objects.requireNonNull(delegate, "delegate");
        Objects.requireNonNull(executor, "executor");
        return call -> CompletableFuture.supplyAsync(() -> {
            try {
                return delegate.call(call);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    /**
     * Adapts a blocking registry onto a process-wide executor: virtual threads when the runtime provides
     * them, otherwise a cached pool of daemon threads named {@code rpc-procedure-N}.
     */
    static <C> ProcedureRouter<C> blocking(Blocking<C> delegate) {
        return blocking(delegate, ProcedureExecutors.shared());
    }
}
