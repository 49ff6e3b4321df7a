package io.github.clickin.rpc.server.core;

/**
 * Observability hook notified of every failure, call-level and request-level.
 *
 * <p>Fire-and-forget: exceptions thrown here are logged and never change the response.
 *
 * @param <C> context type
 */
@FunctionalInterface
public interface ErrorListener<C> {
    void onError(ErrorDetails<C> details);

    static <C> ErrorListener<C> noop() {
        return details -> {};
    }
}
