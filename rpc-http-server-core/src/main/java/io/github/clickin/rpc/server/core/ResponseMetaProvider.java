package io.github.clickin.rpc.server.core;

/**
 * Hook computing extra response headers and an optional status override from the full set of outcomes.
 *
 * <p>Typical uses are {@code Cache-Control} for successful queries and mapping errors to custom statuses.
 * Must be pure; a null result is treated as {@link ResponseMeta#none()}.
 *
 * @param <C> context type
 */
@FunctionalInterface
public interface ResponseMetaProvider<C> {
    ResponseMeta meta(ResponseMetaRequest<C> request);

    static <C> ResponseMetaProvider<C> none() {
        return request -> ResponseMeta.none();
    }
}
