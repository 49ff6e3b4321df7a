package io.github.clickin.rpc.server.core;

import io.github.clickin.rpc.core.ProcedureType;
import io.github.clickin.rpc.core.RpcException;
import io.github.clickin.rpc.server.spi.ProcedureInput;

/**
 * Failure report passed to an {@link ErrorListener}.
 *
 * @param error the normalized error
 * @param path the failing procedure, or null for request-level errors
 * @param input the call input; absent for request-level errors
 * @param context the request context, or null when it was not created
 * @param type the procedure type of the request
 * @param request the original request
 * @param <C> context type
 */
public record ErrorDetails<C>(RpcException error, String path, ProcedureInput input, C context,
                              ProcedureType type, ServerRequest request) {
}
