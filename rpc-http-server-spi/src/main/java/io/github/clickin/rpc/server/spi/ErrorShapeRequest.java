package io.github.clickin.rpc.server.spi;

import io.github.clickin.rpc.core.ProcedureType;
import io.github.clickin.rpc.core.RpcException;

/**
 * Inputs available when shaping an error for the wire.
 *
 * @param error the normalized error
 * @param type the procedure type of the request
 * @param path the failing procedure path, or null for request-level errors
 * @param input the call input; absent for request-level errors
 * @param context the request context, or null when it was not created
 * @param <C> context type
 */
public record ErrorShapeRequest<C>(RpcException error, ProcedureType type, String path, ProcedureInput input, C context) {
}
