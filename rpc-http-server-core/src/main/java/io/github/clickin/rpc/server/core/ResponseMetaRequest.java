package io.github.clickin.rpc.server.core;

import io.github.clickin.rpc.core.ProcedureType;
import io.github.clickin.rpc.core.RpcException;

import java.util.List;

/**
 * Everything a {@link ResponseMetaProvider} may inspect.
 *
 * @param context the request context, or null when the request failed before it was created
 * @param paths the requested procedure paths, or null when the request failed before they were split
 * @param type the procedure type of the request
 * @param data every envelope of the response, a single-element list for non-batch responses
 * @param errors every error of the response
 * @param <C> context type
 */
public record ResponseMetaRequest<C>(C context, List<String> paths, ProcedureType type,
                                     List<ResponseEnvelope> data, List<RpcException> errors) {
}
