package io.github.clickin.rpc.server.spi;

import io.github.clickin.rpc.core.ProcedureType;

import java.util.Objects;

/**
 * One invocation handed to a {@link ProcedureRouter}.
 *
 * @param context the per-request context, shared by every call of a batch (may be null)
 * @param path the procedure path, e.g. {@code "user.byId"}
 * @param input the decoded input
 * @param type the procedure type derived from the HTTP method
 * @param <C> context type
 */
public record ProcedureCall<C>(C context, String path, ProcedureInput input, ProcedureType type) {
    public ProcedureCall {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(type, "type");
    }
}
