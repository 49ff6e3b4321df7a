package io.github.clickin.rpc.server.core;

import io.github.clickin.rpc.core.RpcException;
import io.github.clickin.rpc.server.spi.ProcedureInput;

/**
 * Result of one procedure call: either {@code data} or {@code error} is meaningful.
 */
record CallOutcome(String path, ProcedureInput input, Object data, RpcException error) {

    static CallOutcome success(String path, ProcedureInput input, Object data) {
        return new CallOutcome(path, input, data, null);
    }

    static CallOutcome failure(String path, ProcedureInput input, RpcException error) {
        return new CallOutcome(path, input, null, error);
    }

    boolean failed() {
        return error != null;
    }
}
