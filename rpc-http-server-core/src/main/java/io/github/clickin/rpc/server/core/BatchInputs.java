package io.github.clickin.rpc.server.core;

import io.github.clickin.rpc.core.ErrorCode;
import io.github.clickin.rpc.core.RpcException;
import io.github.clickin.rpc.server.spi.DataTransformer;
import io.github.clickin.rpc.server.spi.ProcedureInput;

import java.util.HashMap;
import java.util.Map;

/**
 * Resolves the decoded input of every call in a request, keyed by positional index.
 *
 * <p>A batch sends one JSON object whose keys are the decimal indices of the calls:
 * {@code {"0": {...}, "1": {...}}}. Calls without an entry receive an absent input.
 */
final class BatchInputs {
    private final Map<Integer, ProcedureInput> byIndex;

    private BatchInputs(Map<Integer, ProcedureInput> byIndex) {
        this.byIndex = byIndex;
    }

    /** Single call: the whole raw input is the input of call 0. */
    static BatchInputs single(ProcedureInput raw, DataTransformer transformer) {
        return new BatchInputs(Map.of(0, raw.map(transformer::deserializeInput)));
    }

    /**
     * Batch call: splits an index-keyed object.
     *
     * @throws RpcException {@link ErrorCode#BAD_REQUEST} if the input is not an object or a key is not an index
     */
    static BatchInputs batch(ProcedureInput raw, DataTransformer transformer) {
        Object value = raw.valueOrNull();
        if (!(value instanceof Map<?, ?> object)) {
            throw new RpcException(ErrorCode.BAD_REQUEST, "\"input\" needs to be an object when doing a batch call");
        }
        Map<Integer, ProcedureInput> out = new HashMap<>();
        for (Map.Entry<?, ?> e : object.entrySet()) {
            int index = parseIndex(String.valueOf(e.getKey()));
            out.put(index, ProcedureInput.of(transformer.deserializeInput(e.getValue())));
        }
        return new BatchInputs(out);
    }

    ProcedureInput get(int index) {
        return byIndex.getOrDefault(index, ProcedureInput.absent());
    }

    // canonical non-negative decimal only: "0", "7", "12"; not "01", "+1", "1.0"
    static int parseIndex(String key) {
        boolean canonical = !key.isEmpty()
                && key.chars().allMatch(ch -> ch >= '0' && ch <= '9')
                && (key.length() == 1 || key.charAt(0) != '0');
        if (canonical) {
            try {
                return Integer.parseInt(key);
            } catch (NumberFormatException ignored) {
                // falls through to the rejection below
            }
        }
        throw new RpcException(ErrorCode.BAD_REQUEST, "Invalid batch input key \"" + key + "\": expected a call index");
    }
}
