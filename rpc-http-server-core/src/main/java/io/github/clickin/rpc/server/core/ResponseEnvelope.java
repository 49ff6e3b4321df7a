package io.github.clickin.rpc.server.core;

import io.github.clickin.rpc.core.Protocol;
import io.github.clickin.rpc.core.RpcException;
import io.github.clickin.rpc.server.spi.DataTransformer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Uniform wire representation of one call's outcome.
 *
 * <p>Success: {@code {"id": null, "result": {"type": "data", "data": ...}}}.
 * Failure: {@code {"id": null, "error": <shaped error>}}.
 */
public sealed interface ResponseEnvelope permits ResponseEnvelope.Result, ResponseEnvelope.Error {

    /** Successful call; {@code data} is the untransformed procedure output. */
    record Result(Object data) implements ResponseEnvelope {}

    /**
     * Failed call.
     *
     * @param cause the normalized error, used for the HTTP status
     * @param shape the shaped error written to the wire
     */
    record Error(RpcException cause, Object shape) implements ResponseEnvelope {
        public Error {
            Objects.requireNonNull(cause, "cause");
        }
    }

    default boolean isError() {
        return this instanceof Error;
    }

    /**
     * Builds the JSON-ready map, passing payloads through {@link DataTransformer#serializeOutput}.
     */
    default Map<String, Object> toWire(DataTransformer transformer) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", null);
        if (this instanceof Result result) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("type", Protocol.RESULT_TYPE_DATA);
            body.put("data", transformer.serializeOutput(result.data()));
            json.put("result", body);
        } else {
            json.put("error", transformer.serializeOutput(((Error) this).shape()));
        }
        return json;
    }
}
