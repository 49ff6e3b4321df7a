package io.github.clickin.rpc.server.core;

import io.github.clickin.rpc.core.ErrorCode;
import io.github.clickin.rpc.core.Protocol;
import io.github.clickin.rpc.core.ProcedureType;
import io.github.clickin.rpc.core.RpcException;
import io.github.clickin.rpc.json.spi.JsonCodec;
import io.github.clickin.rpc.json.spi.JsonException;
import io.github.clickin.rpc.server.spi.ProcedureInput;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Pulls the still-encoded input out of a request.
 *
 * <p>Queries read the {@code input} query parameter; every other method reads the body. The result is
 * interpreted later as a single value or as an index-keyed batch object.
 */
final class InputExtractor {
    private final JsonCodec codec;
    private final long maxBodySize;

    InputExtractor(JsonCodec codec, long maxBodySize) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.maxBodySize = maxBodySize;
    }

    /**
     * @throws RpcException {@link ErrorCode#PARSE_ERROR} for malformed JSON,
     *         {@link ErrorCode#PAYLOAD_TOO_LARGE} for oversized bodies
     */
    ProcedureInput extract(ServerRequest req, ProcedureType type) {
        if (type == ProcedureType.QUERY) {
            QueryParams query = req.query();
            if (!query.has(Protocol.Q_INPUT)) {
                return ProcedureInput.absent();
            }
            return ProcedureInput.of(parse(query.get(Protocol.Q_INPUT)));
        }

        RequestBody body = req.body();
        if (body instanceof RequestBody.Parsed parsed) {
            return ProcedureInput.of(parsed.value());
        }
        if (body instanceof RequestBody.Stream stream) {
            byte[] bytes = readBytes(stream);
            return bytes.length == 0 ? ProcedureInput.absent() : ProcedureInput.of(parse(bytes));
        }
        String text = body instanceof RequestBody.Text t ? t.text() : null;
        if (text == null || text.isEmpty()) {
            return ProcedureInput.absent();
        }
        if (text.getBytes(StandardCharsets.UTF_8).length > maxBodySize) {
            throw RequestBodies.tooLarge(maxBodySize);
        }
        return ProcedureInput.of(parse(text));
    }

    private byte[] readBytes(RequestBody.Stream body) {
        try {
            return RequestBodies.readAll(body.input(), maxBodySize);
        } catch (IOException e) {
            throw new RpcException(ErrorCode.BAD_REQUEST, "Failed to read request body", e);
        }
    }

    private Object parse(byte[] json) {
        try {
            return codec.readValue(json, Object.class);
        } catch (JsonException e) {
            throw new RpcException(ErrorCode.PARSE_ERROR, null, e);
        }
    }

    private Object parse(String json) {
        try {
            return codec.readValue(json);
        } catch (JsonException e) {
            throw new RpcException(ErrorCode.PARSE_ERROR, null, e);
        }
    }
}
