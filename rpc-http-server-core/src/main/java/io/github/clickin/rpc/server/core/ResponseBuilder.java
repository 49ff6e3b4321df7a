package io.github.clickin.rpc.server.core;

import io.github.clickin.rpc.core.ErrorCode;
import io.github.clickin.rpc.core.Protocol;
import io.github.clickin.rpc.core.ProcedureType;
import io.github.clickin.rpc.core.RpcException;
import io.github.clickin.rpc.json.spi.JsonCodec;
import io.github.clickin.rpc.json.spi.JsonException;
import io.github.clickin.rpc.server.spi.DataTransformer;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns envelopes into the final HTTP response: status, headers, output transformation and JSON body.
 */
final class ResponseBuilder<C> {
    private final JsonCodec codec;
    private final DataTransformer transformer;
    private final ResponseMetaProvider<C> metaProvider;

    ResponseBuilder(JsonCodec codec, DataTransformer transformer, ResponseMetaProvider<C> metaProvider) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.transformer = Objects.requireNonNull(transformer, "transformer");
        this.metaProvider = Objects.requireNonNull(metaProvider, "metaProvider");
    }

    /**
     * Builds the response.
     *
     * @param envelopes envelopes in call order
     * @param batch whether the body is the envelope list (batch) or the first envelope alone
     * @param errors every error behind the envelopes
     */
    ServerResponse build(C context, List<String> paths, ProcedureType type,
                         List<ResponseEnvelope> envelopes, boolean batch, List<RpcException> errors) {
        int status = batch ? HttpStatusCodes.of(envelopes) : HttpStatusCodes.of(envelopes.get(0));

        ResponseMeta meta = metaProvider.meta(new ResponseMetaRequest<>(
                context, paths == null ? null : List.copyOf(paths), type, List.copyOf(envelopes), List.copyOf(errors)));
        if (meta == null) meta = ResponseMeta.none();
        if (meta.status().isPresent()) {
            status = meta.status().getAsInt();
        }

        Object wire = batch
                ? envelopes.stream().map(e -> e.toWire(transformer)).toList()
                : envelopes.get(0).toWire(transformer);
        byte[] body;
        try {
            body = codec.writeBytes(wire);
        } catch (JsonException e) {
            throw new RpcException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to serialize response", e);
        }

        ServerResponse resp = new ServerResponse(status, new ResponseBody.Bytes(body))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON);
        for (Map.Entry<String, String> h : meta.headers().entrySet()) {
            if (h.getKey() == null || h.getValue() == null) continue;
            resp.setHeader(h.getKey(), h.getValue());
        }
        return resp;
    }
}
