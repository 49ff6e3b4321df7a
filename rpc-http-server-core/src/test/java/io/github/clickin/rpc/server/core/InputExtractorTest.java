package io.github.clickin.rpc.server.core;

import io.github.clickin.rpc.core.ErrorCode;
import io.github.clickin.rpc.core.ProcedureType;
import io.github.clickin.rpc.core.RpcException;
import io.github.clickin.rpc.json.jackson.JacksonJsonCodec;
import io.github.clickin.rpc.json.spi.JsonException;
import io.github.clickin.rpc.server.spi.ProcedureInput;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputExtractorTest {

    private final InputExtractor extractor = new InputExtractor(new JacksonJsonCodec(), 64);

    @Test
    void queryWithoutInputParameterIsAbsent() {
        ProcedureInput input = extractor.extract(get("http://localhost/rpc/q"), ProcedureType.QUERY);
        assertThat(input).isEqualTo(ProcedureInput.absent());
    }

    @Test
    void queryParsesInputParameter() {
        ProcedureInput input = extractor.extract(get("http://localhost/rpc/q?input=%7B%22a%22%3A1%7D"), ProcedureType.QUERY);
        assertThat(input).isEqualTo(ProcedureInput.of(Map.of("a", 1)));
    }

    @Test
    void queryInputNullIsPresentNull() {
        ProcedureInput input = extractor.extract(get("http://localhost/rpc/q?input=null"), ProcedureType.QUERY);
        assertThat(input.isPresent()).isTrue();
        assertThat(input.valueOrNull()).isNull();
    }

    @Test
    void malformedQueryInputIsParseErrorKeepingCause() {
        assertThatThrownBy(() -> extractor.extract(get("http://localhost/rpc/q?input=not-json"), ProcedureType.QUERY))
                .isInstanceOf(RpcException.class)
                .satisfies(e -> {
                    assertThat(((RpcException) e).code()).isEqualTo(ErrorCode.PARSE_ERROR);
                    assertThat(e.getCause()).isInstanceOf(JsonException.class);
                });
    }

    @Test
    void streamBodyIsParsed() {
        ProcedureInput input = extractor.extract(post(new RequestBody.Stream(stream("[1,2]"))), ProcedureType.MUTATION);
        assertThat(input).isEqualTo(ProcedureInput.of(List.of(1, 2)));
    }

    @Test
    void textBodyIsParsed() {
        ProcedureInput input = extractor.extract(post(new RequestBody.Text("\"hi\"")), ProcedureType.MUTATION);
        assertThat(input).isEqualTo(ProcedureInput.of("hi"));
    }

    @Test
    void parsedBodyPassesThroughUnchanged() {
        Map<String, Object> decoded = Map.of("already", true);
        ProcedureInput input = extractor.extract(post(new RequestBody.Parsed(decoded)), ProcedureType.MUTATION);
        assertThat(input.valueOrNull()).isSameAs(decoded);
    }

    @Test
    void emptyBodyIsAbsent() {
        assertThat(extractor.extract(post(new RequestBody.Empty()), ProcedureType.MUTATION).isPresent()).isFalse();
        assertThat(extractor.extract(post(new RequestBody.Stream(stream(""))), ProcedureType.MUTATION).isPresent()).isFalse();
    }

    @Test
    void malformedBodyIsParseError() {
        assertThatThrownBy(() -> extractor.extract(post(new RequestBody.Text("{oops")), ProcedureType.MUTATION))
                .isInstanceOf(RpcException.class)
                .extracting(e -> ((RpcException) e).code())
                .isEqualTo(ErrorCode.PARSE_ERROR);
    }

    @Test
    void malformedStreamBodyIsParseError() {
        assertThatThrownBy(() -> extractor.extract(post(new RequestBody.Stream(stream("[1,"))), ProcedureType.MUTATION))
                .isInstanceOf(RpcException.class)
                .extracting(e -> ((RpcException) e).code())
                .isEqualTo(ErrorCode.PARSE_ERROR);
    }

    @Test
    void oversizedBodyIsPayloadTooLarge() {
        String big = "\"" + "x".repeat(100) + "\"";
        assertThatThrownBy(() -> extractor.extract(post(new RequestBody.Stream(stream(big))), ProcedureType.MUTATION))
                .isInstanceOf(RpcException.class)
                .extracting(e -> ((RpcException) e).code())
                .isEqualTo(ErrorCode.PAYLOAD_TOO_LARGE);
    }

    private static ServerRequest get(String uri) {
        return new ServerRequest("GET", URI.create(uri), Map.of(), null);
    }

    private static ServerRequest post(RequestBody body) {
        return new ServerRequest("POST", URI.create("http://localhost/rpc/m"), Map.of(), body);
    }

    private static ByteArrayInputStream stream(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }
}
