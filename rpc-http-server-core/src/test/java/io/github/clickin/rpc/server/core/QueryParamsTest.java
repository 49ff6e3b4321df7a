package io.github.clickin.rpc.server.core;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class QueryParamsTest {

    @Test
    void parseDecodesKeysAndValues() {
        QueryParams parsed = QueryParams.parse(URI.create("http://localhost/rpc/user.byId?input=%7B%22a%22%3A1%7D&batch=1"));
        assertThat(parsed.get("input")).isEqualTo("{\"a\":1}");
        assertThat(parsed.get("batch")).isEqualTo("1");
    }

    @Test
    void parseHandlesMissingValueAsEmpty() {
        QueryParams parsed = QueryParams.parse(URI.create("http://localhost/rpc/x?input"));
        assertThat(parsed.has("input")).isTrue();
        assertThat(parsed.get("input")).isEmpty();
    }

    @Test
    void keepsEveryValueOfRepeatedKeys() {
        QueryParams parsed = QueryParams.parse(URI.create("http://localhost/rpc/x?tag=a&tag=b"));
        assertThat(parsed.get("tag")).isEqualTo("a");
        assertThat(parsed.getAll("tag")).containsExactly("a", "b");
    }

    @Test
    void missingParametersAreAbsent() {
        QueryParams parsed = QueryParams.parse(URI.create("http://localhost/rpc/x"));
        assertThat(parsed.has("input")).isFalse();
        assertThat(parsed.get("input")).isNull();
        assertThat(parsed.getAll("input")).isEmpty();
    }

    @Test
    void decodesKeysBeforeComparing() {
        QueryParams parsed = QueryParams.parse(URI.create("http://localhost/rpc/x?inp%75t=1"));
        assertThat(parsed.has("input")).isTrue();
    }
}
