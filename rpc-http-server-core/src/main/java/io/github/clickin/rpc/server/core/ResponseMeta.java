package io.github.clickin.rpc.server.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Extra headers and an optional status override returned by a {@link ResponseMetaProvider}.
 *
 * @param headers headers merged over the defaults; on a name collision these win
 * @param status status that replaces the derived one when present
 */
public record ResponseMeta(Map<String, String> headers, OptionalInt status) {

    public ResponseMeta {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        status = status == null ? OptionalInt.empty() : status;
    }

    public static ResponseMeta none() {
        return new ResponseMeta(Map.of(), OptionalInt.empty());
    }

    public static ResponseMeta status(int status) {
        return new ResponseMeta(Map.of(), OptionalInt.of(status));
    }

    public static ResponseMeta headers(Map<String, String> headers) {
        return new ResponseMeta(Objects.requireNonNull(headers, "headers"), OptionalInt.empty());
    }

    public ResponseMeta withStatus(int status) {
        return new ResponseMeta(headers, OptionalInt.of(status));
    }

    public ResponseMeta withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new ResponseMeta(copy, status);
    }
}
