package io.github.clickin.rpc.server.core;

import io.github.clickin.rpc.core.Headers;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Framework-neutral response abstraction.
 *
 * <p>Adapters should map instances of this class to their framework-specific response objects.
 */
public final class ServerResponse {
    private final int status;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final ResponseBody body;

    /**
     * Creates a new response.
     *
     * @param status the HTTP status code
     * @param body the response body
     */
    public ServerResponse(int status, ResponseBody body) {
        this.status = status;
        this.body = body;
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public ResponseBody body() {
        return body;
    }

    /** First value of a header, matched case-insensitively. */
    public Optional<String> firstHeader(String name) {
        return Headers.firstValue(headers, name);
    }

    /**
     * Adds a header to the response.
     *
     * @param name the header name
     * @param value the header value
     * @return this response (for chaining)
     */
    public ServerResponse header(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }

    /**
     * Replaces every value of a header, matching existing names case-insensitively.
     *
     * @return this response (for chaining)
     */
    public ServerResponse setHeader(String name, String value) {
        Iterator<String> names = headers.keySet().iterator();
        while (names.hasNext()) {
            if (names.next().equalsIgnoreCase(name)) names.remove();
        }
        return header(name, value);
    }
}
