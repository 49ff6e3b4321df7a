package io.github.clickin.rpc.server.core;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Framework-neutral request abstraction.
 *
 * <p>Adapters should map their framework-specific request objects to this class. The method is kept as
 * the raw string so that methods this transport does not serve can still be answered properly.
 */
public final class ServerRequest {
    private final String method;
    private final URI uri;
    private final Map<String, List<String>> headers;
    private final RequestBody body;
    private final QueryParams query;

    /**
     * Creates a new request.
     *
     * @param method the HTTP method, e.g. {@code "GET"}
     * @param uri the full request URI (including query parameters)
     * @param headers the request headers
     * @param body the request body
     */
    public ServerRequest(String method, URI uri, Map<String, List<String>> headers, RequestBody body) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = Map.copyOf(Objects.requireNonNull(headers, "headers"));
        this.body = body != null ? body : new RequestBody.Empty();
        this.query = QueryParams.parse(uri);
    }

    public String method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public RequestBody body() {
        return body;
    }

    /** Decoded query parameters of {@link #uri()}. */
    public QueryParams query() {
        return query;
    }
}
