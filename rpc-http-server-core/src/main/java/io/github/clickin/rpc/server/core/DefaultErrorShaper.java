package io.github.clickin.rpc.server.core;

import io.github.clickin.rpc.core.RpcException;
import io.github.clickin.rpc.server.spi.ErrorShapeRequest;
import io.github.clickin.rpc.server.spi.ErrorShaper;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default error shape:
 * <pre>{@code
 * {
 *   "message": "...",
 *   "code": -32600,
 *   "data": {"code": "BAD_REQUEST", "httpStatus": 400, "path": "user.byId", "stack": "..."}
 * }
 * }</pre>
 *
 * <p>{@code path} is omitted for request-level errors and {@code stack} unless enabled.
 */
public final class DefaultErrorShaper<C> implements ErrorShaper<C> {
    private final boolean includeStackTrace;

    public DefaultErrorShaper() {
        this(false);
    }

    public DefaultErrorShaper(boolean includeStackTrace) {
        this.includeStackTrace = includeStackTrace;
    }

    @Override
    public Object shape(ErrorShapeRequest<C> request) {
        RpcException error = request.error();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("code", error.code().name());
        data.put("httpStatus", error.code().httpStatus());
        if (request.path() != null) data.put("path", request.path());
        if (includeStackTrace) data.put("stack", stackTrace(error));

        Map<String, Object> shape = new LinkedHashMap<>();
        shape.put("message", error.getMessage());
        shape.put("code", error.code().jsonRpcCode());
        shape.put("data", data);
        return shape;
    }

    private static String stackTrace(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
