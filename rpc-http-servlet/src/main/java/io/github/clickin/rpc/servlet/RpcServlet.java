package io.github.clickin.rpc.servlet;

import io.github.clickin.rpc.server.core.RequestBody;
import io.github.clickin.rpc.server.core.ResponseBody;
import io.github.clickin.rpc.server.core.RpcRequestHandler;
import io.github.clickin.rpc.server.core.ServerRequest;
import io.github.clickin.rpc.server.core.ServerResponse;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal HttpServlet adapter for {@link RpcRequestHandler}.
 *
 * <p>The procedure path is the servlet path info without its leading slash, so mapping this servlet to
 * {@code /rpc/*} serves {@code /rpc/user.byId} and batches such as {@code /rpc/user.byId,post.list?batch=1}.
 *
 * <p>Notes:
 * <ul>
 *   <li>When the container supports it, the request is processed asynchronously and the container thread is
 *   released while procedures run.</li>
 *   <li>The optional teardown callback runs once per request after the response was written.</li>
 * </ul>
 */
public final class RpcServlet extends HttpServlet {
    private static final Logger log = LoggerFactory.getLogger(RpcServlet.class);

    private static final String QUERY_CHARS =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-._~!$&'()*+,;=:@/?";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final transient RpcRequestHandler<?> handler;
    private final transient Runnable teardown;

    public RpcServlet(RpcRequestHandler<?> handler) {
        this(handler, null);
    }

    /**
     * @param handler the request handler
     * @param teardown callback run after each response, may be null
     */
    public RpcServlet(RpcRequestHandler<?> handler, Runnable teardown) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.teardown = teardown;
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        ServerRequest engineReq;
        try {
            engineReq = toEngineRequest(req);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Could not read {} {}", req.getMethod(), req.getRequestURI(), e);
            resp.setStatus(HttpServletResponse.SC_BAD_REQUEST);
            runTeardown();
            return;
        }
        String path = procedurePath(req);

        if (!req.isAsyncSupported()) {
            try {
                write(resp, handler.handle(engineReq, path));
            } finally {
                runTeardown();
            }
            return;
        }

        AsyncContext async = req.startAsync();
        async.setTimeout(0);
        handler.handleAsync(engineReq, path).whenComplete((engineResp, error) -> {
            try {
                HttpServletResponse asyncResp = (HttpServletResponse) async.getResponse();
                if (error != null) {
                    log.error("Request handling failed for {}", path, error);
                    asyncResp.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
                } else {
                    write(asyncResp, engineResp);
                }
            } catch (IOException e) {
                log.debug("Client went away while writing response for {}", path, e);
            } finally {
                async.complete();
                runTeardown();
            }
        });
    }

    static String procedurePath(HttpServletRequest req) {
        String info = req.getPathInfo();
        if (info == null) return "";
        return info.startsWith("/") ? info.substring(1) : info;
    }

    private static ServerRequest toEngineRequest(HttpServletRequest req) throws IOException {
        StringBuilder url = new StringBuilder(req.getRequestURL());
        if (req.getQueryString() != null) {
            url.append('?').append(escapeQuery(req.getQueryString()));
        }
        URI uri = URI.create(url.toString());

        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        while (names != null && names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name, Collections.list(req.getHeaders(name)));
        }

        // GET and HEAD never carry input in the body
        boolean readsBody = !"GET".equalsIgnoreCase(req.getMethod()) && !"HEAD".equalsIgnoreCase(req.getMethod());
        RequestBody body = readsBody && req.getContentLengthLong() != 0
                ? new RequestBody.Stream(req.getInputStream())
                : new RequestBody.Empty();
        return new ServerRequest(req.getMethod(), uri, headers, body);
    }

    /**
     * Percent-encodes the characters {@link URI} rejects, leaving well-formed escapes alone.
     *
     * <p>Containers hand the query string over as the client sent it, so {@code input={"id":1}} or a stray
     * {@code %} reach the handler intact and get answered with a JSON result or a parse error.
     */
    static String escapeQuery(String raw) {
        byte[] bytes = raw.getBytes(StandardCharsets.UTF_8);
        StringBuilder out = new StringBuilder(bytes.length + 16);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            if (b == '%') {
                boolean escape = i + 2 < bytes.length && isHex(bytes[i + 1]) && isHex(bytes[i + 2]);
                out.append(escape ? "%" : "%25");
            } else if (b < 0x80 && QUERY_CHARS.indexOf(b) >= 0) {
                out.append((char) b);
            } else {
                out.append('%').append(HEX[b >> 4]).append(HEX[b & 0x0F]);
            }
        }
        return out.toString();
    }

    private static boolean isHex(byte b) {
        return (b >= '0' && b <= '9') || (b >= 'a' && b <= 'f') || (b >= 'A' && b <= 'F');
    }

    private static void write(HttpServletResponse resp, ServerResponse engineResp) throws IOException {
        resp.setStatus(engineResp.status());
        engineResp.headers().forEach((k, vals) -> vals.forEach(v -> resp.addHeader(k, v)));

        ResponseBody body = engineResp.body();
        if (body instanceof ResponseBody.Bytes bytes) {
            resp.setContentLength(bytes.bytes().length);
            resp.getOutputStream().write(bytes.bytes());
            resp.getOutputStream().flush();
        }
    }

    private void runTeardown() {
        if (teardown == null) return;
        try {
            teardown.run();
        } catch (RuntimeException e) {
            log.warn("Teardown callback failed", e);
        }
    }
}
