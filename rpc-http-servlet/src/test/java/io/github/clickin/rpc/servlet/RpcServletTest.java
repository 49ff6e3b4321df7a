package io.github.clickin.rpc.servlet;

import io.github.clickin.rpc.json.jackson.JacksonJsonCodec;
import io.github.clickin.rpc.server.core.RpcRequestHandler;
import io.github.clickin.rpc.server.spi.ProcedureRouter;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.WriteListener;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RpcServletTest {

    private final ProcedureRouter<Object> router = call ->
            CompletableFuture.completedFuture(call.path() + ":" + call.input().valueOrNull());

    private final AtomicInteger teardowns = new AtomicInteger();
    private RpcServlet servlet;
    private CapturingOutputStream out;
    private HttpServletResponse resp;

    @BeforeEach
    void setUp() throws IOException {
        RpcRequestHandler<Object> handler = RpcRequestHandler.builder(router).codec(new JacksonJsonCodec()).build();
        servlet = new RpcServlet(handler, teardowns::incrementAndGet);
        out = new CapturingOutputStream();
        resp = mock(HttpServletResponse.class);
        when(resp.getOutputStream()).thenReturn(out);
    }

    @Test
    void servesQueryFromPathInfo() throws Exception {
        HttpServletRequest req = request("GET", "/rpc/user.byId", "/user.byId", "input=%22u1%22", null);

        servlet.service(req, resp);

        verify(resp).setStatus(200);
        verify(resp).addHeader("Content-Type", "application/json");
        assertThat(out.text()).isEqualTo("{\"id\":null,\"result\":{\"type\":\"data\",\"data\":\"user.byId:u1\"}}");
        assertThat(teardowns).hasValue(1);
    }

    @Test
    void acceptsUnencodedJsonInQueryString() throws Exception {
        HttpServletRequest req = request("GET", "/rpc/user.byId", "/user.byId", "input={\"a\":1}", null);

        servlet.service(req, resp);

        verify(resp).setStatus(200);
        assertThat(out.text()).isEqualTo("{\"id\":null,\"result\":{\"type\":\"data\",\"data\":\"user.byId:{a=1}\"}}");
        assertThat(teardowns).hasValue(1);
    }

    @Test
    void malformedEscapeInQueryStringIsParseError() throws Exception {
        HttpServletRequest req = request("GET", "/rpc/user.byId", "/user.byId", "input=%ZZ", null);

        servlet.service(req, resp);

        verify(resp).setStatus(400);
        verify(resp).addHeader("Content-Type", "application/json");
        assertThat(out.text()).contains("\"code\":-32700");
        assertThat(teardowns).hasValue(1);
    }

    @Test
    void escapeQueryKeepsValidEscapesAndEncodesTheRest() {
        assertThat(RpcServlet.escapeQuery("input=%22u1%22&batch=1")).isEqualTo("input=%22u1%22&batch=1");
        assertThat(RpcServlet.escapeQuery("input={\"a\":[1]}")).isEqualTo("input=%7B%22a%22:%5B1%5D%7D");
        assertThat(RpcServlet.escapeQuery("input=%ZZ%2")).isEqualTo("input=%25ZZ%252");
        assertThat(RpcServlet.escapeQuery("q=\u00e9 x")).isEqualTo("q=%C3%A9%20x");
    }

    @Test
    void servesBatchMutationFromBody() throws Exception {
        HttpServletRequest req = request("POST", "/rpc/a,b", "/a,b", "batch=1", "{\"0\":1,\"1\":2}");

        servlet.service(req, resp);

        verify(resp).setStatus(200);
        assertThat(out.text()).isEqualTo("[{\"id\":null,\"result\":{\"type\":\"data\",\"data\":\"a:1\"}},"
                + "{\"id\":null,\"result\":{\"type\":\"data\",\"data\":\"b:2\"}}]");
    }

    @Test
    void headWritesNoBody() throws Exception {
        HttpServletRequest req = request("HEAD", "/rpc/ping", "/ping", null, null);

        servlet.service(req, resp);

        verify(resp).setStatus(204);
        verify(resp, never()).getOutputStream();
        verify(resp, never()).addHeader(anyString(), anyString());
        assertThat(teardowns).hasValue(1);
    }

    @Test
    void writesResponseAsynchronouslyWhenSupported() throws Exception {
        HttpServletRequest req = request("GET", "/rpc/a", "/a", null, null);
        AsyncContext async = mock(AsyncContext.class);
        when(req.isAsyncSupported()).thenReturn(true);
        when(req.startAsync()).thenReturn(async);
        when(async.getResponse()).thenReturn(resp);

        servlet.service(req, resp);

        verify(async).complete();
        verify(resp).setStatus(200);
        assertThat(out.text()).contains("\"data\":\"a:null\"");
        assertThat(teardowns).hasValue(1);
    }

    @Test
    void missingPathInfoIsEmptyPath() {
        HttpServletRequest req = mock(HttpServletRequest.class);
        assertThat(RpcServlet.procedurePath(req)).isEmpty();
        when(req.getPathInfo()).thenReturn("/post.list");
        assertThat(RpcServlet.procedurePath(req)).isEqualTo("post.list");
    }

    private static HttpServletRequest request(String method, String uri, String pathInfo, String query, String body)
            throws IOException {
        HttpServletRequest req = mock(HttpServletRequest.class);
        when(req.getMethod()).thenReturn(method);
        when(req.getRequestURI()).thenReturn(uri);
        when(req.getRequestURL()).thenReturn(new StringBuffer("http://localhost" + uri));
        when(req.getQueryString()).thenReturn(query);
        when(req.getPathInfo()).thenReturn(pathInfo);
        when(req.getHeaderNames()).thenReturn(Collections.enumeration(List.of("Content-Type")));
        when(req.getHeaders("Content-Type")).thenReturn(Collections.enumeration(List.of("application/json")));
        byte[] bytes = body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8);
        when(req.getContentLengthLong()).thenReturn((long) bytes.length);
        when(req.getInputStream()).thenReturn(new BytesInputStream(bytes));
        return req;
    }

    private static final class BytesInputStream extends ServletInputStream {
        private final ByteArrayInputStream in;

        BytesInputStream(byte[] bytes) {
            this.in = new ByteArrayInputStream(bytes);
        }

        @Override
        public boolean isFinished() {
            return in.available() == 0;
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setReadListener(ReadListener readListener) {
            throw new UnsupportedOperationException();
        }

        @Override
        public int read() {
            return in.read();
        }
    }

    private static final class CapturingOutputStream extends ServletOutputStream {
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setWriteListener(WriteListener writeListener) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void write(int b) {
            bytes.write(b);
        }

        String text() {
            return bytes.toString(StandardCharsets.UTF_8);
        }
    }
}
