package io.github.clickin.rpc.core;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class RpcExceptionTest {

    @Test
    void keepsTaggedErrorsAsIs() {
        RpcException notFound = new RpcException(ErrorCode.NOT_FOUND, "no such user");
        assertThat(RpcException.from(notFound)).isSameAs(notFound);
    }

    @Test
    void unwrapsFutureWrappers() {
        RpcException unauthorized = new RpcException(ErrorCode.UNAUTHORIZED, "login first");
        assertThat(RpcException.from(new CompletionException(unauthorized))).isSameAs(unauthorized);
        assertThat(RpcException.from(new ExecutionException(new CompletionException(unauthorized))))
                .isSameAs(unauthorized);
    }

    @Test
    void untaggedErrorsBecomeInternalServerErrors() {
        IllegalStateException boom = new IllegalStateException("boom");
        RpcException normalized = RpcException.from(boom);

        assertThat(normalized.code()).isEqualTo(ErrorCode.INTERNAL_SERVER_ERROR);
        assertThat(normalized.getMessage()).isEqualTo("boom");
        assertThat(normalized.getCause()).isSameAs(boom);
    }

    @Test
    void fallsBackToCodeNameWhenNoMessageAvailable() {
        RpcException normalized = RpcException.from(new RuntimeException());
        assertThat(normalized.getMessage()).isEqualTo("INTERNAL_SERVER_ERROR");
    }

    @Test
    void errorCodesCarryHttpStatuses() {
        assertThat(ErrorCode.PARSE_ERROR.httpStatus()).isEqualTo(400);
        assertThat(ErrorCode.BAD_REQUEST.httpStatus()).isEqualTo(400);
        assertThat(ErrorCode.UNAUTHORIZED.httpStatus()).isEqualTo(401);
        assertThat(ErrorCode.NOT_FOUND.httpStatus()).isEqualTo(404);
        assertThat(ErrorCode.METHOD_NOT_SUPPORTED.httpStatus()).isEqualTo(405);
        assertThat(ErrorCode.INTERNAL_SERVER_ERROR.httpStatus()).isEqualTo(500);
        assertThat(ErrorCode.PARSE_ERROR.jsonRpcCode()).isEqualTo(-32700);
    }
}
