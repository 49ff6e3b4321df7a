package io.github.clickin.rpc.core;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Exception raised by the transport or by procedures, tagged with an {@link ErrorCode}.
 *
 * <p>Procedures throw this to choose the code reported to clients. Any other throwable is
 * normalized through {@link #from(Throwable)} into {@link ErrorCode#INTERNAL_SERVER_ERROR}
 * with the original kept as the cause.
 */
public class RpcException extends RuntimeException {
    private final ErrorCode code;

    public RpcException(ErrorCode code, String message) {
        this(code, message, null);
    }

    public RpcException(ErrorCode code, String message, Throwable cause) {
        super(message != null ? message : defaultMessage(code, cause), cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode code() {
        return code;
    }

    /**
     * Normalizes any throwable into an {@link RpcException}.
     *
     * <p>Wrappers added by {@code CompletableFuture} are unwrapped first, so a procedure failing its
     * future with an {@code RpcException} keeps its code.
     *
     * @param error the raw failure
     * @return the same instance when already tagged, otherwise an internal server error wrapping it
     */
    public static RpcException from(Throwable error) {
        Throwable unwrapped = unwrap(error);
        if (unwrapped instanceof RpcException rpc) {
            return rpc;
        }
        return new RpcException(ErrorCode.INTERNAL_SERVER_ERROR, null, unwrapped);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String defaultMessage(ErrorCode code, Throwable cause) {
        if (cause != null && cause.getMessage() != null) return cause.getMessage();
        return code == null ? null : code.name();
    }
}
