package io.github.clickin.rpc.server.core;

import io.github.clickin.rpc.core.ErrorCode;
import io.github.clickin.rpc.core.RpcException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads request bodies into memory while enforcing a maximum size.
 */
final class RequestBodies {
    static final long NO_LIMIT = Long.MAX_VALUE;

    private RequestBodies() {}

    /**
     * Reads {@code in} fully.
     *
     * @throws RpcException with {@link ErrorCode#PAYLOAD_TOO_LARGE} once more than {@code maxBytes} are read
     * @throws IOException if the underlying stream fails
     */
    static byte[] readAll(InputStream in, long maxBytes) throws IOException {
        if (in == null) return new byte[0];
        try (in) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buf = new byte[8192];
            long total = 0;
            int r;
            while ((r = in.read(buf)) >= 0) {
                total += r;
                if (total > maxBytes) {
                    throw tooLarge(maxBytes);
                }
                out.write(buf, 0, r);
            }
            return out.toByteArray();
        }
    }

    static RpcException tooLarge(long maxBytes) {
        return new RpcException(ErrorCode.PAYLOAD_TOO_LARGE, "Payload exceeds maximum size of " + maxBytes + " bytes");
    }
}
