package io.github.clickin.rpc.server.core;

/**
 * Framework-neutral response body abstraction.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes {

    /** Empty response body. */
    record Empty() implements ResponseBody {}

    /** In-memory byte array response body (UTF-8 JSON). */
    record Bytes(byte[] bytes) implements ResponseBody {}
}
