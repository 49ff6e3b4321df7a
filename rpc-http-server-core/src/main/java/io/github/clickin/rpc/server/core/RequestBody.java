package io.github.clickin.rpc.server.core;

import java.io.InputStream;

/**
 * Framework-neutral request body abstraction.
 *
 * <p>Adapters pass the raw stream when the framework has not touched the body, or the already decoded
 * value when a body parser ran upstream.
 */
public sealed interface RequestBody permits RequestBody.Empty, RequestBody.Stream, RequestBody.Text, RequestBody.Parsed {

    /** No body. */
    record Empty() implements RequestBody {}

    /** Unread body bytes (JSON text). */
    record Stream(InputStream input) implements RequestBody {}

    /** Body already read as text (JSON text). */
    record Text(String text) implements RequestBody {}

    /** Body already decoded into plain Java values by the hosting framework. */
    record Parsed(Object value) implements RequestBody {}
}
