package io.github.clickin.rpc.core;

/**
 * Wire constants shared by the HTTP transport (query keys, header names, and well-known values).
 *
 * <p>This module intentionally contains no HTTP server bindings and no JSON library dependencies.
 * It only models protocol-level concerns that are shared across servers and adapters.
 */
public final class Protocol {
    private Protocol() {}

    // Query parameter keys
    public static final String Q_INPUT = "input";
    public static final String Q_BATCH = "batch";

    /** Value of {@link #Q_BATCH} that switches a request into batch mode. */
    public static final String BATCH_ENABLED = "1";

    /** Separator between procedure paths of a batch call. */
    public static final String PATH_SEPARATOR = ",";

    // HTTP headers
    public static final String H_CONTENT_TYPE = "Content-Type";

    // Content types
    public static final String CT_JSON = "application/json";

    /** Envelope result type for a successful call. */
    public static final String RESULT_TYPE_DATA = "data";
}
