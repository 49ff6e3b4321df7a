package io.github.clickin.rpc.core;

import java.util.Locale;

/**
 * Kind of procedure a request targets, derived from the HTTP method.
 *
 * <p>Only {@link #QUERY} and {@link #MUTATION} can be served over plain HTTP request/response.
 */
public enum ProcedureType {
    QUERY,
    MUTATION,
    SUBSCRIPTION,
    UNKNOWN;

    /**
     * Maps an HTTP method name to a procedure type.
     *
     * @param method the HTTP method (case-insensitive, may be null)
     * @return GET to QUERY, POST to MUTATION, PATCH to SUBSCRIPTION, anything else UNKNOWN
     */
    public static ProcedureType fromHttpMethod(String method) {
        if (method == null) return UNKNOWN;
        return switch (method.toUpperCase(Locale.ROOT)) {
            case "GET" -> QUERY;
            case "POST" -> MUTATION;
            case "PATCH" -> SUBSCRIPTION;
            default -> UNKNOWN;
        };
    }

    /** Whether this type can be executed by the HTTP request handler. */
    public boolean isServableOverHttp() {
        return this == QUERY || this == MUTATION;
    }

    /** Lower-case wire name ({@code "query"}, {@code "mutation"}, ...). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
