package io.github.clickin.rpc.server.core;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decoded, possibly multi-valued query parameters.
 */
public final class QueryParams {
    private static final QueryParams EMPTY = new QueryParams(Map.of());

    private final Map<String, List<String>> values;

    private QueryParams(Map<String, List<String>> values) {
        this.values = values;
    }

    public static QueryParams parse(URI uri) {
        String q = uri == null ? null : uri.getRawQuery();
        if (q == null || q.isEmpty()) return EMPTY;
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (String part : q.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            String k = decode(eq < 0 ? part : part.substring(0, eq));
            String v = eq < 0 ? "" : decode(part.substring(eq + 1));
            out.computeIfAbsent(k, key -> new ArrayList<>()).add(v);
        }
        return new QueryParams(Collections.unmodifiableMap(out));
    }

    /** First value of {@code name}, or null when the parameter is missing. */
    public String get(String name) {
        List<String> vals = values.get(name);
        return vals == null || vals.isEmpty() ? null : vals.get(0);
    }

    public List<String> getAll(String name) {
        List<String> vals = values.get(name);
        return vals == null ? List.of() : List.copyOf(vals);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
