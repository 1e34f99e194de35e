// file: server/src/main/java/io/treekv/server/http/RequestHeaders.java
package io.treekv.server.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Case-insensitive, multi-valued view of request headers.
 * Keeps every header line separately, in arrival order.
 */
public final class RequestHeaders {
    private final Map<String, List<String>> values = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public static RequestHeaders of(Map<String, ? extends List<String>> raw) {
        RequestHeaders h = new RequestHeaders();
        raw.forEach((name, lines) -> lines.forEach(v -> h.add(name, v)));
        return h;
    }

    public RequestHeaders add(String name, String value) {
        values.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /** First line of the header, or null when absent. */
    public String first(String name) {
        List<String> v = values.get(name);
        return v == null || v.isEmpty() ? null : v.get(0);
    }

    /** Every line of the header; empty when absent. */
    public List<String> all(String name) {
        List<String> v = values.get(name);
        return v == null ? List.of() : Collections.unmodifiableList(v);
    }
}
