package com.storyscene.backend.generation.provider;

import org.springframework.http.HttpHeaders;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

public final class ResponseHeaders {

    private ResponseHeaders() {}

    public static final String REDACTED = "[redacted]";
    public static final String CONTENT_VIOLATION = "x-venice-is-content-violation";
    public static final String CONTAINS_MINOR = "x-venice-contains-minor";

    private static final Set<String> SECRET = Set.of(
            "authorization", "proxy-authorization", "cookie", "set-cookie", "x-api-key", "apikey"
    );

    /** Lower-cased name -> comma-joined values, secrets replaced with {@value #REDACTED}. */
    public static Map<String, String> collect(HttpHeaders headers) {
        Map<String, String> out = new TreeMap<>();
        if (headers == null) return out;
        headers.forEach((name, values) -> {
            if (name == null) return;
            String key = name.toLowerCase(Locale.ROOT);
            out.put(key, SECRET.contains(key) ? REDACTED : String.join(", ", values == null ? List.of() : values));
        });
        return out;
    }

    public static List<String> redactedNames(Map<String, String> headers) {
        List<String> out = new ArrayList<>();
        if (headers == null) return out;
        headers.forEach((k, v) -> {
            if (REDACTED.equals(v)) out.add(k);
        });
        return out;
    }
}
