package com.storyscene.backend.generation.provider;

import java.util.List;
import java.util.Map;

/**
 * A 2xx upstream answer.
 *
 * @param imageBytes decoded image, null when the body carried none
 * @param headers response headers, lower-cased, secrets redacted
 * @param bodyKeys top-level keys of the body, kept for parse-failure diagnostics
 */
public record ImageProviderResult(
        String provider,
        String model,
        int httpStatus,
        byte[] imageBytes,
        Map<String, String> headers,
        List<String> bodyKeys
) {
    public ImageProviderResult {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        bodyKeys = bodyKeys == null ? List.of() : List.copyOf(bodyKeys);
    }

    public boolean contentViolation() {
        return "true".equalsIgnoreCase(headers.get(ResponseHeaders.CONTENT_VIOLATION));
    }

    public boolean containsMinor() {
        return "true".equalsIgnoreCase(headers.get(ResponseHeaders.CONTAINS_MINOR));
    }
}
