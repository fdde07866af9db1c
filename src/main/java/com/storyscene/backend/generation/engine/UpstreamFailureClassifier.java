package com.storyscene.backend.generation.engine;

import com.storyscene.backend.generation.provider.ResponseHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Maps upstream answers and exceptions to a {@link UpstreamFailure}. Never decides billing:
 * every terminal failure is refunded the same way.
 */
public final class UpstreamFailureClassifier {

    private UpstreamFailureClassifier() {}

    public static final String MSG_RATE_LIMIT = "Rate limit exceeded. Please try again later.";
    public static final String MSG_CREDITS = "AI credits exhausted. Please add credits to continue.";
    public static final String MSG_BAD_REQUEST = "Content could not be processed. Try a different scene or style.";
    public static final String MSG_AUTH = "Upstream image provider authentication failed.";
    public static final String MSG_PARSE = "Failed to generate image. Please try again.";
    public static final String MSG_INVALID_IMAGE = "Generated image invalid or blocked due to content policy.";
    public static final String MSG_TIMEOUT = "Image generation timed out. Please try again.";
    public static final String MSG_NOT_CONFIGURED = "No image provider is configured for this model.";

    private static final String[] BODY_VIOLATION_MARKERS = {
            "content policy", "content violation", "nsfw", "contains minor"
    };

    /** Non-2xx answer from the provider. */
    public static UpstreamFailure classifyHttp(int status, String statusText, String body, Map<String, String> headers) {
        List<String> reasons = deriveReasons(status, statusText, body, headers);
        Integer retryAfter = parseRetryAfterSecondsOrNull(headers == null ? null : headers.get("retry-after"));

        if (status == 429) return new UpstreamFailure("UPSTREAM_RATE_LIMITED", 429, MSG_RATE_LIMIT, reasons, retryAfter);
        if (status == 402) return new UpstreamFailure("UPSTREAM_CREDITS_EXHAUSTED", 402, MSG_CREDITS, reasons, null);
        if (status == 400) {
            String code = bodyReportsViolation(body) ? "UPSTREAM_CONTENT_REJECTED" : "UPSTREAM_BAD_REQUEST";
            return new UpstreamFailure(code, 400, MSG_BAD_REQUEST, reasons, null);
        }
        if (status == 401 || status == 403) return new UpstreamFailure("UPSTREAM_AUTH_FAILED", 502, MSG_AUTH, reasons, null);
        return new UpstreamFailure("UPSTREAM_FAILED", 502, "Upstream Generation Failed (" + status + ")", reasons, retryAfter);
    }

    /** No HTTP answer at all: timeout, connection error, missing provider. */
    public static UpstreamFailure classifyThrowable(Throwable e) {
        if (isTimeoutThrowable(e)) {
            return new UpstreamFailure("UPSTREAM_TIMEOUT", 504, MSG_TIMEOUT, List.of("Upstream call timed out"), null);
        }
        if (e instanceof IllegalStateException ise && "PROVIDER_NOT_CONFIGURED".equals(ise.getMessage())) {
            return new UpstreamFailure("PROVIDER_NOT_CONFIGURED", 502, MSG_NOT_CONFIGURED, List.of("No provider registered"), null);
        }
        if (e instanceof ResourceAccessException) {
            return new UpstreamFailure("UPSTREAM_NETWORK_ERROR", 502, "Upstream Generation Failed (network)",
                    List.of("Network error: " + safeMsg(e)), null);
        }
        if (e instanceof RestClientException) {
            return new UpstreamFailure("UPSTREAM_MALFORMED_RESPONSE", 500, MSG_PARSE,
                    List.of("Unreadable upstream response: " + safeMsg(e)), null);
        }
        return new UpstreamFailure("UPSTREAM_FAILED", 502, "Upstream Generation Failed (error)", List.of(safeMsg(e)), null);
    }

    /** 2xx answer that carried no decodable image. */
    public static UpstreamFailure parseFailure(List<String> bodyKeys) {
        List<String> reasons = new ArrayList<>();
        reasons.add("No image in upstream response");
        if (bodyKeys != null && !bodyKeys.isEmpty()) reasons.add("Response keys: " + String.join(",", bodyKeys));
        return new UpstreamFailure("IMAGE_PARSE_FAILED", 500, MSG_PARSE, reasons, null);
    }

    /** 2xx answer whose image failed the content flags, size, format or blank checks. */
    public static UpstreamFailure invalidImage(String code, int size, Map<String, String> headers, String detail) {
        List<String> reasons = new ArrayList<>(flagReasons(headers));
        reasons.add("Invalid image bytes (size=" + size + ")");
        if (detail != null && !detail.isBlank()) reasons.add(detail);
        return new UpstreamFailure(code, 500, MSG_INVALID_IMAGE, reasons, null);
    }

    /**
     * One fallback retry is worth it only for a 400/404 that blames the model.
     */
    public static boolean isModelRejection(int status, String body) {
        if (status != 400 && status != 404) return false;
        if (bodyReportsViolation(body)) return false;
        String lower = body == null ? "" : body.toLowerCase(Locale.ROOT);
        return lower.contains("model") || lower.contains("unknown") || lower.contains("not found");
    }

    /** Policy verdict from either the flag headers or the error body. */
    public static boolean reportsViolation(String body, Map<String, String> headers) {
        return !flagReasons(headers).isEmpty() || bodyReportsViolation(body);
    }

    public static boolean bodyReportsViolation(String body) {
        if (body == null || body.isBlank()) return false;
        String lower = body.toLowerCase(Locale.ROOT);
        for (String m : BODY_VIOLATION_MARKERS) {
            if (lower.contains(m)) return true;
        }
        return false;
    }

    static List<String> deriveReasons(int status, String statusText, String body, Map<String, String> headers) {
        List<String> reasons = new ArrayList<>(flagReasons(headers));
        Map<String, String> h = headers == null ? Map.of() : headers;

        if (status == 429) reasons.add("Upstream rate limit (HTTP 429)");
        if (status == 402) reasons.add("Upstream credits exhausted (HTTP 402)");
        if (status == 401 || status == 403) reasons.add("Upstream auth rejected (HTTP " + status + ")");

        String contentType = h.get("content-type");
        String trimmed = body == null ? "" : body.trim();
        if ((contentType != null && contentType.toLowerCase(Locale.ROOT).contains("text/html"))
            || trimmed.regionMatches(true, 0, "<!doctype html", 0, 14)
            || trimmed.regionMatches(true, 0, "<html", 0, 5)) {
            reasons.add("Upstream returned HTML (likely an error page)");
        }
        if (contentType == null) reasons.add("Missing Content-Type header");
        if ("0".equals(h.get("content-length")) || trimmed.isEmpty()) {
            reasons.add("Empty upstream response body (content-length=0)");
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.contains("invalid style") || lower.contains("style_preset")) reasons.add("Upstream reported invalid style");
        if (lower.contains("unknown model") || lower.contains("model not found") || lower.contains("invalid model")) {
            reasons.add("Upstream reported unknown model");
        }
        if (bodyReportsViolation(trimmed) && !reasons.contains(violationReason())) {
            reasons.add("Upstream body reports a content policy violation");
        }

        if (reasons.isEmpty()) {
            reasons.add((status + " " + (statusText == null ? "" : statusText)).trim());
        }
        return reasons;
    }

    private static List<String> flagReasons(Map<String, String> headers) {
        List<String> out = new ArrayList<>();
        if (headers == null) return out;
        if ("true".equalsIgnoreCase(headers.get(ResponseHeaders.CONTENT_VIOLATION))) out.add(violationReason());
        if ("true".equalsIgnoreCase(headers.get(ResponseHeaders.CONTAINS_MINOR))) {
            out.add("Contains minor (" + ResponseHeaders.CONTAINS_MINOR + "=true)");
        }
        return out;
    }

    private static String violationReason() {
        return "Content policy violation (" + ResponseHeaders.CONTENT_VIOLATION + "=true)";
    }

    static Integer parseRetryAfterSecondsOrNull(String ra) {
        if (ra == null || ra.isBlank()) return null;
        try {
            int v = Integer.parseInt(ra.trim());
            return Math.max(0, Math.min(v, 3600));
        } catch (NumberFormatException ignored) {
            // HTTP-date form is not used by our providers
            return null;
        }
    }

    static boolean isTimeoutThrowable(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SocketTimeoutException) return true;
            if (c instanceof TimeoutException) return true;
            if ("java.net.http.HttpTimeoutException".equals(c.getClass().getName())) return true;

            String m = c.getMessage();
            if (m != null) {
                String s = m.toLowerCase(Locale.ROOT);
                if (s.contains("timeout") || s.contains("timed out")) return true;
            }
        }
        return false;
    }

    private static String safeMsg(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
