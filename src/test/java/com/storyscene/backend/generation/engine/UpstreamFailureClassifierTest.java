package com.storyscene.backend.generation.engine;

import com.storyscene.backend.generation.provider.ResponseHeaders;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UpstreamFailureClassifierTest {

    private static final Map<String, String> JSON = Map.of("content-type", "application/json");

    @Test
    void rate_limit_keeps_status_and_retry_after() {
        UpstreamFailure f = UpstreamFailureClassifier.classifyHttp(429, "Too Many Requests", "{}",
                Map.of("content-type", "application/json", "retry-after", "12"));

        assertThat(f.code()).isEqualTo("UPSTREAM_RATE_LIMITED");
        assertThat(f.httpStatus()).isEqualTo(429);
        assertThat(f.retryAfterSec()).isEqualTo(12);
        assertThat(f.reasons()).contains("Upstream rate limit (HTTP 429)");
    }

    @Test
    void payment_required_maps_to_402() {
        UpstreamFailure f = UpstreamFailureClassifier.classifyHttp(402, "Payment Required", "{}", JSON);

        assertThat(f.httpStatus()).isEqualTo(402);
        assertThat(f.userMessage()).isEqualTo(UpstreamFailureClassifier.MSG_CREDITS);
    }

    @Test
    void auth_rejection_is_a_bad_gateway() {
        assertThat(UpstreamFailureClassifier.classifyHttp(401, "Unauthorized", "{}", JSON).httpStatus()).isEqualTo(502);
        assertThat(UpstreamFailureClassifier.classifyHttp(403, "Forbidden", "{}", JSON).code()).isEqualTo("UPSTREAM_AUTH_FAILED");
    }

    @Test
    void bad_request_with_policy_text_is_a_content_rejection() {
        UpstreamFailure f = UpstreamFailureClassifier.classifyHttp(400, "Bad Request",
                "{\"error\":\"Prompt violates content policy\"}", JSON);

        assertThat(f.code()).isEqualTo("UPSTREAM_CONTENT_REJECTED");
        assertThat(f.httpStatus()).isEqualTo(400);
    }

    @Test
    void html_error_page_and_empty_body_are_named() {
        UpstreamFailure html = UpstreamFailureClassifier.classifyHttp(503, "Service Unavailable",
                "<!DOCTYPE html><html>down</html>", Map.of("content-type", "text/html"));
        assertThat(html.httpStatus()).isEqualTo(502);
        assertThat(html.userMessage()).isEqualTo("Upstream Generation Failed (503)");
        assertThat(html.reasons()).contains("Upstream returned HTML (likely an error page)");

        UpstreamFailure empty = UpstreamFailureClassifier.classifyHttp(500, "Server Error", "", Map.of());
        assertThat(empty.reasons()).contains("Missing Content-Type header", "Empty upstream response body (content-length=0)");
    }

    @Test
    void content_flags_become_reasons_of_an_invalid_image() {
        UpstreamFailure f = UpstreamFailureClassifier.invalidImage("IMAGE_CONTENT_FLAGGED", 2048,
                Map.of(ResponseHeaders.CONTENT_VIOLATION, "true", ResponseHeaders.CONTAINS_MINOR, "true"), null);

        assertThat(f.httpStatus()).isEqualTo(500);
        assertThat(f.reasons()).hasSize(3);
        assertThat(f.reasons().get(0)).startsWith("Content policy violation");
        assertThat(f.reasons().get(1)).startsWith("Contains minor");
    }

    @Test
    void throwables_are_classified_without_an_http_answer() {
        assertThat(UpstreamFailureClassifier.classifyThrowable(
                new ResourceAccessException("I/O error", new SocketTimeoutException("Read timed out"))).code())
                .isEqualTo("UPSTREAM_TIMEOUT");
        assertThat(UpstreamFailureClassifier.classifyThrowable(new ResourceAccessException("Connection refused")).code())
                .isEqualTo("UPSTREAM_NETWORK_ERROR");
        assertThat(UpstreamFailureClassifier.classifyThrowable(new RestClientException("Could not extract response")).httpStatus())
                .isEqualTo(500);
        assertThat(UpstreamFailureClassifier.classifyThrowable(new IllegalStateException("PROVIDER_NOT_CONFIGURED")).code())
                .isEqualTo("PROVIDER_NOT_CONFIGURED");
    }

    @Test
    void only_model_complaints_allow_the_fallback() {
        assertThat(UpstreamFailureClassifier.isModelRejection(400, "{\"error\":\"Unknown model: foo\"}")).isTrue();
        assertThat(UpstreamFailureClassifier.isModelRejection(404, "model not found")).isTrue();
        assertThat(UpstreamFailureClassifier.isModelRejection(400, "{\"error\":\"prompt too long\"}")).isFalse();
        assertThat(UpstreamFailureClassifier.isModelRejection(500, "model crashed")).isFalse();
        assertThat(UpstreamFailureClassifier.isModelRejection(400, "violates content policy for this model")).isFalse();
    }

    @Test
    void retry_after_is_capped_and_tolerant() {
        assertThat(UpstreamFailureClassifier.parseRetryAfterSecondsOrNull("99999")).isEqualTo(3600);
        assertThat(UpstreamFailureClassifier.parseRetryAfterSecondsOrNull("Wed, 21 Oct 2015 07:28:00 GMT")).isNull();
        assertThat(UpstreamFailureClassifier.parseFailure(List.of("error")).reasons()).contains("Response keys: error");
    }
}
