package com.storyscene.backend.generation.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import com.storyscene.backend.generation.model.ModelCatalog;
import com.storyscene.backend.generation.provider.config.VeniceProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class VeniceImageProviderClientTest {

    @RegisterExtension
    static WireMockExtension wm = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private final ProviderTelemetry telemetry = mock(ProviderTelemetry.class);

    private VeniceImageProviderClient client(String apiKey) {
        VeniceProperties props = new VeniceProperties();
        props.setBaseUrl(wm.baseUrl());
        props.setApiKey(apiKey);
        RestClient http = RestClient.builder().baseUrl(wm.baseUrl()).build();
        return new VeniceImageProviderClient(http, props, new ObjectMapper(), telemetry);
    }

    private static ImageGenerationCall call() {
        return new ImageGenerationCall("req-7", ModelCatalog.require("hidream"), "pixel art of a castle at dusk",
                "blurry, lowres", 1024, 576, "16:9", 30, 7.5, List.of());
    }

    @Test
    void decodes_the_first_image_and_keeps_content_flags() {
        byte[] fake = "fake-image-bytes".getBytes(StandardCharsets.UTF_8);
        wm.stubFor(post(urlEqualTo("/api/v1/image/generate"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withHeader("x-venice-is-content-violation", "false")
                        .withBody("{\"id\":\"gen-1\",\"images\":[\"" + Base64.getEncoder().encodeToString(fake) + "\"]}")));

        ImageProviderResult r = client("k-123").generate(call(), Duration.ofSeconds(5));

        assertThat(r.imageBytes()).isEqualTo(fake);
        assertThat(r.httpStatus()).isEqualTo(200);
        assertThat(r.bodyKeys()).containsExactly("id", "images");
        assertThat(r.contentViolation()).isFalse();
        verify(telemetry).ok(eq("VENICE"), eq("hidream"), eq("req-7"), anyLong(), eq(fake.length));

        wm.verify(postRequestedFor(urlEqualTo("/api/v1/image/generate"))
                .withHeader("Authorization", equalTo("Bearer k-123"))
                .withRequestBody(matchingJsonPath("$.model", equalTo("hidream")))
                .withRequestBody(matchingJsonPath("$.negative_prompt", equalTo("blurry, lowres")))
                .withRequestBody(matchingJsonPath("$.safe_mode", equalTo("false")))
                .withRequestBody(matchingJsonPath("$.cfg_scale", equalTo("7.5"))));
    }

    @Test
    void http_errors_propagate_with_status_and_headers() {
        wm.stubFor(post(urlEqualTo("/api/v1/image/generate"))
                .willReturn(aResponse()
                        .withStatus(429)
                        .withHeader("Content-Type", "application/json")
                        .withHeader("Retry-After", "17")
                        .withBody("{\"error\":\"rate limited\"}")));

        assertThatThrownBy(() -> client("k-123").generate(call(), Duration.ofSeconds(5)))
                .isInstanceOfSatisfying(HttpClientErrorException.class, e -> {
                    assertThat(e.getStatusCode().value()).isEqualTo(429);
                    assertThat(ResponseHeaders.collect(e.getResponseHeaders())).containsEntry("retry-after", "17");
                });
        verify(telemetry).fail(eq("VENICE"), eq("hidream"), eq("req-7"), anyLong(), eq("HTTP_429"), eq(429));
    }

    @Test
    void answer_without_an_image_has_null_bytes() {
        wm.stubFor(post(urlEqualTo("/api/v1/image/generate"))
                .willReturn(okJson("{\"id\":\"gen-2\",\"timing\":{}}")));

        ImageProviderResult r = client("k-123").generate(call(), Duration.ofSeconds(5));

        assertThat(r.imageBytes()).isNull();
        assertThat(r.bodyKeys()).containsExactly("id", "timing");
    }

    @Test
    void missing_api_key_fails_before_any_request() {
        assertThatThrownBy(() -> client(" ").generate(call(), Duration.ofSeconds(5)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("VENICE_API_KEY_MISSING");
        verify(telemetry).fail(any(), any(), any(), anyLong(), eq("IllegalStateException"), eq((Integer) null));
        wm.verify(0, postRequestedFor(urlEqualTo("/api/v1/image/generate")));
    }

    @Test
    void long_prompts_are_cut_to_the_model_limit() {
        ImageGenerationCall c = call().withPrompt("x".repeat(5000), 7.5);

        var body = client("k").requestBody(c);

        assertThat(body.get("prompt").asText()).hasSize(ModelCatalog.LIMITED_PROMPT_LENGTH);
        assertThat(body.get("hide_watermark").asBoolean()).isTrue();
    }
}
