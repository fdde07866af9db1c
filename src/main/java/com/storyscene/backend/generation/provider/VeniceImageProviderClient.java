package com.storyscene.backend.generation.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storyscene.backend.generation.image.Base64ImageExtractor;
import com.storyscene.backend.generation.model.ModelCatalog;
import com.storyscene.backend.generation.prompt.PromptSanitizer;
import com.storyscene.backend.generation.provider.config.VeniceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Venice image API: {@code POST /api/v1/image/generate}, base64 image(s) in the JSON answer.
 * Safety filtering is left to the upstream; its verdict comes back in {@code x-venice-*} headers.
 */
@Slf4j
public class VeniceImageProviderClient implements ImageProviderClient {

    private final RestClient http;
    private final VeniceProperties props;
    private final ObjectMapper om;
    private final ProviderTelemetry telemetry;

    public VeniceImageProviderClient(RestClient http, VeniceProperties props, ObjectMapper om, ProviderTelemetry telemetry) {
        this.http = http;
        this.props = props;
        this.om = om;
        this.telemetry = telemetry;
    }

    @Override
    public String providerCode() {
        return ModelCatalog.VENICE;
    }

    @Override
    public ImageProviderResult generate(ImageGenerationCall call, Duration timeout) {
        long t0 = System.nanoTime();
        String modelId = call.model().id();
        try {
            ResponseEntity<JsonNode> res = client(timeout).post()
                    .uri("/api/v1/image/generate")
                    .header("Authorization", "Bearer " + requireApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(requestBody(call))
                    .retrieve()
                    .toEntity(JsonNode.class);

            JsonNode body = res.getBody();
            byte[] bytes = Base64ImageExtractor.extractBytes(body);
            ImageProviderResult out = new ImageProviderResult(
                    providerCode(),
                    modelId,
                    res.getStatusCode().value(),
                    bytes,
                    ResponseHeaders.collect(res.getHeaders()),
                    bodyKeys(body)
            );
            telemetry.ok(providerCode(), modelId, call.requestId(), ProviderTelemetry.msSince(t0),
                    bytes == null ? null : bytes.length);
            return out;
        } catch (RestClientResponseException e) {
            telemetry.fail(providerCode(), modelId, call.requestId(), ProviderTelemetry.msSince(t0),
                    "HTTP_" + e.getStatusCode().value(), e.getStatusCode().value());
            throw e;
        } catch (RuntimeException e) {
            telemetry.fail(providerCode(), modelId, call.requestId(), ProviderTelemetry.msSince(t0),
                    e.getClass().getSimpleName(), null);
            throw e;
        }
    }

    ObjectNode requestBody(ImageGenerationCall call) {
        int limit = call.model().promptLimit();
        ObjectNode req = om.createObjectNode();
        req.put("model", call.model().id());
        req.put("prompt", PromptSanitizer.truncate(call.prompt(), limit));
        if (!PromptSanitizer.isBlank(call.negativePrompt())) {
            req.put("negative_prompt", PromptSanitizer.truncate(call.negativePrompt(), limit));
        }
        req.put("width", call.width());
        req.put("height", call.height());
        req.put("steps", call.steps());
        req.put("cfg_scale", call.cfgScale());
        req.put("safe_mode", false);
        req.put("hide_watermark", true);
        req.put("embed_exif_metadata", false);
        return req;
    }

    /** Read timeout capped by the caller's remaining budget. */
    private RestClient client(Duration timeout) {
        if (timeout == null) return http;
        long readMs = Math.min(props.getReadTimeout().toMillis(), Math.max(1, timeout.toMillis()));
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout((int) Math.min(props.getConnectTimeout().toMillis(), readMs));
        f.setReadTimeout((int) readMs);
        return http.mutate().requestFactory(f).build();
    }

    private String requireApiKey() {
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("VENICE_API_KEY_MISSING");
        return k;
    }

    static List<String> bodyKeys(JsonNode body) {
        List<String> keys = new ArrayList<>();
        if (body != null && body.isObject()) body.fieldNames().forEachRemaining(keys::add);
        return keys;
    }
}
