package com.storyscene.backend.generation.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storyscene.backend.generation.image.Base64ImageExtractor;
import com.storyscene.backend.generation.model.ModelCatalog;
import com.storyscene.backend.generation.prompt.PromptSanitizer;
import com.storyscene.backend.generation.provider.config.GeminiProperties;
import com.storyscene.backend.generation.style.ResolutionCoercer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.TreeMap;

/**
 * Multimodal generation through {@code generateContent}. Reference images travel as inline parts
 * after the text prompt; the picture comes back as an inline part of the first candidate.
 */
@Slf4j
public class GeminiImageProviderClient implements ImageProviderClient {

    private final RestClient http;
    private final GeminiProperties props;
    private final ObjectMapper om;
    private final ProviderTelemetry telemetry;

    public GeminiImageProviderClient(RestClient http, GeminiProperties props, ObjectMapper om, ProviderTelemetry telemetry) {
        this.http = http;
        this.props = props;
        this.om = om;
        this.telemetry = telemetry;
    }

    @Override
    public String providerCode() {
        return ModelCatalog.GEMINI;
    }

    @Override
    public ImageProviderResult generate(ImageGenerationCall call, Duration timeout) {
        long t0 = System.nanoTime();
        String upstreamModel = upstreamModelId(call.model().id());
        try {
            ResponseEntity<JsonNode> res = client(timeout).post()
                    .uri("/v1beta/models/{model}:generateContent", upstreamModel)
                    .header("x-goog-api-key", requireApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(requestBody(call))
                    .retrieve()
                    .toEntity(JsonNode.class);

            JsonNode body = res.getBody();
            byte[] bytes = Base64ImageExtractor.extractBytes(body);

            Map<String, String> headers = new TreeMap<>(ResponseHeaders.collect(res.getHeaders()));
            String blockReason = blockReason(body);
            if (blockReason != null) {
                // surfaces through the same flag the Venice headers use
                headers.put(ResponseHeaders.CONTENT_VIOLATION, "true");
                headers.put("x-gemini-block-reason", blockReason);
            }

            telemetry.ok(providerCode(), upstreamModel, call.requestId(), ProviderTelemetry.msSince(t0),
                    bytes == null ? null : bytes.length);
            return new ImageProviderResult(providerCode(), call.model().id(), res.getStatusCode().value(),
                    bytes, headers, VeniceImageProviderClient.bodyKeys(body));
        } catch (RestClientResponseException e) {
            telemetry.fail(providerCode(), upstreamModel, call.requestId(), ProviderTelemetry.msSince(t0),
                    "HTTP_" + e.getStatusCode().value(), e.getStatusCode().value());
            throw e;
        } catch (RuntimeException e) {
            telemetry.fail(providerCode(), upstreamModel, call.requestId(), ProviderTelemetry.msSince(t0),
                    e.getClass().getSimpleName(), null);
            throw e;
        }
    }

    String upstreamModelId(String publicId) {
        if (ResolutionCoercer.PRO_MODEL.equals(publicId)) return props.getProImageModel();
        return props.getFlashImageModel();
    }

    ObjectNode requestBody(ImageGenerationCall call) {
        ObjectNode req = om.createObjectNode();

        ArrayNode contents = req.putArray("contents");
        ObjectNode content = contents.addObject();
        content.put("role", "user");
        ArrayNode parts = content.putArray("parts");
        parts.addObject().put("text", PromptSanitizer.truncate(call.prompt(), call.model().promptLimit()));

        for (ImageGenerationCall.ReferenceImage ref : call.referenceImages()) {
            if (ref.bytes() == null || ref.bytes().length == 0) continue;
            ObjectNode inline = parts.addObject().putObject("inlineData");
            inline.put("mimeType", ref.contentType() == null ? "image/png" : ref.contentType());
            inline.put("data", Base64.getEncoder().encodeToString(ref.bytes()));
        }

        ObjectNode gen = req.putObject("generationConfig");
        gen.putArray("responseModalities").add("IMAGE");
        if (!PromptSanitizer.isBlank(call.aspectRatio())) {
            gen.putObject("imageConfig").put("aspectRatio", call.aspectRatio());
        }
        return req;
    }

    private static String blockReason(JsonNode body) {
        if (body == null) return null;
        JsonNode br = body.path("promptFeedback").path("blockReason");
        if (br.isTextual() && !br.asText().isBlank()) return br.asText();
        JsonNode finish = body.path("candidates").path(0).path("finishReason");
        if (finish.isTextual()) {
            String f = finish.asText();
            if ("SAFETY".equals(f) || "PROHIBITED_CONTENT".equals(f) || "IMAGE_SAFETY".equals(f)) return f;
        }
        return null;
    }

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
        if (k == null || k.isBlank()) throw new IllegalStateException("GEMINI_API_KEY_MISSING");
        return k;
    }
}
