package com.storyscene.backend.generation.vision;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storyscene.backend.generation.provider.ProviderTelemetry;
import com.storyscene.backend.generation.provider.config.VeniceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.List;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.provider.venice", name = "enabled", havingValue = "true")
public class VeniceVisionClient implements VisionClient {

    private static final String PROVIDER = "VENICE_VISION";

    private final RestClient http;
    private final VeniceProperties props;
    private final ObjectMapper om;
    private final ProviderTelemetry telemetry;

    public VeniceVisionClient(@Qualifier("veniceRestClient") RestClient http, VeniceProperties props,
                              ObjectMapper om, ProviderTelemetry telemetry) {
        this.http = http;
        this.props = props;
        this.om = om;
        this.telemetry = telemetry;
    }

    @Override
    public String complete(String requestId, String prompt, List<String> imageUrls, Duration timeout) {
        long t0 = System.nanoTime();
        String model = props.getVisionModel();
        try {
            JsonNode res = client(timeout).post()
                    .uri("/api/v1/chat/completions")
                    .header("Authorization", "Bearer " + props.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(requestBody(model, prompt, imageUrls))
                    .retrieve()
                    .body(JsonNode.class);

            String text = res == null ? "" : res.path("choices").path(0).path("message").path("content").asText("");
            telemetry.ok(PROVIDER, model, requestId, msSince(t0), text.length());
            return text;
        } catch (RestClientResponseException e) {
            telemetry.fail(PROVIDER, model, requestId, msSince(t0), "HTTP_" + e.getStatusCode().value(), e.getStatusCode().value());
            throw e;
        } catch (RuntimeException e) {
            telemetry.fail(PROVIDER, model, requestId, msSince(t0), e.getClass().getSimpleName(), null);
            throw e;
        }
    }

    ObjectNode requestBody(String model, String prompt, List<String> imageUrls) {
        ObjectNode req = om.createObjectNode();
        req.put("model", model);
        req.put("temperature", 0.1);

        ArrayNode messages = req.putArray("messages");
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        ArrayNode content = user.putArray("content");
        content.addObject().put("type", "text").put("text", prompt);
        if (imageUrls != null) {
            for (String url : imageUrls) {
                if (url == null || url.isBlank()) continue;
                ObjectNode part = content.addObject();
                part.put("type", "image_url");
                part.putObject("image_url").put("url", url);
            }
        }
        return req;
    }

    private RestClient client(Duration timeout) {
        if (timeout == null) return http;
        long readMs = Math.max(1, Math.min(props.getReadTimeout().toMillis(), timeout.toMillis()));
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout((int) Math.min(props.getConnectTimeout().toMillis(), readMs));
        f.setReadTimeout((int) readMs);
        return http.mutate().requestFactory(f).build();
    }

    private static long msSince(long t0) {
        return (System.nanoTime() - t0) / 1_000_000;
    }
}
