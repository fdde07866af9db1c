package com.storyscene.backend.generation.provider;

import com.storyscene.backend.generation.provider.config.VeniceProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Startup self-check, no outbound call:
 * enabled with key and https base -> UP, otherwise DOWN with a reason.
 */
@Component
@ConditionalOnProperty(prefix = "app.provider.venice", name = "enabled", havingValue = "true")
public class VeniceConfigHealthIndicator implements HealthIndicator {

    private final VeniceProperties props;

    public VeniceConfigHealthIndicator(VeniceProperties props) {
        this.props = props;
    }

    @Override
    public Health health() {
        String apiKey = props.getApiKey();
        String baseUrl = props.getBaseUrl();
        String visionModel = props.getVisionModel();

        boolean hasKey = apiKey != null && !apiKey.isBlank();
        boolean baseOk = baseUrl != null && !baseUrl.isBlank() && baseUrl.toLowerCase(Locale.ROOT).startsWith("https://");
        boolean visionOk = visionModel != null && !visionModel.isBlank();

        Health.Builder b;
        if (!hasKey) {
            b = Health.down().withDetail("reason", "VENICE_API_KEY_MISSING");
        } else if (!baseOk) {
            b = Health.down().withDetail("reason", "VENICE_BASE_URL_INVALID");
        } else if (!visionOk) {
            b = Health.down().withDetail("reason", "VENICE_VISION_MODEL_MISSING");
        } else {
            b = Health.up();
        }

        // ✅ never print apiKey
        return b.withDetail("provider", "VENICE")
                .withDetail("enabled", true)
                .withDetail("baseUrl", safe(baseUrl))
                .withDetail("visionModel", safe(visionModel))
                .build();
    }

    private static String safe(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }
}
