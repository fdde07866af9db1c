package com.storyscene.backend.generation.provider.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyscene.backend.generation.provider.GeminiImageProviderClient;
import com.storyscene.backend.generation.provider.ImageProviderClient;
import com.storyscene.backend.generation.provider.ProviderTelemetry;
import com.storyscene.backend.generation.provider.StubImageProviderClient;
import com.storyscene.backend.generation.provider.VeniceImageProviderClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties({VeniceProperties.class, GeminiProperties.class})
public class ProviderConfig {

    /**
     * ✅ Only when explicitly enabled; the router falls back to it for models whose provider is off.
     */
    @Bean
    @ConditionalOnProperty(prefix = "app.provider.stub", name = "enabled", havingValue = "true")
    public ImageProviderClient stubImageProviderClient() {
        return new StubImageProviderClient();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.venice", name = "enabled", havingValue = "true")
    public RestClient veniceRestClient(VeniceProperties props) {
        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(requestFactory(props.getConnectTimeout(), props.getReadTimeout()))
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.venice", name = "enabled", havingValue = "true")
    public ImageProviderClient veniceImageProviderClient(
            @Qualifier("veniceRestClient") RestClient veniceRestClient,
            VeniceProperties props,
            ObjectMapper om,
            ProviderTelemetry telemetry
    ) {
        // ✅ Fail-fast: a missing key shows up at startup
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("VENICE_API_KEY_MISSING");
        if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) throw new IllegalStateException("VENICE_BASE_URL_MISSING");

        return new VeniceImageProviderClient(veniceRestClient, props, om, telemetry);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.gemini", name = "enabled", havingValue = "true")
    public RestClient geminiRestClient(GeminiProperties props) {
        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(requestFactory(props.getConnectTimeout(), props.getReadTimeout()))
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.gemini", name = "enabled", havingValue = "true")
    public ImageProviderClient geminiImageProviderClient(
            @Qualifier("geminiRestClient") RestClient geminiRestClient,
            GeminiProperties props,
            ObjectMapper om,
            ProviderTelemetry telemetry
    ) {
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("GEMINI_API_KEY_MISSING");
        if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) throw new IllegalStateException("GEMINI_BASE_URL_MISSING");
        if (props.getFlashImageModel() == null || props.getFlashImageModel().isBlank()
            || props.getProImageModel() == null || props.getProImageModel().isBlank()) {
            throw new IllegalStateException("GEMINI_IMAGE_MODEL_MISSING");
        }

        return new GeminiImageProviderClient(geminiRestClient, props, om, telemetry);
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connect, Duration read) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout((int) connect.toMillis());
        f.setReadTimeout((int) read.toMillis());
        return f;
    }
}
