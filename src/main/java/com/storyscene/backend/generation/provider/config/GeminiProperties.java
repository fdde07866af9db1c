package com.storyscene.backend.generation.provider.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.provider.gemini")
public class GeminiProperties {

    private boolean enabled = false;

    private String baseUrl = "https://generativelanguage.googleapis.com";

    /** From env: GEMINI_API_KEY */
    private String apiKey;

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(55);

    /** Upstream id behind the public {@code gemini-2.5-flash} model. */
    private String flashImageModel = "gemini-2.5-flash-image";

    /** Upstream id behind the public {@code gemini-3-pro} model. */
    private String proImageModel = "gemini-3-pro-image-preview";

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }

    public String getFlashImageModel() { return flashImageModel; }
    public void setFlashImageModel(String flashImageModel) { this.flashImageModel = flashImageModel; }

    public String getProImageModel() { return proImageModel; }
    public void setProImageModel(String proImageModel) { this.proImageModel = proImageModel; }
}
