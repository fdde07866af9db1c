package com.storyscene.backend.generation.provider.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.provider.venice")
public class VeniceProperties {

    /** Off by default so a dev machine without a key still starts. */
    private boolean enabled = false;

    private String baseUrl = "https://api.venice.ai";

    /** From env: VENICE_API_KEY */
    private String apiKey;

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(55);

    /** Chat model used for optional scene analysis. */
    private String analysisModel = "mistral-31-24b";

    /** Vision-capable chat model for trait descriptions and post-hoc validation. */
    private String visionModel = "mistral-31-24b";

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

    public String getAnalysisModel() { return analysisModel; }
    public void setAnalysisModel(String analysisModel) { this.analysisModel = analysisModel; }

    public String getVisionModel() { return visionModel; }
    public void setVisionModel(String visionModel) { this.visionModel = visionModel; }
}
