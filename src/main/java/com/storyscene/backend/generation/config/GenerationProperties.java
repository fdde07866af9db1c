package com.storyscene.backend.generation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.generation")
public class GenerationProperties {

    /** Credits charged per successful image. */
    private int creditCost = 1;

    /** Platform execution ceiling for one request. */
    private Duration hardLimit = Duration.ofSeconds(58);

    /** Kept free for upload and final bookkeeping. */
    private Duration safetyBuffer = Duration.ofSeconds(5);

    /** Vision validation is skipped when less than this is left. */
    private Duration visionMinRemaining = Duration.ofSeconds(15);

    /** The stricter regeneration is skipped when less than this is left. */
    private Duration retryMinRemaining = Duration.ofSeconds(30);

    private Duration minImageCallTimeout = Duration.ofSeconds(10);
    private Duration visionTimeout = Duration.ofSeconds(15);
    private Duration referenceFetchTimeout = Duration.ofSeconds(5);

    private int minImageBytes = 1000;

    private String defaultModel = "venice-sd35";
    private String fallbackModel = "lustify-sdxl";

    private int defaultWidth = 1024;
    private int defaultHeight = 576;

    private boolean blankDetectionEnabled = true;
    private boolean visionValidationEnabled = true;

    private final Cache cache = new Cache();
    private final Reconciliation reconciliation = new Reconciliation();

    public int getCreditCost() { return creditCost; }
    public void setCreditCost(int creditCost) { this.creditCost = creditCost; }

    public Duration getHardLimit() { return hardLimit; }
    public void setHardLimit(Duration hardLimit) { this.hardLimit = hardLimit; }

    public Duration getSafetyBuffer() { return safetyBuffer; }
    public void setSafetyBuffer(Duration safetyBuffer) { this.safetyBuffer = safetyBuffer; }

    public Duration getVisionMinRemaining() { return visionMinRemaining; }
    public void setVisionMinRemaining(Duration visionMinRemaining) { this.visionMinRemaining = visionMinRemaining; }

    public Duration getRetryMinRemaining() { return retryMinRemaining; }
    public void setRetryMinRemaining(Duration retryMinRemaining) { this.retryMinRemaining = retryMinRemaining; }

    public Duration getMinImageCallTimeout() { return minImageCallTimeout; }
    public void setMinImageCallTimeout(Duration minImageCallTimeout) { this.minImageCallTimeout = minImageCallTimeout; }

    public Duration getVisionTimeout() { return visionTimeout; }
    public void setVisionTimeout(Duration visionTimeout) { this.visionTimeout = visionTimeout; }

    public Duration getReferenceFetchTimeout() { return referenceFetchTimeout; }
    public void setReferenceFetchTimeout(Duration referenceFetchTimeout) { this.referenceFetchTimeout = referenceFetchTimeout; }

    public int getMinImageBytes() { return minImageBytes; }
    public void setMinImageBytes(int minImageBytes) { this.minImageBytes = minImageBytes; }

    public String getDefaultModel() { return defaultModel; }
    public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }

    public String getFallbackModel() { return fallbackModel; }
    public void setFallbackModel(String fallbackModel) { this.fallbackModel = fallbackModel; }

    public int getDefaultWidth() { return defaultWidth; }
    public void setDefaultWidth(int defaultWidth) { this.defaultWidth = defaultWidth; }

    public int getDefaultHeight() { return defaultHeight; }
    public void setDefaultHeight(int defaultHeight) { this.defaultHeight = defaultHeight; }

    public boolean isBlankDetectionEnabled() { return blankDetectionEnabled; }
    public void setBlankDetectionEnabled(boolean blankDetectionEnabled) { this.blankDetectionEnabled = blankDetectionEnabled; }

    public boolean isVisionValidationEnabled() { return visionValidationEnabled; }
    public void setVisionValidationEnabled(boolean visionValidationEnabled) { this.visionValidationEnabled = visionValidationEnabled; }

    public Cache getCache() { return cache; }
    public Reconciliation getReconciliation() { return reconciliation; }

    public static class Cache {
        private final Bounded referenceImages = new Bounded(64, Duration.ofMinutes(10));
        private final Bounded visionDescriptions = new Bounded(256, Duration.ofMinutes(30));

        public Bounded getReferenceImages() { return referenceImages; }
        public Bounded getVisionDescriptions() { return visionDescriptions; }
    }

    public static class Bounded {
        private long maxSize;
        private Duration ttl;

        public Bounded() {}

        Bounded(long maxSize, Duration ttl) {
            this.maxSize = maxSize;
            this.ttl = ttl;
        }

        public long getMaxSize() { return maxSize; }
        public void setMaxSize(long maxSize) { this.maxSize = maxSize; }

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
    }

    /** Sweep of attempts left in STARTED by a crashed process. */
    public static class Reconciliation {
        private boolean enabled = true;
        private Duration staleAfter = Duration.ofMinutes(5);
        private Duration interval = Duration.ofMinutes(2);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getStaleAfter() { return staleAfter; }
        public void setStaleAfter(Duration staleAfter) { this.staleAfter = staleAfter; }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }
}
