package com.storyscene.backend.generation.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.storyscene.backend.generation.provider.ImageGenerationCall.ReferenceImage;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Two bounded, expiring caches. Both are plain performance shortcuts: a miss recomputes.
 */
@Configuration
@EnableConfigurationProperties(GenerationProperties.class)
public class GenerationCacheConfig {

    /** url -> downloaded reference image */
    @Bean("referenceImageCache")
    public Cache<String, ReferenceImage> referenceImageCache(GenerationProperties props) {
        GenerationProperties.Bounded c = props.getCache().getReferenceImages();
        return Caffeine.newBuilder()
                .expireAfterWrite(c.getTtl())
                .maximumSize(c.getMaxSize())
                .build();
    }

    /** url -> short trait description from the vision model */
    @Bean("visionDescriptionCache")
    public Cache<String, String> visionDescriptionCache(GenerationProperties props) {
        GenerationProperties.Bounded c = props.getCache().getVisionDescriptions();
        return Caffeine.newBuilder()
                .expireAfterWrite(c.getTtl())
                .maximumSize(c.getMaxSize())
                .build();
    }
}
