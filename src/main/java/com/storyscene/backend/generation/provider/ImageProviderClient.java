package com.storyscene.backend.generation.provider;

import java.time.Duration;

public interface ImageProviderClient {

    /** Code the router keys on: {@code VENICE}, {@code GEMINI}, {@code STUB}. */
    String providerCode();

    /**
     * One upstream call. HTTP errors surface as {@link org.springframework.web.client.RestClientResponseException},
     * timeouts as {@link org.springframework.web.client.ResourceAccessException}.
     */
    ImageProviderResult generate(ImageGenerationCall call, Duration timeout);
}
