package com.storyscene.backend.generation.vision;

import java.time.Duration;
import java.util.List;

/**
 * "Describe / judge this image" chat call against a vision-capable model.
 */
public interface VisionClient {

    /**
     * @param imageUrls http(s) or {@code data:} URLs, sent after the text part in order
     * @return the model's text answer, never null
     */
    String complete(String requestId, String prompt, List<String> imageUrls, Duration timeout);
}
