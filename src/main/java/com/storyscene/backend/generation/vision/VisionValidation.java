package com.storyscene.backend.generation.vision;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Scored opinion of the vision model about a generated image.
 *
 * @param score combined 0..100, null when the model returned no usable score
 * @param status {@code pass}, {@code warn} or {@code fail}
 * @param raw parsed JSON answer, kept for the scene record
 */
public record VisionValidation(
        Integer score,
        String status,
        Integer characterScore,
        Integer styleScore,
        JsonNode raw
) {
    public static final String PASS = "pass";
    public static final String WARN = "warn";
    public static final String FAIL = "fail";

    public boolean failed() {
        return FAIL.equals(status);
    }
}
