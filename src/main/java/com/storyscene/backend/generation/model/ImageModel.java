package com.storyscene.backend.generation.model;

/**
 * Generation model and the limits the pipeline applies to it.
 *
 * @param provider provider code the router resolves ({@code VENICE}, {@code GEMINI})
 * @param fixedSteps turbo models ignore intensity and use these parameters
 * @param maxSteps upper bound for step-capped models, null when uncapped
 */
public record ImageModel(
        String id,
        String provider,
        boolean multimodal,
        int promptLimit,
        Integer fixedSteps,
        Double fixedCfgScale,
        Integer maxSteps
) {
    public boolean turbo() {
        return fixedSteps != null;
    }
}
