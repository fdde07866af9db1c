package com.storyscene.backend.generation.style;

import com.storyscene.backend.generation.model.ImageModel;

/**
 * Guidance scale and inference steps derived from style intensity and the style's biases.
 */
public record GenerationTuning(double cfgScale, int steps) {

    public static GenerationTuning compute(String styleId, int intensity, boolean strict, ImageModel model) {
        if (model != null && model.turbo()) {
            return new GenerationTuning(model.fixedCfgScale(), model.fixedSteps());
        }

        StyleDefinition def = StyleCatalog.resolve(styleId).definition();
        int i = StyleGuidanceBuilder.clamp(intensity);

        double cfgBase = clamp(5.5 + i * 0.04, 4.5, 10);
        double cfgBias = clamp(def.cfgBias(), -2, 2);
        double cfg = clamp(cfgBase + cfgBias + (strict ? 0.3 : 0), 3.5, 12);

        long stepsBase = Math.round(clamp(26 + i * 0.1 + (strict ? 2 : 0), 20, 40));
        int stepsBias = (int) clamp(def.stepsBias(), -20, 20);
        int steps = (int) Math.round(clamp(stepsBase + stepsBias, 10, 60));

        if (model != null && model.maxSteps() != null) steps = Math.min(steps, model.maxSteps());

        return new GenerationTuning(round2(cfg), steps);
    }

    /** Stricter parameters for the one retry after a failed vision validation. */
    public GenerationTuning stricter() {
        return new GenerationTuning(round2(Math.min(12, cfgScale + 1.0)), steps);
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
