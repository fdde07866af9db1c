package com.storyscene.backend.generation.engine;

import com.storyscene.backend.generation.image.BlankImageDetector;
import com.storyscene.backend.generation.image.ImageSniffer;
import com.storyscene.backend.generation.vision.VisionValidation;

import java.util.List;

/**
 * A checked image ready for upload.
 *
 * @param model model that produced {@code imageBytes}; differs from the requested one after fallback
 * @param prompt prompt that produced {@code imageBytes}
 * @param validation vision verdict on the first image, null when skipped
 * @param retried the stricter regeneration replaced the first image
 */
public record EngineResult(
        byte[] imageBytes,
        ImageSniffer.Detection detection,
        String model,
        String prompt,
        boolean usedFallback,
        BlankImageDetector.Verdict blankVerdict,
        VisionValidation validation,
        boolean retried,
        List<String> warnings
) {
    public EngineResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
