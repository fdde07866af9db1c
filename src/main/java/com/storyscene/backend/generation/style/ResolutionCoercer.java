package com.storyscene.backend.generation.style;

import java.util.ArrayList;
import java.util.List;

/**
 * Brings a requested width/height into what the model accepts.
 * Gemini flash is square only; diffusion models take 512..1536 in multiples of 64;
 * Gemini pro uses the size only to pick an aspect ratio.
 */
public final class ResolutionCoercer {

    private ResolutionCoercer() {}

    public static final String FLASH_MODEL = "gemini-2.5-flash";
    public static final String PRO_MODEL = "gemini-3-pro";

    private static final int MAX_DIM = 1536;
    private static final int MIN_DIM = 512;
    private static final int MULTIPLE = 64;

    public record Resolution(int width, int height, List<String> issues) {
        public Resolution {
            issues = List.copyOf(issues);
        }

        public boolean coerced() {
            return issues.stream().anyMatch(i -> !"resolution_used_for_aspect_ratio_only".equals(i));
        }

        /** Nearest of 16:9, 4:3, 1:1, 3:4, 9:16. */
        public String aspectRatio() {
            if (width <= 0 || height <= 0) return "1:1";
            double r = (double) width / height;
            if (r >= 1.7) return "16:9";
            if (r >= 1.3) return "4:3";
            if (r <= 0.6) return "9:16";
            if (r <= 0.8) return "3:4";
            return "1:1";
        }
    }

    public static Resolution coerce(String modelId, Integer requestedWidth, Integer requestedHeight, int fallbackWidth, int fallbackHeight) {
        List<String> issues = new ArrayList<>();

        boolean valid = requestedWidth != null && requestedHeight != null && requestedWidth > 0 && requestedHeight > 0;
        int width = requestedWidth != null && requestedWidth > 0 ? requestedWidth : fallbackWidth;
        int height = requestedHeight != null && requestedHeight > 0 ? requestedHeight : fallbackHeight;
        if (!valid) issues.add("resolution_missing_or_invalid");

        String model = modelId == null ? "" : modelId.trim();

        if (FLASH_MODEL.equals(model)) {
            if (width != 1024 || height != 1024) {
                issues.add("resolution_coerced_for_model:" + FLASH_MODEL);
                width = 1024;
                height = 1024;
            }
        } else if (PRO_MODEL.equals(model)) {
            issues.add("resolution_used_for_aspect_ratio_only");
        } else {
            double aspect = (double) width / height;
            int currentMax = Math.max(width, height);
            int currentMin = Math.min(width, height);

            if (currentMax > MAX_DIM) {
                double scale = (double) MAX_DIM / currentMax;
                width = (int) Math.max(1, Math.round(width * scale));
                height = (int) Math.max(1, Math.round(height * scale));
                issues.add("resolution_scaled_down");
            }
            if (currentMin < MIN_DIM) {
                double scale = (double) MIN_DIM / Math.max(1, currentMin);
                width = (int) Math.max(1, Math.round(width * scale));
                height = (int) Math.max(1, Math.round(height * scale));
                issues.add("resolution_scaled_up");
            }

            width = roundToMultiple(width);
            height = roundToMultiple(height);

            double postAspect = (double) width / height;
            if (Math.abs(aspect - postAspect) > 0.02) issues.add("resolution_aspect_drift");
        }

        return new Resolution(width, height, issues);
    }

    private static int roundToMultiple(int value) {
        return (int) Math.max(MULTIPLE, Math.round((double) value / MULTIPLE) * MULTIPLE);
    }
}
