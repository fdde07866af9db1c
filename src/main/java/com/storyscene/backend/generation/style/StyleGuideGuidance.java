package com.storyscene.backend.generation.style;

import com.storyscene.backend.generation.entity.StyleGuideEntity;
import com.storyscene.backend.generation.prompt.PromptSanitizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Labelled fragments from a story's style guide. Higher intensity includes more of them.
 */
public record StyleGuideGuidance(String positive, boolean used, List<String> issues) {

    public static final String STRICT_SUFFIX = "consistent style guide adherence";

    public static StyleGuideGuidance from(StyleGuideEntity guide, int intensity, boolean strict) {
        if (guide == null) return new StyleGuideGuidance("", false, List.of("style_guide_missing"));

        List<String[]> ordered = new ArrayList<>();
        addIfPresent(ordered, "rendering", PromptSanitizer.sanitize(guide.getRenderingTechniques(), 320));
        addIfPresent(ordered, "lighting", PromptSanitizer.sanitize(guide.getLightingAndShading(), 320));
        addIfPresent(ordered, "palette", PromptSanitizer.sanitize(guide.getColorPalette(), 280));
        addIfPresent(ordered, "composition", PromptSanitizer.sanitize(guide.getPerspectiveAndComposition(), 320));
        String extra = PromptSanitizer.sanitize(guide.getPositivePrompt(), 320);

        if (ordered.isEmpty() && extra.isEmpty()) {
            return new StyleGuideGuidance("", false, List.of("style_guide_empty"));
        }

        int i = StyleGuidanceBuilder.clamp(intensity);
        int includeCount = i >= 85 ? 4 : i >= 55 ? 3 : i >= 25 ? 2 : 1;

        List<String> parts = new ArrayList<>();
        for (String[] e : ordered.subList(0, Math.min(includeCount, ordered.size()))) {
            parts.add(e[0] + ": " + e[1]);
        }
        parts.add(extra);

        String positive = StyleGuidanceBuilder.joinComma(parts);
        if (strict && !positive.isEmpty()) {
            positive = StyleGuidanceBuilder.joinComma(List.of(positive, STRICT_SUFFIX));
        }
        return new StyleGuideGuidance(positive, !positive.isEmpty(), List.of());
    }

    private static void addIfPresent(List<String[]> out, String label, String text) {
        if (!text.isEmpty()) out.add(new String[] {label, text});
    }
}
