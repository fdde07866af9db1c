package com.storyscene.backend.generation.dto;

import com.storyscene.backend.generation.model.ModelCatalog;
import com.storyscene.backend.generation.prompt.PromptSanitizer;
import com.storyscene.backend.generation.style.StyleCatalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Validated, defaulted view of a {@link GenerateSceneImageRequest}. Built once at the boundary.
 *
 * @param styleIntensity 0..100, or null when the request carried no usable number
 */
public record GenerationOptions(
        String sceneId,
        String storyId,
        String artStyle,
        String model,
        Integer width,
        Integer height,
        Integer styleIntensity,
        boolean strictStyle,
        List<String> disabledStyleElements,
        String forcePrompt,
        String forceFullPrompt,
        boolean promptOnly,
        boolean characterImageReferenceEnabled,
        String clientRequestId,
        boolean reset
) {
    public static final int DEFAULT_INTENSITY = 70;

    public GenerationOptions {
        disabledStyleElements = disabledStyleElements == null ? List.of() : List.copyOf(disabledStyleElements);
    }

    /**
     * @throws IllegalArgumentException with an upper-case code for any invalid field
     */
    public static GenerationOptions from(GenerateSceneImageRequest r) {
        if (r == null) throw new IllegalArgumentException("REQUEST_BODY_REQUIRED");

        boolean reset = Boolean.TRUE.equals(r.reset());
        String storyId = trimToNull(r.storyId());
        String sceneId = trimToNull(r.sceneId());

        if (reset) {
            if (!isUuid(storyId)) throw new IllegalArgumentException("STORY_ID_INVALID");
        } else {
            if (!isUuid(sceneId)) throw new IllegalArgumentException("SCENE_ID_INVALID");
            if (storyId != null && !isUuid(storyId)) throw new IllegalArgumentException("STORY_ID_INVALID");
        }

        String artStyle = trimToNull(r.artStyle());
        if (artStyle != null) {
            artStyle = artStyle.toLowerCase(Locale.ROOT);
            if (!StyleCatalog.isKnown(artStyle)) throw new IllegalArgumentException("ART_STYLE_INVALID");
        }

        String model = trimToNull(r.model());
        if (model != null && !ModelCatalog.isAllowed(model)) throw new IllegalArgumentException("MODEL_INVALID");

        String clientRequestId = trimToNull(r.clientRequestId());
        if (clientRequestId != null && !isUuid(clientRequestId)) throw new IllegalArgumentException("REQUEST_ID_INVALID");

        String forcePrompt = trimToNull(r.forcePrompt());
        String forceFullPrompt = trimToNull(r.forceFullPrompt());
        if (r.forceFullPrompt() != null && forceFullPrompt == null) throw new IllegalArgumentException("PROMPT_EMPTY");

        return new GenerationOptions(
                sceneId,
                storyId,
                artStyle,
                model,
                positiveOrNull(r.width()),
                positiveOrNull(r.height()),
                parseIntensity(r.styleIntensity()),
                parseStrict(r.strictStyle()),
                cleanList(r.disabledStyleElements()),
                forcePrompt,
                forceFullPrompt,
                Boolean.TRUE.equals(r.promptOnly()),
                r.characterImageReferenceEnabled() == null || r.characterImageReferenceEnabled(),
                clientRequestId,
                reset
        );
    }

    /** Request value, then the story's stored value, then {@value #DEFAULT_INTENSITY}. */
    public int effectiveIntensity(Integer storedIntensity) {
        if (styleIntensity != null) return styleIntensity;
        if (storedIntensity != null) return clamp(storedIntensity);
        return DEFAULT_INTENSITY;
    }

    /** {@code true}, {@code "true"}, {@code 1} and {@code "1"} mean strict; absent means strict. */
    static boolean parseStrict(Object v) {
        if (v == null) return true;
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.intValue() == 1;
        String s = v.toString().trim().toLowerCase(Locale.ROOT);
        return s.equals("true") || s.equals("1");
    }

    static Integer parseIntensity(Object v) {
        if (v == null) return null;
        if (v instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? clamp((int) Math.round(d)) : null;
        }
        try {
            double d = Double.parseDouble(v.toString().trim());
            return Double.isFinite(d) ? clamp((int) Math.round(d)) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(100, v));
    }

    private static Integer positiveOrNull(Integer v) {
        return v == null || v <= 0 ? null : v;
    }

    private static List<String> cleanList(List<String> in) {
        List<String> out = new ArrayList<>();
        if (in == null) return out;
        for (String s : in) {
            String t = PromptSanitizer.sanitize(s);
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    static boolean isUuid(String s) {
        if (s == null || s.length() != 36) return false;
        try {
            UUID.fromString(s);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
