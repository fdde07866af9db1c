package com.storyscene.backend.generation.style;

import java.util.List;
import java.util.Locale;

public enum StyleCategory {
    ANIME("anime", List.of(
            "photorealistic", "realistic", "photo", "8k", "unreal engine", "octane render",
            "cinematic lighting", "photograph", "hyperrealistic", "live action", "movie still",
            "film grain", "depth of field", "bokeh")),
    REALISTIC("realistic", List.of(
            "anime", "manga", "cartoon", "illustration", "painting", "drawing", "sketch",
            "cel shaded", "flat color", "vector", "pixel art", "low poly")),
    ARTISTIC("artistic", List.of(
            "photorealistic", "photograph", "live action", "8k photo", "raw photo", "3d render", "octane render")),
    THREE_D("3d", List.of(
            "2d", "flat", "sketch", "drawing", "painting", "watercolor", "anime", "manga")),
    PIXEL("pixel", List.of(
            "smooth", "anti-aliased", "high resolution", "4k", "8k", "photorealistic", "vector", "photograph"));

    private final String code;
    private final List<String> conflictingTerms;

    StyleCategory(String code, List<String> conflictingTerms) {
        this.code = code;
        this.conflictingTerms = conflictingTerms;
    }

    public String code() { return code; }

    /** Terms that pull a prompt away from this category; removed from scene text. */
    public List<String> conflictingTerms() { return conflictingTerms; }

    /** Word-based guess for ids that are not in the catalog. */
    public static StyleCategory infer(String styleId) {
        String id = styleId == null ? "" : styleId.trim().toLowerCase(Locale.ROOT);
        if (id.isEmpty()) return ARTISTIC;

        if (containsAny(id, "anime", "manga", "webtoon", "ghibli", "cartoon", "pixar", "disney")) return ANIME;
        if (containsAny(id, "pixel", "minecraft", "roblox", "lego")) return PIXEL;
        if (containsAny(id, "3d", "render", "low_poly")) return THREE_D;
        if (containsAny(id, "noir", "cyberpunk", "neon")) return REALISTIC;
        return ARTISTIC;
    }

    private static boolean containsAny(String s, String... needles) {
        for (String n : needles) {
            if (s.contains(n)) return true;
        }
        return false;
    }
}
