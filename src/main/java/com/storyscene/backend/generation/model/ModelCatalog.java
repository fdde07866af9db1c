package com.storyscene.backend.generation.model;

import com.storyscene.backend.generation.style.StyleCategory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class ModelCatalog {

    private ModelCatalog() {}

    public static final String VENICE = "VENICE";
    public static final String GEMINI = "GEMINI";

    public static final int LIMITED_PROMPT_LENGTH = 1400;
    public static final int DIFFUSION_PROMPT_LENGTH = 3000;
    public static final int MULTIMODAL_PROMPT_LENGTH = 8000;

    private static final Map<String, ImageModel> MODELS = new LinkedHashMap<>();

    static {
        venice("venice-sd35", DIFFUSION_PROMPT_LENGTH, null, null, null);
        venice("hidream", LIMITED_PROMPT_LENGTH, null, null, null);
        venice("lustify-sdxl", LIMITED_PROMPT_LENGTH, null, null, null);
        venice("lustify-v7", LIMITED_PROMPT_LENGTH, null, null, null);
        venice("qwen-image", LIMITED_PROMPT_LENGTH, null, null, 8);
        venice("wai-Illustrious", DIFFUSION_PROMPT_LENGTH, null, null, null);
        venice("z-image-turbo", LIMITED_PROMPT_LENGTH, 4, 1.8, null);
        MODELS.put("gemini-2.5-flash", new ImageModel("gemini-2.5-flash", GEMINI, true, MULTIMODAL_PROMPT_LENGTH, null, null, null));
        MODELS.put("gemini-3-pro", new ImageModel("gemini-3-pro", GEMINI, true, MULTIMODAL_PROMPT_LENGTH, null, null, null));
    }

    private static final Map<StyleCategory, String> PREFERRED_BY_CATEGORY = Map.of(
            StyleCategory.ANIME, "wai-Illustrious",
            StyleCategory.REALISTIC, "venice-sd35",
            StyleCategory.ARTISTIC, "hidream",
            StyleCategory.THREE_D, "venice-sd35",
            StyleCategory.PIXEL, "qwen-image"
    );

    private static final Map<StyleCategory, Set<String>> RECOMMENDED_BY_CATEGORY = Map.of(
            StyleCategory.ANIME, Set.of("wai-Illustrious", "lustify-sdxl", "gemini-3-pro"),
            StyleCategory.REALISTIC, Set.of("venice-sd35", "lustify-v7", "hidream", "gemini-3-pro"),
            StyleCategory.ARTISTIC, Set.of("hidream", "venice-sd35", "gemini-2.5-flash", "gemini-3-pro"),
            StyleCategory.THREE_D, Set.of("venice-sd35", "hidream", "gemini-3-pro"),
            StyleCategory.PIXEL, Set.of("qwen-image", "z-image-turbo", "gemini-2.5-flash")
    );

    private static void venice(String id, int promptLimit, Integer fixedSteps, Double fixedCfg, Integer maxSteps) {
        MODELS.put(id, new ImageModel(id, VENICE, false, promptLimit, fixedSteps, fixedCfg, maxSteps));
    }

    public static Optional<ImageModel> find(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(MODELS.get(id.trim()));
    }

    public static ImageModel require(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("MODEL_INVALID"));
    }

    public static boolean isAllowed(String id) {
        return find(id).isPresent();
    }

    public static List<String> allowedIds() {
        return List.copyOf(MODELS.keySet());
    }

    /** Preferred model for a style category; null category means no style preference. */
    public static String preferredFor(StyleCategory category) {
        return category == null ? null : PREFERRED_BY_CATEGORY.get(category);
    }

    public static boolean isRecommendedFor(StyleCategory category, String modelId) {
        if (category == null || modelId == null) return true;
        return RECOMMENDED_BY_CATEGORY.getOrDefault(category, Set.of()).contains(modelId);
    }
}
