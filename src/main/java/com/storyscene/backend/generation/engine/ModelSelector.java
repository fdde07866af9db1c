package com.storyscene.backend.generation.engine;

import com.storyscene.backend.generation.model.ImageModel;
import com.storyscene.backend.generation.model.ModelCatalog;
import com.storyscene.backend.generation.style.StyleCatalog;
import com.storyscene.backend.generation.style.StyleCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * Explicit model if the caller named one, else the style category's preference, else the default.
 */
public final class ModelSelector {

    private ModelSelector() {}

    public record Selection(ImageModel model, boolean explicit, StyleCategory category, List<String> warnings) {
        public Selection {
            warnings = List.copyOf(warnings);
        }
    }

    /**
     * @throws IllegalArgumentException {@code MODEL_INVALID} for a named model outside the allow-list
     */
    public static Selection select(String requestedModel, String styleId, boolean strictStyle, String defaultModel) {
        StyleCategory category = StyleCatalog.categoryOf(styleId);
        List<String> warnings = new ArrayList<>();

        String requested = requestedModel == null ? null : requestedModel.trim();
        if (requested != null && !requested.isEmpty()) {
            ImageModel m = ModelCatalog.require(requested);
            if (strictStyle && !ModelCatalog.isRecommendedFor(category, m.id())) {
                warnings.add("model_not_recommended_for_style:" + m.id() + ":" + category.code());
            }
            return new Selection(m, true, category, warnings);
        }

        String preferred = ModelCatalog.preferredFor(category);
        String id = preferred != null ? preferred : defaultModel;
        ImageModel m = ModelCatalog.find(id).orElseGet(() -> ModelCatalog.require(ModelCatalog.allowedIds().get(0)));
        return new Selection(m, false, category, warnings);
    }
}
