package com.storyscene.backend.generation.style;

import java.util.List;

/**
 * Positive style text for one request.
 *
 * @param positive comma-joined guidance fragments, empty for {@code none}
 * @param prefix text that opens the subject ({@code "anime style artwork of"}), may be empty
 */
public record StyleGuidance(
        String styleId,
        String styleName,
        String prefix,
        String positive,
        boolean usedFallback,
        List<String> pickedElements
) {
    public static StyleGuidance none() {
        return new StyleGuidance(StyleCatalog.NONE, "No Specific Style", "", "", false, List.of());
    }
}
