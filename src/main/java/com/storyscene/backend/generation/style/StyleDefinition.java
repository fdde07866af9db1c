package com.storyscene.backend.generation.style;

import java.util.List;

/**
 * One art style: the prefix that opens the prompt, guidance fragments ordered from most
 * to least characteristic, tuning biases and the markers a strict prompt must carry.
 */
public record StyleDefinition(
        String id,
        String name,
        StyleCategory category,
        String prefix,
        List<String> elements,
        List<String> palettes,
        List<String> composition,
        List<String> context,
        double cfgBias,
        int stepsBias,
        List<String> mustInclude,
        List<String> avoid
) {
    public StyleDefinition {
        prefix = prefix == null ? "" : prefix;
        elements = List.copyOf(elements);
        palettes = List.copyOf(palettes);
        composition = List.copyOf(composition);
        context = List.copyOf(context);
        mustInclude = List.copyOf(mustInclude);
        if (avoid == null || avoid.isEmpty()) {
            avoid = StyleCatalog.NONE.equals(id) ? List.of() : defaultAvoid(category);
        } else {
            avoid = List.copyOf(avoid);
        }
    }

    public boolean isNone() {
        return StyleCatalog.NONE.equals(id);
    }

    /** Id with underscores as spaces, e.g. {@code film noir}. */
    public String readableId() {
        return id.replace('_', ' ').trim();
    }

    private static List<String> defaultAvoid(StyleCategory category) {
        if (category == null) return List.of();
        List<String> terms = category.conflictingTerms();
        return List.copyOf(terms.subList(0, Math.min(4, terms.size())));
    }
}
