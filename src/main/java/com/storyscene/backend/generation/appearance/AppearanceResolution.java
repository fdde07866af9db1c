package com.storyscene.backend.generation.appearance;

import java.util.List;
import java.util.Map;

/**
 * @param effectiveByName resolved appearance per character, in request order
 * @param missingClothing characters with no clothing after every fallback (soft warning)
 */
public record AppearanceResolution(Map<String, ResolvedAppearance> effectiveByName, List<String> missingClothing) {

    public AppearanceResolution {
        effectiveByName = effectiveByName == null ? Map.of() : effectiveByName;
        missingClothing = missingClothing == null ? List.of() : List.copyOf(missingClothing);
    }

    public AppearanceSnapshot snapshotOf(String name) {
        ResolvedAppearance r = effectiveByName.get(name);
        return r == null ? AppearanceSnapshot.EMPTY : r.snapshot();
    }
}
