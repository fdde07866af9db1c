package com.storyscene.backend.generation.appearance;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Snapshots recorded for one scene, keyed by character name (case-insensitive).
 */
public record SceneAppearance(int sceneNumber, Map<String, AppearanceSnapshot> byName) {

    public SceneAppearance {
        Map<String, AppearanceSnapshot> normalized = new LinkedHashMap<>();
        if (byName != null) {
            byName.forEach((k, v) -> {
                if (k != null && v != null) normalized.put(key(k), v);
            });
        }
        byName = Map.copyOf(normalized);
    }

    public static SceneAppearance empty(int sceneNumber) {
        return new SceneAppearance(sceneNumber, Map.of());
    }

    public AppearanceSnapshot snapshotOf(String characterName) {
        if (characterName == null) return AppearanceSnapshot.EMPTY;
        AppearanceSnapshot s = byName.get(key(characterName));
        return s == null ? AppearanceSnapshot.EMPTY : s;
    }

    static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
