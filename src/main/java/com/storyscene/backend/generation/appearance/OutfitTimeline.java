package com.storyscene.backend.generation.appearance;

import com.fasterxml.jackson.databind.JsonNode;
import com.storyscene.backend.generation.prompt.PromptSanitizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Outfit ranges from a reference sheet: {@code [{"scene_range":{"start":1,"end":4},"description":"..."}]}.
 * {@code start_scene}/{@code end_scene} and {@code name}/{@code clothing} are accepted too.
 */
public record OutfitTimeline(List<Entry> entries) {

    public static final OutfitTimeline NONE = new OutfitTimeline(List.of());

    public record Entry(int start, int end, String clothing) {
        boolean covers(int sceneNumber) {
            return sceneNumber >= start && sceneNumber <= end;
        }
    }

    public OutfitTimeline {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static OutfitTimeline fromJson(JsonNode outfits) {
        if (outfits == null || !outfits.isArray()) return NONE;

        List<Entry> out = new ArrayList<>();
        for (JsonNode o : outfits) {
            if (o == null || !o.isObject()) continue;
            JsonNode range = o.path("scene_range");
            int start = range.has("start") ? range.path("start").asInt(0) : o.path("start_scene").asInt(0);
            int end = range.has("end") ? range.path("end").asInt(999_999) : o.path("end_scene").asInt(999_999);

            String clothing = PromptSanitizer.firstNonBlank(
                    o.path("description").asText(null),
                    o.path("clothing").asText(null),
                    o.path("name").asText(null)
            );
            if (clothing == null) continue;
            out.add(new Entry(start, end, PromptSanitizer.sanitize(clothing)));
        }
        return new OutfitTimeline(out);
    }

    /** First entry covering the scene, or null. */
    public String clothingFor(int sceneNumber) {
        for (Entry e : entries) {
            if (e.covers(sceneNumber)) return e.clothing();
        }
        return null;
    }
}
