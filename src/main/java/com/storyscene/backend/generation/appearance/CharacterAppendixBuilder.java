package com.storyscene.backend.generation.appearance;

import com.storyscene.backend.generation.prompt.PromptSanitizer;

import java.util.List;
import java.util.Map;

public final class CharacterAppendixBuilder {

    private CharacterAppendixBuilder() {}

    /**
     * One line per character:
     * {@code - Name: snippet. physical. Outfit: ... Accessories: ... State: ... Traits: ...}
     */
    public static String build(
            AppearanceResolution resolution,
            Map<String, CharacterProfile> profilesByName,
            Map<String, String> visionTraitsByName
    ) {
        if (resolution == null || resolution.effectiveByName().isEmpty()) return "";

        StringBuilder sb = new StringBuilder("Characters:");
        resolution.effectiveByName().forEach((name, r) -> {
            CharacterProfile p = profilesByName == null ? null : profilesByName.get(name);
            AppearanceSnapshot s = r.snapshot();
            String traits = visionTraitsByName == null ? null : visionTraitsByName.get(name);

            StringBuilder line = new StringBuilder("- ").append(name).append(':');
            append(line, p == null ? null : p.referenceSnippet(), "");
            append(line, s.physicalAttributes(), "");
            append(line, s.clothing(), "Outfit: ");
            append(line, s.accessories(), "Accessories: ");
            append(line, s.state(), "State: ");
            append(line, traits, "Traits: ");
            sb.append('\n').append(line.toString().trim());
        });
        return sb.toString();
    }

    public static List<String> names(AppearanceResolution resolution) {
        return resolution == null ? List.of() : List.copyOf(resolution.effectiveByName().keySet());
    }

    private static void append(StringBuilder line, String value, String label) {
        String v = PromptSanitizer.sanitize(value);
        if (v.isEmpty()) return;
        line.append(' ').append(label).append(v);
        if (!v.endsWith(".")) line.append('.');
    }
}
