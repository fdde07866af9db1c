package com.storyscene.backend.generation.appearance;

import com.fasterxml.jackson.databind.JsonNode;
import com.storyscene.backend.generation.prompt.PromptSanitizer;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Clothing / condition / physical description of one character in one scene.
 * Blank strings are normalized to {@code null}.
 */
public record AppearanceSnapshot(
        String clothing,
        String state,
        String physicalAttributes,
        String accessories,
        Map<String, String> extra
) {

    public static final AppearanceSnapshot EMPTY = new AppearanceSnapshot(null, null, null, null, Map.of());

    private static final Set<String> KNOWN_FIELDS =
            Set.of("clothing", "state", "condition", "physical_attributes", "accessories");

    public AppearanceSnapshot {
        clothing = blankToNull(clothing);
        state = blankToNull(state);
        physicalAttributes = blankToNull(physicalAttributes);
        accessories = blankToNull(accessories);
        extra = (extra == null) ? Map.of() : Map.copyOf(extra);
    }

    public static AppearanceSnapshot of(String clothing, String state, String physicalAttributes, String accessories) {
        return new AppearanceSnapshot(clothing, state, physicalAttributes, accessories, Map.of());
    }

    /**
     * Reads {@code {"clothing":..,"state"|"condition":..,"physical_attributes":..,"accessories":..}}.
     * Other textual fields land in {@link #extra()}.
     */
    public static AppearanceSnapshot fromJson(JsonNode node) {
        if (node == null || !node.isObject()) return EMPTY;

        String state = text(node, "state");
        if (state == null) state = text(node, "condition");

        Map<String, String> extra = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (KNOWN_FIELDS.contains(e.getKey())) continue;
            JsonNode v = e.getValue();
            if (v != null && v.isValueNode() && !v.asText().isBlank()) {
                extra.put(e.getKey(), PromptSanitizer.sanitize(v.asText()));
            }
        }

        return new AppearanceSnapshot(
                text(node, "clothing"),
                state,
                text(node, "physical_attributes"),
                text(node, "accessories"),
                extra
        );
    }

    /** Fields of {@code over} that are present win over this snapshot's. */
    public AppearanceSnapshot overlay(AppearanceSnapshot over) {
        if (over == null) return this;
        Map<String, String> mergedExtra = new LinkedHashMap<>(extra);
        mergedExtra.putAll(over.extra);
        return new AppearanceSnapshot(
                firstNonNull(over.clothing, clothing),
                firstNonNull(over.state, state),
                firstNonNull(over.physicalAttributes, physicalAttributes),
                firstNonNull(over.accessories, accessories),
                mergedExtra
        );
    }

    public boolean isEmpty() {
        return clothing == null && state == null && physicalAttributes == null && accessories == null && extra.isEmpty();
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || !v.isValueNode()) return null;
        return PromptSanitizer.sanitize(v.asText());
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
