package com.storyscene.backend.generation.style;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class StyleGuidanceBuilder {

    private StyleGuidanceBuilder() {}

    public static String strengthText(int intensity) {
        if (intensity >= 90) return "maximal and unmistakable";
        if (intensity >= 70) return "strong and clearly readable";
        if (intensity >= 40) return "moderate and balanced";
        if (intensity >= 15) return "subtle";
        return "minimal";
    }

    /**
     * Picks elements, palettes, composition notes and context references by intensity,
     * drops disabled elements, and appends the strict block when requested.
     */
    public static StyleGuidance build(String styleId, int intensity, boolean strict, Collection<String> disabledElements) {
        StyleCatalog.Resolution resolved = StyleCatalog.resolve(styleId);
        StyleDefinition def = resolved.definition();
        if (def.isNone()) return StyleGuidance.none();

        int i = clamp(intensity);
        Set<String> disabled = lowerSet(disabledElements);

        int countElements = i >= 90 ? 7 : i >= 70 ? 5 : i >= 40 ? 4 : i >= 20 ? 3 : 2;
        int countPalette = i >= 70 ? 2 : 1;
        int countComp = i >= 70 ? 2 : 1;
        int countCtx = i >= 85 ? 2 : i >= 35 ? 1 : 0;

        String readable = resolved.canonicalId().replace('_', ' ').trim();
        String baseName = "";
        if (resolved.appendStyleName()) {
            String requested = styleId == null ? readable : styleId.trim().replace('_', ' ');
            baseName = requested.toLowerCase(Locale.ROOT).matches(".*\\bstyle\\b.*") ? requested : requested + " style";
        }
        String baseLower = baseName.toLowerCase(Locale.ROOT);

        List<String> picked = new ArrayList<>();
        for (String e : def.elements()) {
            if (picked.size() >= countElements) break;
            if (e == null || e.isBlank()) continue;
            String lower = e.toLowerCase(Locale.ROOT);
            if (disabled.contains(lower)) continue;
            if (!baseLower.isEmpty() && lower.equals(baseLower)) continue;
            picked.add(e.trim());
        }

        List<String> parts = new ArrayList<>();
        parts.add(baseName);
        parts.addAll(picked);
        parts.addAll(take(def.palettes(), countPalette));
        parts.addAll(take(def.composition(), countComp));
        parts.addAll(take(def.context(), countCtx));

        if (strict) {
            parts.add("strict " + def.name());
            parts.add("consistent parameters");
            parts.add(strengthText(i) + " stylization");
            if (!def.mustInclude().isEmpty()) parts.add("markers: " + String.join(", ", def.mustInclude()));
        }

        return new StyleGuidance(
                resolved.canonicalId(),
                def.name(),
                def.prefix(),
                joinComma(parts),
                resolved.usedFallback(),
                List.copyOf(picked)
        );
    }

    static String joinComma(List<String> parts) {
        StringBuilder sb = new StringBuilder();
        for (String p : parts) {
            if (p == null) continue;
            String t = p.trim();
            if (t.isEmpty()) continue;
            if (sb.length() > 0) sb.append(", ");
            sb.append(t);
        }
        return sb.toString();
    }

    static Set<String> lowerSet(Collection<String> values) {
        Set<String> out = new HashSet<>();
        if (values == null) return out;
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }

    static int clamp(int intensity) {
        return Math.max(0, Math.min(100, intensity));
    }

    private static List<String> take(List<String> list, int n) {
        return list.subList(0, Math.min(Math.max(0, n), list.size()));
    }
}
