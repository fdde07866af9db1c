package com.storyscene.backend.generation.style;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class StyleValidator {

    private StyleValidator() {}

    public record Result(boolean ok, List<String> issues) {
        public Result {
            issues = List.copyOf(issues);
        }
    }

    /**
     * Checks the guidance itself: non-empty, must-include markers not disabled (and present
     * when strict), and the category marker ({@code anime}, {@code pixel}, ...) present.
     */
    public static Result validateGuidance(String styleId, boolean strict, StyleGuidance guidance, Collection<String> disabledElements) {
        StyleCatalog.Resolution resolved = StyleCatalog.resolve(styleId);
        StyleDefinition def = resolved.definition();
        if (def.isNone()) return new Result(true, List.of());

        List<String> issues = new ArrayList<>();
        String prefix = guidance == null ? "" : nz(guidance.prefix()).trim();
        String positive = guidance == null ? "" : nz(guidance.positive()).trim();
        if (prefix.isEmpty() && positive.isEmpty()) issues.add("style_guidance_empty");

        String combined = (prefix + " " + positive).toLowerCase(Locale.ROOT);
        Set<String> disabled = StyleGuidanceBuilder.lowerSet(disabledElements);

        for (String marker : def.mustInclude()) {
            String lower = marker.toLowerCase(Locale.ROOT);
            if (disabled.contains(lower)) {
                issues.add("style_must_include_disabled:" + marker);
                continue;
            }
            if (strict && !combined.contains(lower)) issues.add("style_must_include_missing:" + marker);
        }

        switch (def.category()) {
            case ANIME -> {
                if (!combined.contains("anime") && !combined.contains("manga")) issues.add("style_category_marker_missing:anime");
            }
            case PIXEL -> {
                if (!combined.contains("pixel")) issues.add("style_category_marker_missing:pixel");
            }
            case THREE_D -> {
                if (!combined.contains("3d") && !combined.contains("cgi")) issues.add("style_category_marker_missing:3d");
            }
            case REALISTIC -> {
                if (!combined.contains("photo") && !combined.contains("cinematic")) issues.add("style_category_marker_missing:realistic");
            }
            default -> { }
        }

        return new Result(issues.isEmpty(), issues);
    }

    /**
     * True when the final prompt names the style: its prefix, its display name, or its id with
     * underscores as spaces. Always true for {@code none}.
     */
    public static boolean promptCarriesStyleMarker(String prompt, StyleGuidance guidance) {
        if (guidance == null || StyleCatalog.NONE.equals(guidance.styleId())) return true;
        String lower = nz(prompt).toLowerCase(Locale.ROOT);
        if (lower.isEmpty()) return false;

        for (String marker : markersOf(guidance)) {
            if (!marker.isEmpty() && lower.contains(marker)) return true;
        }
        return false;
    }

    public static List<String> markersOf(StyleGuidance guidance) {
        List<String> out = new ArrayList<>();
        out.add(nz(guidance.prefix()).trim().toLowerCase(Locale.ROOT));
        out.add(nz(guidance.styleName()).trim().toLowerCase(Locale.ROOT));
        out.add(nz(guidance.styleId()).replace('_', ' ').trim().toLowerCase(Locale.ROOT));
        return out;
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
