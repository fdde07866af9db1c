package com.storyscene.backend.generation.prompt;

import java.util.regex.Pattern;

public final class PromptSanitizer {

    private PromptSanitizer() {}

    private static final Pattern CONTROL = Pattern.compile("\\p{Cntrl}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Replaces control characters with spaces and collapses whitespace. Never returns null. */
    public static String sanitize(String raw) {
        if (raw == null) return "";
        String s = CONTROL.matcher(raw).replaceAll(" ");
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    public static String sanitize(String raw, int maxLength) {
        return truncate(sanitize(raw), maxLength);
    }

    public static String truncate(String s, int maxLength) {
        if (s == null) return "";
        if (maxLength <= 0) return "";
        return s.length() <= maxLength ? s : s.substring(0, maxLength);
    }

    /**
     * Cuts at {@code maxLength}, preferring the last space, comma or period when that
     * keeps at least 70% of the budget.
     */
    public static String truncateAtWordBoundary(String s, int maxLength) {
        if (s == null || maxLength <= 0) return "";
        if (s.length() <= maxLength) return s;
        String cut = s.substring(0, maxLength);
        int idx = Math.max(cut.lastIndexOf(' '), Math.max(cut.lastIndexOf(','), cut.lastIndexOf('.')));
        if (idx > (int) (maxLength * 0.7)) cut = cut.substring(0, idx);
        return cut.trim();
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
