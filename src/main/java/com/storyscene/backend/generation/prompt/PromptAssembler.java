package com.storyscene.backend.generation.prompt;

import com.storyscene.backend.generation.style.StyleCatalog;
import com.storyscene.backend.generation.style.StylePhraseStripper;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds {@code [style marker], <prefix> <base>, <style parts...>\n\n<characters>} and trims it
 * to the model's limit. Style parts go first, then the base text, then the character text.
 */
public final class PromptAssembler {

    private PromptAssembler() {}

    public static final int DEFAULT_MAX_LENGTH = 1400;

    private static final Pattern PART_SPLIT = Pattern.compile("[,\\n]");
    private static final Pattern ENDS_WITH_OF = Pattern.compile("(?i).*\\bof$");

    public record Input(
            String basePrompt,
            String characterAppendix,
            String stylePrefix,
            String stylePositive,
            String styleGuidePositive,
            String selectedStyleId,
            Integer maxLength,
            List<String> requiredSubjects
    ) {}

    public static AssembledPrompt assemble(Input in) {
        int limit = in.maxLength() == null ? DEFAULT_MAX_LENGTH : in.maxLength();

        String styleId = in.selectedStyleId() == null ? "" : in.selectedStyleId().trim();
        String styleLabel = styleId.isEmpty() || StyleCatalog.NONE.equals(styleId) ? "" : styleId.replace('_', ' ').trim();
        String styleDescriptor = styleLabel.isEmpty() ? "" : styleLabel + " style";

        String base = PromptSanitizer.sanitize(in.basePrompt());
        if (!styleId.isEmpty()) base = StylePhraseStripper.stripKnownStylePhrases(base);
        base = StylePhraseStripper.removeConflictingTerms(base, styleId);

        String chars = PromptSanitizer.sanitize(in.characterAppendix());
        if (!styleId.isEmpty()) chars = PromptSanitizer.sanitize(StylePhraseStripper.stripKnownStylePhrases(chars));

        String guide = PromptSanitizer.sanitize(in.styleGuidePositive());
        String prefix = PromptSanitizer.sanitize(in.stylePrefix());
        String styleMarker = prefix.isEmpty() && !styleLabel.isEmpty() ? styleDescriptor : "";
        String styledSubject = styledSubject(prefix, base);

        List<String> styleParts = new ArrayList<>();
        List<String> rawParts = new ArrayList<>(splitParts(in.stylePositive()));
        rawParts.addAll(splitParts(guide));
        for (String p : uniq(rawParts)) {
            if (!prefix.isEmpty() && !styleDescriptor.isEmpty() && containsLoosePhrase(p, styleDescriptor)) continue;
            styleParts.add(p);
        }

        String head = core(styleMarker, styledSubject, styleParts);
        if (!styleDescriptor.isEmpty()) {
            head = dedupeAllButFirst(head, styleDescriptor)
                    .replaceAll(",\\s*,+", ", ")
                    .replaceAll("\\s+,", ",")
                    .replaceAll(",\\s+", ", ")
                    .replaceAll("\\s+", " ")
                    .trim();
        }

        String full = chars.isEmpty() ? head : head + "\n\n" + chars;
        String partsStyle = joinComma(uniq(withMarker(styleMarker, styleParts)));
        String partsBase = styledSubject;
        String partsChars = chars;
        boolean truncated = false;

        if (full.length() > limit) {
            truncated = true;
            List<String> workingParts = new ArrayList<>(styleParts);
            String workingBase = styledSubject;
            String workingChars = chars;

            String out = withChars(core(styleMarker, workingBase, workingParts), workingChars);
            while (out.length() > limit && !workingParts.isEmpty()) {
                workingParts.remove(workingParts.size() - 1);
                out = withChars(core(styleMarker, workingBase, workingParts), workingChars);
            }

            if (out.length() > limit) {
                String styleOnly = joinComma(uniq(withMarker(styleMarker, workingParts)));
                int budgetForBase = Math.max(0, limit - styleOnly.length() - 2);
                workingBase = PromptSanitizer.truncateAtWordBoundary(workingBase, budgetForBase);
                out = withChars(core(styleMarker, workingBase, workingParts), workingChars);
            }

            if (out.length() > limit && !workingChars.isEmpty()) {
                int coreLen = core(styleMarker, workingBase, workingParts).length();
                int remaining = Math.max(0, limit - coreLen - 2);
                workingChars = PromptSanitizer.truncateAtWordBoundary(workingChars, remaining);
                out = withChars(core(styleMarker, workingBase, workingParts), workingChars);
            }

            full = out.length() > limit ? PromptSanitizer.truncateAtWordBoundary(out, limit) : out;
            partsStyle = joinComma(uniq(withMarker(styleMarker, workingParts)));
            partsBase = workingBase;
            partsChars = workingChars;
        }

        return new AssembledPrompt(
                full,
                truncated,
                missingSubjects(full, in.requiredSubjects()),
                new AssembledPrompt.Parts(partsBase, partsChars, partsStyle, guide)
        );
    }

    /** Required names whose lower-case form is not a substring of the prompt. */
    public static List<String> missingSubjects(String prompt, List<String> requiredSubjects) {
        List<String> missing = new ArrayList<>();
        if (requiredSubjects == null || requiredSubjects.isEmpty()) return missing;
        String lower = prompt == null ? "" : prompt.toLowerCase(Locale.ROOT);
        for (String s : requiredSubjects) {
            if (s == null || s.isBlank()) continue;
            if (!lower.contains(s.trim().toLowerCase(Locale.ROOT))) missing.add(s.trim());
        }
        return missing;
    }

    static String styledSubject(String prefix, String base) {
        String p = PromptSanitizer.sanitize(prefix);
        String b = PromptSanitizer.sanitize(base).replaceAll("^[,\\s]+", "").replaceAll("[,\\s]+$", "").trim();
        if (p.isEmpty()) return b;
        if (b.isEmpty()) return p;
        if (ENDS_WITH_OF.matcher(p).matches()) return (p + " " + b).trim();
        return joinComma(List.of(p, b));
    }

    private static String core(String marker, String subject, List<String> styleParts) {
        List<String> parts = new ArrayList<>();
        if (!marker.isEmpty()) parts.add(marker);
        parts.add(subject);
        parts.addAll(styleParts);
        return joinComma(uniq(parts));
    }

    private static String withChars(String core, String chars) {
        return chars.isEmpty() ? core : core + "\n\n" + chars;
    }

    private static List<String> withMarker(String marker, List<String> parts) {
        List<String> out = new ArrayList<>();
        if (!marker.isEmpty()) out.add(marker);
        out.addAll(parts);
        return out;
    }

    private static List<String> splitParts(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;
        for (String p : PART_SPLIT.split(text)) {
            String t = p.replaceAll("\\s+", " ").trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    /** Drops later parts equal after lower-casing and treating hyphens/underscores as spaces. */
    private static List<String> uniq(List<String> parts) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> out = new ArrayList<>();
        for (String raw : parts) {
            if (raw == null) continue;
            String p = raw.replaceAll("\\s+", " ").trim();
            if (p.isEmpty()) continue;
            String key = p.toLowerCase(Locale.ROOT).replaceAll("[-_]+", " ").replaceAll("\\s+", " ").trim();
            if (seen.add(key)) out.add(p);
        }
        return out;
    }

    private static String joinComma(List<String> parts) {
        StringBuilder sb = new StringBuilder();
        for (String p : parts) {
            if (p == null) continue;
            String t = p.replaceAll("\\s+", " ").trim();
            if (t.isEmpty()) continue;
            if (sb.length() > 0) sb.append(", ");
            sb.append(t);
        }
        return sb.toString();
    }

    private static Pattern loosePhrase(String phrase) {
        List<String> tokens = new ArrayList<>();
        for (String t : phrase.trim().split("\\s+")) {
            if (!t.isEmpty()) tokens.add(Pattern.quote(t));
        }
        return Pattern.compile("\\b" + String.join("(?:\\s+|[-_]+)", tokens) + "\\b", Pattern.CASE_INSENSITIVE);
    }

    private static boolean containsLoosePhrase(String text, String phrase) {
        if (text == null || text.isEmpty() || phrase == null || phrase.isBlank()) return false;
        return loosePhrase(phrase).matcher(text).find();
    }

    private static String dedupeAllButFirst(String text, String phrase) {
        if (phrase == null || phrase.isBlank()) return text;
        Matcher m = loosePhrase(phrase).matcher(text);
        StringBuilder out = new StringBuilder();
        int last = 0;
        boolean seen = false;
        while (m.find()) {
            if (!seen) {
                seen = true;
                continue;
            }
            out.append(text, last, m.start());
            last = m.end();
        }
        if (!seen) return text;
        out.append(text.substring(last));
        return out.toString();
    }
}
