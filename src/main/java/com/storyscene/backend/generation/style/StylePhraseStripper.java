package com.storyscene.backend.generation.style;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes phrases that name a catalog style ("in the style of watercolor", "anime style",
 * "oil painting of ...") and a category's conflicting terms from free text, so scene text
 * cannot fight the selected style.
 */
public final class StylePhraseStripper {

    private StylePhraseStripper() {}

    public record Stripped(String text, List<String> removed) {}

    private static final String WORD_SEP = "(?:\\s+|[-_]+)";
    private static final String LEAD = "(^|[\\s,;:(\\[])";

    private record Rule(Pattern pattern, String label, boolean leading) {}

    private record Entry(String styleId, List<Rule> rules) {}

    private static final List<Entry> ENTRIES = buildEntries();

    private static final Map<StyleCategory, List<Pattern>> CONFLICT_PATTERNS = buildConflictPatterns();

    public static Stripped stripKnownStylePhrases(String text, String keepStyleId) {
        String prompt = text == null ? "" : text;
        List<String> removed = new ArrayList<>();

        String keep = keepStyleId == null ? "" : keepStyleId.trim().toLowerCase(Locale.ROOT);
        if (!keep.isEmpty()) keep = StyleCatalog.aliases().getOrDefault(keep, keep);

        for (Entry entry : ENTRIES) {
            if (!keep.isEmpty() && entry.styleId().equals(keep)) continue;

            for (Rule rule : entry.rules()) {
                Matcher m = rule.pattern().matcher(prompt);
                if (!m.find()) continue;

                if (rule.leading()) {
                    prompt = m.replaceFirst("");
                    removed.add(rule.label());
                } else {
                    prompt = m.replaceAll(r -> {
                        removed.add(rule.label());
                        String lead = r.group(1);
                        return Matcher.quoteReplacement(lead == null || lead.isEmpty() ? " " : lead);
                    });
                }
            }
        }

        return new Stripped(tidy(prompt), removed);
    }

    public static String stripKnownStylePhrases(String text) {
        return stripKnownStylePhrases(text, null).text();
    }

    /** Removes the category's conflicting terms as whole words. */
    public static String removeConflictingTerms(String text, String styleId) {
        if (text == null || text.isEmpty() || styleId == null || StyleCatalog.NONE.equals(styleId.trim())) {
            return text == null ? "" : text;
        }
        StyleCategory category = StyleCatalog.categoryOf(styleId);
        if (category == null) return text;

        String out = text;
        for (Pattern p : CONFLICT_PATTERNS.get(category)) {
            out = p.matcher(out).replaceAll("");
        }
        out = out.replaceAll("\\s+", " ").replaceAll("\\s*,\\s*", ", ");
        out = out.replaceAll("^,", "").replaceAll(",$", "");
        return out.trim();
    }

    private static String tidy(String raw) {
        return raw
                .replaceAll("\\s+", " ")
                .replaceAll("\\s+,", ",")
                .replaceAll("\\s+;", ";")
                .replaceAll("\\s+:", ":")
                .replaceAll("\\(\\s+", "(")
                .replaceAll("\\s+\\)", ")")
                .replaceAll(",\\s*,+", ", ")
                .trim();
    }

    private static List<Entry> buildEntries() {
        Map<String, Set<String>> variants = new LinkedHashMap<>();
        Map<String, Set<String>> prefixes = new LinkedHashMap<>();

        for (StyleDefinition def : StyleCatalog.definitions().values()) {
            if (def.isNone()) continue;
            addVariant(variants, def.id(), def.id());
            addVariant(variants, def.id(), def.name());
            String p = def.prefix().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
            if (!p.isEmpty()) prefixes.computeIfAbsent(def.id(), k -> new LinkedHashSet<>()).add(p);
        }
        StyleCatalog.aliases().forEach((alias, canonical) -> addVariant(variants, canonical, alias));

        Comparator<String> longestFirst = Comparator.comparingInt(String::length).reversed();
        List<Entry> out = new ArrayList<>();
        for (String styleId : variants.keySet()) {
            List<Rule> rules = new ArrayList<>();

            List<String> ps = new ArrayList<>(prefixes.getOrDefault(styleId, Set.of()));
            ps.sort(longestFirst);
            for (String p : ps) {
                rules.add(new Rule(ci("^\\s*" + loose(p) + "(?:\\b|\\s|,|:|;|\\.)\\s*"), p, true));
            }

            List<String> vs = new ArrayList<>(variants.get(styleId));
            vs.sort(longestFirst);
            for (String v : vs) {
                String lv = loose(v);
                rules.add(new Rule(ci(LEAD + "(?:in\\s+(?:the\\s+)?)?style" + WORD_SEP + "of" + WORD_SEP + "(?:an?\\s+)?" + lv + "\\b"), v, false));
                rules.add(new Rule(ci(LEAD + "(?:in\\s+)?(?:an?\\s+)?" + lv + WORD_SEP + "style\\b"), v, false));
                rules.add(new Rule(ci(LEAD + "style\\s*:\\s*(?:an?\\s+)?" + lv + "\\b"), v, false));
                rules.add(new Rule(ci(LEAD + "(?:inspired" + WORD_SEP + "by|influenced?" + WORD_SEP + "by)" + WORD_SEP + "(?:an?\\s+)?" + lv + "\\b"), v, false));
            }
            out.add(new Entry(styleId, rules));
        }
        out.sort(Comparator.comparingInt((Entry e) -> e.styleId().length()).reversed());
        return List.copyOf(out);
    }

    private static Map<StyleCategory, List<Pattern>> buildConflictPatterns() {
        Map<StyleCategory, List<Pattern>> out = new LinkedHashMap<>();
        for (StyleCategory c : StyleCategory.values()) {
            List<Pattern> ps = new ArrayList<>();
            for (String term : c.conflictingTerms()) {
                ps.add(ci("\\b" + Pattern.quote(term) + "\\b"));
            }
            out.put(c, List.copyOf(ps));
        }
        return out;
    }

    private static void addVariant(Map<String, Set<String>> variants, String styleId, String raw) {
        String v = raw == null ? "" : raw.toLowerCase(Locale.ROOT).replaceAll("[_\\s-]+", " ").trim();
        if (v.isEmpty()) return;
        Set<String> set = variants.computeIfAbsent(styleId, k -> new LinkedHashSet<>());
        set.add(v);
        if (v.endsWith(" style")) set.add(v.substring(0, v.length() - " style".length()).trim());
    }

    private static String loose(String phrase) {
        String normalized = phrase.toLowerCase(Locale.ROOT).replaceAll("[-_]+", " ").replaceAll("\\s+", " ").trim();
        List<String> words = new ArrayList<>();
        for (String w : normalized.split(" ")) {
            if (!w.isEmpty()) words.add(Pattern.quote(w));
        }
        return String.join(WORD_SEP, words);
    }

    private static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
