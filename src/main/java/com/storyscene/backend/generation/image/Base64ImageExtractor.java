package com.storyscene.backend.generation.image;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Base64;
import java.util.Locale;

/**
 * Finds the first base64 image in a provider response:
 * {@code images[0]}, {@code data[0]} (string or {b64_json|b64|base64|image}), top-level
 * {@code image|b64_json|base64}, or Gemini {@code candidates[].content.parts[].inlineData.data}.
 * A {@code data:image/...;base64,} prefix is stripped.
 */
public final class Base64ImageExtractor {

    private Base64ImageExtractor() {}

    private static final String[] ITEM_FIELDS = {"b64_json", "b64", "base64", "image"};
    private static final String[] TOP_FIELDS = {"image", "b64_json", "base64"};

    public static String extract(JsonNode body) {
        if (body == null || !body.isObject()) return null;

        String v = fromItem(first(body.get("images")));
        if (v == null) v = fromItem(first(body.get("data")));
        if (v == null) {
            for (String f : TOP_FIELDS) {
                v = textOrNull(body.get(f));
                if (v != null) break;
            }
        }
        if (v == null) v = fromGemini(body);
        return v == null ? null : stripDataUrl(v);
    }

    /** Decoded bytes, or null when nothing usable is present. */
    public static byte[] extractBytes(JsonNode body) {
        String b64 = extract(body);
        if (b64 == null) return null;
        try {
            return Base64.getMimeDecoder().decode(b64);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    static String stripDataUrl(String v) {
        String s = v.trim();
        if (s.regionMatches(true, 0, "data:", 0, 5)) {
            int comma = s.indexOf(',');
            if (comma > 0 && s.substring(0, comma).toLowerCase(Locale.ROOT).contains(";base64")) {
                return s.substring(comma + 1).trim();
            }
        }
        return s;
    }

    private static String fromGemini(JsonNode body) {
        JsonNode candidates = body.get("candidates");
        if (candidates == null || !candidates.isArray()) return null;
        for (JsonNode c : candidates) {
            JsonNode parts = c.path("content").path("parts");
            if (!parts.isArray()) continue;
            for (JsonNode p : parts) {
                JsonNode inline = p.has("inlineData") ? p.get("inlineData") : p.get("inline_data");
                String data = inline == null ? null : textOrNull(inline.get("data"));
                if (data != null) return data;
            }
        }
        return null;
    }

    private static JsonNode first(JsonNode arr) {
        if (arr == null || !arr.isArray() || arr.isEmpty()) return null;
        return arr.get(0);
    }

    private static String fromItem(JsonNode item) {
        if (item == null) return null;
        if (item.isTextual()) return textOrNull(item);
        if (item.isObject()) {
            for (String f : ITEM_FIELDS) {
                String v = textOrNull(item.get(f));
                if (v != null) return v;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode n) {
        if (n == null || !n.isTextual()) return null;
        String s = n.asText();
        return s.isBlank() ? null : s;
    }
}
