package com.storyscene.backend.generation.vision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyscene.backend.generation.prompt.PromptSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Post-hoc check of a generated image by a vision model: character accuracy and style adherence.
 * Optional by nature, so every failure path returns empty instead of throwing.
 */
@Slf4j
@Service
public class VisionValidationService {

    static final double CHARACTER_WEIGHT = 0.65;
    static final double STYLE_WEIGHT = 0.35;
    static final int PASS_SCORE = 85;
    static final int WARN_SCORE = 70;
    static final int STRICT_STYLE_MIN = 75;
    static final int RETRY_FOCUS_THRESHOLD = 70;

    private final ObjectProvider<VisionClient> vision;
    private final ObjectMapper om;

    public VisionValidationService(ObjectProvider<VisionClient> vision, ObjectMapper om) {
        this.vision = vision;
        this.om = om;
    }

    public boolean available() {
        return vision.getIfAvailable() != null;
    }

    public Optional<VisionValidation> validate(
            String requestId,
            byte[] image,
            String contentType,
            List<ValidationCharacter> characters,
            String styleName,
            boolean strictStyle,
            Duration timeout
    ) {
        VisionClient client = vision.getIfAvailable();
        if (client == null || image == null || image.length == 0) return Optional.empty();

        List<String> urls = new ArrayList<>();
        if (characters != null) {
            for (ValidationCharacter c : characters) {
                if (urls.size() >= ReferenceImageLoader.MAX_REFERENCES) break;
                if (!PromptSanitizer.isBlank(c.referenceImageUrl())) urls.add(c.referenceImageUrl());
            }
        }
        urls.add("data:" + (contentType == null ? "image/png" : contentType) + ";base64,"
                 + Base64.getEncoder().encodeToString(image));

        String answer;
        try {
            answer = client.complete(requestId, prompt(characters, styleName, urls.size() - 1), urls, timeout);
        } catch (RuntimeException e) {
            log.warn("vision_validation_failed requestId={} err={}", requestId, e.toString());
            return Optional.empty();
        }
        return parse(answer, strictStyle);
    }

    Optional<VisionValidation> parse(String answer, boolean strictStyle) {
        JsonNode json = firstJsonObject(answer);
        if (json == null) {
            log.warn("vision_validation_unparseable length={}", answer == null ? 0 : answer.length());
            return Optional.empty();
        }

        Integer charScore = characterScore(json);
        Integer styleScore = intOrNull(json.path("style_check").path("adherence_score"));

        Integer combined;
        if (charScore != null && styleScore != null) {
            combined = (int) Math.round(CHARACTER_WEIGHT * charScore + STYLE_WEIGHT * styleScore);
        } else if (charScore != null) {
            combined = charScore;
        } else {
            combined = styleScore;
        }

        String status = normalizeStatus(json.path("status").asText(null));
        if (strictStyle && styleScore != null && styleScore < STRICT_STYLE_MIN) {
            status = VisionValidation.FAIL;
        } else if (status == null && combined != null) {
            status = derive(combined);
        }
        if (status == null) return Optional.empty();

        return Optional.of(new VisionValidation(combined, status, charScore, styleScore, json));
    }

    /** Prompt prefix for the one stricter regeneration. */
    public static String retryPrefix(VisionValidation v, String styleName) {
        if (v == null) return "";
        if (v.styleScore() != null && v.styleScore() < RETRY_FOCUS_THRESHOLD && !PromptSanitizer.isBlank(styleName)) {
            return "Use " + styleName + " style strictly. ";
        }
        if (v.characterScore() != null && v.characterScore() < RETRY_FOCUS_THRESHOLD) {
            return "Focus on character accuracy. ";
        }
        return "";
    }

    static String derive(int score) {
        if (score >= PASS_SCORE) return VisionValidation.PASS;
        if (score >= WARN_SCORE) return VisionValidation.WARN;
        return VisionValidation.FAIL;
    }

    private Integer characterScore(JsonNode json) {
        Integer overall = intOrNull(json.path("overall_score"));
        if (overall != null) return overall;

        JsonNode chars = json.path("characters");
        if (!chars.isArray() || chars.isEmpty()) return null;
        int sum = 0;
        int n = 0;
        for (JsonNode c : chars) {
            Integer s = intOrNull(c.path("score"));
            if (s == null) continue;
            sum += s;
            n++;
        }
        return n == 0 ? null : Math.round((float) sum / n);
    }

    private JsonNode firstJsonObject(String text) {
        if (text == null) return null;
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) return null;
        try {
            JsonNode n = om.readTree(text.substring(start, end + 1));
            return n != null && n.isObject() ? n : null;
        } catch (JsonProcessingException e) {
            log.debug("vision_validation_json_invalid err={}", e.getOriginalMessage());
            return null;
        }
    }

    private static Integer intOrNull(JsonNode n) {
        if (n == null || n.isMissingNode() || n.isNull()) return null;
        if (n.isNumber()) return clamp((int) Math.round(n.asDouble()));
        if (n.isTextual()) {
            try {
                return clamp((int) Math.round(Double.parseDouble(n.asText().trim())));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(100, v));
    }

    private static String normalizeStatus(String s) {
        if (s == null) return null;
        String v = s.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "pass", "warn", "fail" -> v;
            default -> null;
        };
    }

    private static String prompt(List<ValidationCharacter> characters, String styleName, int referenceCount) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a strict visual consistency reviewer for illustrated stories. ");
        if (referenceCount > 0) {
            sb.append("The first ").append(referenceCount).append(" image(s) are character references; ");
        }
        sb.append("the last image is the generated scene.\n");
        if (characters != null && !characters.isEmpty()) {
            sb.append("Expected characters:\n");
            for (ValidationCharacter c : characters) {
                sb.append("- ").append(c.name());
                if (!PromptSanitizer.isBlank(c.referenceText())) sb.append(": ").append(c.referenceText());
                if (!PromptSanitizer.isBlank(c.expectedOutfit())) sb.append(". Outfit: ").append(c.expectedOutfit());
                if (!PromptSanitizer.isBlank(c.expectedState())) sb.append(". State: ").append(c.expectedState());
                sb.append('\n');
            }
        }
        if (!PromptSanitizer.isBlank(styleName)) {
            sb.append("Expected art style: ").append(styleName).append('\n');
        }
        sb.append("Answer with JSON only: {\"overall_score\":0-100,\"status\":\"pass|warn|fail\",")
          .append("\"characters\":[{\"name\":\"\",\"score\":0-100,\"issues\":[]}],")
          .append("\"timeline_check\":{\"ok\":true,\"notes\":\"\"},")
          .append("\"gradual_change_check\":{\"ok\":true,\"notes\":\"\"},")
          .append("\"style_check\":{\"adherence_score\":0-100,\"issues\":[]}}");
        return sb.toString();
    }
}
