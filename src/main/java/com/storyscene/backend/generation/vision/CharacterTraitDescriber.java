package com.storyscene.backend.generation.vision;

import com.github.benmanes.caffeine.cache.Cache;
import com.storyscene.backend.generation.appearance.CharacterProfile;
import com.storyscene.backend.generation.engine.TimeBudget;
import com.storyscene.backend.generation.config.GenerationProperties;
import com.storyscene.backend.generation.prompt.PromptSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Short visual trait lines for characters with a reference image, appended to their prompt line.
 * Cached per image URL; any failure just leaves the character without traits.
 */
@Slf4j
@Service
public class CharacterTraitDescriber {

    static final int MAX_TRAIT_LENGTH = 200;

    static final String PROMPT = "Describe this character's stable visual traits for an illustrator: hair, eyes, "
            + "skin tone, build, age range, distinctive marks. One short comma-separated line. "
            + "Do not describe clothing, pose or background.";

    private final ObjectProvider<VisionClient> vision;
    private final Cache<String, String> cache;
    private final GenerationProperties props;

    public CharacterTraitDescriber(ObjectProvider<VisionClient> vision,
                                   @Qualifier("visionDescriptionCache") Cache<String, String> cache,
                                   GenerationProperties props) {
        this.vision = vision;
        this.cache = cache;
        this.props = props;
    }

    /** name -> trait line, only for characters that got one. */
    public Map<String, String> describe(String requestId, Collection<CharacterProfile> profiles, TimeBudget budget) {
        Map<String, String> out = new LinkedHashMap<>();
        VisionClient client = vision.getIfAvailable();
        if (profiles == null) return out;

        for (CharacterProfile p : profiles) {
            String url = p.referenceImageUrl();
            if (PromptSanitizer.isBlank(url)) continue;

            String cached = cache.getIfPresent(url);
            if (cached != null) {
                out.put(p.name(), cached);
                continue;
            }
            if (client == null || !budget.hasAtLeast(props.getRetryMinRemaining())) continue;

            try {
                String text = PromptSanitizer.sanitize(
                        client.complete(requestId, PROMPT, List.of(url), props.getVisionTimeout()), MAX_TRAIT_LENGTH);
                if (!text.isEmpty()) {
                    cache.put(url, text);
                    out.put(p.name(), text);
                }
            } catch (RuntimeException e) {
                log.warn("character_traits_failed requestId={} character={} err={}", requestId, p.name(), e.toString());
            }
        }
        return out;
    }
}
