package com.storyscene.backend.generation.appearance;

import com.storyscene.backend.generation.entity.CharacterEntity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class ActiveCharacterDetector {

    private ActiveCharacterDetector() {}

    private static final Pattern NAME_SPLIT = Pattern.compile("\\s+");

    /**
     * A character is active when an explicit name matches it (either string containing
     * the other, case-insensitive), or when the scene text mentions its full name or any
     * name part longer than two characters.
     */
    public static List<CharacterEntity> detect(
            List<CharacterEntity> storyCharacters,
            Collection<String> explicitNames,
            String sceneText
    ) {
        List<CharacterEntity> active = new ArrayList<>();
        if (storyCharacters == null) return active;

        List<String> explicit = new ArrayList<>();
        if (explicitNames != null) {
            for (String n : explicitNames) {
                if (n != null && !n.isBlank()) explicit.add(n.trim().toLowerCase(Locale.ROOT));
            }
        }
        String text = sceneText == null ? "" : sceneText.toLowerCase(Locale.ROOT);

        for (CharacterEntity c : storyCharacters) {
            if (c == null || c.getName() == null || c.getName().isBlank()) continue;
            String name = c.getName().trim().toLowerCase(Locale.ROOT);

            boolean explicitMatch = explicit.stream().anyMatch(e -> e.contains(name) || name.contains(e));
            if (explicitMatch || mentions(text, name)) active.add(c);
        }
        return active;
    }

    private static boolean mentions(String text, String name) {
        if (text.isEmpty()) return false;
        if (text.contains(name)) return true;
        for (String part : NAME_SPLIT.split(name)) {
            if (part.length() > 2 && text.contains(part)) return true;
        }
        return false;
    }
}
