package com.storyscene.backend.generation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.storyscene.backend.generation.appearance.ActiveCharacterDetector;
import com.storyscene.backend.generation.appearance.AppearanceSnapshot;
import com.storyscene.backend.generation.appearance.CharacterProfile;
import com.storyscene.backend.generation.appearance.OutfitTimeline;
import com.storyscene.backend.generation.appearance.SceneAppearance;
import com.storyscene.backend.generation.entity.CharacterEntity;
import com.storyscene.backend.generation.entity.CharacterReferenceSheetEntity;
import com.storyscene.backend.generation.entity.SceneCharacterStateEntity;
import com.storyscene.backend.generation.entity.SceneEntity;
import com.storyscene.backend.generation.entity.StoryEntity;
import com.storyscene.backend.generation.prompt.PromptSanitizer;
import com.storyscene.backend.generation.repo.CharacterReferenceSheetRepository;
import com.storyscene.backend.generation.repo.CharacterRepository;
import com.storyscene.backend.generation.repo.SceneCharacterStateRepository;
import com.storyscene.backend.generation.repo.SceneRepository;
import com.storyscene.backend.generation.repo.StoryRepository;
import com.storyscene.backend.generation.repo.StyleGuideRepository;
import com.storyscene.backend.generation.web.ForbiddenException;
import com.storyscene.backend.generation.web.NotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

@Service
@RequiredArgsConstructor
public class SceneContextLoader {

    private final SceneRepository scenes;
    private final StoryRepository stories;
    private final CharacterRepository characters;
    private final CharacterReferenceSheetRepository sheets;
    private final SceneCharacterStateRepository characterStates;
    private final StyleGuideRepository styleGuides;

    /**
     * @throws NotFoundException {@code SCENE_NOT_FOUND} / {@code STORY_NOT_FOUND}
     * @throws ForbiddenException {@code NOT_ALLOWED} when the caller does not own the story
     */
    @Transactional(readOnly = true)
    public SceneContext load(Long userId, String sceneId, String expectedStoryId) {
        SceneEntity scene = scenes.findById(sceneId).orElseThrow(() -> new NotFoundException("SCENE_NOT_FOUND"));
        if (expectedStoryId != null && !expectedStoryId.equals(scene.getStoryId())) {
            throw new IllegalArgumentException("STORY_ID_INVALID");
        }
        StoryEntity story = requireOwnedStory(userId, scene.getStoryId());

        List<CharacterEntity> storyCharacters = characters.findByStoryIdOrderByNameAsc(story.getId());
        List<CharacterEntity> active = ActiveCharacterDetector.detect(storyCharacters, explicitNames(scene.getCharacters()), sceneText(scene));

        Map<String, CharacterProfile> profiles = profiles(active);
        Map<String, String> nameById = new HashMap<>();
        for (CharacterEntity c : storyCharacters) nameById.put(c.getId(), c.getName());

        List<SceneEntity> before = scenes.findByStoryIdAndSceneNumberLessThanOrderBySceneNumberAsc(story.getId(), scene.getSceneNumber());
        List<String> ids = new ArrayList<>();
        for (SceneEntity s : before) ids.add(s.getId());
        ids.add(scene.getId());

        Map<String, List<SceneCharacterStateEntity>> rowsByScene = new HashMap<>();
        for (SceneCharacterStateEntity row : characterStates.findBySceneIdIn(ids)) {
            rowsByScene.computeIfAbsent(row.getSceneId(), k -> new ArrayList<>()).add(row);
        }

        List<SceneAppearance> history = new ArrayList<>();
        for (SceneEntity s : before) history.add(appearanceOf(s, rowsByScene.get(s.getId()), nameById));

        return new SceneContext(
                story,
                scene,
                active.stream().map(CharacterEntity::getName).toList(),
                profiles,
                appearanceOf(scene, rowsByScene.get(scene.getId()), nameById),
                history,
                before.isEmpty() ? null : before.get(before.size() - 1).getId(),
                styleGuides.findFirstByStoryIdOrderByCreatedAtUtcDesc(story.getId()).orElse(null)
        );
    }

    @Transactional(readOnly = true)
    public StoryEntity requireOwnedStory(Long userId, String storyId) {
        StoryEntity story = stories.findById(storyId).orElseThrow(() -> new NotFoundException("STORY_NOT_FOUND"));
        if (!Objects.equals(story.getUserId(), userId)) throw new ForbiddenException("NOT_ALLOWED");
        return story;
    }

    /** Per-character rows first, the scene's by-name JSON over them. */
    static SceneAppearance appearanceOf(SceneEntity scene, List<SceneCharacterStateEntity> rows, Map<String, String> nameById) {
        Map<String, AppearanceSnapshot> byName = new LinkedHashMap<>();
        if (rows != null) {
            for (SceneCharacterStateEntity r : rows) {
                String name = nameById.get(r.getCharacterId());
                if (name == null) continue;
                AppearanceSnapshot s = AppearanceSnapshot.fromJson(r.getExtra())
                        .overlay(AppearanceSnapshot.of(r.getClothing(), r.getState(), r.getPhysicalAttributes(), r.getAccessories()));
                byName.put(name.trim().toLowerCase(Locale.ROOT), s);
            }
        }

        JsonNode states = scene.getCharacterStates();
        if (states != null && states.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = states.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                String key = e.getKey().trim().toLowerCase(Locale.ROOT);
                AppearanceSnapshot fromJson = AppearanceSnapshot.fromJson(e.getValue());
                AppearanceSnapshot base = byName.getOrDefault(key, AppearanceSnapshot.EMPTY);
                byName.put(key, base.overlay(fromJson));
            }
        }
        return new SceneAppearance(scene.getSceneNumber(), byName);
    }

    private Map<String, CharacterProfile> profiles(List<CharacterEntity> active) {
        Map<String, CharacterProfile> out = new LinkedHashMap<>();
        if (active.isEmpty()) return out;

        List<String> ids = active.stream().map(CharacterEntity::getId).toList();
        List<String> activeSheetIds = active.stream()
                .map(CharacterEntity::getActiveReferenceSheetId)
                .filter(Objects::nonNull)
                .toList();

        Map<String, CharacterReferenceSheetEntity> sheetByCharacter = new HashMap<>();
        // newest approved first, then the explicitly active sheet overrides
        for (CharacterReferenceSheetEntity s : sheets.findByCharacterIdInAndApprovedTrueOrderByCreatedAtUtcDesc(ids)) {
            sheetByCharacter.putIfAbsent(s.getCharacterId(), s);
        }
        if (!activeSheetIds.isEmpty()) {
            for (CharacterReferenceSheetEntity s : sheets.findAllById(activeSheetIds)) {
                sheetByCharacter.put(s.getCharacterId(), s);
            }
        }

        for (CharacterEntity c : active) {
            CharacterReferenceSheetEntity sheet = sheetByCharacter.get(c.getId());
            out.put(c.getName(), new CharacterProfile(
                    c.getId(),
                    c.getName(),
                    c.getDefaultClothing(),
                    c.getPhysicalAttributes(),
                    sheet == null ? null : PromptSanitizer.sanitize(sheet.getPromptSnippet(), 400),
                    sheet != null && !PromptSanitizer.isBlank(sheet.getReferenceImageUrl()) ? sheet.getReferenceImageUrl() : c.getImageUrl(),
                    sheet == null ? OutfitTimeline.NONE : OutfitTimeline.fromJson(sheet.getOutfitVariations())
            ));
        }
        return out;
    }

    private static List<String> explicitNames(JsonNode characters) {
        List<String> out = new ArrayList<>();
        if (characters == null || !characters.isArray()) return out;
        for (JsonNode n : characters) {
            String name = n.isTextual() ? n.asText() : n.path("name").asText(null);
            if (!PromptSanitizer.isBlank(name)) out.add(name.trim());
        }
        return out;
    }

    private static String sceneText(SceneEntity s) {
        return String.join(" ",
                nz(s.getTitle()), nz(s.getSummary()), nz(s.getOriginalText()), nz(s.getImagePrompt()));
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
