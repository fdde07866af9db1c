package com.storyscene.backend.generation.service;

import com.storyscene.backend.generation.appearance.CharacterProfile;
import com.storyscene.backend.generation.appearance.SceneAppearance;
import com.storyscene.backend.generation.entity.SceneEntity;
import com.storyscene.backend.generation.entity.StoryEntity;
import com.storyscene.backend.generation.entity.StyleGuideEntity;

import java.util.List;
import java.util.Map;

/**
 * Stored data one generation reads: the scene, its story, the characters active in it and
 * the appearance history before it.
 *
 * @param activeNames canonical names of the characters appearing in the scene
 * @param profilesByName keyed by canonical name
 * @param history snapshots of earlier scenes, ascending by scene number
 * @param previousSceneId the scene right before this one, null for the first
 * @param styleGuide newest style guide of the story, may be null
 */
public record SceneContext(
        StoryEntity story,
        SceneEntity scene,
        List<String> activeNames,
        Map<String, CharacterProfile> profilesByName,
        SceneAppearance current,
        List<SceneAppearance> history,
        String previousSceneId,
        StyleGuideEntity styleGuide
) {
    public SceneContext {
        activeNames = List.copyOf(activeNames);
        profilesByName = Map.copyOf(profilesByName);
        history = List.copyOf(history);
    }
}
