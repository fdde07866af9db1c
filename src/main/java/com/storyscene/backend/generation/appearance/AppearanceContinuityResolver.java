package com.storyscene.backend.generation.appearance;

import com.storyscene.backend.generation.appearance.ResolvedAppearance.ClothingSource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes each character's effective appearance for a scene by walking the
 * predecessor scenes in ascending order.
 *
 * <ul>
 *   <li>clothing: current scene, then outfit timeline, then last value seen in history, then default</li>
 *   <li>state: current scene, then history; no default</li>
 *   <li>physical attributes: current scene, then history, then default</li>
 *   <li>accessories: current scene only, never carried forward</li>
 * </ul>
 */
@Component
public class AppearanceContinuityResolver {

    public AppearanceResolution resolve(
            List<String> characterNames,
            SceneAppearance current,
            List<SceneAppearance> historyAscending,
            Map<String, CharacterProfile> profilesByName
    ) {
        Map<String, ResolvedAppearance> effective = new LinkedHashMap<>();
        List<String> missingClothing = new ArrayList<>();

        if (characterNames == null || characterNames.isEmpty()) {
            return new AppearanceResolution(effective, missingClothing);
        }

        SceneAppearance cur = current == null ? SceneAppearance.empty(0) : current;
        List<SceneAppearance> history = sortedHistory(historyAscending, cur.sceneNumber());

        for (String name : characterNames) {
            if (name == null || name.isBlank() || effective.containsKey(name)) continue;

            CharacterProfile profile = profilesByName == null ? null : profilesByName.get(name);
            ResolvedAppearance r = resolveOne(name, cur, history, profile);
            effective.put(name, r);
            if (r.snapshot().clothing() == null) missingClothing.add(name);
        }

        return new AppearanceResolution(effective, missingClothing);
    }

    /**
     * Reports characters whose effective clothing changed since the previous scene
     * without the current scene saying so.
     */
    public List<ContinuityIssue> continuityIssues(
            AppearanceResolution resolution,
            List<SceneAppearance> historyAscending,
            Map<String, CharacterProfile> profilesByName
    ) {
        List<ContinuityIssue> issues = new ArrayList<>();
        if (resolution == null || historyAscending == null || historyAscending.isEmpty()) return issues;

        List<SceneAppearance> history = sortedHistory(historyAscending, Integer.MAX_VALUE);
        if (history.isEmpty()) return issues;

        SceneAppearance previous = history.get(history.size() - 1);
        List<SceneAppearance> beforePrevious = history.subList(0, history.size() - 1);

        resolution.effectiveByName().forEach((name, now) -> {
            if (now.clothingStatedInScene()) return;

            CharacterProfile profile = profilesByName == null ? null : profilesByName.get(name);
            ResolvedAppearance before = resolveOne(name, previous, beforePrevious, profile);

            String prevClothing = before.snapshot().clothing();
            String currClothing = now.snapshot().clothing();
            if (prevClothing != null && currClothing != null && !prevClothing.equals(currClothing)) {
                issues.add(ContinuityIssue.outfitChange(name, prevClothing, currClothing));
            }
        });
        return issues;
    }

    private ResolvedAppearance resolveOne(
            String name,
            SceneAppearance current,
            List<SceneAppearance> history,
            CharacterProfile profile
    ) {
        String carriedClothing = null;
        String carriedState = null;
        String carriedPhysical = null;

        for (SceneAppearance scene : history) {
            AppearanceSnapshot s = scene.snapshotOf(name);
            if (s.clothing() != null) carriedClothing = s.clothing();
            if (s.state() != null) carriedState = s.state();
            if (s.physicalAttributes() != null) carriedPhysical = s.physicalAttributes();
        }

        AppearanceSnapshot own = current.snapshotOf(name);
        String timelineClothing = profile == null ? null : profile.timeline().clothingFor(current.sceneNumber());
        String defaultClothing = profile == null ? null : profile.defaultClothing();
        String defaultPhysical = profile == null ? null : profile.defaultPhysicalAttributes();

        String clothing;
        ClothingSource source;
        if (own.clothing() != null) {
            clothing = own.clothing();
            source = ClothingSource.SCENE;
        } else if (notBlank(timelineClothing)) {
            clothing = timelineClothing;
            source = ClothingSource.TIMELINE;
        } else if (carriedClothing != null) {
            clothing = carriedClothing;
            source = ClothingSource.HISTORY;
        } else if (notBlank(defaultClothing)) {
            clothing = defaultClothing;
            source = ClothingSource.DEFAULT;
        } else {
            clothing = null;
            source = ClothingSource.NONE;
        }

        AppearanceSnapshot resolved = new AppearanceSnapshot(
                clothing,
                own.state() != null ? own.state() : carriedState,
                own.physicalAttributes() != null ? own.physicalAttributes()
                        : carriedPhysical != null ? carriedPhysical : defaultPhysical,
                own.accessories(),
                own.extra()
        );
        return new ResolvedAppearance(name, resolved, source);
    }

    private static List<SceneAppearance> sortedHistory(List<SceneAppearance> history, int beforeSceneNumber) {
        if (history == null) return List.of();
        return history.stream()
                .filter(Objects::nonNull)
                .filter(s -> s.sceneNumber() < beforeSceneNumber)
                .sorted((a, b) -> Integer.compare(a.sceneNumber(), b.sceneNumber()))
                .toList();
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
