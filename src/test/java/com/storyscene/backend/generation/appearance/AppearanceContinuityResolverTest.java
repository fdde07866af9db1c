package com.storyscene.backend.generation.appearance;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AppearanceContinuityResolverTest {

    private final AppearanceContinuityResolver resolver = new AppearanceContinuityResolver();

    private static SceneAppearance scene(int n, String name, AppearanceSnapshot s) {
        return new SceneAppearance(n, Map.of(name, s));
    }

    @Test
    void clothing_from_scene_one_carries_to_scene_n() {
        List<SceneAppearance> history = List.of(
                scene(1, "Mira", AppearanceSnapshot.of("red cloak", null, null, null)),
                SceneAppearance.empty(2),
                SceneAppearance.empty(3)
        );

        AppearanceResolution r = resolver.resolve(List.of("Mira"), SceneAppearance.empty(4), history, Map.of());

        assertThat(r.snapshotOf("Mira").clothing()).isEqualTo("red cloak");
        assertThat(r.effectiveByName().get("Mira").clothingSource()).isEqualTo(ResolvedAppearance.ClothingSource.HISTORY);
        assertThat(r.missingClothing()).isEmpty();
    }

    @Test
    void accessories_are_never_carried_forward() {
        List<SceneAppearance> history = List.of(
                scene(1, "Mira", AppearanceSnapshot.of("red cloak", null, null, "silver locket"))
        );

        AppearanceResolution r = resolver.resolve(List.of("Mira"), SceneAppearance.empty(2), history, Map.of());

        assertThat(r.snapshotOf("Mira").accessories()).isNull();
        assertThat(r.snapshotOf("Mira").clothing()).isEqualTo("red cloak");
    }

    @Test
    void explicit_scene_value_beats_timeline_history_and_default() throws Exception {
        OutfitTimeline timeline = OutfitTimeline.fromJson(new ObjectMapper().readTree(
                "[{\"scene_range\":{\"start\":1,\"end\":5},\"description\":\"travel coat\"}]"));
        CharacterProfile p = new CharacterProfile("c1", "Mira", "plain dress", null, null, null, timeline);

        AppearanceResolution explicit = resolver.resolve(List.of("Mira"),
                scene(3, "mira", AppearanceSnapshot.of("ball gown", null, null, null)),
                List.of(scene(1, "Mira", AppearanceSnapshot.of("red cloak", null, null, null))),
                Map.of("Mira", p));
        assertThat(explicit.snapshotOf("Mira").clothing()).isEqualTo("ball gown");

        AppearanceResolution fromTimeline = resolver.resolve(List.of("Mira"), SceneAppearance.empty(3),
                List.of(scene(1, "Mira", AppearanceSnapshot.of("red cloak", null, null, null))),
                Map.of("Mira", p));
        assertThat(fromTimeline.snapshotOf("Mira").clothing()).isEqualTo("travel coat");

        AppearanceResolution fromDefault = resolver.resolve(List.of("Mira"), SceneAppearance.empty(9), List.of(),
                Map.of("Mira", p));
        assertThat(fromDefault.snapshotOf("Mira").clothing()).isEqualTo("plain dress");
    }

    @Test
    void state_and_physical_fall_back_through_history_then_default() {
        CharacterProfile p = CharacterProfile.of("Ash", null, "tall, grey eyes");
        List<SceneAppearance> history = List.of(
                scene(1, "Ash", AppearanceSnapshot.of(null, "wounded arm", null, null))
        );

        AppearanceResolution r = resolver.resolve(List.of("Ash"), SceneAppearance.empty(2), history, Map.of("Ash", p));

        assertThat(r.snapshotOf("Ash").state()).isEqualTo("wounded arm");
        assertThat(r.snapshotOf("Ash").physicalAttributes()).isEqualTo("tall, grey eyes");
        assertThat(r.missingClothing()).containsExactly("Ash");
    }

    @Test
    void unexplained_outfit_change_is_reported() throws Exception {
        OutfitTimeline timeline = OutfitTimeline.fromJson(new ObjectMapper().readTree(
                "[{\"scene_range\":{\"start\":3,\"end\":4},\"clothing\":\"armor\"}]"));
        CharacterProfile p = new CharacterProfile("c1", "Mira", null, null, null, null, timeline);
        List<SceneAppearance> history = List.of(
                scene(1, "Mira", AppearanceSnapshot.of("red cloak", null, null, null)),
                SceneAppearance.empty(2)
        );

        AppearanceResolution r = resolver.resolve(List.of("Mira"), SceneAppearance.empty(3), history, Map.of("Mira", p));
        List<ContinuityIssue> issues = resolver.continuityIssues(r, history, Map.of("Mira", p));

        assertThat(issues).hasSize(1);
        assertThat(issues.get(0).type()).isEqualTo(ContinuityIssue.OUTFIT_CHANGE_UNEXPLAINED);
        assertThat(issues.get(0).previous()).isEqualTo("red cloak");
        assertThat(issues.get(0).current()).isEqualTo("armor");
    }

    @Test
    void stated_change_is_not_an_issue() {
        List<SceneAppearance> history = List.of(scene(1, "Mira", AppearanceSnapshot.of("red cloak", null, null, null)));
        SceneAppearance current = scene(2, "Mira", AppearanceSnapshot.of("ball gown", null, null, null));

        AppearanceResolution r = resolver.resolve(List.of("Mira"), current, history, Map.of());

        assertThat(resolver.continuityIssues(r, history, Map.of())).isEmpty();
    }

    @Test
    void states_hash_ignores_name_case_and_order() {
        SceneAppearance cur = new SceneAppearance(1, Map.of(
                "Mira", AppearanceSnapshot.of("cloak", null, null, null),
                "Ash", AppearanceSnapshot.of("armor", null, null, null)));

        String a = CharacterStatesHasher.hash(resolver.resolve(List.of("Mira", "Ash"), cur, List.of(), Map.of()));
        String b = CharacterStatesHasher.hash(resolver.resolve(List.of("Ash", "Mira"), cur, List.of(), Map.of()));

        assertThat(a).isEqualTo(b).hasSize(64);
    }
}
