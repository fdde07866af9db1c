package com.storyscene.backend.generation.style;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StyleValidatorTest {

    @Test
    void cinematic_marker_missing_from_prompt_is_detected() {
        StyleGuidance g = StyleGuidanceBuilder.build("cinematic", 70, true, List.of());

        assertThat(StyleValidator.promptCarriesStyleMarker("A castle at dawn, soft light", g)).isFalse();
        assertThat(StyleValidator.promptCarriesStyleMarker("cinematic film still of a castle at dawn", g)).isTrue();
        assertThat(StyleValidator.promptCarriesStyleMarker("a Cinematic view of a castle", g)).isTrue();
    }

    @Test
    void none_style_never_needs_a_marker() {
        assertThat(StyleValidator.promptCarriesStyleMarker("anything", StyleGuidance.none())).isTrue();
        assertThat(StyleValidator.validateGuidance("none", true, StyleGuidance.none(), List.of()).ok()).isTrue();
    }

    @Test
    void disabling_a_must_include_element_is_an_issue() {
        StyleGuidance g = StyleGuidanceBuilder.build("anime", 70, true, List.of("cel shading"));

        StyleValidator.Result r = StyleValidator.validateGuidance("anime", true, g, List.of("cel shading"));

        assertThat(r.ok()).isFalse();
        assertThat(r.issues()).contains("style_must_include_disabled:cel shading");
    }

    @Test
    void full_anime_guidance_validates() {
        StyleGuidance g = StyleGuidanceBuilder.build("anime", 70, true, List.of());

        assertThat(StyleValidator.validateGuidance("anime", true, g, List.of()).issues()).isEmpty();
    }
}
