package com.storyscene.backend.generation.prompt;

import com.storyscene.backend.generation.style.StyleGuidance;
import com.storyscene.backend.generation.style.StyleGuidanceBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptAssemblerTest {

    private static PromptAssembler.Input input(String base, String appendix, StyleGuidance g, int limit, List<String> subjects) {
        return new PromptAssembler.Input(base, appendix, g.prefix(), g.positive(), "", g.styleId(), limit, subjects);
    }

    @Test
    void anime_prompt_opens_with_the_style_prefix() {
        StyleGuidance g = StyleGuidanceBuilder.build("anime", 70, true, List.of());

        AssembledPrompt p = PromptAssembler.assemble(input("A girl on a rooftop at dusk", "", g, 1400, List.of()));

        assertThat(p.fullPrompt()).startsWith("anime style artwork of A girl on a rooftop at dusk");
        assertThat(p.fullPrompt().toLowerCase()).contains("anime");
        assertThat(p.truncated()).isFalse();
    }

    @Test
    void never_exceeds_the_limit_and_flags_truncation() {
        StyleGuidance g = StyleGuidanceBuilder.build("cinematic", 100, true, List.of());
        String longBase = "the old lighthouse keeper climbs the stairs again ".repeat(100);
        String appendix = "Characters:\n- Mira: Outfit: red cloak.";

        AssembledPrompt p = PromptAssembler.assemble(input(longBase, appendix, g, 1400, List.of("Mira")));

        assertThat(p.fullPrompt().length()).isLessThanOrEqualTo(1400);
        assertThat(p.truncated()).isTrue();
    }

    @Test
    void short_prompt_is_not_truncated() {
        StyleGuidance g = StyleGuidance.none();

        AssembledPrompt p = PromptAssembler.assemble(input("A quiet harbor", "", g, 1400, List.of()));

        assertThat(p.fullPrompt()).isEqualTo("A quiet harbor");
        assertThat(p.truncated()).isFalse();
    }

    @Test
    void reports_required_subjects_missing_from_the_prompt() {
        StyleGuidance g = StyleGuidance.none();

        AssembledPrompt p = PromptAssembler.assemble(input(
                "A castle at dawn", "Characters:\n- Mira: Outfit: red cloak.", g, 1400, List.of("Mira", "Ash")));

        assertThat(p.missingSubjects()).containsExactly("Ash");
    }

    @Test
    void phrases_naming_another_style_are_stripped_from_scene_text() {
        StyleGuidance g = StyleGuidanceBuilder.build("anime", 50, false, List.of());

        AssembledPrompt p = PromptAssembler.assemble(input("a watercolor style painting of a fox", "", g, 1400, List.of()));

        assertThat(p.fullPrompt().toLowerCase()).doesNotContain("watercolor style");
        assertThat(p.fullPrompt()).contains("fox");
    }

    @Test
    void sanitizer_collapses_control_characters_and_whitespace() {
        assertThat(PromptSanitizer.sanitize("a\tb\u0000  c\n")).isEqualTo("a b c");
        assertThat(PromptSanitizer.sanitize(null)).isEmpty();
        assertThat(PromptSanitizer.truncateAtWordBoundary("alpha beta gamma delta", 15)).isEqualTo("alpha beta");
        assertThat(PromptSanitizer.firstNonBlank(null, " ", "x")).isEqualTo("x");
    }
}
