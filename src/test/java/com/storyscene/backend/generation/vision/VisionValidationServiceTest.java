package com.storyscene.backend.generation.vision;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VisionValidationServiceTest {

    private VisionClient client;
    private VisionValidationService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        client = mock(VisionClient.class);
        ObjectProvider<VisionClient> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(client);
        service = new VisionValidationService(provider, new ObjectMapper());
    }

    @Test
    void scores_are_weighted_and_status_derived() {
        Optional<VisionValidation> v = service.parse(
                "Here you go: {\"overall_score\": 90, \"style_check\": {\"adherence_score\": 80}} thanks", false);

        assertThat(v).isPresent();
        // 0.65 * 90 + 0.35 * 80 = 86.5
        assertThat(v.get().score()).isEqualTo(87);
        assertThat(v.get().status()).isEqualTo(VisionValidation.PASS);
    }

    @Test
    void character_average_is_used_without_an_overall_score() {
        VisionValidation v = service.parse(
                "{\"characters\":[{\"name\":\"Ash\",\"score\":60},{\"name\":\"Mia\",\"score\":\"80\"}]}", false).orElseThrow();

        assertThat(v.characterScore()).isEqualTo(70);
        assertThat(v.styleScore()).isNull();
        assertThat(v.status()).isEqualTo(VisionValidation.WARN);
    }

    @Test
    void strict_style_fails_on_weak_adherence_even_if_the_model_says_pass() {
        VisionValidation v = service.parse(
                "{\"overall_score\":95,\"status\":\"pass\",\"style_check\":{\"adherence_score\":60}}", true).orElseThrow();

        assertThat(v.failed()).isTrue();
    }

    @Test
    void unusable_answers_yield_nothing() {
        assertThat(service.parse("I cannot evaluate this image.", false)).isEmpty();
        assertThat(service.parse("{\"notes\":\"looks fine\"}", false)).isEmpty();
        assertThat(service.parse("{broken json}", false)).isEmpty();
    }

    @Test
    void client_errors_are_swallowed_into_empty() {
        when(client.complete(anyString(), anyString(), anyList(), any())).thenThrow(new IllegalStateException("boom"));

        Optional<VisionValidation> v = service.validate("r1", new byte[]{1, 2, 3}, "image/png",
                List.of(), "Anime", false, Duration.ofSeconds(5));

        assertThat(v).isEmpty();
    }

    @Test
    void references_precede_the_generated_image() {
        when(client.complete(anyString(), anyString(), anyList(), any())).thenReturn("{\"overall_score\":88}");

        service.validate("r1", new byte[]{1, 2, 3}, "image/webp",
                List.of(new ValidationCharacter("Ash", "https://cdn.example.com/ash.png", "tall, red hair", "red jacket", null)),
                "Anime", false, Duration.ofSeconds(5));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<String>> urls = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(client).complete(eq("r1"), prompt.capture(), urls.capture(), any());
        assertThat(urls.getValue()).hasSize(2);
        assertThat(urls.getValue().get(0)).isEqualTo("https://cdn.example.com/ash.png");
        assertThat(urls.getValue().get(1)).startsWith("data:image/webp;base64,");
        assertThat(prompt.getValue()).contains("- Ash: tall, red hair. Outfit: red jacket", "Expected art style: Anime");
    }

    @Test
    void retry_prefix_targets_the_weaker_aspect() {
        assertThat(VisionValidationService.retryPrefix(new VisionValidation(50, "fail", 90, 40, null), "Anime"))
                .isEqualTo("Use Anime style strictly. ");
        assertThat(VisionValidationService.retryPrefix(new VisionValidation(50, "fail", 40, 90, null), "Anime"))
                .isEqualTo("Focus on character accuracy. ");
        assertThat(VisionValidationService.retryPrefix(new VisionValidation(50, "fail", 40, 40, null), null))
                .isEqualTo("Focus on character accuracy. ");
    }
}
