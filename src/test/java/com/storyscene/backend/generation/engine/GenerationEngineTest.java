package com.storyscene.backend.generation.engine;

import com.storyscene.backend.generation.config.GenerationProperties;
import com.storyscene.backend.generation.model.ModelCatalog;
import com.storyscene.backend.generation.provider.ImageGenerationCall;
import com.storyscene.backend.generation.provider.ImageProviderClient;
import com.storyscene.backend.generation.provider.ImageProviderResult;
import com.storyscene.backend.generation.provider.ImageProviderRouter;
import com.storyscene.backend.generation.provider.ResponseHeaders;
import com.storyscene.backend.generation.style.GenerationTuning;
import com.storyscene.backend.generation.style.ResolutionCoercer;
import com.storyscene.backend.generation.vision.ValidationCharacter;
import com.storyscene.backend.generation.vision.VisionValidation;
import com.storyscene.backend.generation.vision.VisionValidationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GenerationEngineTest {

    private ImageProviderRouter router;
    private ImageProviderClient client;
    private VisionValidationService validator;
    private GenerationProperties props;
    private GenerationEngine engine;

    @BeforeEach
    void setUp() {
        router = mock(ImageProviderRouter.class);
        client = mock(ImageProviderClient.class);
        validator = mock(VisionValidationService.class);
        when(router.pick(any())).thenReturn(client);

        props = new GenerationProperties();
        props.setVisionValidationEnabled(false);
        engine = new GenerationEngine(router, validator, props);
    }

    private static byte[] bandsPng() throws IOException {
        BufferedImage img = new BufferedImage(64, 64, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        for (int i = 0; i < 16; i++) {
            g.setColor(new Color(i * 16, 255 - i * 16, (i * 37) % 256));
            g.fillRect(i * 4, 0, 4, 64);
        }
        g.dispose();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(img, "png", out);
        return out.toByteArray();
    }

    private static byte[] solidPng() throws IOException {
        BufferedImage img = new BufferedImage(256, 256, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(Color.BLACK);
        g.fillRect(0, 0, 256, 256);
        g.dispose();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(img, "png", out);
        return padded(out.toByteArray());
    }

    private static ImageProviderResult ok(byte[] bytes) {
        return new ImageProviderResult("VENICE", "venice-sd35", 200, bytes, Map.of("content-type", "application/json"), List.of("images"));
    }

    private static EngineRequest request(String modelId, boolean explicit) {
        return new EngineRequest("req-1", ModelCatalog.require(modelId), explicit,
                "anime style artwork of Ash walking through a forest", "blurry",
                new ResolutionCoercer.Resolution(1024, 576, List.of()),
                new GenerationTuning(7.5, 30), List.of(),
                List.of(new ValidationCharacter("Ash", null, "red jacket", "red jacket", null)),
                "Anime", false);
    }

    private static TimeBudget budget() {
        return TimeBudget.start(Duration.ofSeconds(58), Duration.ofSeconds(5));
    }

    private static HttpClientErrorException badRequest(String body) {
        return HttpClientErrorException.create(HttpStatus.BAD_REQUEST, "Bad Request", new HttpHeaders(),
                body.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
    }

    @Test
    void returns_the_checked_image() throws Exception {
        byte[] png = bandsPng();
        when(client.generate(any(), any())).thenReturn(ok(padded(png)));

        EngineResult r = engine.generate(request("venice-sd35", false), budget());

        assertThat(r.model()).isEqualTo("venice-sd35");
        assertThat(r.usedFallback()).isFalse();
        assertThat(r.detection().ext()).isEqualTo(".png");
        assertThat(r.blankVerdict().blank()).isFalse();
        assertThat(r.validation()).isNull();
    }

    @Test
    void rejected_model_falls_back_once() throws Exception {
        when(client.generate(any(), any()))
                .thenThrow(badRequest("{\"error\":\"Unknown model venice-sd35\"}"))
                .thenReturn(ok(padded(bandsPng())));

        EngineResult r = engine.generate(request("venice-sd35", false), budget());

        ArgumentCaptor<ImageGenerationCall> calls = ArgumentCaptor.forClass(ImageGenerationCall.class);
        verify(client, times(2)).generate(calls.capture(), any());
        assertThat(calls.getAllValues().get(1).model().id()).isEqualTo("lustify-sdxl");
        assertThat(r.usedFallback()).isTrue();
        assertThat(r.model()).isEqualTo("lustify-sdxl");
        assertThat(r.warnings()).contains("model_fallback:venice-sd35->lustify-sdxl");
    }

    @Test
    void explicit_model_is_never_swapped() {
        when(client.generate(any(), any())).thenThrow(badRequest("{\"error\":\"Unknown model\"}"));

        assertThatThrownBy(() -> engine.generate(request("venice-sd35", true), budget()))
                .isInstanceOfSatisfying(ImageGenerationException.class, e -> {
                    assertThat(e.getUpstreamStatus()).isEqualTo(400);
                    assertThat(e.getFailure().code()).isEqualTo("UPSTREAM_BAD_REQUEST");
                    assertThat(e.getStage()).isEqualTo(ImageGenerationException.STAGE_UPSTREAM);
                    assertThat(e.getModel()).isEqualTo("venice-sd35");
                });
        verify(client, times(1)).generate(any(), any());
    }

    @Test
    void content_rejection_does_not_trigger_the_fallback() {
        when(client.generate(any(), any())).thenThrow(badRequest("{\"error\":\"violates content policy\"}"));

        assertThatThrownBy(() -> engine.generate(request("venice-sd35", false), budget()))
                .isInstanceOfSatisfying(ImageGenerationException.class,
                        e -> assertThat(e.getFailure().code()).isEqualTo("UPSTREAM_CONTENT_REJECTED"));
        verify(client, times(1)).generate(any(), any());
    }

    @Test
    void policy_rejection_naming_the_model_is_terminal() {
        when(client.generate(any(), any()))
                .thenThrow(badRequest("{\"error\":\"Prompt violates content policy for this model\"}"));

        assertThatThrownBy(() -> engine.generate(request("venice-sd35", false), budget()))
                .isInstanceOfSatisfying(ImageGenerationException.class, e -> {
                    assertThat(e.getFailure().code()).isEqualTo("UPSTREAM_CONTENT_REJECTED");
                    assertThat(e.getModel()).isEqualTo("venice-sd35");
                });
        verify(client, times(1)).generate(any(), any());
    }

    @Test
    void flagged_rejection_header_blocks_the_fallback() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(ResponseHeaders.CONTENT_VIOLATION, "true");
        when(client.generate(any(), any())).thenThrow(HttpClientErrorException.create(HttpStatus.BAD_REQUEST,
                "Bad Request", headers, "{\"error\":\"model refused\"}".getBytes(StandardCharsets.UTF_8),
                StandardCharsets.UTF_8));

        assertThatThrownBy(() -> engine.generate(request("venice-sd35", false), budget()))
                .isInstanceOf(ImageGenerationException.class);
        verify(client, times(1)).generate(any(), any());
    }

    @Test
    void missing_image_is_a_parse_failure() {
        when(client.generate(any(), any())).thenReturn(
                new ImageProviderResult("VENICE", "venice-sd35", 200, null, Map.of(), List.of("id", "timing")));

        assertThatThrownBy(() -> engine.generate(request("venice-sd35", false), budget()))
                .isInstanceOfSatisfying(ImageGenerationException.class, e -> {
                    assertThat(e.getFailure().code()).isEqualTo("IMAGE_PARSE_FAILED");
                    assertThat(e.getFailure().reasons()).contains("Response keys: id,timing");
                });
    }

    @Test
    void tiny_image_is_rejected() {
        when(client.generate(any(), any())).thenReturn(ok(new byte[]{(byte) 0x89, 'P', 'N', 'G'}));

        assertThatThrownBy(() -> engine.generate(request("venice-sd35", false), budget()))
                .isInstanceOfSatisfying(ImageGenerationException.class, e -> {
                    assertThat(e.getFailure().code()).isEqualTo("IMAGE_TOO_SMALL");
                    assertThat(e.getStage()).isEqualTo(ImageGenerationException.STAGE_BLANK);
                });
    }

    @Test
    void flagged_image_is_rejected() throws Exception {
        ImageProviderResult flagged = new ImageProviderResult("VENICE", "venice-sd35", 200, padded(bandsPng()),
                Map.of(ResponseHeaders.CONTENT_VIOLATION, "true"), List.of());
        when(client.generate(any(), any())).thenReturn(flagged);

        assertThatThrownBy(() -> engine.generate(request("venice-sd35", false), budget()))
                .isInstanceOfSatisfying(ImageGenerationException.class,
                        e -> assertThat(e.getFailure().code()).isEqualTo("IMAGE_CONTENT_FLAGGED"));
    }

    @Test
    void blank_image_is_rejected() throws Exception {
        when(client.generate(any(), any())).thenReturn(ok(solidPng()));

        assertThatThrownBy(() -> engine.generate(request("venice-sd35", false), budget()))
                .isInstanceOfSatisfying(ImageGenerationException.class,
                        e -> assertThat(e.getFailure().code()).isEqualTo("IMAGE_BLANK"));
    }

    @Test
    void failed_validation_triggers_one_stricter_retry() throws Exception {
        props.setVisionValidationEnabled(true);
        when(validator.available()).thenReturn(true);
        when(validator.validate(any(), any(), any(), any(), any(), anyBoolean(), any()))
                .thenReturn(Optional.of(new VisionValidation(55, VisionValidation.FAIL, 80, 40, null)));
        when(client.generate(any(), any())).thenReturn(ok(padded(bandsPng())));

        EngineResult r = engine.generate(request("venice-sd35", false), budget());

        ArgumentCaptor<ImageGenerationCall> calls = ArgumentCaptor.forClass(ImageGenerationCall.class);
        verify(client, times(2)).generate(calls.capture(), any());
        ImageGenerationCall retry = calls.getAllValues().get(1);
        assertThat(retry.prompt()).startsWith("Use Anime style strictly. ");
        assertThat(retry.cfgScale()).isEqualTo(8.5);
        assertThat(r.retried()).isTrue();
        assertThat(r.validation().score()).isEqualTo(55);
    }

    @Test
    void validation_is_skipped_when_time_is_short() throws Exception {
        props.setVisionValidationEnabled(true);
        props.setVisionMinRemaining(Duration.ofMinutes(5));
        when(validator.available()).thenReturn(true);
        when(client.generate(any(), any())).thenReturn(ok(padded(bandsPng())));

        EngineResult r = engine.generate(request("venice-sd35", false), budget());

        assertThat(r.validation()).isNull();
        assertThat(r.warnings()).contains("validation_skipped_time_budget");
    }

    /** Pads past the minimum size check; decoders stop at IEND. */
    private static byte[] padded(byte[] png) {
        byte[] out = new byte[Math.max(png.length, 2048)];
        System.arraycopy(png, 0, out, 0, png.length);
        return out;
    }
}
