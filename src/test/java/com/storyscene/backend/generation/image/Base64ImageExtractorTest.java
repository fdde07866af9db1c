package com.storyscene.backend.generation.image;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

class Base64ImageExtractorTest {

    private final ObjectMapper om = new ObjectMapper();
    private final String b64 = Base64.getEncoder().encodeToString("pixels".getBytes(StandardCharsets.UTF_8));

    @Test
    void reads_venice_images_array() throws Exception {
        byte[] out = Base64ImageExtractor.extractBytes(om.readTree("{\"images\":[\"" + b64 + "\"]}"));

        assertThat(new String(out, StandardCharsets.UTF_8)).isEqualTo("pixels");
    }

    @Test
    void reads_openai_style_data_items_and_strips_data_url() throws Exception {
        String body = "{\"data\":[{\"b64_json\":\"data:image/png;base64," + b64 + "\"}]}";

        assertThat(Base64ImageExtractor.extract(om.readTree(body))).isEqualTo(b64);
    }

    @Test
    void reads_gemini_inline_data() throws Exception {
        String body = """
                {"candidates":[{"content":{"parts":[{"text":"here"},{"inlineData":{"mimeType":"image/png","data":"%s"}}]}}]}
                """.formatted(b64);

        assertThat(Base64ImageExtractor.extract(om.readTree(body))).isEqualTo(b64);
    }

    @Test
    void nothing_usable_is_null() throws Exception {
        assertThat(Base64ImageExtractor.extractBytes(om.readTree("{\"images\":[]}"))).isNull();
        assertThat(Base64ImageExtractor.extractBytes(om.readTree("{\"image\":42}"))).isNull();
        assertThat(Base64ImageExtractor.extractBytes(null)).isNull();
    }
}
