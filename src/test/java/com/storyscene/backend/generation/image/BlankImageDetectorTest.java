package com.storyscene.backend.generation.image;

import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class BlankImageDetectorTest {

    private static byte[] png(BufferedImage img) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(img, "png", out);
        return out.toByteArray();
    }

    private static BufferedImage solid(Color c) {
        BufferedImage img = new BufferedImage(64, 64, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(c);
        g.fillRect(0, 0, 64, 64);
        g.dispose();
        return img;
    }

    /** 16 vertical bands, 4px each, all different colors. */
    private static BufferedImage bands() {
        BufferedImage img = new BufferedImage(64, 64, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        for (int i = 0; i < 16; i++) {
            g.setColor(new Color(i * 16, 255 - i * 16, (i * 37) % 256));
            g.fillRect(i * 4, 0, 4, 64);
        }
        g.dispose();
        return img;
    }

    @Test
    void uniform_image_is_blank() throws Exception {
        BlankImageDetector.Verdict v = BlankImageDetector.inspect(png(solid(new Color(120, 60, 200))));

        assertThat(v.decoded()).isTrue();
        assertThat(v.blank()).isTrue();
        assertThat(v.std()).isLessThan(0.01);
        assertThat(v.reason()).startsWith("low_variance");
    }

    @Test
    void varied_image_is_not_blank() throws Exception {
        BlankImageDetector.Verdict v = BlankImageDetector.inspect(png(bands()));

        assertThat(v.blank()).isFalse();
        assertThat(v.uniqueColors()).isGreaterThanOrEqualTo(10);
        assertThat(v.std()).isGreaterThan(5);
    }

    @Test
    void fully_transparent_image_is_blank() throws Exception {
        BufferedImage clear = new BufferedImage(64, 64, BufferedImage.TYPE_INT_ARGB);

        BlankImageDetector.Verdict v = BlankImageDetector.inspect(png(clear));

        assertThat(v.blank()).isTrue();
        assertThat(v.reason()).isEqualTo("fully_transparent");
    }

    @Test
    void undecodable_bytes_are_not_called_blank() {
        BlankImageDetector.Verdict v = BlankImageDetector.inspect(new byte[]{'R', 'I', 'F', 'F', 0, 0, 0, 0, 'W', 'E', 'B', 'P'});

        assertThat(v.decoded()).isFalse();
        assertThat(v.blank()).isFalse();
    }
}
