package com.storyscene.backend.generation.provider;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.GradientPaint;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Offline provider for local runs and tests: a seeded, non-blank PNG per prompt, no network.
 */
@Slf4j
public class StubImageProviderClient implements ImageProviderClient {

    private static final int MAX_SIDE = 512;

    @Override
    public String providerCode() {
        return ImageProviderRouter.STUB;
    }

    @Override
    public ImageProviderResult generate(ImageGenerationCall call, Duration timeout) {
        double scale = Math.min(1.0, (double) MAX_SIDE / Math.max(call.width(), call.height()));
        int w = Math.max(64, (int) Math.round(call.width() * scale));
        int h = Math.max(64, (int) Math.round(call.height() * scale));

        Random rnd = new Random(call.prompt() == null ? 0 : call.prompt().hashCode());
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setPaint(new GradientPaint(0, 0, randomColor(rnd), w, h, randomColor(rnd)));
            g.fillRect(0, 0, w, h);
            for (int i = 0; i < 24; i++) {
                g.setColor(randomColor(rnd));
                int s = 8 + rnd.nextInt(Math.max(9, w / 4));
                g.fillOval(rnd.nextInt(w), rnd.nextInt(h), s, s);
            }
        } finally {
            g.dispose();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(img, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        log.debug("stub image generated requestId={} model={} size={}x{}", call.requestId(), call.model().id(), w, h);
        return new ImageProviderResult(providerCode(), call.model().id(), 200, out.toByteArray(),
                Map.of("content-type", "application/json"), List.of("images"));
    }

    private static Color randomColor(Random rnd) {
        return new Color(rnd.nextInt(256), rnd.nextInt(256), rnd.nextInt(256));
    }
}
