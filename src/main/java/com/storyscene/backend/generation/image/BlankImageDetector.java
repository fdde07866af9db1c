package com.storyscene.backend.generation.image;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

/**
 * Cheap blankness check: the image is scaled to 64x64 and every 4th pixel is sampled for
 * luma mean/std, a quantized color count and alpha.
 */
@Slf4j
public final class BlankImageDetector {

    private BlankImageDetector() {}

    static final int GRID = 64;
    static final int STRIDE = 4;
    static final double MIN_STD = 2.5;
    static final int MIN_COLORS = 3;

    public record Verdict(boolean decoded, boolean blank, String reason, double mean, double std, int uniqueColors) {

        static Verdict undecodable() {
            return new Verdict(false, false, null, 0, 0, 0);
        }
    }

    /**
     * Bytes ImageIO cannot decode (WEBP on a stock JDK) are reported as {@code decoded=false}
     * and not blank; the caller has already checked size and magic bytes.
     */
    public static Verdict inspect(byte[] bytes) {
        BufferedImage src;
        try {
            src = bytes == null ? null : ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            log.debug("blank_check_decode_failed err={}", e.toString());
            return Verdict.undecodable();
        }
        if (src == null) return Verdict.undecodable();
        return inspect(src);
    }

    public static Verdict inspect(BufferedImage src) {
        BufferedImage img = new BufferedImage(GRID, GRID, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(src, 0, 0, GRID, GRID, null);
        } finally {
            g.dispose();
        }

        double sum = 0;
        double sumSq = 0;
        int count = 0;
        int opaque = 0;
        Set<Integer> colors = new HashSet<>();

        for (int idx = 0; idx < GRID * GRID; idx += STRIDE) {
            int argb = img.getRGB(idx % GRID, idx / GRID);
            int a = (argb >>> 24) & 0xFF;
            int r = (argb >> 16) & 0xFF;
            int gr = (argb >> 8) & 0xFF;
            int b = argb & 0xFF;

            double lum = 0.2126 * r + 0.7152 * gr + 0.0722 * b;
            sum += lum;
            sumSq += lum * lum;
            count++;
            if (a > 0) opaque++;
            colors.add(((r >> 4) << 8) | ((gr >> 4) << 4) | (b >> 4));
        }

        double mean = count > 0 ? sum / count : 0;
        double variance = count > 0 ? sumSq / count - mean * mean : 0;
        double std = Math.sqrt(Math.max(0, variance));
        int unique = colors.size();

        String reason = null;
        if (opaque == 0) {
            reason = "fully_transparent";
        } else if (std < MIN_STD) {
            reason = String.format("low_variance(mean=%.1f,std=%.1f)", mean, std);
        } else if (unique < MIN_COLORS) {
            reason = "low_color_variety(colors=" + unique + ")";
        }

        return new Verdict(true, reason != null, reason, mean, std, unique);
    }
}
