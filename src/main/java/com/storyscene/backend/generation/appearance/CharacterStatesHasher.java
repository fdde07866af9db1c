package com.storyscene.backend.generation.appearance;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

public final class CharacterStatesHasher {

    private CharacterStatesHasher() {}

    /**
     * SHA-256 hex over the resolved snapshots, ordered by lower-cased name so the
     * result does not depend on request order.
     */
    public static String hash(AppearanceResolution resolution) {
        Map<String, AppearanceSnapshot> sorted = new TreeMap<>();
        if (resolution != null) {
            resolution.effectiveByName().forEach((name, r) ->
                    sorted.put(name.toLowerCase(Locale.ROOT), r.snapshot()));
        }

        StringBuilder sb = new StringBuilder();
        sorted.forEach((name, s) -> sb
                .append(name).append('|')
                .append(nz(s.clothing())).append('|')
                .append(nz(s.state())).append('|')
                .append(nz(s.physicalAttributes())).append('|')
                .append(nz(s.accessories())).append('\n'));
        return sha256Hex(sb.toString());
    }

    public static String sha256Hex(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
