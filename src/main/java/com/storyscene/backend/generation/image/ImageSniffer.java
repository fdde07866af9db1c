package com.storyscene.backend.generation.image;

import java.util.Arrays;

/**
 * Container format from magic bytes. The content type a provider declares is not trusted.
 */
public final class ImageSniffer {

    private ImageSniffer() {}

    public enum ImageType {
        WEBP("image/webp", ".webp"),
        PNG("image/png", ".png"),
        JPEG("image/jpeg", ".jpg");

        private final String contentType;
        private final String ext;

        ImageType(String contentType, String ext) {
            this.contentType = contentType;
            this.ext = ext;
        }

        public String contentType() { return contentType; }
        public String ext() { return ext; }
    }

    public record Detection(ImageType type) {
        public String contentType() { return type.contentType(); }
        public String ext() { return type.ext(); }
    }

    private static final byte[] PNG_SIG = new byte[] {
            (byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A
    };

    /** Null when the bytes match none of WEBP, PNG, JPEG. */
    public static Detection detect(byte[] bytes) {
        if (bytes == null) return null;
        int n = bytes.length;

        // RIFF....WEBP
        if (n >= 12
                && bytes[0] == 'R' && bytes[1] == 'I' && bytes[2] == 'F' && bytes[3] == 'F'
                && bytes[8] == 'W' && bytes[9] == 'E' && bytes[10] == 'B' && bytes[11] == 'P') {
            return new Detection(ImageType.WEBP);
        }

        if (n >= 8 && Arrays.equals(Arrays.copyOfRange(bytes, 0, PNG_SIG.length), PNG_SIG)) {
            return new Detection(ImageType.PNG);
        }

        // JPEG: FF D8
        if (n >= 2 && bytes[0] == (byte) 0xFF && bytes[1] == (byte) 0xD8) {
            return new Detection(ImageType.JPEG);
        }

        return null;
    }
}
