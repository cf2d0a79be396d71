package com.example.imagebot.conversion.model;

import java.util.Locale;
import java.util.Optional;

public enum TargetFormat {
    JPEG(".jpg", "jpeg"),
    PNG(".png", "png"),
    WEBP(".webp", "webp"),
    GIF(".gif", "gif"),
    TIFF(".tiff", "tiff"),
    BMP(".bmp", "bmp"),
    AVIF(".avif", "avif");

    private final String extension;
    private final String imageIoName;

    TargetFormat(String extension, String imageIoName) {
        this.extension = extension;
        this.imageIoName = imageIoName;
    }

    public String extension() {
        return extension;
    }

    public String imageIoName() {
        return imageIoName;
    }

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TargetFormat> fromToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String normalized = token.trim().toUpperCase(Locale.ROOT);
        for (TargetFormat format : values()) {
            if (format.name().equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
