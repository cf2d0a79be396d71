package com.example.imagebot.conversion.support;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.imagebot.conversion.model.TargetFormat;
import java.awt.image.BufferedImage;
import org.junit.jupiter.api.Test;

class ColorModeNormalizerTest {

    private final ColorModeNormalizer normalizer = new ColorModeNormalizer();

    @Test
    void flattensAlphaForJpeg() {
        BufferedImage rgba = new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB);
        rgba.setRGB(0, 0, 0x80FF0000);

        BufferedImage result = normalizer.normalize(rgba, TargetFormat.JPEG);

        assertThat(result.getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
        assertThat(result.getColorModel().hasAlpha()).isFalse();
        assertThat(result.getWidth()).isEqualTo(2);
    }

    @Test
    void flattensPaletteImagesForJpeg() {
        BufferedImage indexed = new BufferedImage(3, 1, BufferedImage.TYPE_BYTE_INDEXED);

        assertThat(normalizer.normalize(indexed, TargetFormat.JPEG).getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
    }

    @Test
    void leavesOpaqueRgbUntouchedForJpeg() {
        BufferedImage rgb = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);

        assertThat(normalizer.normalize(rgb, TargetFormat.JPEG)).isSameAs(rgb);
    }

    @Test
    void promotesGrayscaleToRgbaForWebp() {
        BufferedImage gray = new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_GRAY);

        BufferedImage result = normalizer.normalize(gray, TargetFormat.WEBP);

        assertThat(result.getType()).isEqualTo(BufferedImage.TYPE_INT_ARGB);
    }

    @Test
    void promotesPaletteToRgbaForAvif() {
        BufferedImage indexed = new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_INDEXED);

        assertThat(normalizer.normalize(indexed, TargetFormat.AVIF).getType())
                .isEqualTo(BufferedImage.TYPE_INT_ARGB);
    }

    @Test
    void keepsRgbAndRgbaForWebp() {
        BufferedImage rgb = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);
        BufferedImage rgba = new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB);

        assertThat(normalizer.normalize(rgb, TargetFormat.WEBP)).isSameAs(rgb);
        assertThat(normalizer.normalize(rgba, TargetFormat.WEBP)).isSameAs(rgba);
    }

    @Test
    void passesEverythingThroughForLosslessTargets() {
        BufferedImage rgba = new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB);
        BufferedImage gray = new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_GRAY);

        assertThat(normalizer.normalize(rgba, TargetFormat.PNG)).isSameAs(rgba);
        assertThat(normalizer.normalize(gray, TargetFormat.BMP)).isSameAs(gray);
        assertThat(normalizer.normalize(rgba, TargetFormat.GIF)).isSameAs(rgba);
    }

    @Test
    void preservesPixelColoursWhenDroppingAlpha() {
        BufferedImage rgba = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        rgba.setRGB(0, 0, 0xFF336699);

        BufferedImage result = normalizer.normalize(rgba, TargetFormat.JPEG);

        assertThat(result.getRGB(0, 0) & 0xFFFFFF).isEqualTo(0x336699);
    }
}
