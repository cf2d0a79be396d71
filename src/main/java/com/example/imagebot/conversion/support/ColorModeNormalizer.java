package com.example.imagebot.conversion.support;

import com.example.imagebot.conversion.model.TargetFormat;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ColorModeNormalizer {

    public BufferedImage normalize(BufferedImage image, TargetFormat target) {
        return switch (target) {
            case JPEG -> hasAlphaOrPalette(image) ? copyInto(image, BufferedImage.TYPE_INT_RGB) : image;
            case WEBP, AVIF -> isRgbOrRgba(image) ? image : copyInto(image, BufferedImage.TYPE_INT_ARGB);
            default -> image;
        };
    }

    static boolean hasAlphaOrPalette(BufferedImage image) {
        ColorModel colorModel = image.getColorModel();
        return colorModel.hasAlpha() || colorModel instanceof IndexColorModel;
    }

    static boolean isRgbOrRgba(BufferedImage image) {
        ColorModel colorModel = image.getColorModel();
        if (colorModel instanceof IndexColorModel) {
            return false;
        }
        int components = colorModel.getNumComponents();
        return colorModel.getColorSpace().getType() == ColorSpace.TYPE_RGB
                && (components == 3 || components == 4);
    }

    static BufferedImage copyInto(BufferedImage source, int imageType) {
        int width = source.getWidth();
        int height = source.getHeight();
        log.debug("Converting {}x{} image from type {} to type {}", width, height, source.getType(), imageType);
        BufferedImage converted = new BufferedImage(width, height, imageType);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            source.getRGB(0, y, width, 1, row, 0, width);
            converted.setRGB(0, y, width, 1, row, 0, width);
        }
        return converted;
    }
}
