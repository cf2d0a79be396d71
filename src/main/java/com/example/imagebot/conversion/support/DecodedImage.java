package com.example.imagebot.conversion.support;

import java.awt.image.BufferedImage;

public record DecodedImage(BufferedImage image, String sourceFormat) {
}
