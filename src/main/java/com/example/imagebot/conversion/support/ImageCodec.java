package com.example.imagebot.conversion.support;

import com.example.imagebot.conversion.model.TargetFormat;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Optional;

public interface ImageCodec {

    DecodedImage decode(Path source);

    /**
     * Encodes {@code image} as {@code format} into {@code target}, replacing its content. Writers
     * that cannot store an alpha channel receive an opaque copy.
     *
     * @throws ImageEncodeException when no encoder exists for the format or encoding fails
     */
    void encode(BufferedImage image, TargetFormat format, Path target);

    boolean canEncode(TargetFormat format);

    /**
     * Reports the container format of {@code source} from its header, without decoding pixels.
     */
    Optional<String> detectFormat(Path source);
}
