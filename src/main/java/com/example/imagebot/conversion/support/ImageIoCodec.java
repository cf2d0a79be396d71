package com.example.imagebot.conversion.support;

import com.example.imagebot.conversion.model.TargetFormat;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ImageIoCodec implements ImageCodec {

    static {
        ImageIO.setUseCache(false);
        ImageIO.scanForPlugins();
    }

    @Override
    public DecodedImage decode(Path source) {
        try (ImageInputStream input = ImageIO.createImageInputStream(source.toFile())) {
            if (input == null) {
                throw new ImageDecodeException("Cannot open %s".formatted(source.getFileName()));
            }
            ImageReader reader = firstReader(input)
                    .orElseThrow(() -> new ImageDecodeException(
                            "No image reader recognises %s".formatted(source.getFileName())));
            try {
                reader.setInput(input, true, true);
                BufferedImage image = reader.read(0);
                String format = reader.getFormatName().toUpperCase(Locale.ROOT);
                log.debug("Decoded {} as {} {}x{} type={}", source.getFileName(), format, image.getWidth(),
                        image.getHeight(), image.getType());
                return new DecodedImage(image, format);
            } finally {
                reader.dispose();
            }
        } catch (ImageDecodeException ex) {
            throw ex;
        } catch (IOException | RuntimeException ex) {
            throw new ImageDecodeException("Failed to decode %s".formatted(source.getFileName()), ex);
        }
    }

    @Override
    public void encode(BufferedImage image, TargetFormat format, Path target) {
        ImageWriter writer = firstWriter(format)
                .orElseThrow(() -> new ImageEncodeException("No image writer available for %s".formatted(format)));
        try {
            BufferedImage encodable = encodableImage(writer, image, format);
            Files.deleteIfExists(target);
            try (ImageOutputStream output = ImageIO.createImageOutputStream(target.toFile())) {
                writer.setOutput(output);
                writer.write(encodable);
                output.flush();
            }
        } catch (ImageEncodeException ex) {
            throw ex;
        } catch (IOException | RuntimeException ex) {
            throw new ImageEncodeException("Failed to encode image as %s".formatted(format), ex);
        } finally {
            writer.dispose();
        }
    }

    @Override
    public boolean canEncode(TargetFormat format) {
        return ImageIO.getImageWritersByFormatName(format.imageIoName()).hasNext();
    }

    @Override
    public Optional<String> detectFormat(Path source) {
        try (ImageInputStream input = ImageIO.createImageInputStream(source.toFile())) {
            if (input == null) {
                return Optional.empty();
            }
            return firstReader(input).map(reader -> {
                try {
                    return reader.getFormatName().toUpperCase(Locale.ROOT);
                } catch (IOException ex) {
                    log.debug("Format name unavailable for {}: {}", source.getFileName(), ex.getMessage());
                    return null;
                } finally {
                    reader.dispose();
                }
            });
        } catch (IOException ex) {
            log.warn("Unable to inspect {}: {}", source.getFileName(), ex.getMessage());
            return Optional.empty();
        }
    }

    private static BufferedImage encodableImage(ImageWriter writer, BufferedImage image, TargetFormat format) {
        if (writer.getOriginatingProvider().canEncodeImage(image)) {
            return image;
        }
        if (image.getColorModel().hasAlpha()) {
            BufferedImage opaque = ColorModeNormalizer.copyInto(image, BufferedImage.TYPE_INT_RGB);
            if (writer.getOriginatingProvider().canEncodeImage(opaque)) {
                log.debug("{} writer has no alpha support, encoding an opaque copy", format);
                return opaque;
            }
        }
        throw new ImageEncodeException("%s writer cannot encode image type %d".formatted(format, image.getType()));
    }

    private static Optional<ImageReader> firstReader(ImageInputStream input) {
        Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
        return readers.hasNext() ? Optional.of(readers.next()) : Optional.empty();
    }

    private static Optional<ImageWriter> firstWriter(TargetFormat format) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.imageIoName());
        return writers.hasNext() ? Optional.of(writers.next()) : Optional.empty();
    }
}
