package com.example.imagebot.conversion.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.imagebot.conversion.model.TargetFormat;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageIoCodecTest {

    private final ImageIoCodec codec = new ImageIoCodec();

    @TempDir
    Path tempDir;

    @Test
    void decodesPngAndReportsItsFormat() throws IOException {
        Path png = tempDir.resolve("input.png");
        ImageIO.write(new BufferedImage(4, 3, BufferedImage.TYPE_INT_ARGB), "png", png.toFile());

        DecodedImage decoded = codec.decode(png);

        assertThat(decoded.sourceFormat()).isEqualTo("PNG");
        assertThat(decoded.image().getWidth()).isEqualTo(4);
        assertThat(decoded.image().getHeight()).isEqualTo(3);
    }

    @Test
    void encodesJpegThatCanBeDetectedAgain() {
        Path target = tempDir.resolve("out.jpg");

        codec.encode(new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB), TargetFormat.JPEG, target);

        assertThat(target).isNotEmptyFile();
        assertThat(codec.detectFormat(target)).contains("JPEG");
    }

    @Test
    void failsToDecodeNonImageContent() throws IOException {
        Path text = Files.writeString(tempDir.resolve("fake.png"), "not an image", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.decode(text)).isInstanceOf(ImageDecodeException.class);
    }

    @Test
    void detectsNothingForNonImageContent() throws IOException {
        Path text = Files.writeString(tempDir.resolve("fake.jpg"), "plain text", StandardCharsets.UTF_8);

        assertThat(codec.detectFormat(text)).isEmpty();
    }

    @Test
    void writesOpaqueBmpFromImageWithAlpha() throws IOException {
        BufferedImage translucent = new BufferedImage(3, 3, BufferedImage.TYPE_INT_ARGB);
        translucent.setRGB(1, 1, 0x80FF0000);
        Path target = tempDir.resolve("alpha.bmp");

        codec.encode(translucent, TargetFormat.BMP, target);

        BufferedImage written = ImageIO.read(target.toFile());
        assertThat(written).isNotNull();
        assertThat(written.getColorModel().hasAlpha()).isFalse();
        assertThat(written.getWidth()).isEqualTo(3);
    }

    @Test
    void writesJpegFromImageWithAlpha() throws IOException {
        Path target = tempDir.resolve("alpha.jpg");

        codec.encode(new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB), TargetFormat.JPEG, target);

        assertThat(ImageIO.read(target.toFile())).isNotNull();
    }

    @Test
    void reportsWhichFormatsHaveAnEncoder() {
        assertThat(codec.canEncode(TargetFormat.PNG)).isTrue();
        assertThat(codec.canEncode(TargetFormat.BMP)).isTrue();
        assertThat(codec.canEncode(TargetFormat.AVIF)).isFalse();
    }

    @Test
    void failsToEncodeFormatWithoutWriter() {
        Path target = tempDir.resolve("out.avif");

        assertThatThrownBy(() -> codec.encode(new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB),
                TargetFormat.AVIF, target)).isInstanceOf(ImageEncodeException.class);
        assertThat(target).doesNotExist();
    }
}
