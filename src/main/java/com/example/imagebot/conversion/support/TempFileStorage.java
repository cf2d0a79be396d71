package com.example.imagebot.conversion.support;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
public class TempFileStorage {

    private static final String DEFAULT_DIRECTORY_NAME = "image-bot";
    private static final int COPY_BUFFER_SIZE = 64 * 1024;

    private final Path directory;

    public TempFileStorage(@Value("${app.conversion.temp-dir:}") String configuredDirectory) throws IOException {
        this.directory = StringUtils.hasText(configuredDirectory)
                ? Path.of(configuredDirectory)
                : Path.of(System.getProperty("java.io.tmpdir"), DEFAULT_DIRECTORY_NAME);
        Files.createDirectories(directory);
        log.info("Temporary conversion files are kept in {}", directory.toAbsolutePath());
    }

    public Path directory() {
        return directory;
    }

    public Path newFile(String prefix, String suffix) throws IOException {
        return Files.createTempFile(directory, prefix, sanitizeSuffix(suffix));
    }

    /**
     * Copies {@code content} into a new staged file. Nothing is kept when the content is longer
     * than {@code maxBytes}.
     *
     * @return the staged file, or empty when the limit was exceeded
     */
    public Optional<Path> stage(InputStream content, String originalName, long maxBytes) throws IOException {
        Path path = newFile("staged-", "_" + originalName);
        boolean kept = false;
        try (OutputStream out = Files.newOutputStream(path)) {
            byte[] buffer = new byte[COPY_BUFFER_SIZE];
            long written = 0;
            int read;
            while ((read = content.read(buffer)) != -1) {
                written += read;
                if (written > maxBytes) {
                    return Optional.empty();
                }
                out.write(buffer, 0, read);
            }
            kept = true;
            return Optional.of(path);
        } finally {
            if (!kept) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static String sanitizeSuffix(String suffix) {
        if (suffix == null) {
            return null;
        }
        return suffix.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
