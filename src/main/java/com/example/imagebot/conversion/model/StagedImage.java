package com.example.imagebot.conversion.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public record StagedImage(Path storageRef, String originalName) {

    public boolean isReadable() {
        return storageRef != null && Files.isRegularFile(storageRef);
    }

    public long size() throws IOException {
        return Files.size(storageRef);
    }

    public void deleteSilently() {
        if (storageRef == null) {
            return;
        }
        try {
            Files.deleteIfExists(storageRef);
        } catch (IOException ex) {
            log.warn("Failed to delete staged file {}: {}", storageRef, ex.getMessage());
        }
    }
}
