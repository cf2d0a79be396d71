package com.example.imagebot.conversion.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public record ConversionResult(
        Path outputRef,
        String archiveName,
        long originalSize,
        long convertedSize) {

    public void deleteSilently() {
        try {
            Files.deleteIfExists(outputRef);
        } catch (IOException ex) {
            log.warn("Failed to delete converted file {}: {}", outputRef, ex.getMessage());
        }
    }
}
