package com.example.imagebot.conversion.service;

import com.example.imagebot.conversion.model.StatisticsRecord;
import com.example.imagebot.conversion.support.StatisticsPersistenceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Slf4j
@Component
class StatisticsRepository {

    private final ObjectMapper objectMapper;
    private final Path file;

    StatisticsRepository(ObjectMapper objectMapper,
            @Value("${app.statistics.file:bot_statistics.json}") String file) {
        this.objectMapper = objectMapper;
        this.file = Path.of(file).toAbsolutePath();
    }

    StatisticsRecord load() {
        if (!Files.exists(file)) {
            log.info("No statistics file at {}, starting from zero", file);
            return new StatisticsRecord();
        }
        try {
            StatisticsRecord loaded = objectMapper.readValue(file.toFile(), StatisticsRecord.class);
            log.info("Loaded statistics from {} totalImages={}", file, loaded.getTotalImages());
            return loaded;
        } catch (IOException ex) {
            log.error("Error loading statistics from {}: {}", file, ex.getMessage(), ex);
            return new StatisticsRecord();
        }
    }

    void save(StatisticsRecord statistics) {
        Path tempFile = null;
        try {
            Path directory = file.getParent();
            Files.createDirectories(directory);
            tempFile = Files.createTempFile(directory, "statistics-", ".tmp");
            objectMapper.writeValue(tempFile.toFile(), statistics);
            try {
                Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            deleteQuietly(tempFile);
            throw new StatisticsPersistenceException("Failed to write statistics to %s".formatted(file), ex);
        }
    }

    Path file() {
        return file;
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Failed to delete temporary statistics file {}: {}", path, ex.getMessage());
        }
    }
}
