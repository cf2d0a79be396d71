package com.example.imagebot.conversion.service;

import com.example.imagebot.conversion.model.BatchOutcome;
import com.example.imagebot.conversion.model.ConversionResult;
import com.example.imagebot.conversion.model.StagedImage;
import com.example.imagebot.conversion.model.TargetFormat;
import com.example.imagebot.conversion.support.ColorModeNormalizer;
import com.example.imagebot.conversion.support.DecodedImage;
import com.example.imagebot.conversion.support.ImageCodec;
import com.example.imagebot.conversion.support.ImageDecodeException;
import com.example.imagebot.conversion.support.ImageEncodeException;
import com.example.imagebot.conversion.support.TempFileStorage;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class ConversionPipeline {

    private final ImageCodec imageCodec;
    private final ColorModeNormalizer normalizer;
    private final StatisticsAggregator statistics;
    private final TempFileStorage storage;
    private final int progressInterval;

    public ConversionPipeline(ImageCodec imageCodec,
            ColorModeNormalizer normalizer,
            StatisticsAggregator statistics,
            TempFileStorage storage,
            @Value("${app.conversion.progress-interval:5}") int progressInterval) {
        this.imageCodec = imageCodec;
        this.normalizer = normalizer;
        this.statistics = statistics;
        this.storage = storage;
        this.progressInterval = Math.max(1, progressInterval);
    }

    BatchOutcome run(List<StagedImage> batch, TargetFormat targetFormat, ProgressListener listener) {
        long start = System.nanoTime();
        BatchAccumulator accumulator = new BatchAccumulator(batch.size(), listener, progressInterval);
        log.info("Converting {} images to {}", batch.size(), targetFormat);

        try {
            for (int i = 0; i < batch.size(); i++) {
                StagedImage item = batch.get(i);
                try {
                    convertItem(item, targetFormat, accumulator);
                } finally {
                    item.deleteSilently();
                }
                accumulator.itemFinished(i == batch.size() - 1);
            }
        } catch (RuntimeException ex) {
            log.error("Batch conversion to {} aborted after {} results: {}", targetFormat,
                    accumulator.results.size(), ex.getMessage());
            accumulator.results.forEach(ConversionResult::deleteSilently);
            throw ex;
        }

        BatchOutcome outcome = accumulator.toOutcome(Duration.ofNanos(System.nanoTime() - start));
        log.info("Completed conversion to {} processed={}/{} failed={} skipped={} bytes={}->{} durationMs={}",
                targetFormat, outcome.processedCount(), outcome.totalCount(), outcome.failedCount(),
                outcome.skippedCount(), outcome.totalOriginalBytes(), outcome.totalConvertedBytes(),
                outcome.elapsed().toMillis());
        return outcome;
    }

    private void convertItem(StagedImage item, TargetFormat targetFormat, BatchAccumulator accumulator) {
        log.info("Processing file: {} (original: {})", item.storageRef(), item.originalName());
        if (!item.isReadable()) {
            log.error("File {} does not exist. Skipping.", item.storageRef());
            accumulator.skipped();
            return;
        }

        Path output = null;
        try {
            long originalSize = item.size();
            if (originalSize == 0) {
                log.warn("File {} is empty. Skipping.", item.storageRef());
                accumulator.skipped();
                return;
            }

            DecodedImage decoded = imageCodec.decode(item.storageRef());
            BufferedImage normalized = normalizer.normalize(decoded.image(), targetFormat);
            String archiveName = outputName(item.originalName(), targetFormat);

            output = storage.newFile("converted-", targetFormat.extension());
            imageCodec.encode(normalized, targetFormat, output);

            long convertedSize = Files.exists(output) ? Files.size(output) : 0;
            if (convertedSize == 0) {
                throw new ImageEncodeException("Output for %s is missing or empty".formatted(item.originalName()));
            }

            accumulator.converted(new ConversionResult(output, accumulator.uniqueName(archiveName), originalSize,
                    convertedSize));
            output = null;
            statistics.record(originalSize, convertedSize, targetFormat);
            log.debug("Converted {} from {} to {} ({} -> {} bytes)", item.originalName(), decoded.sourceFormat(),
                    targetFormat, originalSize, convertedSize);
        } catch (ImageDecodeException | ImageEncodeException ex) {
            log.error("Error converting image {} (original: {}): {}", item.storageRef(), item.originalName(),
                    ex.getMessage(), ex);
            accumulator.failed(item.originalName());
        } catch (IOException ex) {
            log.error("I/O error converting image {} (original: {}): {}", item.storageRef(), item.originalName(),
                    ex.getMessage(), ex);
            accumulator.failed(item.originalName());
        } finally {
            deletePartialOutput(output);
        }
    }

    static String outputName(String originalName, TargetFormat targetFormat) {
        String base = originalName;
        int dot = originalName.lastIndexOf('.');
        if (dot > 0) {
            base = originalName.substring(0, dot);
        }
        return base + targetFormat.extension();
    }

    private static void deletePartialOutput(Path output) {
        if (output == null) {
            return;
        }
        try {
            Files.deleteIfExists(output);
        } catch (IOException ex) {
            log.warn("Failed to delete partial output {}: {}", output, ex.getMessage());
        }
    }

    private static final class BatchAccumulator {
        private final int total;
        private final ProgressListener listener;
        private final int interval;
        private final List<ConversionResult> results = new ArrayList<>();
        private final Set<String> usedNames = new HashSet<>();

        private int failed;
        private int skipped;
        private long originalBytes;
        private long convertedBytes;
        private boolean reportDue;

        private BatchAccumulator(int total, ProgressListener listener, int interval) {
            this.total = total;
            this.listener = listener;
            this.interval = interval;
        }

        void converted(ConversionResult result) {
            results.add(result);
            originalBytes += result.originalSize();
            convertedBytes += result.convertedSize();
            reportDue = results.size() % interval == 0;
        }

        void failed(String originalName) {
            failed++;
            if (listener != null) {
                listener.onItemFailed(originalName);
            }
        }

        void skipped() {
            skipped++;
        }

        void itemFinished(boolean last) {
            if (listener != null && (reportDue || last)) {
                listener.onProgress(results.size(), total, originalBytes, convertedBytes);
            }
            reportDue = false;
        }

        String uniqueName(String candidate) {
            String name = candidate;
            int dot = candidate.lastIndexOf('.');
            String base = dot > 0 ? candidate.substring(0, dot) : candidate;
            String extension = dot > 0 ? candidate.substring(dot) : "";
            int counter = 2;
            while (!usedNames.add(name.toLowerCase(Locale.ROOT))) {
                name = base + "_" + counter++ + extension;
            }
            return name;
        }

        BatchOutcome toOutcome(Duration elapsed) {
            return new BatchOutcome(results, total, results.size(), failed, skipped, originalBytes, convertedBytes,
                    elapsed);
        }
    }
}
