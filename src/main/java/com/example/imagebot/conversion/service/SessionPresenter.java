package com.example.imagebot.conversion.service;

import com.example.imagebot.conversion.model.BatchOutcome;
import com.example.imagebot.conversion.model.FormatChoice;
import com.example.imagebot.conversion.model.StagedImage;
import com.example.imagebot.conversion.model.StatisticsView;
import com.example.imagebot.conversion.model.TargetFormat;
import com.example.imagebot.conversion.support.ImageCodec;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

@Slf4j
@Component
public class SessionPresenter {

    private static final String[] SIZE_UNITS = { "B", "KB", "MB", "GB" };
    private static final int CHOICES_PER_ROW = 2;

    private final ImageCodec imageCodec;
    private final DataSize maxFileSize;
    private final int maxBatchSize;

    public SessionPresenter(ImageCodec imageCodec,
            @Value("${app.conversion.max-file-size:20MB}") DataSize maxFileSize,
            @Value("${app.conversion.max-batch-size:50}") int maxBatchSize) {
        this.imageCodec = imageCodec;
        this.maxFileSize = maxFileSize;
        this.maxBatchSize = maxBatchSize;
    }

    public String welcomeText() {
        return """
                👋 Welcome to the Image Format Changer Bot!

                You can:
                1. Send me any image or multiple images
                2. Send a ZIP file containing images
                I'll detect the format and provide conversion options.

                Try sending an image now! 📸""";
    }

    public String helpText() {
        String formats = Arrays.stream(TargetFormat.values())
                .map(TargetFormat::name)
                .collect(Collectors.joining(", "));
        return """
                🔍 Here's how to use this bot:

                1. Send any image or multiple images
                2. Or send a ZIP file containing images
                3. I'll detect the format automatically
                4. Choose the desired format from the inline buttons
                5. I'll convert and send back your image(s) in a ZIP file.

                Supported formats: %s

                Maximum file size: %dMB
                Maximum batch size: %d images""".formatted(formats, maxFileSize.toMegabytes(), maxBatchSize);
    }

    public String statusText(List<StagedImage> pending) {
        Map<String, Integer> formats = new LinkedHashMap<>();
        long totalSize = 0;
        for (StagedImage image : pending) {
            if (!image.isReadable()) {
                log.warn("File {} not found while summarising session. Skipping.", image.storageRef());
                continue;
            }
            try {
                totalSize += image.size();
            } catch (IOException ex) {
                log.error("Error reading image {}: {}", image.storageRef(), ex.getMessage());
                continue;
            }
            String format = imageCodec.detectFormat(image.storageRef()).orElse("Unknown");
            formats.merge(format, 1, Integer::sum);
        }

        List<String> lines = new ArrayList<>();
        lines.add("📸 Total images: %d (%s)".formatted(pending.size(), formatSize(totalSize)));
        if (formats.isEmpty()) {
            lines.add("- No image formats detected yet (or files are not images).");
        } else {
            formats.forEach((format, count) ->
                    lines.add("- %s: %d image%s".formatted(format, count, count > 1 ? "s" : "")));
        }
        return String.join("\n", lines) + "\n\nSelect the format to convert all images:";
    }

    public List<List<FormatChoice>> formatChoices() {
        List<List<FormatChoice>> rows = new ArrayList<>();
        List<FormatChoice> row = new ArrayList<>();
        for (TargetFormat format : TargetFormat.values()) {
            row.add(FormatChoice.of(format));
            if (row.size() == CHOICES_PER_ROW) {
                rows.add(List.copyOf(row));
                row.clear();
            }
        }
        if (!row.isEmpty()) {
            rows.add(List.copyOf(row));
        }
        return List.copyOf(rows);
    }

    public String preparingText(int count, TargetFormat format) {
        return "Preparing to convert %d images to %s...".formatted(count, format);
    }

    public String progressText(int converted, int total, long originalBytes, long convertedBytes) {
        return "Converting... %d/%d images processed.\nTotal size so far: %s → %s".formatted(converted, total,
                formatSize(originalBytes), formatSize(convertedBytes));
    }

    public String unavailableFormatText(TargetFormat format) {
        return "%s encoding is unavailable right now. Please choose another format.".formatted(format);
    }

    public String itemFailedText(String originalName) {
        return "⚠️ Error converting %s. Skipping it.".formatted(originalName);
    }

    public String captionText(int converted, TargetFormat format) {
        return "Converted %d images to %s.".formatted(converted, format);
    }

    public String summaryText(BatchOutcome outcome) {
        return String.format(Locale.ROOT, """
                ✅ Batch conversion completed!
                - Processed: %d/%d images
                - Original total size: %s
                - Converted total size: %s
                - Space saved: %s (%.1f%%)
                - Time taken: %.1f seconds""",
                outcome.processedCount(), outcome.totalCount(),
                formatSize(outcome.totalOriginalBytes()),
                formatSize(outcome.totalConvertedBytes()),
                formatSize(outcome.savedBytes()),
                outcome.sizeReductionPercent(),
                outcome.elapsed().toMillis() / 1000.0);
    }

    public String statisticsText(StatisticsView view) {
        return switch (view.scope()) {
            case TODAY -> periodText("📊 Today's Statistics:", view);
            case MONTH -> periodText("📊 This Month's Statistics:", view);
            case ALL -> allTimeText(view);
        };
    }

    public static String formatSize(long bytes) {
        double size = bytes;
        int unit = 0;
        while (size >= 1024 && unit < SIZE_UNITS.length - 1) {
            size /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", size, SIZE_UNITS[unit]);
    }

    private static String periodText(String title, StatisticsView view) {
        return """
                %s
                Images processed: %d
                Original size: %s
                Converted size: %s
                Space saved: %s""".formatted(title, view.images(), formatSize(view.originalBytes()),
                formatSize(view.convertedBytes()), formatSize(view.savedBytes()));
    }

    private static String allTimeText(StatisticsView view) {
        String formats = view.byFormat().entrySet().stream()
                .map(entry -> "- %s: %d images".formatted(entry.getKey(), entry.getValue()))
                .collect(Collectors.joining("\n"));
        return """
                📊 Overall Statistics:
                Total images processed: %d
                Total original size: %s
                Total converted size: %s
                Total space saved: %s

                Conversions by format:
                %s""".formatted(view.images(), formatSize(view.originalBytes()),
                formatSize(view.convertedBytes()), formatSize(view.savedBytes()), formats);
    }
}
