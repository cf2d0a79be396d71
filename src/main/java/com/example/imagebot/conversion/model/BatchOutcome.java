package com.example.imagebot.conversion.model;

import java.time.Duration;
import java.util.List;

public record BatchOutcome(
        List<ConversionResult> results,
        int totalCount,
        int processedCount,
        int failedCount,
        int skippedCount,
        long totalOriginalBytes,
        long totalConvertedBytes,
        Duration elapsed) {

    public BatchOutcome {
        results = List.copyOf(results);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public long savedBytes() {
        return totalOriginalBytes - totalConvertedBytes;
    }

    public double sizeReductionPercent() {
        if (totalOriginalBytes <= 0) {
            return 0;
        }
        return (double) savedBytes() / totalOriginalBytes * 100;
    }
}
