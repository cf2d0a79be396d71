package com.example.imagebot.conversion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record StatisticsView(
        StatisticsScope scope,
        String period,
        long images,
        long originalBytes,
        long convertedBytes,
        Map<String, Long> byFormat) {

    public StatisticsView {
        byFormat = Collections.unmodifiableMap(new LinkedHashMap<>(byFormat));
    }

    public long savedBytes() {
        return originalBytes - convertedBytes;
    }
}
