package com.example.imagebot.conversion.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StatisticsRecord {

    @JsonProperty("total_images")
    private long totalImages;
    @JsonProperty("total_size_original")
    private long totalOriginalBytes;
    @JsonProperty("total_size_converted")
    private long totalConvertedBytes;
    @JsonProperty("conversions_by_format")
    private Map<String, Long> byFormat = new LinkedHashMap<>();
    @JsonProperty("daily_stats")
    private Map<String, PeriodCounters> byDay = new TreeMap<>();
    @JsonProperty("monthly_stats")
    private Map<String, PeriodCounters> byMonth = new TreeMap<>();

    public void apply(String format, String day, String month, long originalSize, long convertedSize) {
        totalImages++;
        totalOriginalBytes += originalSize;
        totalConvertedBytes += convertedSize;
        byFormat.merge(format, 1L, Long::sum);
        byDay.computeIfAbsent(day, key -> new PeriodCounters()).add(originalSize, convertedSize);
        byMonth.computeIfAbsent(month, key -> new PeriodCounters()).add(originalSize, convertedSize);
    }

    public StatisticsRecord copy() {
        StatisticsRecord copy = new StatisticsRecord();
        copy.totalImages = totalImages;
        copy.totalOriginalBytes = totalOriginalBytes;
        copy.totalConvertedBytes = totalConvertedBytes;
        copy.byFormat = new LinkedHashMap<>(byFormat);
        copy.byDay = copyPeriods(byDay);
        copy.byMonth = copyPeriods(byMonth);
        return copy;
    }

    private static Map<String, PeriodCounters> copyPeriods(Map<String, PeriodCounters> source) {
        Map<String, PeriodCounters> copy = new TreeMap<>();
        source.forEach((key, counters) -> copy.put(key, new PeriodCounters(counters)));
        return copy;
    }
}
