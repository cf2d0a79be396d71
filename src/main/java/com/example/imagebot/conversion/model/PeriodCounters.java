package com.example.imagebot.conversion.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString
@NoArgsConstructor
public class PeriodCounters {

    private long images;
    @JsonProperty("size_original")
    private long originalBytes;
    @JsonProperty("size_converted")
    private long convertedBytes;

    public PeriodCounters(PeriodCounters other) {
        this.images = other.images;
        this.originalBytes = other.originalBytes;
        this.convertedBytes = other.convertedBytes;
    }

    public void add(long originalSize, long convertedSize) {
        images++;
        originalBytes += originalSize;
        convertedBytes += convertedSize;
    }
}
