package com.example.imagebot.conversion.service;

import com.example.imagebot.conversion.model.PeriodCounters;
import com.example.imagebot.conversion.model.StatisticsRecord;
import com.example.imagebot.conversion.model.StatisticsScope;
import com.example.imagebot.conversion.model.StatisticsView;
import com.example.imagebot.conversion.model.TargetFormat;
import com.example.imagebot.conversion.support.StatisticsPersistenceException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class StatisticsAggregator {

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    private final StatisticsRepository repository;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final StatisticsRecord statistics;

    StatisticsAggregator(StatisticsRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
        this.statistics = repository.load();
    }

    public void record(long originalSize, long convertedSize, TargetFormat format) {
        LocalDate today = LocalDate.now(clock);
        lock.lock();
        try {
            statistics.apply(format.name(), today.format(DAY_FORMAT), today.format(MONTH_FORMAT),
                    originalSize, convertedSize);
            try {
                repository.save(statistics);
            } catch (StatisticsPersistenceException ex) {
                log.error("Error saving statistics: {}", ex.getMessage(), ex);
            }
        } finally {
            lock.unlock();
        }
    }

    public StatisticsView query(StatisticsScope scope) {
        LocalDate today = LocalDate.now(clock);
        lock.lock();
        try {
            return switch (scope) {
                case TODAY -> periodView(scope, today.format(DAY_FORMAT), statistics.getByDay());
                case MONTH -> periodView(scope, today.format(MONTH_FORMAT), statistics.getByMonth());
                case ALL -> new StatisticsView(scope, "all", statistics.getTotalImages(),
                        statistics.getTotalOriginalBytes(), statistics.getTotalConvertedBytes(),
                        statistics.getByFormat());
            };
        } finally {
            lock.unlock();
        }
    }

    StatisticsRecord snapshot() {
        lock.lock();
        try {
            return statistics.copy();
        } finally {
            lock.unlock();
        }
    }

    private static StatisticsView periodView(StatisticsScope scope, String key, Map<String, PeriodCounters> periods) {
        PeriodCounters counters = periods.getOrDefault(key, new PeriodCounters());
        return new StatisticsView(scope, key, counters.getImages(), counters.getOriginalBytes(),
                counters.getConvertedBytes(), Map.of());
    }
}
