package com.example.imagebot.conversion.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class ConversionExecutorConfiguration {

    // One thread per busy chat; concurrent conversions are capped separately by BatchConversionService.
    @Bean(destroyMethod = "shutdown")
    public ExecutorService chatUpdateExecutor() {
        log.info("Creating chat update executor");
        return Executors.newCachedThreadPool(namedThreadFactory("chat-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
