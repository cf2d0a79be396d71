package com.example.imagebot.conversion.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.imagebot.conversion.transport.ChatUpdateDispatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConversionExecutorConfigurationTest {

    private final ExecutorService executor = new ConversionExecutorConfiguration().chatUpdateExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void longRunningChatsDoNotStallOtherChats() throws Exception {
        ChatUpdateDispatcher dispatcher = new ChatUpdateDispatcher(executor);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch busyStarted = new CountDownLatch(12);
        List<CompletableFuture<Void>> busy = new ArrayList<>();
        for (long chatId = 1; chatId <= 12; chatId++) {
            busy.add(dispatcher.submit(chatId, () -> {
                busyStarted.countDown();
                awaitQuietly(release);
            }));
        }

        assertThat(busyStarted.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<Void> quick = dispatcher.submit(99L, () -> { });
        quick.get(5, TimeUnit.SECONDS);

        release.countDown();
        CompletableFuture.allOf(busy.toArray(CompletableFuture[]::new)).get(10, TimeUnit.SECONDS);
    }

    @Test
    void workerThreadsAreNamedDaemons() throws Exception {
        Thread worker = executor.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

        assertThat(worker.getName()).startsWith("chat-");
        assertThat(worker.isDaemon()).isTrue();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
