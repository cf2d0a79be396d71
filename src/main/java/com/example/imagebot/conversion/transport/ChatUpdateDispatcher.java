package com.example.imagebot.conversion.transport;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

// Events of one chat run in arrival order; different chats run in parallel.
@Slf4j
@Component
public class ChatUpdateDispatcher {

    private final ExecutorService executor;
    private final Map<Long, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public ChatUpdateDispatcher(ExecutorService chatUpdateExecutor) {
        this.executor = chatUpdateExecutor;
    }

    public CompletableFuture<Void> submit(long chatId, Runnable task) {
        CompletableFuture<Void> next = tails.compute(chatId, (id, tail) -> {
            CompletableFuture<Void> previous = tail == null ? CompletableFuture.completedFuture(null) : tail;
            return previous
                    .handle((ignored, failure) -> null)
                    .thenRunAsync(() -> runGuarded(chatId, task), executor);
        });
        next.whenComplete((ignored, failure) -> tails.remove(chatId, next));
        return next;
    }

    int pendingChats() {
        return tails.size();
    }

    private static void runGuarded(long chatId, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException ex) {
            log.error("Unhandled failure while processing update for chat={}: {}", chatId, ex.getMessage(), ex);
        }
    }
}
