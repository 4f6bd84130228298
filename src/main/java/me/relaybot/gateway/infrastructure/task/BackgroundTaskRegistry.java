package me.relaybot.gateway.infrastructure.task;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs fire-and-forget work off the caller's thread and keeps a handle on every
 * pending task so shutdown can cancel what is still running.
 */
@Component
@Slf4j
public class BackgroundTaskRegistry {

    private final ExecutorService executor;
    private final Set<CompletableFuture<?>> pending = ConcurrentHashMap.newKeySet();

    @Autowired
    public BackgroundTaskRegistry() {
        this(Executors.newCachedThreadPool(new NamedThreadFactory("background-task")));
    }

    // Visible for testing
    public BackgroundTaskRegistry(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Submit a task. Failures are logged with the task name and never reach the
     * submitter.
     */
    public CompletableFuture<Void> submit(String name, Runnable task) {
        CompletableFuture<Void> future = CompletableFuture.runAsync(task, executor);
        pending.add(future);
        future.whenComplete((ignored, error) -> {
            pending.remove(future);
            if (error != null) {
                log.warn("[Background] Task '{}' failed: {}", name, error.getMessage());
            }
        });
        return future;
    }

    public int pendingCount() {
        return pending.size();
    }

    @PreDestroy
    public void shutdown() {
        int cancelled = 0;
        for (CompletableFuture<?> future : pending) {
            if (future.cancel(true)) {
                cancelled++;
            }
        }
        pending.clear();
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("[Background] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (cancelled > 0) {
            log.info("[Background] Cancelled {} pending task(s)", cancelled);
        }
    }

    /**
     * Daemon thread factory with sequential names.
     */
    public static class NamedThreadFactory implements java.util.concurrent.ThreadFactory {

        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        public NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
