package me.botfleet.infrastructure.config;

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
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools of the orchestrator.
 *
 * <p>
 * The loop scheduler is single-threaded and owns all registry state; the I/O
 * pool runs blocking knowledge-store calls so the loop never waits on disk.
 */
@Component
@Slf4j
public class FleetExecutors {

    private final ScheduledExecutorService loop;
    private final ExecutorService io;

    public FleetExecutors(FleetProperties properties) {
        this.loop = Executors.newSingleThreadScheduledExecutor(daemonFactory("fleet-orchestrator", false));
        this.io = Executors.newFixedThreadPool(Math.max(1, properties.getOrchestrator().getIoThreads()),
                daemonFactory("fleet-io", true));
    }

    public ScheduledExecutorService loop() {
        return loop;
    }

    public ExecutorService io() {
        return io;
    }

    @PreDestroy
    public void shutdown() {
        loop.shutdown();
        io.shutdown();
        try {
            if (!loop.awaitTermination(5, TimeUnit.SECONDS)) {
                loop.shutdownNow();
            }
            if (!io.awaitTermination(5, TimeUnit.SECONDS)) {
                io.shutdownNow();
            }
        } catch (InterruptedException e) {
            loop.shutdownNow();
            io.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("[Orchestrator] Executors stopped");
    }

    private static ThreadFactory daemonFactory(String prefix, boolean numbered) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            String name = numbered ? prefix + "-" + counter.incrementAndGet() : prefix;
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
