package me.botfleet.reload;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.botfleet.domain.service.FleetConfigService;
import me.botfleet.infrastructure.config.FleetProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Polls the persisted fleet document and hands external edits to
 * {@link FleetConfigService#reloadIfChanged()}. Writes made by the service
 * itself are recognized by their fingerprint and ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FleetConfigWatcher {

    private final FleetConfigService fleetConfigService;
    private final FleetProperties properties;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pollTask;

    @PostConstruct
    public void init() {
        FleetProperties.ReloadProperties reload = properties.getReload();
        if (!reload.isEnabled()) {
            log.info("[ConfigWatcher] Config reload disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "fleet-config-watcher");
            t.setDaemon(true);
            return t;
        });

        long intervalMillis = Math.max(100, reload.getPollInterval().toMillis());
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, intervalMillis, intervalMillis,
                TimeUnit.MILLISECONDS);
        log.info("[ConfigWatcher] Watching fleet document every {}ms", intervalMillis);
    }

    /**
     * One poll cycle. Errors are logged and the next cycle runs as usual.
     */
    public void poll() {
        try {
            if (fleetConfigService.reloadIfChanged()) {
                log.info("[ConfigWatcher] Fleet document change applied");
            }
        } catch (RuntimeException e) {
            log.warn("[ConfigWatcher] Poll failed: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (pollTask != null) {
            pollTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[ConfigWatcher] Shut down");
    }
}
