package me.botfleet.supervision;

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

import lombok.extern.slf4j.Slf4j;
import me.botfleet.domain.model.InstanceStopRequestedEvent;
import me.botfleet.domain.model.InstanceTransition;
import me.botfleet.domain.model.LifecycleState;
import me.botfleet.domain.service.InstanceOrchestrator;
import me.botfleet.infrastructure.config.FleetExecutors;
import me.botfleet.infrastructure.config.FleetProperties;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Optional restart of instances that crashed while running.
 *
 * <p>
 * Disabled unless {@code fleet.supervision.auto-restart.enabled=true}. Each
 * instance gets at most {@code max-attempts} restarts; the counter resets once
 * the instance is stopped on purpose. A stop or delete request cancels a
 * restart that is still waiting for its delay, and the orchestrator skips a
 * restart that fires after the instance is no longer wanted.
 */
@Component
@Slf4j
public class CrashRestartPolicy {

    private final InstanceOrchestrator orchestrator;
    private final FleetExecutors executors;
    private final FleetProperties.AutoRestartProperties settings;
    private final Map<String, Integer> attempts = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> scheduled = new ConcurrentHashMap<>();

    public CrashRestartPolicy(InstanceOrchestrator orchestrator, FleetExecutors executors,
            FleetProperties properties) {
        this.orchestrator = orchestrator;
        this.executors = executors;
        this.settings = properties.getSupervision().getAutoRestart();
    }

    @EventListener
    public void onTransition(InstanceTransition transition) {
        if (transition.newState() == LifecycleState.STOPPED) {
            attempts.remove(transition.instanceId());
            return;
        }
        if (!settings.isEnabled() || !transition.crashedWhileRunning()) {
            return;
        }

        String id = transition.instanceId();
        int attempt = attempts.merge(id, 1, Integer::sum);
        if (attempt > settings.getMaxAttempts()) {
            log.warn("[Supervisor] {} crashed again, giving up after {} restart(s)", id, settings.getMaxAttempts());
            return;
        }

        long delayMillis = settings.getDelay().toMillis();
        log.info("[Supervisor] {} crashed, restart {}/{} in {}ms", id, attempt, settings.getMaxAttempts(),
                delayMillis);
        ScheduledFuture<?> restart = executors.loop().schedule(() -> {
            scheduled.remove(id);
            orchestrator.restartAfterCrash(id).whenComplete((status, error) -> {
                if (error != null) {
                    log.warn("[Supervisor] Restart of {} failed: {}", id, error.getMessage());
                }
            });
        }, delayMillis, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = scheduled.put(id, restart);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    @EventListener
    public void onStopRequested(InstanceStopRequestedEvent event) {
        String id = event.instanceId();
        attempts.remove(id);
        ScheduledFuture<?> pending = scheduled.remove(id);
        if (pending != null && pending.cancel(false)) {
            log.info("[Supervisor] Cancelled pending restart of {}", id);
        }
    }

    public int attemptsFor(String instanceId) {
        return attempts.getOrDefault(instanceId, 0);
    }

    public boolean hasPendingRestart(String instanceId) {
        return scheduled.containsKey(instanceId);
    }
}
