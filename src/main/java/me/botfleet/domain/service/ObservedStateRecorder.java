package me.botfleet.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.botfleet.domain.model.InstanceTransition;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes the latest observed state into the persisted instance config for
 * operator display. Nothing reads it back to make lifecycle decisions.
 *
 * <p>
 * Runs on the publishing thread. Transitions are published in order from the
 * orchestrator thread, so the last write is always the latest state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ObservedStateRecorder {

    private final FleetConfigService fleetConfigService;

    @EventListener
    public void onTransition(InstanceTransition transition) {
        try {
            fleetConfigService.update(doc -> doc.findInstance(transition.instanceId())
                    .ifPresent(instance -> instance.setLastObservedState(transition.newState())));
        } catch (RuntimeException e) {
            log.warn("[FleetConfig] Failed to record observed state for {}: {}", transition.instanceId(),
                    e.getMessage());
        }
    }
}
