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

import lombok.extern.slf4j.Slf4j;
import me.botfleet.domain.model.InstanceTransition;
import me.botfleet.infrastructure.event.SpringEventBus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Broadcasts lifecycle transitions.
 *
 * <p>
 * External subscribers (WebSocket clients) get at-most-once delivery with no
 * replay: a subscriber that connects late or falls behind reconciles against
 * the instance list. In-process listeners receive every transition as a Spring
 * event.
 */
@Service
@Slf4j
public class StatusBus {

    private final SpringEventBus eventBus;
    private final Sinks.Many<InstanceTransition> sink = Sinks.many().multicast().directBestEffort();

    public StatusBus(SpringEventBus eventBus) {
        this.eventBus = eventBus;
    }

    public void publish(InstanceTransition transition) {
        log.info("[Status] {}: {} -> {}{}", transition.instanceId(), transition.oldState(), transition.newState(),
                transition.reason() != null ? " (" + transition.reason() + ")" : "");
        Sinks.EmitResult result = sink.tryEmitNext(transition);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("[Status] Dropped transition for {}: {}", transition.instanceId(), result);
        }
        eventBus.publish(transition);
    }

    public Flux<InstanceTransition> stream() {
        return sink.asFlux();
    }

    public int subscriberCount() {
        return sink.currentSubscriberCount();
    }
}
