package me.botfleet.port.outbound;

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

import me.botfleet.domain.model.BehaviorDescriptor;

import java.util.Set;

/**
 * Port to the personality engine. Read-only from the orchestrator's point of
 * view and cheap enough to call on the orchestrator thread.
 */
public interface PersonalityPort {

    /**
     * Describes how the instance {@code identity} should behave.
     *
     * @param personalityOverride
     *            forced personality id, or {@code null} for the engine's
     *            adaptive default
     */
    BehaviorDescriptor describe(String identity, String personalityOverride);

    /**
     * Whether {@code personalityId} names a personality this engine can
     * describe.
     */
    boolean isKnown(String personalityId);

    Set<String> availablePersonalities();
}
