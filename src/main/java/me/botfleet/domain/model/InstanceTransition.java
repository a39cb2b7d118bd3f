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

package me.botfleet.domain.model;

import java.time.Instant;

/**
 * Lifecycle transition pushed on the status bus.
 *
 * @param reason
 *            failure message for transitions into {@link LifecycleState#ERROR},
 *            otherwise null
 * @param crash
 *            true when a running task faulted, as opposed to a failed connect
 */
public record InstanceTransition(String instanceId, LifecycleState oldState, LifecycleState newState,
        Instant timestamp, String reason, boolean crash) {

    public static InstanceTransition of(String instanceId, LifecycleState oldState, LifecycleState newState,
            Instant timestamp) {
        return new InstanceTransition(instanceId, oldState, newState, timestamp, null, false);
    }

    public boolean crashedWhileRunning() {
        return crash && newState == LifecycleState.ERROR;
    }
}
