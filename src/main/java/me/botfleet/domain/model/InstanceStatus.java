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

import lombok.Builder;

import java.time.Instant;

/**
 * Observed status of an instance, derived from the live registry.
 */
@Builder(toBuilder = true)
public record InstanceStatus(
        String id,
        String displayName,
        LifecycleState state,
        String taskId,
        String lastError,
        Instant startedAt,
        Instant heartbeatAt,
        boolean heartbeatStale,
        String isolationPath,
        String personality,
        DesiredState desiredState,
        boolean autoStart) {

    public boolean hasLiveTask() {
        return state != null && state.isLive();
    }
}
