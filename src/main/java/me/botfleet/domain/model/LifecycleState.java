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

import java.util.EnumSet;
import java.util.Set;

/**
 * Observed lifecycle state of a bot instance.
 *
 * <pre>
 * STOPPED → STARTING → RUNNING → STOPPING → STOPPED
 *              ↓          ↓
 *            ERROR ←──────┘
 * ERROR → STARTING
 * </pre>
 */
public enum LifecycleState {

    STOPPED, STARTING, RUNNING, STOPPING, ERROR;

    /**
     * Whether the state machine allows moving from this state to {@code next}.
     */
    public boolean canTransitionTo(LifecycleState next) {
        return allowedNext().contains(next);
    }

    /**
     * Whether a live task backs this state.
     */
    public boolean isLive() {
        return this == STARTING || this == RUNNING || this == STOPPING;
    }

    private Set<LifecycleState> allowedNext() {
        switch (this) {
        case STOPPED:
        case ERROR:
            return EnumSet.of(STARTING);
        case STARTING:
            return EnumSet.of(RUNNING, ERROR);
        case RUNNING:
            return EnumSet.of(STOPPING, ERROR);
        case STOPPING:
            return EnumSet.of(STOPPED);
        default:
            return EnumSet.noneOf(LifecycleState.class);
        }
    }
}
