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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted configuration of one bot instance.
 *
 * <p>
 * {@code desiredState} and {@code autoStart} are operator intent.
 * {@code lastObservedState} is written for display only and is never used to
 * decide whether an instance is running.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InstanceConfig {

    private String id;
    private String displayName;
    private String templateId;
    private String credentialRef;
    private String personalityOverride;

    private boolean autoStart;

    @Builder.Default
    private DesiredState desiredState = DesiredState.STOPPED;

    private LifecycleState lastObservedState;

    private Instant createdAt;

    @Builder.Default
    private TemplateDefaults defaults = new TemplateDefaults();

    /**
     * Personality after applying the per-instance override on top of the
     * template snapshot.
     */
    public String effectivePersonality() {
        if (personalityOverride != null && !personalityOverride.isBlank()) {
            return personalityOverride;
        }
        return defaults != null ? defaults.getPersonality() : null;
    }

    public Map<String, Boolean> effectiveFeatures() {
        return defaults != null && defaults.getFeatures() != null ? new LinkedHashMap<>(defaults.getFeatures())
                : new LinkedHashMap<>();
    }

    /**
     * Template settings snapshot, copied so callers cannot touch the config.
     */
    public Map<String, String> effectiveSettings() {
        return defaults != null && defaults.getSettings() != null ? new LinkedHashMap<>(defaults.getSettings())
                : new LinkedHashMap<>();
    }

    /**
     * Whether switching from {@code other} to this config moves the instance to
     * a different credential and therefore a different isolation boundary.
     */
    public boolean changesIsolationFrom(InstanceConfig other) {
        return other == null || !Objects.equals(credentialRef, other.credentialRef);
    }

    /**
     * Equality that ignores the display-only observed state.
     */
    public boolean sameIntentAs(InstanceConfig other) {
        if (other == null) {
            return false;
        }
        return toBuilder().lastObservedState(null).build()
                .equals(other.toBuilder().lastObservedState(null).build());
    }
}
