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

import java.util.List;
import java.util.Map;

/**
 * Read-only personality description handed to the chat gateway, together with
 * the instance's template defaults ({@code loadEmbedder}, {@code features},
 * {@code settings}).
 */
@Builder(toBuilder = true)
public record BehaviorDescriptor(
        String identity,
        String personalityId,
        String displayName,
        String baseContext,
        List<String> catchphrases,
        Map<String, String> traits,
        boolean adaptive,
        boolean loadEmbedder,
        Map<String, Boolean> features,
        Map<String, String> settings) {

    public boolean featureEnabled(String feature) {
        return features != null && Boolean.TRUE.equals(features.get(feature));
    }

    public String setting(String key) {
        return settings != null ? settings.get(key) : null;
    }
}
