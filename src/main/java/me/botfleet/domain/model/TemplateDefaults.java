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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copy of a template's default fields taken when an instance is created. Later
 * template edits do not touch this snapshot.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TemplateDefaults {

    private String personality;

    @Builder.Default
    private boolean loadEmbedder = true;

    @Builder.Default
    private Map<String, Boolean> features = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> settings = new LinkedHashMap<>();

    public static TemplateDefaults from(Template template) {
        return TemplateDefaults.builder()
                .personality(template.getPersonality())
                .loadEmbedder(template.isLoadEmbedder())
                .features(template.getFeatures() != null ? new LinkedHashMap<>(template.getFeatures())
                        : new LinkedHashMap<>())
                .settings(template.getSettings() != null ? new LinkedHashMap<>(template.getSettings())
                        : new LinkedHashMap<>())
                .build();
    }
}
