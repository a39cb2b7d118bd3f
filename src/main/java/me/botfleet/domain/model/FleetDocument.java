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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The single persisted document: credential table, instance table and custom
 * template table. Persisted to {@code fleet/fleet-config.json} via StoragePort.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FleetDocument {

    @Builder.Default
    private String version = "1";

    @Builder.Default
    private List<CredentialRecord> credentials = new ArrayList<>();

    @Builder.Default
    private List<InstanceConfig> instances = new ArrayList<>();

    @Builder.Default
    private Map<String, Template> templates = new LinkedHashMap<>();

    public Optional<InstanceConfig> findInstance(String id) {
        return instances.stream().filter(instance -> instance.getId().equals(id)).findFirst();
    }

    public Optional<CredentialRecord> findCredential(String id) {
        return credentials.stream().filter(credential -> credential.getId().equals(id)).findFirst();
    }

    public Map<String, InstanceConfig> instancesById() {
        Map<String, InstanceConfig> byId = new LinkedHashMap<>();
        for (InstanceConfig instance : instances) {
            byId.put(instance.getId(), instance);
        }
        return byId;
    }
}
