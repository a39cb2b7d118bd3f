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

/**
 * Partial change to an instance config. Null fields are left unchanged; an
 * empty {@code personalityOverride} clears the override.
 */
@Builder
public record InstanceUpdate(
        String displayName,
        String templateId,
        String credentialRef,
        String personalityOverride,
        Boolean autoStart) {
}
