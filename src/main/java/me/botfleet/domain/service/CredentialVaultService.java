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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.botfleet.domain.model.CredentialRecord;
import me.botfleet.domain.model.FleetDocument;
import me.botfleet.domain.model.InvalidReferenceException;
import me.botfleet.domain.model.Secret;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * Token vault. Bot tokens are stored in the fleet document under generated
 * reference ids; instance configs only ever hold the reference.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialVaultService {

    private final FleetConfigService fleetConfigService;
    private final Clock clock;

    /**
     * Stores a new token and returns its record with the secret redacted.
     */
    public CredentialRecord create(String name, String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Token is required");
        }
        CredentialRecord record = CredentialRecord.builder()
                .id(UUID.randomUUID().toString())
                .name(name != null && !name.isBlank() ? name.trim() : "Discord Token")
                .secret(Secret.of(token.trim()))
                .active(true)
                .createdAt(Instant.now(clock))
                .build();
        fleetConfigService.update(doc -> doc.getCredentials().add(record));
        log.info("[Vault] Stored credential {} ({})", record.getId(), record.getName());
        return redacted(record);
    }

    /**
     * All credentials with secrets redacted.
     */
    public List<CredentialRecord> list() {
        return fleetConfigService.getDocument().getCredentials().stream()
                .map(CredentialVaultService::redacted)
                .toList();
    }

    public CredentialRecord deactivate(String credentialId) {
        FleetDocument updated = fleetConfigService.update(doc -> doc.findCredential(credentialId)
                .orElseThrow(() -> new NoSuchElementException("Credential '" + credentialId + "' not found"))
                .setActive(false));
        log.info("[Vault] Deactivated credential {}", credentialId);
        return redacted(updated.findCredential(credentialId).orElseThrow());
    }

    /**
     * Resolves a reference to the raw token.
     *
     * @throws InvalidReferenceException
     *             if the reference is unknown, inactive or empty
     */
    public String resolve(String credentialId) {
        if (credentialId == null || credentialId.isBlank()) {
            throw new InvalidReferenceException("credential", credentialId, "Credential reference is required");
        }
        CredentialRecord record = fleetConfigService.getDocument().findCredential(credentialId)
                .orElseThrow(() -> InvalidReferenceException.unknown("credential", credentialId));
        if (!record.isActive()) {
            throw new InvalidReferenceException("credential", credentialId,
                    "Credential '" + credentialId + "' is inactive");
        }
        if (!Secret.hasValue(record.getSecret())) {
            throw new InvalidReferenceException("credential", credentialId,
                    "Credential '" + credentialId + "' has no token");
        }
        return record.getSecret().getValue();
    }

    private static CredentialRecord redacted(CredentialRecord record) {
        return record.toBuilder().secret(Secret.redacted(record.getSecret())).build();
    }
}
