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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.botfleet.domain.model.CredentialRecord;
import me.botfleet.domain.model.DesiredState;
import me.botfleet.domain.model.FleetConfigReloadedEvent;
import me.botfleet.domain.model.FleetDocument;
import me.botfleet.domain.model.InstanceConfig;
import me.botfleet.domain.model.Secret;
import me.botfleet.domain.model.Template;
import me.botfleet.domain.model.TemplateDefaults;
import me.botfleet.infrastructure.event.SpringEventBus;
import me.botfleet.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Owner of the persisted fleet document ({@code fleet/fleet-config.json}).
 *
 * <p>
 * Readers always receive deep copies. Writers go through
 * {@link #update(Consumer)}: the mutation is applied to a copy, validated,
 * swapped in and persisted. Persistence is asynchronous but ordered, so the
 * file always converges to the latest in-memory document.
 *
 * <p>
 * External replacements (file edit picked up by {@link #reloadIfChanged()} or
 * {@link #importDocument(FleetDocument)}) publish a
 * {@link FleetConfigReloadedEvent} for the orchestrator to reconcile.
 *
 * <p>
 * The lock only guards in-memory work. The document is loaded at startup and
 * disk reads for reload happen outside the lock, so callers on the
 * orchestrator thread never wait on storage.
 */
@Service
@Slf4j
public class FleetConfigService {

    static final String FLEET_DIR = "fleet";
    static final String CONFIG_FILE = "fleet-config.json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final SpringEventBus eventBus;

    private final Object lock = new Object();
    private FleetDocument document;
    private String lastFingerprint;
    private CompletableFuture<Void> persistChain = CompletableFuture.completedFuture(null);

    public FleetConfigService(StoragePort storagePort, ObjectMapper objectMapper, SpringEventBus eventBus) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.eventBus = eventBus;
    }

    @PostConstruct
    public void init() {
        synchronized (lock) {
            loaded();
        }
    }

    /**
     * Deep copy of the current document.
     */
    public FleetDocument getDocument() {
        synchronized (lock) {
            return copy(loaded());
        }
    }

    public Optional<InstanceConfig> findInstance(String id) {
        synchronized (lock) {
            return loaded().findInstance(id).map(this::copyInstance);
        }
    }

    public List<InstanceConfig> getInstances() {
        return getDocument().getInstances();
    }

    /**
     * Applies {@code mutator} to a copy of the document and makes it current.
     * An exception from the mutator or from validation leaves the document
     * unchanged.
     *
     * @return copy of the updated document
     */
    public FleetDocument update(Consumer<FleetDocument> mutator) {
        synchronized (lock) {
            FleetDocument working = copy(loaded());
            mutator.accept(working);
            normalize(working);
            validate(working);
            document = working;
            persist(working);
            return copy(working);
        }
    }

    /**
     * Reads the persisted file and, when its content differs from what this
     * service last wrote or loaded, replaces the document and publishes a
     * reload event.
     *
     * @return true if a reload was published
     */
    public boolean reloadIfChanged() {
        init();
        CompletableFuture<Void> written = flush();
        written.join();
        String json = storagePort.getText(FLEET_DIR, CONFIG_FILE).join();
        if (json == null || json.isBlank()) {
            return false;
        }
        String fingerprint = fingerprint(json);

        FleetConfigReloadedEvent event;
        synchronized (lock) {
            if (persistChain != written) {
                // a write started after the read; the next poll sees its result
                return false;
            }
            if (fingerprint.equals(lastFingerprint)) {
                return false;
            }
            lastFingerprint = fingerprint;

            FleetDocument incoming;
            try {
                incoming = objectMapper.readValue(json, FleetDocument.class);
                normalize(incoming);
                validate(incoming);
            } catch (IOException | IllegalArgumentException e) {
                log.error("[FleetConfig] Ignoring invalid fleet document on disk: {}", e.getMessage());
                return false;
            }

            FleetDocument previous = document;
            document = incoming;
            event = new FleetConfigReloadedEvent(copy(previous), copy(incoming));
            log.info("[FleetConfig] Reloaded fleet document from disk ({} instances)",
                    incoming.getInstances().size());
        }
        eventBus.publish(event);
        return true;
    }

    /**
     * Replaces the whole document. Credentials arriving without a secret value
     * (a redacted export) keep the secret already stored under the same id.
     */
    public FleetDocument importDocument(FleetDocument incoming) {
        if (incoming == null) {
            throw new IllegalArgumentException("Import document is required");
        }
        FleetConfigReloadedEvent event;
        FleetDocument result;
        synchronized (lock) {
            FleetDocument previous = loaded();
            FleetDocument working = copy(incoming);
            normalize(working);
            for (CredentialRecord credential : working.getCredentials()) {
                Secret existing = previous.findCredential(credential.getId())
                        .map(CredentialRecord::getSecret)
                        .orElse(null);
                credential.setSecret(Secret.merge(existing, credential.getSecret()));
            }
            validate(working);
            document = working;
            persist(working);
            result = copy(working);
            event = new FleetConfigReloadedEvent(copy(previous), copy(working));
            log.info("[FleetConfig] Imported fleet document ({} instances, {} credentials)",
                    working.getInstances().size(), working.getCredentials().size());
        }
        eventBus.publish(event);
        return result;
    }

    /**
     * Copy of the document with every secret redacted.
     */
    public FleetDocument exportDocument() {
        FleetDocument export = getDocument();
        for (CredentialRecord credential : export.getCredentials()) {
            credential.setSecret(Secret.redacted(credential.getSecret()));
        }
        return export;
    }

    /**
     * Completes when every persist requested so far has reached the storage.
     */
    public CompletableFuture<Void> flush() {
        synchronized (lock) {
            return persistChain;
        }
    }

    static String fingerprint(String json) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(json.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ==================== internals ====================

    private FleetDocument loaded() {
        if (document == null) {
            document = loadOrCreate();
        }
        return document;
    }

    private FleetDocument loadOrCreate() {
        try {
            String json = storagePort.getText(FLEET_DIR, CONFIG_FILE).join();
            if (json != null && !json.isBlank()) {
                FleetDocument loaded = objectMapper.readValue(json, FleetDocument.class);
                normalize(loaded);
                validate(loaded);
                lastFingerprint = fingerprint(json);
                log.info("[FleetConfig] Loaded fleet document: {} instances, {} credentials, {} custom templates",
                        loaded.getInstances().size(), loaded.getCredentials().size(), loaded.getTemplates().size());
                return loaded;
            }
        } catch (IOException | RuntimeException e) { // NOSONAR
            log.warn("[FleetConfig] Could not load fleet document, starting empty: {}", e.getMessage());
        }

        FleetDocument empty = FleetDocument.builder().build();
        persist(empty);
        log.info("[FleetConfig] Created empty fleet document");
        return empty;
    }

    private void persist(FleetDocument snapshot) {
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize fleet document", e);
        }
        lastFingerprint = fingerprint(json);
        persistChain = persistChain
                .thenCompose(ignored -> storagePort.putTextAtomic(FLEET_DIR, CONFIG_FILE, json, true))
                .exceptionally(error -> {
                    log.error("[FleetConfig] Failed to persist fleet document", error);
                    return null;
                });
    }

    private void normalize(FleetDocument doc) {
        if (doc.getCredentials() == null) {
            doc.setCredentials(new ArrayList<>());
        }
        if (doc.getInstances() == null) {
            doc.setInstances(new ArrayList<>());
        }
        if (doc.getTemplates() == null) {
            doc.setTemplates(new LinkedHashMap<>());
        }
        doc.getTemplates().values().removeIf(template -> template == null || template.isBuiltin());
        for (var entry : doc.getTemplates().entrySet()) {
            Template template = entry.getValue();
            if (template.getId() == null) {
                template.setId(entry.getKey());
            }
        }
        for (InstanceConfig instance : doc.getInstances()) {
            if (instance.getDefaults() == null) {
                instance.setDefaults(new TemplateDefaults());
            }
            if (instance.getDesiredState() == null) {
                instance.setDesiredState(DesiredState.STOPPED);
            }
        }
    }

    private void validate(FleetDocument doc) {
        Set<String> ids = new HashSet<>();
        for (InstanceConfig instance : doc.getInstances()) {
            if (instance.getId() == null || instance.getId().isBlank()) {
                throw new IllegalArgumentException("Instance id is required");
            }
            if (!ids.add(instance.getId())) {
                throw new IllegalArgumentException("Duplicate instance id '" + instance.getId() + "'");
            }
        }
        Set<String> credentialIds = new HashSet<>();
        for (CredentialRecord credential : doc.getCredentials()) {
            if (credential.getId() == null || !credentialIds.add(credential.getId())) {
                throw new IllegalArgumentException("Missing or duplicate credential id '" + credential.getId() + "'");
            }
        }
    }

    private FleetDocument copy(FleetDocument source) {
        try {
            String json = objectMapper.writeValueAsString(source);
            return objectMapper.readValue(json, FleetDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy fleet document", e);
        }
    }

    private InstanceConfig copyInstance(InstanceConfig source) {
        try {
            String json = objectMapper.writeValueAsString(source);
            return objectMapper.readValue(json, InstanceConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy instance config", e);
        }
    }
}
