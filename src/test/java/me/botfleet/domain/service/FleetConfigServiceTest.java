package me.botfleet.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.botfleet.adapter.outbound.storage.LocalStorageAdapter;
import me.botfleet.domain.model.CredentialRecord;
import me.botfleet.domain.model.FleetConfigReloadedEvent;
import me.botfleet.domain.model.FleetDocument;
import me.botfleet.domain.model.InstanceConfig;
import me.botfleet.domain.model.Secret;
import me.botfleet.domain.model.Template;
import me.botfleet.infrastructure.config.FleetAutoConfiguration;
import me.botfleet.infrastructure.config.FleetProperties;
import me.botfleet.infrastructure.event.SpringEventBus;
import me.botfleet.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FleetConfigServiceTest {

    @TempDir
    Path workspace;

    private ObjectMapper objectMapper;
    private LocalStorageAdapter storage;
    private SpringEventBus eventBus;
    private FleetConfigService service;

    @BeforeEach
    void setUp() {
        FleetProperties properties = new FleetProperties();
        properties.getStorage().setBasePath(workspace.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = FleetAutoConfiguration.objectMapper();
        eventBus = mock(SpringEventBus.class);
        service = new FleetConfigService(storage, objectMapper, eventBus);
    }

    @Test
    void shouldCreateEmptyDocumentOnFirstAccess() {
        FleetDocument document = service.getDocument();
        service.flush().join();

        assertTrue(document.getInstances().isEmpty());
        assertTrue(Files.exists(configFile()));
    }

    @Test
    void shouldPersistUpdatesAtomicallyWithBackup() throws IOException {
        service.update(doc -> doc.getInstances().add(instance("grug-1")));
        service.update(doc -> doc.getInstances().add(instance("grug-2")));
        service.flush().join();

        FleetDocument onDisk = objectMapper.readValue(Files.readString(configFile()), FleetDocument.class);
        assertEquals(List.of("grug-1", "grug-2"), onDisk.getInstances().stream().map(InstanceConfig::getId).toList());
        assertTrue(Files.exists(configFile().resolveSibling("fleet-config.json.bak")));
        assertFalse(Files.exists(configFile().resolveSibling("fleet-config.json.tmp")));
    }

    @Test
    void shouldReturnCopiesThatDoNotLeakIntoState() {
        service.update(doc -> doc.getInstances().add(instance("grug-1")));

        service.getDocument().getInstances().clear();
        service.findInstance("grug-1").orElseThrow().setDisplayName("mutated");

        InstanceConfig stored = service.findInstance("grug-1").orElseThrow();
        assertEquals("grug-1", stored.getDisplayName());
    }

    @Test
    void shouldRejectDuplicateInstanceIdsAndKeepPreviousDocument() {
        service.update(doc -> doc.getInstances().add(instance("grug-1")));

        assertThrows(IllegalArgumentException.class,
                () -> service.update(doc -> doc.getInstances().add(instance("grug-1"))));

        assertEquals(1, service.getInstances().size());
    }

    @Test
    void shouldDropBuiltinTemplatesFromDocument() {
        service.update(doc -> {
            doc.getTemplates().put("pure_grug", Template.builder().id("pure_grug").builtin(true).build());
            doc.getTemplates().put("custom", Template.builder().name("Custom").build());
        });

        FleetDocument document = service.getDocument();
        assertEquals(List.of("custom"), List.copyOf(document.getTemplates().keySet()));
        assertEquals("custom", document.getTemplates().get("custom").getId());
    }

    @Test
    void shouldReloadExternalEditAndPublishEvent() throws IOException {
        service.update(doc -> doc.getInstances().add(instance("grug-1")));
        service.flush().join();
        assertFalse(service.reloadIfChanged());

        FleetDocument edited = service.getDocument();
        edited.getInstances().add(instance("grug-2"));
        Files.writeString(configFile(), objectMapper.writeValueAsString(edited), StandardCharsets.UTF_8);

        assertTrue(service.reloadIfChanged());
        assertFalse(service.reloadIfChanged());

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventBus).publish(captor.capture());
        FleetConfigReloadedEvent event = (FleetConfigReloadedEvent) captor.getValue();
        assertEquals(1, event.previous().getInstances().size());
        assertEquals(2, event.current().getInstances().size());
        assertEquals(2, service.getInstances().size());
    }

    @Test
    void shouldIgnoreInvalidDocumentOnDisk() throws IOException {
        service.update(doc -> doc.getInstances().add(instance("grug-1")));
        service.flush().join();

        Files.writeString(configFile(), "{ not json", StandardCharsets.UTF_8);

        assertFalse(service.reloadIfChanged());
        assertEquals(1, service.getInstances().size());
        verify(eventBus, never()).publish(any());
    }

    @Test
    void shouldLoadDocumentEagerlyOnInit() {
        StoragePort storagePort = mock(StoragePort.class);
        when(storagePort.getText(FleetConfigService.FLEET_DIR, FleetConfigService.CONFIG_FILE))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));
        FleetConfigService eager = new FleetConfigService(storagePort, objectMapper, eventBus);

        eager.init();

        verify(storagePort).getText(FleetConfigService.FLEET_DIR, FleetConfigService.CONFIG_FILE);
        verify(storagePort).putTextAtomic(eq(FleetConfigService.FLEET_DIR), eq(FleetConfigService.CONFIG_FILE),
                anyString(), eq(true));
    }

    @Test
    void shouldServeReadersAndWritersWhileReloadWaitsOnDisk() throws Exception {
        StoragePort storagePort = mock(StoragePort.class);
        CompletableFuture<String> slowRead = new CompletableFuture<>();
        when(storagePort.getText(FleetConfigService.FLEET_DIR, FleetConfigService.CONFIG_FILE))
                .thenReturn(CompletableFuture.<String>completedFuture(null), slowRead);
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));
        FleetConfigService slow = new FleetConfigService(storagePort, objectMapper, eventBus);
        slow.init();

        CompletableFuture<Boolean> reload = CompletableFuture.supplyAsync(slow::reloadIfChanged);
        verify(storagePort, timeout(2000).times(2)).getText(FleetConfigService.FLEET_DIR,
                FleetConfigService.CONFIG_FILE);

        assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
            slow.update(doc -> doc.getInstances().add(instance("grug-1")));
            assertEquals(1, slow.getInstances().size());
        });

        FleetDocument stale = FleetDocument.builder().build();
        slowRead.complete(objectMapper.writeValueAsString(stale));

        assertFalse(reload.get());
        assertEquals(1, slow.getInstances().size());
        verify(eventBus, never()).publish(any());
    }

    @Test
    void shouldRedactSecretsOnExport() {
        service.update(doc -> doc.getCredentials().add(credential("cred-1", "super-secret")));

        FleetDocument export = service.exportDocument();

        Secret secret = export.getCredentials().get(0).getSecret();
        assertNull(secret.getValue());
        assertTrue(secret.getPresent());
        assertEquals("super-secret", service.getDocument().getCredentials().get(0).getSecret().getValue());
    }

    @Test
    void shouldKeepStoredSecretWhenImportingRedactedExport() {
        service.update(doc -> doc.getCredentials().add(credential("cred-1", "super-secret")));
        FleetDocument export = service.exportDocument();
        export.getInstances().add(instance("imported-1"));

        service.importDocument(export);

        FleetDocument document = service.getDocument();
        assertEquals("super-secret", document.getCredentials().get(0).getSecret().getValue());
        assertEquals(1, document.getInstances().size());
        verify(eventBus).publish(any(FleetConfigReloadedEvent.class));
    }

    @Test
    void shouldProduceStableFingerprints() {
        assertEquals(FleetConfigService.fingerprint("{}"), FleetConfigService.fingerprint("{}"));
        assertNotEquals(FleetConfigService.fingerprint("{}"), FleetConfigService.fingerprint("{ }"));
        assertEquals(64, FleetConfigService.fingerprint("{}").length());
    }

    private Path configFile() {
        return workspace.resolve(FleetConfigService.FLEET_DIR).resolve(FleetConfigService.CONFIG_FILE);
    }

    private static InstanceConfig instance(String id) {
        return InstanceConfig.builder()
                .id(id)
                .displayName(id)
                .templateId("pure_grug")
                .credentialRef("cred-1")
                .build();
    }

    private static CredentialRecord credential(String id, String token) {
        return CredentialRecord.builder()
                .id(id)
                .name(id)
                .secret(Secret.of(token))
                .build();
    }
}
