package me.botfleet.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.botfleet.domain.model.FleetConfigReloadedEvent;
import me.botfleet.domain.model.FleetDocument;
import me.botfleet.domain.model.InstanceConfig;
import me.botfleet.domain.model.InstanceStatus;
import me.botfleet.domain.model.LifecycleState;
import me.botfleet.domain.model.TemplateDefaults;
import me.botfleet.testsupport.FleetHarness;
import me.botfleet.testsupport.gateway.FakeConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import static me.botfleet.testsupport.FleetHarness.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * External edits of the fleet document, picked up by the reload path and
 * applied to the live set.
 */
class InstanceOrchestratorReloadTest {

    @TempDir
    Path workspace;

    private FleetHarness fleet;
    private InstanceOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        fleet = new FleetHarness(workspace);
        orchestrator = fleet.getOrchestrator();
    }

    @AfterEach
    void tearDown() {
        fleet.close();
    }

    @Test
    void shouldStopInstanceRemovedFromDocument() throws IOException {
        fleet.create("grug-1", "pure_grug", fleet.credential("alpha"));
        fleet.create("grug-2", "pure_grug", fleet.credential("beta"));
        await(orchestrator.start("grug-1"));
        await(orchestrator.start("grug-2"));
        FakeConnection removed = fleet.getGateway().connections().get(0);

        editOnDisk(doc -> doc.getInstances().removeIf(instance -> "grug-1".equals(instance.getId())));
        applyReload();

        assertEquals(1, removed.disconnectCalls());
        assertFalse(removed.knowledge().isOpen());
        assertEquals(Set.of("grug-2"), await(orchestrator.liveIds()));
        List<String> ids = await(orchestrator.list()).stream().map(InstanceStatus::id).toList();
        assertEquals(List.of("grug-2"), ids);
    }

    @Test
    void shouldStartAddedAutoStartInstance() throws IOException {
        String credential = fleet.credential("alpha");

        editOnDisk(doc -> doc.getInstances().add(InstanceConfig.builder()
                .id("added-1")
                .displayName("Added")
                .templateId("pure_big_rob")
                .credentialRef(credential)
                .autoStart(true)
                .defaults(TemplateDefaults.builder().personality("big_rob").build())
                .build()));
        applyReload();

        InstanceStatus status = await(orchestrator.status("added-1"));
        assertEquals(LifecycleState.RUNNING, status.state());
        assertEquals("big_rob", fleet.getGateway().lastConnection().behavior().personalityId());
    }

    @Test
    void shouldRestartInstanceWhoseCredentialChanged() throws IOException {
        fleet.create("grug-1", "pure_grug", fleet.credential("alpha"));
        String beta = fleet.credential("beta");
        InstanceStatus before = await(orchestrator.start("grug-1"));

        editOnDisk(doc -> doc.findInstance("grug-1").orElseThrow().setCredentialRef(beta));
        applyReload();

        InstanceStatus after = await(orchestrator.status("grug-1"));
        assertEquals(LifecycleState.RUNNING, after.state());
        assertNotEquals(before.taskId(), after.taskId());
        assertEquals("token-beta", fleet.getGateway().lastConnection().credential());
    }

    @Test
    void shouldHotApplyPersonalityChange() throws IOException {
        fleet.create("bot-1", "evolution_bot", fleet.credential("alpha"));
        InstanceStatus before = await(orchestrator.start("bot-1"));

        editOnDisk(doc -> doc.findInstance("bot-1").orElseThrow().setPersonalityOverride("grug"));
        applyReload();

        InstanceStatus after = await(orchestrator.status("bot-1"));
        assertEquals(before.taskId(), after.taskId());
        assertEquals("grug", fleet.getGateway().lastConnection().behavior().personalityId());
        assertEquals(1, fleet.getGateway().connectCount());
    }

    @Test
    void shouldKeepTaskWhenOnlyDisplayNameChanges() throws IOException {
        fleet.create("grug-1", "pure_grug", fleet.credential("alpha"));
        InstanceStatus before = await(orchestrator.start("grug-1"));

        editOnDisk(doc -> doc.findInstance("grug-1").orElseThrow().setDisplayName("Grug Prime"));
        applyReload();

        InstanceStatus after = await(orchestrator.status("grug-1"));
        assertEquals(before.taskId(), after.taskId());
        assertEquals("Grug Prime", after.displayName());
        assertEquals(LifecycleState.RUNNING, after.state());
        assertEquals(1, fleet.getGateway().connectCount());
        assertEquals(0, fleet.getGateway().lastConnection().disconnectCalls());
    }

    @Test
    void shouldIgnoreOwnWrites() {
        fleet.create("grug-1", "pure_grug", fleet.credential("alpha"));
        fleet.getConfigService().flush().join();

        assertFalse(fleet.getConfigService().reloadIfChanged());
        assertTrue(fleet.getEvents().stream().noneMatch(FleetConfigReloadedEvent.class::isInstance));
    }

    private void editOnDisk(Consumer<FleetDocument> edit) throws IOException {
        fleet.getConfigService().flush().join();
        FleetDocument document = fleet.getConfigService().getDocument();
        edit.accept(document);
        ObjectMapper mapper = fleet.getObjectMapper();
        Files.writeString(workspace.resolve("fleet").resolve("fleet-config.json"),
                mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document), StandardCharsets.UTF_8);
    }

    private void applyReload() {
        assertTrue(fleet.getConfigService().reloadIfChanged());
        FleetConfigReloadedEvent event = fleet.getEvents().stream()
                .filter(FleetConfigReloadedEvent.class::isInstance)
                .map(FleetConfigReloadedEvent.class::cast)
                .reduce((first, second) -> second)
                .orElseThrow();
        await(orchestrator.applyReload(event.previous(), event.current()));
    }
}
