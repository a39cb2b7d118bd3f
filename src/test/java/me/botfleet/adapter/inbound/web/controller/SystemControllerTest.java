package me.botfleet.adapter.inbound.web.controller;

import me.botfleet.adapter.inbound.web.dto.LogEntryDto;
import me.botfleet.adapter.inbound.web.dto.LogsPageResponse;
import me.botfleet.adapter.inbound.web.dto.SystemHealthResponse;
import me.botfleet.adapter.inbound.web.dto.SystemStatsResponse;
import me.botfleet.adapter.inbound.web.logstream.DashboardLogService;
import me.botfleet.domain.model.CredentialRecord;
import me.botfleet.domain.model.InstanceStatus;
import me.botfleet.domain.model.LifecycleState;
import me.botfleet.domain.model.Template;
import me.botfleet.domain.service.CredentialVaultService;
import me.botfleet.domain.service.InstanceOrchestrator;
import me.botfleet.domain.service.StatusBus;
import me.botfleet.domain.service.TemplateService;
import me.botfleet.port.outbound.ChatGatewayPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SystemControllerTest {

    private InstanceOrchestrator orchestrator;
    private CredentialVaultService vault;
    private TemplateService templateService;
    private StatusBus statusBus;
    private ChatGatewayPort chatGatewayPort;
    private DashboardLogService dashboardLogService;
    private ObjectProvider<BuildProperties> buildPropertiesProvider;
    private SystemController controller;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        orchestrator = mock(InstanceOrchestrator.class);
        vault = mock(CredentialVaultService.class);
        templateService = mock(TemplateService.class);
        statusBus = mock(StatusBus.class);
        chatGatewayPort = mock(ChatGatewayPort.class);
        dashboardLogService = mock(DashboardLogService.class);
        buildPropertiesProvider = mock(ObjectProvider.class);

        when(chatGatewayPort.getPlatform()).thenReturn("discord");
        when(statusBus.subscriberCount()).thenReturn(2);

        controller = new SystemController(orchestrator, vault, templateService, statusBus, chatGatewayPort,
                dashboardLogService, buildPropertiesProvider);
    }

    @Test
    void shouldReturnHealthStatus() {
        StepVerifier.create(controller.health())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    SystemHealthResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("UP", body.getStatus());
                    assertEquals("discord", body.getPlatform());
                    assertEquals(2, body.getStatusSubscribers());
                    assertTrue(body.getUptimeMs() >= 0);
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnDevVersionWhenBuildPropertiesAbsent() {
        StepVerifier.create(controller.health())
                .assertNext(response -> {
                    SystemHealthResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("dev", body.getVersion());
                    assertNull(body.getBuildTime());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnVersionFromBuildProperties() {
        Properties props = new Properties();
        props.setProperty("version", "1.2.3");
        props.setProperty("time", "2026-02-19T12:00:00Z");
        when(buildPropertiesProvider.getIfAvailable()).thenReturn(new BuildProperties(props));

        StepVerifier.create(controller.health())
                .assertNext(response -> {
                    SystemHealthResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("1.2.3", body.getVersion());
                    assertTrue(body.getBuildTime().contains("2026-02-19"));
                })
                .verifyComplete();
    }

    @Test
    void shouldCountInstancesByState() {
        when(orchestrator.list()).thenReturn(CompletableFuture.completedFuture(List.of(
                status("grug-1", LifecycleState.RUNNING),
                status("grug-2", LifecycleState.RUNNING),
                status("rob-1", LifecycleState.ERROR),
                status("rob-2", LifecycleState.STOPPED))));
        when(vault.list()).thenReturn(List.of(CredentialRecord.builder().id("cred-1").build()));
        when(templateService.list()).thenReturn(List.of(Template.builder().id("a").build(),
                Template.builder().id("b").build()));

        StepVerifier.create(controller.stats())
                .assertNext(response -> {
                    SystemStatsResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(4, body.getTotalInstances());
                    assertEquals(2, body.getRunningInstances());
                    assertEquals(1, body.getErrorInstances());
                    assertEquals(1, body.getByState().get("STOPPED"));
                    assertEquals(0, body.getByState().get("STARTING"));
                    assertEquals(1, body.getCredentials());
                    assertEquals(2, body.getTemplates());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnLogsPage() {
        LogEntryDto entry = LogEntryDto.builder().seq(9L).message("hello").instanceId("grug-1").build();
        when(dashboardLogService.getLogsPage(10L, 50, "grug-1"))
                .thenReturn(new DashboardLogService.LogsSlice(List.of(entry), 1L, 12L, true));

        StepVerifier.create(controller.logs(10L, 50, "grug-1"))
                .assertNext(response -> {
                    LogsPageResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(1, body.getItems().size());
                    assertEquals(1L, body.getOldestSeq());
                    assertEquals(12L, body.getNewestSeq());
                    assertTrue(body.isHasMore());
                })
                .verifyComplete();
    }

    private static InstanceStatus status(String id, LifecycleState state) {
        return InstanceStatus.builder().id(id).state(state).build();
    }
}
