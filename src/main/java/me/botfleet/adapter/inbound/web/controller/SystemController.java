package me.botfleet.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.botfleet.adapter.inbound.web.dto.LogsPageResponse;
import me.botfleet.adapter.inbound.web.dto.SystemHealthResponse;
import me.botfleet.adapter.inbound.web.dto.SystemStatsResponse;
import me.botfleet.adapter.inbound.web.logstream.DashboardLogService;
import me.botfleet.domain.model.InstanceStatus;
import me.botfleet.domain.model.LifecycleState;
import me.botfleet.domain.service.CredentialVaultService;
import me.botfleet.domain.service.InstanceOrchestrator;
import me.botfleet.domain.service.StatusBus;
import me.botfleet.domain.service.TemplateService;
import me.botfleet.port.outbound.ChatGatewayPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.lang.management.ManagementFactory;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * System health, fleet counters and the dashboard log tail.
 */
@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
public class SystemController {

    private final InstanceOrchestrator orchestrator;
    private final CredentialVaultService vault;
    private final TemplateService templateService;
    private final StatusBus statusBus;
    private final ChatGatewayPort chatGatewayPort;
    private final DashboardLogService dashboardLogService;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @GetMapping("/health")
    public Mono<ResponseEntity<SystemHealthResponse>> health() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        SystemHealthResponse response = SystemHealthResponse.builder()
                .status("UP")
                .version(buildProps != null ? buildProps.getVersion() : "dev")
                .buildTime(buildProps != null && buildProps.getTime() != null ? buildProps.getTime().toString() : null)
                .uptimeMs(ManagementFactory.getRuntimeMXBean().getUptime())
                .platform(chatGatewayPort.getPlatform())
                .statusSubscribers(statusBus.subscriberCount())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<SystemStatsResponse>> stats() {
        return Mono.fromFuture(orchestrator.list()).map(statuses -> ResponseEntity.ok(toStats(statuses)));
    }

    @GetMapping("/logs")
    public Mono<ResponseEntity<LogsPageResponse>> logs(
            @RequestParam(required = false) Long beforeSeq,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String instanceId) {
        DashboardLogService.LogsSlice slice = dashboardLogService.getLogsPage(beforeSeq, limit, instanceId);
        LogsPageResponse response = LogsPageResponse.builder()
                .items(slice.items())
                .oldestSeq(slice.oldestSeq())
                .newestSeq(slice.newestSeq())
                .hasMore(slice.hasMore())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    private SystemStatsResponse toStats(List<InstanceStatus> statuses) {
        Map<String, Integer> byState = new LinkedHashMap<>();
        for (LifecycleState state : LifecycleState.values()) {
            byState.put(state.name(), 0);
        }
        for (InstanceStatus status : statuses) {
            byState.merge(status.state().name(), 1, Integer::sum);
        }
        return SystemStatsResponse.builder()
                .totalInstances(statuses.size())
                .runningInstances(byState.get(LifecycleState.RUNNING.name()))
                .errorInstances(byState.get(LifecycleState.ERROR.name()))
                .byState(byState)
                .credentials(vault.list().size())
                .templates(templateService.list().size())
                .uptimeMs(ManagementFactory.getRuntimeMXBean().getUptime())
                .build();
    }
}
