package me.botfleet.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.botfleet.adapter.inbound.web.dto.CreateInstanceRequest;
import me.botfleet.adapter.inbound.web.dto.UpdateInstanceRequest;
import me.botfleet.domain.model.InstanceConfig;
import me.botfleet.domain.model.InstanceStatus;
import me.botfleet.domain.model.InstanceUpdate;
import me.botfleet.domain.service.InstanceOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Instance lifecycle endpoints. Every mutating call answers with the observed
 * status once the orchestrator has finished the operation.
 */
@RestController
@RequestMapping("/api/instances")
@RequiredArgsConstructor
public class InstancesController {

    private final InstanceOrchestrator orchestrator;

    @GetMapping
    public Mono<ResponseEntity<List<InstanceStatus>>> listInstances() {
        return Mono.fromFuture(orchestrator.list()).map(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<InstanceStatus>> getInstance(@PathVariable String id) {
        return Mono.fromFuture(orchestrator.status(id)).map(ResponseEntity::ok);
    }

    @PostMapping
    public Mono<ResponseEntity<InstanceStatus>> createInstance(@RequestBody CreateInstanceRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        InstanceConfig draft = InstanceConfig.builder()
                .id(request.getId())
                .displayName(request.getDisplayName())
                .templateId(request.getTemplateId())
                .credentialRef(request.getCredentialRef())
                .personalityOverride(request.getPersonalityOverride())
                .autoStart(request.isAutoStart())
                .build();
        return Mono.fromFuture(orchestrator.create(draft))
                .map(status -> ResponseEntity.status(HttpStatus.CREATED).body(status));
    }

    @PutMapping("/{id}")
    public Mono<ResponseEntity<InstanceStatus>> updateInstance(@PathVariable String id,
            @RequestBody UpdateInstanceRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        InstanceUpdate change = InstanceUpdate.builder()
                .displayName(request.getDisplayName())
                .templateId(request.getTemplateId())
                .credentialRef(request.getCredentialRef())
                .personalityOverride(request.getPersonalityOverride())
                .autoStart(request.getAutoStart())
                .build();
        return Mono.fromFuture(orchestrator.update(id, change)).map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/start")
    public Mono<ResponseEntity<InstanceStatus>> startInstance(@PathVariable String id) {
        return Mono.fromFuture(orchestrator.start(id)).map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/stop")
    public Mono<ResponseEntity<InstanceStatus>> stopInstance(@PathVariable String id) {
        return Mono.fromFuture(orchestrator.stop(id)).map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/restart")
    public Mono<ResponseEntity<InstanceStatus>> restartInstance(@PathVariable String id) {
        return Mono.fromFuture(orchestrator.restart(id)).map(ResponseEntity::ok);
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<InstanceStatus>> deleteInstance(@PathVariable String id) {
        return Mono.fromFuture(orchestrator.delete(id)).map(ResponseEntity::ok);
    }
}
