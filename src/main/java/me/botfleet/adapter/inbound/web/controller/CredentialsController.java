package me.botfleet.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.botfleet.adapter.inbound.web.dto.CreateCredentialRequest;
import me.botfleet.adapter.inbound.web.dto.CredentialDto;
import me.botfleet.domain.model.CredentialRecord;
import me.botfleet.domain.service.CredentialVaultService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Vault endpoints. Tokens go in, never come out.
 */
@RestController
@RequestMapping("/api/credentials")
@RequiredArgsConstructor
public class CredentialsController {

    private final CredentialVaultService vault;

    @GetMapping
    public Mono<ResponseEntity<List<CredentialDto>>> listCredentials() {
        List<CredentialDto> dtos = vault.list().stream()
                .map(CredentialsController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @PostMapping
    public Mono<ResponseEntity<CredentialDto>> createCredential(@RequestBody CreateCredentialRequest request) {
        CredentialRecord created = vault.create(request.getName(), request.getToken());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(created)));
    }

    @PostMapping("/{id}/deactivate")
    public Mono<ResponseEntity<CredentialDto>> deactivateCredential(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(toDto(vault.deactivate(id))));
    }

    private static CredentialDto toDto(CredentialRecord record) {
        return CredentialDto.builder()
                .id(record.getId())
                .name(record.getName())
                .active(record.isActive())
                .hasToken(record.getSecret() != null && Boolean.TRUE.equals(record.getSecret().getPresent()))
                .createdAt(record.getCreatedAt())
                .build();
    }
}
