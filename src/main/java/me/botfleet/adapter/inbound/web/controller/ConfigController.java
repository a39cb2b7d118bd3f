package me.botfleet.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.botfleet.domain.model.FleetDocument;
import me.botfleet.domain.service.FleetConfigService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Whole-document export and import. Exports are redacted; an import that
 * omits a token keeps the one already stored under the same credential id.
 */
@RestController
@RequestMapping("/api/config")
@RequiredArgsConstructor
@Slf4j
public class ConfigController {

    private final FleetConfigService fleetConfigService;

    @GetMapping("/export")
    public Mono<ResponseEntity<FleetDocument>> exportConfig() {
        return Mono.just(ResponseEntity.ok(fleetConfigService.exportDocument()));
    }

    @PostMapping("/import")
    public Mono<ResponseEntity<FleetDocument>> importConfig(@RequestBody FleetDocument document) {
        fleetConfigService.importDocument(document);
        log.info("[API] Fleet document imported");
        return Mono.just(ResponseEntity.ok(fleetConfigService.exportDocument()));
    }
}
