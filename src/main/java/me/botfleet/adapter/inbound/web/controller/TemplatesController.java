package me.botfleet.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.botfleet.adapter.inbound.web.dto.TemplateRequest;
import me.botfleet.domain.model.Template;
import me.botfleet.domain.service.TemplateService;
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

@RestController
@RequestMapping("/api/templates")
@RequiredArgsConstructor
public class TemplatesController {

    private final TemplateService templateService;

    @GetMapping
    public Mono<ResponseEntity<List<Template>>> listTemplates() {
        return Mono.just(ResponseEntity.ok(templateService.list()));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<Template>> getTemplate(@PathVariable String id) {
        Template template = templateService.get(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Template not found"));
        return Mono.just(ResponseEntity.ok(template));
    }

    @PostMapping
    public Mono<ResponseEntity<Template>> createTemplate(@RequestBody TemplateRequest request) {
        Template created = templateService.create(toTemplate(request.getId(), request));
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @PutMapping("/{id}")
    public Mono<ResponseEntity<Template>> updateTemplate(@PathVariable String id,
            @RequestBody TemplateRequest request) {
        return Mono.just(ResponseEntity.ok(templateService.update(id, toTemplate(id, request))));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteTemplate(@PathVariable String id) {
        templateService.delete(id);
        return Mono.just(ResponseEntity.noContent().build());
    }

    private static Template toTemplate(String id, TemplateRequest request) {
        return Template.builder()
                .id(id)
                .name(request.getName())
                .description(request.getDescription())
                .personality(request.getPersonality())
                .loadEmbedder(request.isLoadEmbedder())
                .features(request.getFeatures())
                .settings(request.getSettings())
                .build();
    }
}
