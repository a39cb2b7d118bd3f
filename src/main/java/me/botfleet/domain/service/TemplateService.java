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

import lombok.extern.slf4j.Slf4j;
import me.botfleet.domain.model.InvalidReferenceException;
import me.botfleet.domain.model.Template;
import me.botfleet.port.outbound.PersonalityPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Template store: six built-in templates plus custom ones kept in the fleet
 * document. Built-ins are read-only.
 */
@Service
@Slf4j
public class TemplateService {

    private static final Pattern TEMPLATE_ID = Pattern.compile("[a-z0-9][a-z0-9_-]{0,63}");

    private final FleetConfigService fleetConfigService;
    private final PersonalityPort personalityPort;
    private final Map<String, Template> builtins;

    public TemplateService(FleetConfigService fleetConfigService, PersonalityPort personalityPort) {
        this.fleetConfigService = fleetConfigService;
        this.personalityPort = personalityPort;
        this.builtins = Collections.unmodifiableMap(builtinTemplates());
    }

    public List<Template> list() {
        List<Template> all = new ArrayList<>();
        builtins.values().forEach(template -> all.add(copyOf(template)));
        all.addAll(fleetConfigService.getDocument().getTemplates().values());
        return all;
    }

    public Optional<Template> get(String templateId) {
        if (templateId == null) {
            return Optional.empty();
        }
        Template builtin = builtins.get(templateId);
        if (builtin != null) {
            return Optional.of(copyOf(builtin));
        }
        return Optional.ofNullable(fleetConfigService.getDocument().getTemplates().get(templateId));
    }

    /**
     * Looks up a template for instance creation.
     *
     * @throws InvalidReferenceException
     *             if no template has this id
     */
    public Template resolve(String templateId) {
        return get(templateId).orElseThrow(() -> InvalidReferenceException.unknown("template", templateId));
    }

    public Template create(Template request) {
        String id = request.getId();
        if (id == null || !TEMPLATE_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Template id must match " + TEMPLATE_ID.pattern());
        }
        if (builtins.containsKey(id)) {
            throw new IllegalStateException("Template '" + id + "' is built in");
        }
        validatePersonality(request.getPersonality());
        Template template = sanitized(id, request);
        fleetConfigService.update(doc -> {
            if (doc.getTemplates().containsKey(id)) {
                throw new IllegalStateException("Template '" + id + "' already exists");
            }
            doc.getTemplates().put(id, template);
        });
        log.info("[Templates] Created template {}", id);
        return template;
    }

    /**
     * Replaces a custom template. Instances created from it keep their own
     * snapshot of the old defaults.
     */
    public Template update(String templateId, Template request) {
        if (builtins.containsKey(templateId)) {
            throw new IllegalStateException("Built-in template '" + templateId + "' cannot be modified");
        }
        validatePersonality(request.getPersonality());
        Template template = sanitized(templateId, request);
        fleetConfigService.update(doc -> {
            if (!doc.getTemplates().containsKey(templateId)) {
                throw new NoSuchElementException("Template '" + templateId + "' not found");
            }
            doc.getTemplates().put(templateId, template);
        });
        log.info("[Templates] Updated template {}", templateId);
        return template;
    }

    public void delete(String templateId) {
        if (builtins.containsKey(templateId)) {
            throw new IllegalStateException("Built-in template '" + templateId + "' cannot be deleted");
        }
        fleetConfigService.update(doc -> {
            if (!doc.getTemplates().containsKey(templateId)) {
                throw new NoSuchElementException("Template '" + templateId + "' not found");
            }
            boolean referenced = doc.getInstances().stream()
                    .anyMatch(instance -> templateId.equals(instance.getTemplateId()));
            if (referenced) {
                throw new IllegalStateException("Template '" + templateId + "' is used by an instance");
            }
            doc.getTemplates().remove(templateId);
        });
        log.info("[Templates] Deleted template {}", templateId);
    }

    private void validatePersonality(String personality) {
        if (personality != null && !personality.isBlank() && !personalityPort.isKnown(personality)) {
            throw InvalidReferenceException.unknown("personality", personality);
        }
    }

    private static Template sanitized(String id, Template request) {
        return Template.builder()
                .id(id)
                .name(request.getName() != null && !request.getName().isBlank() ? request.getName() : id)
                .description(request.getDescription())
                .personality(request.getPersonality() != null && !request.getPersonality().isBlank()
                        ? request.getPersonality()
                        : null)
                .loadEmbedder(request.isLoadEmbedder())
                .features(request.getFeatures() != null ? new LinkedHashMap<>(request.getFeatures())
                        : new LinkedHashMap<>())
                .settings(request.getSettings() != null ? new LinkedHashMap<>(request.getSettings())
                        : new LinkedHashMap<>())
                .builtin(false)
                .build();
    }

    private static Template copyOf(Template template) {
        return template.toBuilder()
                .features(new LinkedHashMap<>(template.getFeatures()))
                .settings(new LinkedHashMap<>(template.getSettings()))
                .build();
    }

    private static Map<String, Template> builtinTemplates() {
        Map<String, Template> templates = new LinkedHashMap<>();
        templates.put("pure_grug", builtin("pure_grug", "Pure Grug",
                "Caveman personality only, no evolution", "grug", true, Map.of()));
        templates.put("pure_big_rob", builtin("pure_big_rob", "Pure Big Rob",
                "norf FC lad personality only, no evolution", "big_rob", true, Map.of()));
        templates.put("evolution_bot", builtin("evolution_bot", "Evolution Bot",
                "Adaptive personality that evolves per server", null, true, Map.of()));
        templates.put("lightweight_grug", builtin("lightweight_grug", "Lightweight Grug",
                "Grug personality without semantic search", "grug", false, Map.of()));
        templates.put("multi_personality", builtin("multi_personality", "Multi-Personality",
                "Random personality selection per server", null, true, Map.of()));
        templates.put("ollama_bot", builtin("ollama_bot", "Ollama Bot",
                "Uses local Ollama instead of Gemini", null, true,
                Map.of("OLLAMA_URLS", "http://localhost:11434", "OLLAMA_MODELS", "llama3.2:3b")));
        return templates;
    }

    private static Template builtin(String id, String name, String description, String personality,
            boolean loadEmbedder, Map<String, String> settings) {
        return Template.builder()
                .id(id)
                .name(name)
                .description(description)
                .personality(personality)
                .loadEmbedder(loadEmbedder)
                .features(new LinkedHashMap<>())
                .settings(new LinkedHashMap<>(settings))
                .builtin(true)
                .build();
    }
}
